package com.example.crons.store;

import com.example.crons.model.MonitorState;

/** 変更後のモニター状態と、呼び出し元へ返す値。 */
public record CasResult<T>(MonitorState state, T value) {}
