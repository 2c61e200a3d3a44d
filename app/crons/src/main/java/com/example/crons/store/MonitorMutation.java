package com.example.crons.store;

import com.example.crons.model.MonitorRecord;

/** version を claim 済みのトランザクション内で実行する変更。 */
@FunctionalInterface
public interface MonitorMutation<T> {

  CasResult<T> apply(MonitorRecord snapshot);
}
