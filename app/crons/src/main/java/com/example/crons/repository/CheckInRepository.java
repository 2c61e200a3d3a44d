/*
 * どこで: Crons データアクセス
 * 何を: monitor_checkins への追記と check_in_id からの Run 逆引きを担う
 * なぜ: 終端チェックインを開始チェックインの Run に結び付けるため
 */
package com.example.crons.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.crons.model.CheckInRecord;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CheckInRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(CheckInRecord record) {
    final String sql =
        """
        INSERT INTO monitor_checkins (
          checkin_ref,
          monitor_id,
          check_in_id,
          status,
          duration_seconds,
          received_at,
          run_ref,
          outcome
        ) VALUES (
          :checkinRef,
          :monitorId,
          :checkInId,
          :status,
          :durationSeconds,
          :receivedAt,
          :runRef,
          :outcome
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("checkinRef", record.checkinRef())
            .addValue("monitorId", record.monitorId())
            .addValue("checkInId", record.checkInId())
            .addValue("status", record.status().name())
            .addValue("durationSeconds", record.durationSeconds())
            .addValue("receivedAt", toTimestamp(record.receivedAt()))
            .addValue("runRef", record.runRef())
            .addValue("outcome", record.outcome().name());
    return jdbcTemplate.update(sql, params);
  }

  // 同じ check_in_id の開始チェックインが解決した Run を最新から引く
  public Optional<UUID> findStartedRunRef(UUID monitorId, String checkInId) {
    final String sql =
        """
        SELECT run_ref
        FROM monitor_checkins
        WHERE monitor_id = :monitorId
          AND check_in_id = :checkInId
          AND status = 'IN_PROGRESS'
          AND run_ref IS NOT NULL
        ORDER BY received_at DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("monitorId", monitorId).addValue("checkInId", checkInId);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("run_ref")))
        .stream()
        .findFirst();
  }
}
