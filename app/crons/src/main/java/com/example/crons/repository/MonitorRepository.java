/*
 * どこで: Crons データアクセス
 * 何を: monitors の upsert / 参照 / version claim / 状態更新を担う
 * なぜ: モニター単位の直列化を version の CAS だけで実現するため
 */
package com.example.crons.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.crons.model.MonitorConfig;
import com.example.crons.model.MonitorRecord;
import com.example.crons.model.MonitorState;
import com.example.crons.model.MonitorStatus;
import com.example.crons.model.ScheduleType;
import com.example.crons.schedule.IntervalUnit;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MonitorRepository {

  private static final String COLUMNS =
      """
      monitor_id, slug, environment, schedule_type, crontab, interval_value, interval_unit,
      timezone, checkin_margin_minutes, max_runtime_minutes, failure_threshold,
      recovery_threshold, status, consecutive_failures, consecutive_successes,
      last_expected_run_at, last_run_id, version, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<MonitorRecord> upsertConfig(
      UUID monitorId, String slug, String environment, MonitorConfig config, Instant now) {
    // 設定列が同一なら更新せず空結果を返す (version も進めない)
    final String sql =
        """
        INSERT INTO monitors (
          monitor_id,
          slug,
          environment,
          schedule_type,
          crontab,
          interval_value,
          interval_unit,
          timezone,
          checkin_margin_minutes,
          max_runtime_minutes,
          failure_threshold,
          recovery_threshold,
          status,
          consecutive_failures,
          consecutive_successes,
          version,
          created_at,
          updated_at
        ) VALUES (
          :monitorId,
          :slug,
          :environment,
          :scheduleType,
          :crontab,
          :intervalValue,
          :intervalUnit,
          :timezone,
          :checkinMargin,
          :maxRuntime,
          :failureThreshold,
          :recoveryThreshold,
          'UP',
          0,
          0,
          0,
          :now,
          :now
        )
        ON CONFLICT (slug, environment)
        DO UPDATE SET
          schedule_type = EXCLUDED.schedule_type,
          crontab = EXCLUDED.crontab,
          interval_value = EXCLUDED.interval_value,
          interval_unit = EXCLUDED.interval_unit,
          timezone = EXCLUDED.timezone,
          checkin_margin_minutes = EXCLUDED.checkin_margin_minutes,
          max_runtime_minutes = EXCLUDED.max_runtime_minutes,
          failure_threshold = EXCLUDED.failure_threshold,
          recovery_threshold = EXCLUDED.recovery_threshold,
          version = monitors.version + 1,
          updated_at = EXCLUDED.updated_at
        WHERE (
          monitors.schedule_type,
          monitors.crontab,
          monitors.interval_value,
          monitors.interval_unit,
          monitors.timezone,
          monitors.checkin_margin_minutes,
          monitors.max_runtime_minutes,
          monitors.failure_threshold,
          monitors.recovery_threshold
        ) IS DISTINCT FROM (
          EXCLUDED.schedule_type,
          EXCLUDED.crontab,
          EXCLUDED.interval_value,
          EXCLUDED.interval_unit,
          EXCLUDED.timezone,
          EXCLUDED.checkin_margin_minutes,
          EXCLUDED.max_runtime_minutes,
          EXCLUDED.failure_threshold,
          EXCLUDED.recovery_threshold
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("monitorId", monitorId)
            .addValue("slug", slug)
            .addValue("environment", environment)
            .addValue("scheduleType", config.scheduleType().name())
            .addValue("crontab", config.crontab())
            .addValue("intervalValue", config.intervalValue())
            .addValue(
                "intervalUnit", config.intervalUnit() == null ? null : config.intervalUnit().name())
            .addValue("timezone", config.timezone().getId())
            .addValue("checkinMargin", config.checkinMarginMinutes())
            .addValue("maxRuntime", config.maxRuntimeMinutes())
            .addValue("failureThreshold", config.failureThreshold())
            .addValue("recoveryThreshold", config.recoveryThreshold())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<MonitorRecord> findBySlugAndEnvironment(String slug, String environment) {
    final String sql =
        "SELECT " + COLUMNS + " FROM monitors WHERE slug = :slug AND environment = :environment";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("slug", slug).addValue("environment", environment);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<MonitorRecord> findById(UUID monitorId) {
    final String sql = "SELECT " + COLUMNS + " FROM monitors WHERE monitor_id = :monitorId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("monitorId", monitorId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // スイープ用のキーセットページング。afterId が null なら先頭から
  public List<MonitorRecord> findPageAfter(UUID afterId, int limit) {
    final String where = afterId == null ? "" : " WHERE monitor_id > :afterId";
    final String sql =
        "SELECT " + COLUMNS + " FROM monitors" + where + " ORDER BY monitor_id LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("afterId", afterId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int claimVersion(UUID monitorId, long expectedVersion, Instant now) {
    // 行ロックを取りつつ version を進める。0 件なら他の書き手が先行している
    final String sql =
        """
        UPDATE monitors
        SET version = version + 1,
            updated_at = :now
        WHERE monitor_id = :monitorId
          AND version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("monitorId", monitorId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateState(UUID monitorId, MonitorState state, Instant now) {
    final String sql =
        """
        UPDATE monitors
        SET status = :status,
            consecutive_failures = :failures,
            consecutive_successes = :successes,
            last_expected_run_at = :lastExpectedRunAt,
            last_run_id = :lastRunId,
            updated_at = :now
        WHERE monitor_id = :monitorId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", state.status().name())
            .addValue("failures", state.consecutiveFailures())
            .addValue("successes", state.consecutiveSuccesses())
            .addValue("lastExpectedRunAt", toTimestamp(state.lastExpectedRunAt()))
            .addValue("lastRunId", state.lastRunId())
            .addValue("now", toTimestamp(now))
            .addValue("monitorId", monitorId);
    return jdbcTemplate.update(sql, params);
  }

  private MonitorRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int intervalValue = rs.getInt("interval_value");
    final Integer nullableIntervalValue = rs.wasNull() ? null : intervalValue;
    final String intervalUnit = rs.getString("interval_unit");
    final MonitorConfig config =
        new MonitorConfig(
            ScheduleType.valueOf(rs.getString("schedule_type")),
            rs.getString("crontab"),
            nullableIntervalValue,
            intervalUnit == null ? null : IntervalUnit.valueOf(intervalUnit),
            ZoneId.of(rs.getString("timezone")),
            rs.getInt("checkin_margin_minutes"),
            rs.getInt("max_runtime_minutes"),
            rs.getInt("failure_threshold"),
            rs.getInt("recovery_threshold"));
    final MonitorState state =
        new MonitorState(
            MonitorStatus.valueOf(rs.getString("status")),
            rs.getInt("consecutive_failures"),
            rs.getInt("consecutive_successes"),
            getInstant(rs, "last_expected_run_at"),
            rs.getString("last_run_id"));
    return new MonitorRecord(
        UUID.fromString(rs.getString("monitor_id")),
        rs.getString("slug"),
        rs.getString("environment"),
        config,
        state,
        rs.getLong("version"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
