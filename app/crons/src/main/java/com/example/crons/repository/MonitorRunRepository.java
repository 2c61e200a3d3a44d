/*
 * どこで: Crons データアクセス
 * 何を: monitor_runs の作成 / 参照 / 開始・終端の条件付き更新を担う
 * なぜ: 開始と終端をそれぞれ first-writer-wins で一度だけ書くため
 */
package com.example.crons.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.crons.model.RunRecord;
import com.example.crons.model.RunStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MonitorRunRepository {

  private static final String COLUMNS =
      """
      run_ref, monitor_id, run_id, expected_at, started_at, finished_at, terminal_status,
      checkin_margin_minutes, max_runtime_minutes
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * expected_at に Run が無ければ未開始の Run を作る。
   *
   * @return 作成した件数 (既存なら 0)
   */
  public int insertIfAbsent(
      UUID monitorId,
      Instant expectedAt,
      int checkinMarginMinutes,
      int maxRuntimeMinutes,
      Instant now) {
    return insert(monitorId, null, expectedAt, null, checkinMarginMinutes, maxRuntimeMinutes, now);
  }

  /**
   * 予定時刻にチェックインが来なかった Run を MISSED で作る。既存 Run があれば何もしない。
   *
   * @return 作成した件数 (既存なら 0)
   */
  public int insertMissedIfAbsent(
      UUID monitorId,
      String runId,
      Instant expectedAt,
      int checkinMarginMinutes,
      int maxRuntimeMinutes,
      Instant now) {
    return insert(
        monitorId,
        runId,
        expectedAt,
        RunStatus.MISSED,
        checkinMarginMinutes,
        maxRuntimeMinutes,
        now);
  }

  private int insert(
      UUID monitorId,
      String runId,
      Instant expectedAt,
      RunStatus terminalStatus,
      int checkinMarginMinutes,
      int maxRuntimeMinutes,
      Instant now) {
    final String sql =
        """
        INSERT INTO monitor_runs (
          run_ref,
          monitor_id,
          run_id,
          expected_at,
          started_at,
          finished_at,
          terminal_status,
          checkin_margin_minutes,
          max_runtime_minutes,
          created_at,
          updated_at
        ) VALUES (
          :runRef,
          :monitorId,
          :runId,
          :expectedAt,
          NULL,
          :finishedAt,
          :terminalStatus,
          :checkinMargin,
          :maxRuntime,
          :now,
          :now
        )
        ON CONFLICT (monitor_id, expected_at) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runRef", UUID.randomUUID())
            .addValue("monitorId", monitorId)
            .addValue("runId", runId)
            .addValue("expectedAt", toTimestamp(expectedAt))
            .addValue("finishedAt", terminalStatus == null ? null : toTimestamp(now))
            .addValue("terminalStatus", terminalStatus == null ? null : terminalStatus.name())
            .addValue("checkinMargin", checkinMarginMinutes)
            .addValue("maxRuntime", maxRuntimeMinutes)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<RunRecord> findByExpectedAt(UUID monitorId, Instant expectedAt) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM monitor_runs WHERE monitor_id = :monitorId AND expected_at = :expectedAt";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("monitorId", monitorId)
            .addValue("expectedAt", toTimestamp(expectedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RunRecord> findByRunRef(UUID runRef) {
    final String sql = "SELECT " + COLUMNS + " FROM monitor_runs WHERE run_ref = :runRef";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("runRef", runRef);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RunRecord> findByRunId(UUID monitorId, String runId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM monitor_runs
            WHERE monitor_id = :monitorId
              AND run_id = :runId
            ORDER BY expected_at DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("monitorId", monitorId).addValue("runId", runId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RunRecord> findLatestOpen(UUID monitorId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM monitor_runs
            WHERE monitor_id = :monitorId
              AND started_at IS NOT NULL
              AND terminal_status IS NULL
            ORDER BY expected_at DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("monitorId", monitorId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<RunRecord> findOpen(UUID monitorId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM monitor_runs
            WHERE monitor_id = :monitorId
              AND started_at IS NOT NULL
              AND terminal_status IS NULL
            ORDER BY expected_at
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("monitorId", monitorId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<RunRecord> findRecent(UUID monitorId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM monitor_runs
            WHERE monitor_id = :monitorId
            ORDER BY expected_at DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("monitorId", monitorId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markStarted(UUID runRef, String runId, Instant startedAt, Instant now) {
    // 未開始かつ未終端の Run だけを開始させる
    final String sql =
        """
        UPDATE monitor_runs
        SET run_id = :runId,
            started_at = :startedAt,
            updated_at = :now
        WHERE run_ref = :runRef
          AND started_at IS NULL
          AND terminal_status IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("now", toTimestamp(now))
            .addValue("runRef", runRef);
    return jdbcTemplate.update(sql, params);
  }

  public int markTerminal(UUID runRef, RunStatus status, Instant finishedAt, Instant now) {
    // 終端は一度だけ。既に終端済みなら 0 件
    final String sql =
        """
        UPDATE monitor_runs
        SET terminal_status = :status,
            finished_at = :finishedAt,
            updated_at = :now
        WHERE run_ref = :runRef
          AND terminal_status IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("now", toTimestamp(now))
            .addValue("runRef", runRef);
    return jdbcTemplate.update(sql, params);
  }

  public int closeHeartbeat(
      UUID runRef, String runId, Instant startedAt, RunStatus status, Instant finishedAt, Instant now) {
    // 開始チェックインの無い Run を開始と終端まとめて書く。既存の開始情報は上書きしない
    final String sql =
        """
        UPDATE monitor_runs
        SET run_id = COALESCE(run_id, :runId),
            started_at = COALESCE(started_at, :startedAt),
            terminal_status = :status,
            finished_at = :finishedAt,
            updated_at = :now
        WHERE run_ref = :runRef
          AND terminal_status IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("now", toTimestamp(now))
            .addValue("runRef", runRef);
    return jdbcTemplate.update(sql, params);
  }

  private RunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String terminalStatus = rs.getString("terminal_status");
    return new RunRecord(
        UUID.fromString(rs.getString("run_ref")),
        UUID.fromString(rs.getString("monitor_id")),
        rs.getString("run_id"),
        getInstant(rs, "expected_at"),
        getInstant(rs, "started_at"),
        getInstant(rs, "finished_at"),
        terminalStatus == null ? null : RunStatus.valueOf(terminalStatus),
        rs.getInt("checkin_margin_minutes"),
        rs.getInt("max_runtime_minutes"));
  }
}
