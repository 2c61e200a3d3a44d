/*
 * どこで: Crons データアクセス
 * 何を: transition_outbox の登録/claim/状態更新を担う
 * なぜ: 状態遷移のコミットとイベント配信を切り離して確実に届けるため
 */
package com.example.crons.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.crons.model.OutboxEventRecord;
import com.example.crons.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OutboxEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt) {
    final String sql =
        """
        INSERT INTO transition_outbox (
          event_id,
          event_type,
          aggregate_key,
          payload,
          status,
          attempt_count,
          created_at
        ) VALUES (
          :eventId,
          :eventType,
          :aggregateKey,
          :payload::jsonb,
          'PENDING',
          0,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public List<OutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 再送時刻を過ぎた PENDING と、持ち主のリースが切れた IN_FLIGHT を古い順に取る
    final String sql =
        """
        WITH claimable AS (
          SELECT event_id
          FROM transition_outbox
          WHERE (status = 'PENDING' AND (next_retry_at IS NULL OR next_retry_at <= :now))
             OR (status = 'IN_FLIGHT' AND (lease_until IS NULL OR lease_until <= :now))
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE transition_outbox o
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM claimable
        WHERE o.event_id = claimable.event_id
        RETURNING o.event_id, o.event_type, o.aggregate_key, o.payload::text AS payload_text,
                  o.attempt_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE transition_outbox
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE transition_outbox
        SET attempt_count = :attemptCount,
            status = :status,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("status", status.name())
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deletePublishedOlderThan(Instant threshold) {
    // 未送信/失敗は調査用に残す
    final String sql =
        """
        DELETE FROM transition_outbox
        WHERE status = 'PUBLISHED'
          AND published_at <= :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countFailed() {
    final String sql = "SELECT COUNT(*) FROM transition_outbox WHERE status = 'FAILED'";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private OutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        UUID.fromString(rs.getString("event_id")),
        rs.getString("event_type"),
        rs.getString("aggregate_key"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"));
  }
}
