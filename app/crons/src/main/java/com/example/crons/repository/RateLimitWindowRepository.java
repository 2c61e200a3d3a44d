/*
 * どこで: Crons データアクセス
 * 何を: checkin_rate_limits の固定窓カウンタを 1 文で判定と加算する
 * なぜ: 複数ノードから同時に来ても読み書きの間に競合を挟まないため
 */
package com.example.crons.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RateLimitWindowRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 現在の窓のカウンタを 1 進め、加算後の値を返す。
   *
   * <p>窓の開始が {@code windowStartedBefore} 以前なら窓を {@code now} から作り直す。
   */
  public int incrementAndGet(String slug, String environment, Instant now, Instant windowStartedBefore) {
    final String sql =
        """
        INSERT INTO checkin_rate_limits (
          slug,
          environment,
          window_started_at,
          request_count,
          updated_at
        ) VALUES (
          :slug,
          :environment,
          :now,
          1,
          :now
        )
        ON CONFLICT (slug, environment)
        DO UPDATE SET
          window_started_at = CASE
            WHEN checkin_rate_limits.window_started_at <= :windowStartedBefore
              THEN EXCLUDED.window_started_at
            ELSE checkin_rate_limits.window_started_at
          END,
          request_count = CASE
            WHEN checkin_rate_limits.window_started_at <= :windowStartedBefore THEN 1
            ELSE checkin_rate_limits.request_count + 1
          END,
          updated_at = EXCLUDED.updated_at
        RETURNING request_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("slug", slug)
            .addValue("environment", environment)
            .addValue("now", toTimestamp(now))
            .addValue("windowStartedBefore", toTimestamp(windowStartedBefore));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteIdleBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM checkin_rate_limits
        WHERE updated_at <= :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
