/*
 * どこで: Crons データアクセス
 * 何を: sweep_leases でスイープ実行ノードのリースを取得/解放する
 * なぜ: 複数ノード構成でも 1 パスを 1 ノードに寄せるため
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
public class SweepLeaseRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // 期限切れか自分の保持するリースだけを奪える
  public boolean tryAcquire(String leaseName, String owner, Instant now, Instant leaseUntil) {
    final String sql =
        """
        INSERT INTO sweep_leases (
          lease_name,
          owner,
          acquired_at,
          lease_until
        ) VALUES (
          :leaseName,
          :owner,
          :now,
          :leaseUntil
        )
        ON CONFLICT (lease_name)
        DO UPDATE SET
          owner = EXCLUDED.owner,
          acquired_at = EXCLUDED.acquired_at,
          lease_until = EXCLUDED.lease_until
        WHERE sweep_leases.lease_until <= EXCLUDED.acquired_at
           OR sweep_leases.owner = EXCLUDED.owner
        RETURNING owner
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leaseName", leaseName)
            .addValue("owner", owner)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    return !jdbcTemplate.queryForList(sql, params, String.class).isEmpty();
  }

  public int release(String leaseName, String owner, Instant now) {
    final String sql =
        """
        UPDATE sweep_leases
        SET lease_until = :now
        WHERE lease_name = :leaseName
          AND owner = :owner
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leaseName", leaseName)
            .addValue("owner", owner)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }
}
