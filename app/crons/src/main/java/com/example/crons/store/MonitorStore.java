/*
 * どこで: Crons モニターストア
 * 何を: モニター設定の upsert と、version claim を伴う CAS トランザクションを提供する
 * なぜ: チェックインとスイープの書込みをモニター単位で線形化するため
 */
package com.example.crons.store;

import com.example.crons.model.MonitorConfig;
import com.example.crons.model.MonitorRecord;
import com.example.crons.repository.MonitorRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class MonitorStore {

  private final MonitorRepository monitorRepository;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  /**
   * 無ければ作成し、あれば設定列だけを上書きする。
   *
   * <p>状態 (status, 連続回数, スイープ位置) には触れない。設定が同一なら書込みも version 更新もしない。
   */
  public MonitorRecord upsert(String slug, String environment, MonitorConfig config) {
    final Instant now = Instant.now(clock);
    return monitorRepository
        .upsertConfig(UUID.randomUUID(), slug, environment, config, now)
        .or(() -> monitorRepository.findBySlugAndEnvironment(slug, environment))
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "monitor disappeared after upsert slug=" + slug + " environment=" + environment));
  }

  public Optional<MonitorRecord> find(String slug, String environment) {
    return monitorRepository.findBySlugAndEnvironment(slug, environment);
  }

  public Optional<MonitorRecord> findById(UUID monitorId) {
    return monitorRepository.findById(monitorId);
  }

  public List<MonitorRecord> findPageAfter(UUID afterId, int limit) {
    return monitorRepository.findPageAfter(afterId, limit);
  }

  /**
   * スナップショットの version を claim してから mutation を同一トランザクションで実行する。
   *
   * @throws MonitorVersionConflictException 他の書き手が先に version を進めていた場合 (ロールバック済み)
   */
  public <T> T compareAndSet(MonitorRecord snapshot, Duration timeout, MonitorMutation<T> mutation) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    transactionTemplate.setTimeout(toTimeoutSeconds(timeout));
    return transactionTemplate.execute(
        status -> {
          final Instant now = Instant.now(clock);
          final int claimed =
              monitorRepository.claimVersion(snapshot.monitorId(), snapshot.version(), now);
          if (claimed == 0) {
            throw new MonitorVersionConflictException(
                snapshot.slug(), snapshot.environment(), snapshot.version());
          }
          final CasResult<T> result = mutation.apply(snapshot);
          if (!result.state().equals(snapshot.state())) {
            monitorRepository.updateState(snapshot.monitorId(), result.state(), now);
          }
          return result.value();
        });
  }

  // TransactionTemplate の timeout は秒単位。端数は切り上げ、最低 1 秒
  private int toTimeoutSeconds(Duration timeout) {
    final long millis = Math.max(timeout.toMillis(), 1L);
    return (int) Math.min(Integer.MAX_VALUE, (millis + 999L) / 1000L);
  }
}
