/*
 * どこで: Crons モニターストア
 * 何を: CAS 競合とストア一時障害の再試行を、呼び出し元の期限内で実行する
 * なぜ: 再試行の回数・待機・期限の扱いをチェックインとスイープで揃えるため
 */
package com.example.crons.store;

import com.example.crons.config.CronsStoreProperties;
import com.example.crons.model.MonitorRecord;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

@Component
@RequiredArgsConstructor
public class StoreRetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(StoreRetryExecutor.class);

  private final MonitorStore monitorStore;
  private final CronsStoreProperties properties;
  private final Clock clock;

  /**
   * ストア操作を実行し、一時障害なら上限回数まで再試行する。
   *
   * @param deadline 呼び出し元の期限。null なら期限なし
   * @throws StoreUnavailableException 再試行上限に達した場合
   * @throws StoreDeadlineExceededException 期限切れの場合
   */
  public <T> T call(Supplier<T> operation, @Nullable Instant deadline) {
    int attempt = 1;
    while (true) {
      ensureBeforeDeadline(deadline);
      try {
        return operation.get();
      } catch (TransientDataAccessException
          | DataAccessResourceFailureException
          | CannotCreateTransactionException
          | TransactionTimedOutException ex) {
        if (isExpired(deadline)) {
          throw new StoreDeadlineExceededException("deadline exceeded during store call", ex);
        }
        if (attempt >= properties.maxStoreAttempts()) {
          throw new StoreUnavailableException("store unavailable after " + attempt + " attempts", ex);
        }
        logger.warn("store call failed; retrying attempt={}", attempt, ex);
        sleep(computeBackoffDuration(attempt), deadline);
        attempt++;
      }
    }
  }

  /**
   * version の CAS を実行し、競合なら最新を読み直して上限回数まで再試行する。
   *
   * <p>mutation は毎回読み直したスナップショットに対して評価されるため、再試行で判断が変わりうる。
   *
   * @param initial 1 回目に使うスナップショット
   * @param reread 競合後に最新スナップショットを読む処理
   * @throws MonitorVersionConflictException 再試行上限まで競合が続いた場合
   */
  public <T> T compareAndSet(
      MonitorRecord initial,
      Supplier<MonitorRecord> reread,
      MonitorMutation<T> mutation,
      @Nullable Instant deadline) {
    MonitorRecord snapshot = initial;
    int attempt = 1;
    while (true) {
      final MonitorRecord current = snapshot;
      try {
        return call(
            () -> monitorStore.compareAndSet(current, transactionTimeout(deadline), mutation),
            deadline);
      } catch (MonitorVersionConflictException ex) {
        if (attempt >= properties.maxCasAttempts()) {
          throw ex;
        }
        logger.debug(
            "monitor version conflict; retrying slug={} attempt={}", current.slug(), attempt);
        sleep(computeBackoffDuration(attempt), deadline);
        snapshot = call(reread, deadline);
        attempt++;
      }
    }
  }

  private Duration transactionTimeout(@Nullable Instant deadline) {
    final Duration configured = properties.transactionTimeout();
    if (deadline == null) {
      return configured;
    }
    final Duration remaining = Duration.between(Instant.now(clock), deadline);
    return remaining.compareTo(configured) < 0 ? remaining : configured;
  }

  private void ensureBeforeDeadline(@Nullable Instant deadline) {
    if (isExpired(deadline)) {
      throw new StoreDeadlineExceededException("deadline exceeded before store call");
    }
  }

  private boolean isExpired(@Nullable Instant deadline) {
    return deadline != null && !Instant.now(clock).isBefore(deadline);
  }

  private void sleep(Duration backoff, @Nullable Instant deadline) {
    Duration wait = backoff;
    if (deadline != null) {
      final Duration remaining = Duration.between(Instant.now(clock), deadline);
      if (remaining.compareTo(wait) < 0) {
        wait = remaining.isNegative() ? Duration.ZERO : remaining;
      }
    }
    try {
      Thread.sleep(wait.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new StoreDeadlineExceededException("interrupted while waiting for retry", ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }
}
