/*
 * どこで: Crons スケジュール評価
 * 何を: Schedule から予定実行時刻を計算する純粋関数群を提供する
 * なぜ: 取り込み側とスイープ側が同じ予定タイムラインに合意するため
 */
package com.example.crons.schedule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Optional;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
public class ScheduleEvaluator {

  private static final int CRONTAB_FIELD_COUNT = 5;
  private static final int DAY_OF_MONTH_FIELD = 2;
  private static final int DAY_OF_WEEK_FIELD = 4;
  // DST 等によるオフセット変化の上限。ローカル時刻と Instant の順序が入れ替わりうる幅
  private static final Duration MAX_OFFSET_SHIFT = Duration.ofHours(3);
  private static final Duration MAX_HORIZON = Duration.ofDays(8 * 366);
  private static final List<Duration> LOOKBACK_WINDOWS =
      List.of(
          Duration.ofHours(1),
          Duration.ofDays(1),
          Duration.ofDays(32),
          Duration.ofDays(367),
          MAX_HORIZON);

  /** {@code after} より厳密に後の最初の予定時刻。 */
  public Instant nextExpected(Schedule schedule, Instant after) {
    if (schedule instanceof CrontabSchedule crontab) {
      return nextCrontab(crontab, after);
    }
    if (schedule instanceof IntervalSchedule interval) {
      return nextInterval(interval, after);
    }
    throw new IllegalArgumentException("unsupported schedule: " + schedule);
  }

  /** {@code atOrBefore} 以前で最も新しい予定時刻。起点より前なら空。 */
  public Optional<Instant> previousExpected(Schedule schedule, Instant atOrBefore) {
    if (schedule instanceof CrontabSchedule crontab) {
      return previousCrontab(crontab, atOrBefore);
    }
    if (schedule instanceof IntervalSchedule interval) {
      return previousInterval(interval, atOrBefore);
    }
    throw new IllegalArgumentException("unsupported schedule: " + schedule);
  }

  /** 前後の予定時刻のうち近い方。等距離なら前を選ぶ。 */
  public Instant nearestExpected(Schedule schedule, Instant timestamp) {
    final Instant next = nextExpected(schedule, timestamp);
    final Optional<Instant> previous = previousExpected(schedule, timestamp);
    if (previous.isEmpty()) {
      return next;
    }
    final Duration sincePrevious = Duration.between(previous.get(), timestamp);
    final Duration untilNext = Duration.between(timestamp, next);
    return untilNext.compareTo(sincePrevious) < 0 ? next : previous.get();
  }

  public WindowState inWindow(Instant expected, Duration margin, Instant now) {
    if (!now.isAfter(expected)) {
      return WindowState.ON_TIME;
    }
    if (!now.isAfter(expected.plus(margin))) {
      return WindowState.LATE;
    }
    return WindowState.MISSED;
  }

  /**
   * 5 フィールドの crontab 式 (または {@code @daily} 等のマクロ) を秒フィールド付きの式に変換して解析する。
   *
   * <p>日と曜日の両方が制限されている場合、標準の cron と同じくどちらか一方に一致すれば発火する。
   * {@link CronExpression} は両方の一致を要求するため、日だけ・曜日だけの 2 式に分けて返す。
   *
   * @throws InvalidScheduleException 式が不正な場合
   */
  public static List<CronExpression> parseCrontab(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidScheduleException("crontab expression is required");
    }
    final String trimmed = expression.trim();
    if (trimmed.startsWith("@")) {
      return List.of(parseSixFields(trimmed, expression));
    }
    final String[] fields = trimmed.split("\\s+");
    if (fields.length != CRONTAB_FIELD_COUNT) {
      throw new InvalidScheduleException("crontab must have 5 fields: " + expression);
    }
    final String dayOfMonth = fields[DAY_OF_MONTH_FIELD];
    final String dayOfWeek = fields[DAY_OF_WEEK_FIELD];
    if (isUnrestricted(dayOfMonth) || isUnrestricted(dayOfWeek)) {
      return List.of(parseSixFields("0 " + String.join(" ", fields), expression));
    }
    final String[] byDayOfMonth = fields.clone();
    byDayOfMonth[DAY_OF_WEEK_FIELD] = "*";
    final String[] byDayOfWeek = fields.clone();
    byDayOfWeek[DAY_OF_MONTH_FIELD] = "*";
    return List.of(
        parseSixFields("0 " + String.join(" ", byDayOfMonth), expression),
        parseSixFields("0 " + String.join(" ", byDayOfWeek), expression));
  }

  // 先頭が * の値 (*/2 等も含む) は制限なしとして扱う
  private static boolean isUnrestricted(String field) {
    return field.startsWith("*") || field.equals("?");
  }

  private static CronExpression parseSixFields(String sixFields, String original) {
    try {
      return CronExpression.parse(sixFields);
    } catch (IllegalArgumentException ex) {
      throw new InvalidScheduleException("invalid crontab: " + original, ex);
    }
  }

  private Instant nextCrontab(CrontabSchedule schedule, Instant after) {
    Instant best = null;
    for (CronExpression cron : parseCrontab(schedule.expression())) {
      final Instant candidate = nextCrontab(cron, schedule, after);
      if (candidate != null && (best == null || candidate.isBefore(best))) {
        best = candidate;
      }
    }
    if (best == null) {
      throw new InvalidScheduleException(
          "crontab has no future occurrence: " + schedule.expression());
    }
    return best;
  }

  private Instant nextCrontab(CronExpression cron, CrontabSchedule schedule, Instant after) {
    final ZoneRules rules = schedule.zone().getRules();
    final Duration shift = rules.isFixedOffset() ? Duration.ZERO : MAX_OFFSET_SHIFT;
    final LocalDateTime localAfter = LocalDateTime.ofInstant(after, schedule.zone());
    final LocalDateTime limit = localAfter.plus(MAX_HORIZON);

    Instant best = null;
    LocalDateTime bestLocal = null;
    LocalDateTime cursor = localAfter.minus(shift);
    while (true) {
      final LocalDateTime local = cron.next(cursor);
      if (local == null || local.isAfter(limit)) {
        break;
      }
      // これより先のローカル時刻は best より前の Instant になり得ない
      if (bestLocal != null && local.isAfter(bestLocal.plus(shift))) {
        break;
      }
      // 夏時間の欠落時刻は有効オフセットが無いので生成しない。重複時刻は両方を候補にする
      for (ZoneOffset offset : rules.getValidOffsets(local)) {
        final Instant candidate = local.toInstant(offset);
        if (candidate.isAfter(after) && (best == null || candidate.isBefore(best))) {
          best = candidate;
          bestLocal = local;
        }
      }
      cursor = local;
    }
    return best;
  }

  private Optional<Instant> previousCrontab(CrontabSchedule schedule, Instant atOrBefore) {
    Optional<Instant> best = Optional.empty();
    for (CronExpression cron : parseCrontab(schedule.expression())) {
      final Optional<Instant> candidate = previousCrontab(cron, schedule, atOrBefore);
      if (candidate.isPresent() && (best.isEmpty() || candidate.get().isAfter(best.get()))) {
        best = candidate;
      }
    }
    return best;
  }

  private Optional<Instant> previousCrontab(
      CronExpression cron, CrontabSchedule schedule, Instant atOrBefore) {
    final ZoneRules rules = schedule.zone().getRules();
    final Duration shift = rules.isFixedOffset() ? Duration.ZERO : MAX_OFFSET_SHIFT;
    final LocalDateTime localAt = LocalDateTime.ofInstant(atOrBefore, schedule.zone());
    final LocalDateTime end = localAt.plus(shift);

    Instant best = null;
    for (Duration window : LOOKBACK_WINDOWS) {
      final LocalDateTime start = localAt.minus(window).minus(shift);
      best = null;
      LocalDateTime bestLocal = null;
      LocalDateTime cursor = start;
      while (true) {
        final LocalDateTime local = cron.next(cursor);
        if (local == null || local.isAfter(end)) {
          break;
        }
        for (ZoneOffset offset : rules.getValidOffsets(local)) {
          final Instant candidate = local.toInstant(offset);
          if (!candidate.isAfter(atOrBefore) && (best == null || candidate.isAfter(best))) {
            best = candidate;
            bestLocal = local;
          }
        }
        cursor = local;
      }
      // 窓の下端付近で見つかった候補は、窓の外にもっと新しい Instant がある可能性を残す
      if (best != null && !bestLocal.isBefore(start.plus(shift))) {
        return Optional.of(best);
      }
    }
    return Optional.ofNullable(best);
  }

  private Instant nextInterval(IntervalSchedule schedule, Instant after) {
    if (after.isBefore(schedule.anchor())) {
      return schedule.anchor();
    }
    long n = estimateIndex(schedule, after);
    while (n > 0 && occurrence(schedule, n - 1).isAfter(after)) {
      n--;
    }
    while (!occurrence(schedule, n).isAfter(after)) {
      n++;
    }
    return occurrence(schedule, n);
  }

  private Optional<Instant> previousInterval(IntervalSchedule schedule, Instant atOrBefore) {
    if (atOrBefore.isBefore(schedule.anchor())) {
      return Optional.empty();
    }
    long n = estimateIndex(schedule, atOrBefore);
    while (n > 0 && occurrence(schedule, n).isAfter(atOrBefore)) {
      n--;
    }
    while (!isBeyond(schedule, n + 1, atOrBefore)) {
      n++;
    }
    return Optional.of(occurrence(schedule, n));
  }

  // 表現できる範囲を超えた回は、どの時刻よりも後にあるものとして扱う
  private boolean isBeyond(IntervalSchedule schedule, long n, Instant instant) {
    try {
      return occurrence(schedule, n).isAfter(instant);
    } catch (InvalidScheduleException ex) {
      return true;
    }
  }

  // N 回目は常に起点から計算する (前回実行時刻に加算しない)
  private Instant occurrence(IntervalSchedule schedule, long n) {
    try {
      final long amount = Math.multiplyExact(n, (long) schedule.value());
      if (schedule.unit().isFixedLength()) {
        return schedule
            .anchor()
            .plus(schedule.unit().chronoUnit().getDuration().multipliedBy(amount));
      }
      return schedule
          .anchor()
          .atZone(schedule.zone())
          .plus(amount, schedule.unit().chronoUnit())
          .toInstant();
    } catch (ArithmeticException | DateTimeException ex) {
      throw new InvalidScheduleException(
          "interval occurrence is out of range: "
              + schedule.value()
              + " "
              + schedule.unit().value(),
          ex);
    }
  }

  // 秒単位で概算する。ミリ秒だと年単位の大きな間隔で long が溢れる
  private long estimateIndex(IntervalSchedule schedule, Instant instant) {
    final long stepSeconds =
        Math.multiplyExact(
            schedule.unit().chronoUnit().getDuration().getSeconds(), (long) schedule.value());
    final long elapsedSeconds = Duration.between(schedule.anchor(), instant).getSeconds();
    return Math.max(0L, elapsedSeconds / stepSeconds);
  }
}
