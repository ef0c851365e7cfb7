package io.github.samzhu.usagemonitor.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

import io.github.samzhu.usagemonitor.dto.BillingPeriod;

/**
 * 帳單週期工具類。
 *
 * <p>週期以每月固定的錨定日（1-28）為界，在指定時區的午夜切換，
 * 而不是日曆月的邊界。週期為半開區間 {@code [start, end)}，
 * {@code end} 恰為 {@code start} 之後一個日曆月。
 */
public final class PeriodUtils {

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 計算目前所在的帳單週期。
     *
     * <p>若今天（週期時區）的日期小於錨定日，週期從上個月的錨定日開始；
     * 否則從本月的錨定日開始。
     *
     * @param startDay 錨定日 (1-28)
     * @param zone 週期時區
     * @param now 目前時間
     * @return 目前帳單週期
     * @throws IllegalArgumentException 錨定日不在 1-28 之間
     */
    public static BillingPeriod currentBillingPeriod(int startDay, ZoneId zone, Instant now) {
        if (startDay < 1 || startDay > 28) {
            throw new IllegalArgumentException("Billing start day must be between 1 and 28: " + startDay);
        }
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate startDate = today.withDayOfMonth(startDay);
        if (today.getDayOfMonth() < startDay) {
            startDate = startDate.minusMonths(1);
        }

        ZonedDateTime start = startDate.atStartOfDay(zone);
        ZonedDateTime end = start.plusMonths(1);
        return new BillingPeriod(start.toInstant(), end.toInstant(), zone);
    }

    /**
     * 計算距離週期結束的剩餘天數。
     *
     * @param periodEnd 週期結束時間
     * @param now 目前時間
     * @return 剩餘天數，如果已過期則返回 0
     */
    public static long getDaysRemaining(Instant periodEnd, Instant now) {
        if (periodEnd == null || !now.isBefore(periodEnd)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(now, periodEnd);
    }

    /**
     * 計算週期已經過的比例。
     *
     * @param period 帳單週期
     * @param now 目前時間
     * @return 0 到 1 之間的比例
     */
    public static double getElapsedFraction(BillingPeriod period, Instant now) {
        long total = period.end().toEpochMilli() - period.start().toEpochMilli();
        long elapsed = now.toEpochMilli() - period.start().toEpochMilli();
        if (total <= 0 || elapsed <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) elapsed / total);
    }
}
