package io.github.samzhu.usagemonitor.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 帳單週期，半開區間 {@code [start, end)}。
 *
 * @param start 週期開始時間（含）
 * @param end 週期結束時間（不含），恰為開始後一個日曆月
 * @param zone 計算週期所用的時區
 */
public record BillingPeriod(
    Instant start,
    Instant end,
    ZoneId zone
) {

    /**
     * 週期開始日期（週期時區）。
     */
    public LocalDate startDate() {
        return LocalDate.ofInstant(start, zone);
    }

    /**
     * 週期結束日期（週期時區，不含）。
     */
    public LocalDate endDate() {
        return LocalDate.ofInstant(end, zone);
    }
}
