package io.github.samzhu.usagemonitor.dto.api;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 帳單週期回應。
 *
 * @param start 週期開始時間（含）
 * @param end 週期結束時間（不含）
 * @param timezone 週期時區
 * @param startDate 開始日期
 * @param endDate 結束日期（不含）
 * @param daysRemaining 距離週期結束的天數
 * @param elapsedPercent 週期已經過的百分比
 */
public record BillingPeriodResponse(
    Instant start,
    Instant end,
    String timezone,
    LocalDate startDate,
    LocalDate endDate,
    long daysRemaining,
    double elapsedPercent
) {}
