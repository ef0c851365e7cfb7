package io.github.samzhu.usagemonitor.dto.api;

import java.util.List;

import io.github.samzhu.usagemonitor.dto.UsageRecord;

/**
 * 所有指標用量報表回應。
 *
 * @param billingPeriod 帳單週期
 * @param zoneId 指定的 zone，全帳號檢視時為 null
 * @param summary 已啟用指標的分類統計
 * @param products 所有指標的用量紀錄（未啟用者在最後）
 * @param totalQueryDurationMs 查詢耗時總和
 */
public record UsageReportResponse(
    BillingPeriodResponse billingPeriod,
    String zoneId,
    SummaryCounts summary,
    List<UsageRecord> products,
    long totalQueryDurationMs
) {}
