package io.github.samzhu.usagemonitor.dto;

import java.time.Instant;

import io.github.samzhu.usagemonitor.product.MetricScope;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.product.ProductCategory;

/**
 * 單一指標在一次查詢中的用量紀錄。
 *
 * <p>每次呼叫重新計算，不持久化。使用率固定為：
 * <pre>
 * percentUsed = unlimited ? 0 : (limit > 0 ? currentUsage / limit * 100 : 0)
 * </pre>
 *
 * @param metricId 指標 ID
 * @param name 顯示名稱
 * @param category 產品分類
 * @param unit 計量單位
 * @param currentUsage 目前用量（已套用單位轉換）
 * @param limit 週期上限，0 表示未設定
 * @param percentUsed 使用率百分比
 * @param scope 查詢範圍
 * @param billingPeriodStart 帳單週期開始
 * @param billingPeriodEnd 帳單週期結束（不含）
 * @param error 錯誤訊息，成功時為 null
 * @param confidence 信賴區間，非抽樣資料時為 null
 * @param queryDurationMs 查詢耗時（毫秒）
 * @param note 附註
 * @param enabled 是否啟用監控
 * @param unlimited 是否無上限
 */
public record UsageRecord(
    String metricId,
    String name,
    ProductCategory category,
    String unit,
    double currentUsage,
    double limit,
    double percentUsed,
    MetricScope scope,
    Instant billingPeriodStart,
    Instant billingPeriodEnd,
    String error,
    ConfidenceInterval confidence,
    long queryDurationMs,
    String note,
    boolean enabled,
    boolean unlimited
) {

    static final String DISABLED_NOTE =
        "Product not enabled. Enable it under usage-monitor.products.<id>.enabled to monitor.";

    /**
     * 建立成功查詢的紀錄，並依上限計算使用率。
     */
    public static UsageRecord measured(MonitoredMetric metric, BillingPeriod period,
                                       double usage, ConfidenceInterval confidence, long durationMs) {
        boolean unlimited = metric.definition().unlimited();
        return new UsageRecord(
            metric.id(),
            metric.definition().name(),
            metric.definition().category(),
            metric.definition().unit(),
            usage,
            metric.limit(),
            calculatePercentUsed(usage, metric.limit(), unlimited),
            metric.scope(),
            period.start(),
            period.end(),
            null,
            confidence,
            durationMs,
            metric.definition().note(),
            true,
            unlimited
        );
    }

    /**
     * 建立失敗的紀錄，用量固定為 0。
     */
    public static UsageRecord failed(MonitoredMetric metric, BillingPeriod period,
                                     String error, long durationMs) {
        return new UsageRecord(
            metric.id(),
            metric.definition().name(),
            metric.definition().category(),
            metric.definition().unit(),
            0,
            metric.limit(),
            0,
            metric.scope(),
            period.start(),
            period.end(),
            error != null ? error : "Unknown error",
            null,
            durationMs,
            metric.definition().note(),
            true,
            metric.definition().unlimited()
        );
    }

    /**
     * 建立未啟用指標的佔位紀錄（不查詢）。
     */
    public static UsageRecord disabled(MonitoredMetric metric, BillingPeriod period) {
        return new UsageRecord(
            metric.id(),
            metric.definition().name(),
            metric.definition().category(),
            metric.definition().unit(),
            0,
            metric.limit(),
            0,
            metric.scope(),
            period.start(),
            period.end(),
            null,
            null,
            0,
            DISABLED_NOTE,
            false,
            metric.definition().unlimited()
        );
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    /**
     * 計算使用率。
     *
     * @param usage 目前用量
     * @param limit 上限
     * @param unlimited 是否無上限
     * @return 使用率百分比 (0-100+)，無上限或上限為 0 時回傳 0
     */
    public static double calculatePercentUsed(double usage, double limit, boolean unlimited) {
        if (unlimited || limit <= 0) {
            return 0.0;
        }
        return (usage / limit) * 100.0;
    }
}
