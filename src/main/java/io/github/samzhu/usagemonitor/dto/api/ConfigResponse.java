package io.github.samzhu.usagemonitor.dto.api;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.ProductCatalog;

/**
 * 遮蔽後的組態檢視。
 *
 * <p>只回報憑證是否存在，不回傳 API Token 與帳號 ID。
 *
 * @param thresholds 告警與警示門檻
 * @param billing 帳單週期設定與目前週期
 * @param contractCaps 有設定上限且未停用的合約上限
 * @param monitorCron 定時監控排程
 * @param environment 環境設定狀態
 */
public record ConfigResponse(
    Thresholds thresholds,
    Billing billing,
    List<ContractCap> contractCaps,
    String monitorCron,
    Environment environment
) {

    public record Thresholds(double alertPercent, double warningPercent) {}

    public record Billing(int startDay, String timezone, BillingPeriodResponse currentPeriod) {}

    /**
     * 單一指標的合約上限，目錄找不到時名稱與單位沿用 ID 與空字串。
     */
    public record ContractCap(String productId, String productName, double limit, String unit) {}

    public record Environment(
        boolean hasApiToken,
        boolean hasAccountId,
        boolean hasZoneTags,
        int zoneTagsConfigured,
        boolean configured,
        boolean seatLimitConfigured
    ) {}

    public static ConfigResponse from(UsageMonitorProperties properties,
                                      List<String> zoneTags,
                                      BillingPeriodResponse currentPeriod) {
        UsageMonitorProperties.ApiConfig api = properties.api();
        return new ConfigResponse(
            new Thresholds(properties.thresholds().alertPercent(), properties.thresholds().warningPercent()),
            new Billing(properties.billing().startDay(), properties.billing().timezone(), currentPeriod),
            contractCaps(properties.products()),
            properties.monitor().cron(),
            new Environment(
                hasText(api.apiToken()),
                hasText(api.accountId()),
                !zoneTags.isEmpty(),
                zoneTags.size(),
                api.isConfigured(),
                properties.seats().limit() > 0
            )
        );
    }

    private static List<ContractCap> contractCaps(Map<String, UsageMonitorProperties.ProductOverride> products) {
        return products.entrySet().stream()
            .filter(e -> e.getValue() != null && e.getValue().limit() != null)
            .filter(e -> !Boolean.FALSE.equals(e.getValue().enabled()))
            .map(e -> {
                MetricDefinition definition = ProductCatalog.findById(e.getKey()).orElse(null);
                return new ContractCap(
                    e.getKey(),
                    definition != null ? definition.name() : e.getKey(),
                    e.getValue().limit(),
                    definition != null ? definition.unit() : "");
            })
            .sorted(Comparator.comparing(ContractCap::productId))
            .toList();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
