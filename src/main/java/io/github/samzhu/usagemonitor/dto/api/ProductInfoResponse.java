package io.github.samzhu.usagemonitor.dto.api;

import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.MetricScope;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;

/**
 * 指標目錄項目回應，含合併覆寫後的上限與啟用狀態。
 */
public record ProductInfoResponse(
    String id,
    String name,
    String category,
    String description,
    String unit,
    MetricScope scope,
    String dataset,
    double limit,
    boolean enabled,
    boolean unlimited,
    String note
) {

    public static ProductInfoResponse from(MonitoredMetric metric) {
        MetricDefinition d = metric.definition();
        return new ProductInfoResponse(
            d.id(),
            d.name(),
            d.category() != null ? d.category().displayName() : null,
            d.description(),
            d.unit(),
            d.scope(),
            d.dataset(),
            metric.limit(),
            metric.enabled(),
            d.unlimited(),
            d.note()
        );
    }
}
