package io.github.samzhu.usagemonitor.service;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties.ProductOverride;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.MetricScope;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.product.ProductCatalog;

/**
 * 合併內建目錄與組態覆寫，產生執行期指標。
 *
 * <p>合併規則：
 * <ul>
 *   <li>limit = 覆寫值，未設定時為目錄預設</li>
 *   <li>enabled = 覆寫值，未設定時為目錄預設</li>
 *   <li>zoneTags = 覆寫值，未設定時 zone 範圍指標使用預設 zone，account 範圍為空</li>
 * </ul>
 * 指向未知指標的覆寫只記錄警告並忽略。
 */
@Service
public class ProductConfigService {

    private static final Logger log = LoggerFactory.getLogger(ProductConfigService.class);

    private final List<MetricDefinition> catalog;
    private final Map<String, ProductOverride> overrides;

    public ProductConfigService(UsageMonitorProperties properties) {
        this(ProductCatalog.all(), properties.products());
    }

    ProductConfigService(List<MetricDefinition> catalog, Map<String, ProductOverride> overrides) {
        this.catalog = List.copyOf(catalog);
        this.overrides = Map.copyOf(overrides);
        overrides.keySet().stream()
            .filter(id -> catalog.stream().noneMatch(d -> d.id().equals(id)))
            .sorted()
            .forEach(id -> log.warn("Ignoring override for unknown product: {}", id));
    }

    /**
     * 取得所有指標（含未啟用）。
     *
     * @param defaultZoneTags zone 範圍指標的預設 zone
     * @return 執行期指標，順序與目錄相同
     */
    public List<MonitoredMetric> getConfiguredMetrics(List<String> defaultZoneTags) {
        return catalog.stream()
            .map(definition -> merge(definition, defaultZoneTags))
            .toList();
    }

    /**
     * 取得已啟用的指標。
     */
    public List<MonitoredMetric> getEnabledMetrics(List<String> defaultZoneTags) {
        return getConfiguredMetrics(defaultZoneTags).stream()
            .filter(MonitoredMetric::enabled)
            .toList();
    }

    private MonitoredMetric merge(MetricDefinition definition, List<String> defaultZoneTags) {
        ProductOverride override = overrides.get(definition.id());
        double limit = override != null && override.limit() != null
            ? override.limit()
            : definition.defaultLimit();
        boolean enabled = override != null && override.enabled() != null
            ? override.enabled()
            : definition.enabledByDefault();
        List<String> zoneTags;
        if (override != null && override.zoneTags() != null) {
            zoneTags = override.zoneTags();
        } else {
            zoneTags = definition.scope() == MetricScope.ZONE ? defaultZoneTags : List.of();
        }
        return new MonitoredMetric(definition, limit, enabled, zoneTags);
    }
}
