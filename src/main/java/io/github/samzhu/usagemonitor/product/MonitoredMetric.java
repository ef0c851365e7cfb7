package io.github.samzhu.usagemonitor.product;

import java.util.List;

/**
 * 合併組態覆寫後的執行期指標。
 *
 * @param definition 指標定義
 * @param limit 有效週期上限（覆寫值或預設值），0 表示未設定
 * @param enabled 是否啟用監控
 * @param zoneTags zone 範圍指標要查詢的 zone；account 範圍為空列表
 */
public record MonitoredMetric(
    MetricDefinition definition,
    double limit,
    boolean enabled,
    List<String> zoneTags
) {
    public MonitoredMetric {
        zoneTags = zoneTags == null ? List.of() : List.copyOf(zoneTags);
    }

    public String id() {
        return definition.id();
    }

    public MetricScope scope() {
        return definition.scope();
    }

    /**
     * 以指定 zone 集合建立副本。
     */
    public MonitoredMetric withZoneTags(List<String> tags) {
        return new MonitoredMetric(definition, limit, enabled, tags);
    }
}
