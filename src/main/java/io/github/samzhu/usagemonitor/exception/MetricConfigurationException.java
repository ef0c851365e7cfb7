package io.github.samzhu.usagemonitor.exception;

/**
 * 指標組態錯誤。
 *
 * <p>在以下情況拋出：
 * <ul>
 *   <li>指標定義格式錯誤（例如非 count 聚合卻沒有 field），於建立定義時拋出</li>
 *   <li>zone 範圍指標沒有任何 zone 可查詢，於執行期轉為該指標的錯誤紀錄</li>
 * </ul>
 *
 * <p>此錯誤只影響單一指標，不會中止整批查詢。
 */
public class MetricConfigurationException extends RuntimeException {

    private final String metricId;

    public MetricConfigurationException(String metricId, String message) {
        super(message);
        this.metricId = metricId;
    }

    public String getMetricId() {
        return metricId;
    }
}
