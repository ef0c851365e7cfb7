package io.github.samzhu.usagemonitor.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.dto.UsageSummary;
import io.github.samzhu.usagemonitor.product.MetricScope;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.util.PeriodUtils;

/**
 * 用量彙總引擎的對外入口。
 *
 * <p>提供：
 * <ul>
 *   <li>{@link #queryAllEnabled} - 查詢所有已啟用指標</li>
 *   <li>{@link #queryAllConfigured} - 查詢所有指標，未啟用者以佔位紀錄回傳</li>
 *   <li>{@link #categorize} - 依門檻分類</li>
 *   <li>{@link #currentBillingPeriod} - 計算目前帳單週期</li>
 * </ul>
 *
 * <p>所有入口都不會拋出例外；每個失敗都落在對應紀錄的 {@code error} 欄位。
 * 每次呼叫都從頭計算整個週期的用量，可安全重試。
 */
@Service
public class UsageMonitorService {

    private static final Logger log = LoggerFactory.getLogger(UsageMonitorService.class);

    private final BatchQueryRunner batchQueryRunner;
    private final UsageCategorizer categorizer;
    private final UsageMonitorProperties properties;
    private final Clock clock;

    public UsageMonitorService(
            BatchQueryRunner batchQueryRunner,
            UsageCategorizer categorizer,
            UsageMonitorProperties properties,
            Clock clock) {
        this.batchQueryRunner = batchQueryRunner;
        this.categorizer = categorizer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 查詢所有已啟用指標，未啟用者略過。
     *
     * @param metrics 執行期指標
     * @param zoneTags 未指定 zone 的 zone 範圍指標所使用的 zone
     * @param filters 流量過濾選項
     * @return 已啟用指標的用量紀錄，順序與輸入相同
     */
    public List<UsageRecord> queryAllEnabled(List<MonitoredMetric> metrics, List<String> zoneTags,
                                             QueryFilterOptions filters) {
        BillingPeriod period = currentBillingPeriod();
        List<MonitoredMetric> enabled = metrics.stream()
            .filter(MonitoredMetric::enabled)
            .map(metric -> withDefaultZones(metric, zoneTags))
            .toList();

        log.info("Querying {} enabled metrics for period {} - {}", enabled.size(), period.start(), period.end());
        return batchQueryRunner.runAll(enabled, period, filters);
    }

    /**
     * 查詢所有指標，未啟用者附加在最後，作為不查詢的佔位紀錄。
     *
     * <p>指定單一 zone 時只保留 zone 範圍指標，並改以該 zone 查詢，
     * 同時隱藏有 zone 變體的帳號層級指標；未指定時則隱藏 zone 變體以避免重複計算。
     *
     * @param metrics 執行期指標
     * @param zoneTags 未指定 zone 的 zone 範圍指標所使用的 zone
     * @param filters 流量過濾選項
     * @return 已查詢紀錄在前、佔位紀錄在後
     */
    public List<UsageRecord> queryAllConfigured(List<MonitoredMetric> metrics, List<String> zoneTags,
                                                QueryFilterOptions filters) {
        BillingPeriod period = currentBillingPeriod();
        Map<String, String> zoneVariants = properties.zoneVariants();
        QueryFilterOptions effectiveFilters = filters != null ? filters : QueryFilterOptions.none();

        List<MonitoredMetric> visible;
        if (effectiveFilters.hasZoneRestriction()) {
            List<String> restricted = List.of(effectiveFilters.zoneId());
            visible = metrics.stream()
                .filter(metric -> metric.scope() == MetricScope.ZONE)
                .filter(metric -> !zoneVariants.containsKey(metric.id()))
                .map(metric -> metric.withZoneTags(restricted))
                .toList();
        } else {
            Collection<String> hiddenVariants = zoneVariants.values();
            visible = metrics.stream()
                .filter(metric -> !hiddenVariants.contains(metric.id()))
                .map(metric -> withDefaultZones(metric, zoneTags))
                .toList();
        }

        List<MonitoredMetric> enabled = visible.stream().filter(MonitoredMetric::enabled).toList();
        List<MonitoredMetric> disabled = visible.stream().filter(metric -> !metric.enabled()).toList();

        log.info("Querying {} of {} configured metrics (zone={})",
            enabled.size(), visible.size(), effectiveFilters.zoneId());

        List<UsageRecord> results = new ArrayList<>(batchQueryRunner.runAll(enabled, period, effectiveFilters));
        for (MonitoredMetric metric : disabled) {
            results.add(UsageRecord.disabled(metric, period));
        }
        return results;
    }

    /**
     * 依門檻分類用量紀錄。
     */
    public UsageSummary categorize(List<UsageRecord> records, double alertThreshold, double warningThreshold) {
        return categorizer.categorize(records, alertThreshold, warningThreshold);
    }

    /**
     * 依組態的錨定日與時區計算目前帳單週期。
     */
    public BillingPeriod currentBillingPeriod() {
        UsageMonitorProperties.BillingConfig billing = properties.billing();
        return currentBillingPeriod(billing.startDay(), billing.zoneId(), Instant.now(clock));
    }

    public static BillingPeriod currentBillingPeriod(int anchorDay, ZoneId timezone, Instant now) {
        return PeriodUtils.currentBillingPeriod(anchorDay, timezone, now);
    }

    private static MonitoredMetric withDefaultZones(MonitoredMetric metric, List<String> zoneTags) {
        if (metric.scope() == MetricScope.ZONE && metric.zoneTags().isEmpty() && zoneTags != null) {
            return metric.withZoneTags(zoneTags);
        }
        return metric;
    }
}
