package io.github.samzhu.usagemonitor.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.MonitorRunResult;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.dto.UsageSummary;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;

/**
 * 定時用量監控任務，預設每 6 小時執行一次。
 *
 * <p>執行流程：
 * <ol>
 *   <li>確認已設定帳號 ID 與 API Token，否則略過本次執行</li>
 *   <li>從 {@link ZoneTagProvider} 取得 zone 列表</li>
 *   <li>查詢所有已啟用指標（套用排程的流量過濾）</li>
 *   <li>依組態門檻分類並記錄摘要</li>
 * </ol>
 *
 * <p>重試與整體逾時由排程器負責；單次執行本身可重複呼叫。
 *
 * @see UsageMonitorService
 */
@Service
public class UsageMonitorJob {

    private static final Logger log = LoggerFactory.getLogger(UsageMonitorJob.class);

    private final UsageMonitorService monitorService;
    private final ProductConfigService productConfigService;
    private final ZoneTagProvider zoneTagProvider;
    private final UsageMonitorProperties properties;
    private final Clock clock;

    public UsageMonitorJob(
            UsageMonitorService monitorService,
            ProductConfigService productConfigService,
            ZoneTagProvider zoneTagProvider,
            UsageMonitorProperties properties,
            Clock clock) {
        this.monitorService = monitorService;
        this.productConfigService = productConfigService;
        this.zoneTagProvider = zoneTagProvider;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 排程進入點。
     */
    @Scheduled(cron = "${usage-monitor.monitor.cron:0 0 */6 * * *}")
    public void scheduledCheck() {
        if (!properties.monitor().enabled()) {
            log.debug("Scheduled usage check is disabled");
            return;
        }
        runCheck();
    }

    /**
     * 執行一次完整的用量檢查。
     *
     * @return 執行結果；組態不完整時為略過結果
     */
    public MonitorRunResult runCheck() {
        Instant startedAt = Instant.now(clock);
        long startTime = System.currentTimeMillis();

        if (!properties.api().isConfigured()) {
            String reason = "Missing account ID or API token";
            log.error("Skipping usage check: {}", reason);
            return MonitorRunResult.skipped(reason, startedAt);
        }

        log.info("Starting usage check...");

        List<String> zoneTags = zoneTagProvider.getZoneTags();
        List<MonitoredMetric> metrics = productConfigService.getEnabledMetrics(zoneTags);
        UsageMonitorProperties.MonitorConfig monitor = properties.monitor();
        QueryFilterOptions filters = new QueryFilterOptions(
            monitor.eyeballOnly(), monitor.excludeEdgeWorkers(), monitor.excludeBlocked(), null);

        List<UsageRecord> records = monitorService.queryAllEnabled(metrics, zoneTags, filters);
        UsageMonitorProperties.ThresholdConfig thresholds = properties.thresholds();
        UsageSummary summary = monitorService.categorize(
            records, thresholds.alertPercent(), thresholds.warningPercent());

        long duration = System.currentTimeMillis() - startTime;
        log.info("Usage check completed in {}ms: {} alerts, {} warnings, {} healthy, {} errors",
            duration, summary.alerts().size(), summary.warnings().size(),
            summary.healthy().size(), summary.errors().size());
        if (summary.hasFindings()) {
            summary.alerts().forEach(r ->
                log.warn("ALERT {}: {} / {} {} ({}%)", r.metricId(), r.currentUsage(), r.limit(), r.unit(),
                    String.format("%.1f", r.percentUsed())));
            summary.warnings().forEach(r ->
                log.info("WARNING {}: {} / {} {} ({}%)", r.metricId(), r.currentUsage(), r.limit(), r.unit(),
                    String.format("%.1f", r.percentUsed())));
        } else {
            log.info("All {} metrics are within thresholds", summary.healthy().size());
        }

        return new MonitorRunResult(summary, metrics.size(), zoneTags.size(), false, null, startedAt, duration);
    }
}
