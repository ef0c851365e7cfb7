package io.github.samzhu.usagemonitor.controller;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.DatasetDiscovery;
import io.github.samzhu.usagemonitor.dto.MonitorRunResult;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.dto.SeatUsage;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.dto.UsageSummary;
import io.github.samzhu.usagemonitor.dto.api.BillingPeriodResponse;
import io.github.samzhu.usagemonitor.dto.api.ConfigResponse;
import io.github.samzhu.usagemonitor.dto.api.ErrorResponse;
import io.github.samzhu.usagemonitor.dto.api.ProductInfoResponse;
import io.github.samzhu.usagemonitor.dto.api.SummaryCounts;
import io.github.samzhu.usagemonitor.dto.api.UsageReportResponse;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.service.DatasetDiscoveryService;
import io.github.samzhu.usagemonitor.service.ProductConfigService;
import io.github.samzhu.usagemonitor.service.SeatUsageService;
import io.github.samzhu.usagemonitor.service.UsageMonitorJob;
import io.github.samzhu.usagemonitor.service.UsageMonitorService;
import io.github.samzhu.usagemonitor.service.ZoneTagProvider;
import io.github.samzhu.usagemonitor.util.PeriodUtils;

/**
 * 用量監控 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/usage} - 所有指標用量（含未啟用佔位）</li>
 *   <li>{@code GET /api/v1/usage/summary} - 已啟用指標的分類摘要</li>
 *   <li>{@code GET /api/v1/usage/billing-period} - 目前帳單週期</li>
 *   <li>{@code GET /api/v1/usage/products} - 指標目錄與執行期上限</li>
 *   <li>{@code GET /api/v1/usage/zones} - 使用中的 zone 列表</li>
 *   <li>{@code GET /api/v1/usage/seats} - Zero Trust 席次用量</li>
 *   <li>{@code GET /api/v1/usage/config} - 遮蔽憑證後的組態</li>
 *   <li>{@code GET /api/v1/usage/datasets} - 後端可用但尚未納入目錄的 dataset</li>
 *   <li>{@code POST /api/v1/usage/check} - 立即執行一次監控</li>
 * </ul>
 *
 * <p>zone ID 必須為 32 位十六進位字串，門檻必須介於 0 到 100，否則回傳 400。
 */
@RestController
@RequestMapping("/api/v1/usage")
public class UsageApiController {

    private static final Logger log = LoggerFactory.getLogger(UsageApiController.class);

    private static final Pattern ZONE_ID_PATTERN = Pattern.compile("^[a-f0-9]{32}$");

    private final UsageMonitorService monitorService;
    private final ProductConfigService productConfigService;
    private final ZoneTagProvider zoneTagProvider;
    private final UsageMonitorJob monitorJob;
    private final SeatUsageService seatUsageService;
    private final DatasetDiscoveryService datasetDiscoveryService;
    private final UsageMonitorProperties properties;
    private final Clock clock;

    public UsageApiController(UsageMonitorService monitorService,
                              ProductConfigService productConfigService,
                              ZoneTagProvider zoneTagProvider,
                              UsageMonitorJob monitorJob,
                              SeatUsageService seatUsageService,
                              DatasetDiscoveryService datasetDiscoveryService,
                              UsageMonitorProperties properties,
                              Clock clock) {
        this.monitorService = monitorService;
        this.productConfigService = productConfigService;
        this.zoneTagProvider = zoneTagProvider;
        this.monitorJob = monitorJob;
        this.seatUsageService = seatUsageService;
        this.datasetDiscoveryService = datasetDiscoveryService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 查詢所有指標用量。
     *
     * <p>端點：{@code GET /api/v1/usage?zoneId=&eyeballOnly=&excludeBlocked=&excludeEdgeWorkers=}
     *
     * @param zoneId 只查詢單一 zone
     * @param eyeballOnly 只計算訪客流量
     * @param excludeBlocked 排除被阻擋的請求
     * @param excludeEdgeWorkers 排除 edge Worker 請求
     * @return 用量報表
     */
    @GetMapping
    public ResponseEntity<?> getUsage(
            @RequestParam(required = false) String zoneId,
            @RequestParam(defaultValue = "false") boolean eyeballOnly,
            @RequestParam(defaultValue = "false") boolean excludeBlocked,
            @RequestParam(defaultValue = "false") boolean excludeEdgeWorkers) {

        log.info("API request: getUsage zoneId={}, eyeballOnly={}, excludeBlocked={}, excludeEdgeWorkers={}",
            zoneId, eyeballOnly, excludeBlocked, excludeEdgeWorkers);

        String normalizedZoneId = null;
        if (zoneId != null && !zoneId.isBlank()) {
            normalizedZoneId = zoneId.trim().toLowerCase(Locale.ROOT);
            if (!ZONE_ID_PATTERN.matcher(normalizedZoneId).matches()) {
                return ResponseEntity.badRequest().body(
                    new ErrorResponse("invalid_zone_id", "zoneId must be a 32-character hexadecimal string"));
            }
        }

        QueryFilterOptions filters = new QueryFilterOptions(
            eyeballOnly, excludeEdgeWorkers, excludeBlocked, normalizedZoneId);
        List<String> zoneTags = zoneTagProvider.getZoneTags();
        List<MonitoredMetric> metrics = productConfigService.getConfiguredMetrics(zoneTags);

        List<UsageRecord> records = monitorService.queryAllConfigured(metrics, zoneTags, filters);
        List<UsageRecord> enabled = records.stream().filter(UsageRecord::enabled).toList();
        UsageMonitorProperties.ThresholdConfig thresholds = properties.thresholds();
        UsageSummary summary = monitorService.categorize(
            enabled, thresholds.alertPercent(), thresholds.warningPercent());

        log.debug("getUsage response: {} records, {} enabled", records.size(), enabled.size());

        return ResponseEntity.ok(new UsageReportResponse(
            toResponse(monitorService.currentBillingPeriod()),
            normalizedZoneId,
            SummaryCounts.of(summary, records.size() - enabled.size()),
            records,
            summary.totalQueryDurationMs()
        ));
    }

    /**
     * 查詢已啟用指標並依門檻分類。
     *
     * <p>端點：{@code GET /api/v1/usage/summary?alertThreshold=&warningThreshold=}
     *
     * @param alertThreshold 告警門檻，未指定時使用組態值
     * @param warningThreshold 警示門檻，未指定時使用組態值
     * @return 用量摘要
     */
    @GetMapping("/summary")
    public ResponseEntity<?> getSummary(
            @RequestParam(required = false) Double alertThreshold,
            @RequestParam(required = false) Double warningThreshold) {

        UsageMonitorProperties.ThresholdConfig thresholds = properties.thresholds();
        double alert = alertThreshold != null ? alertThreshold : thresholds.alertPercent();
        double warning = warningThreshold != null ? warningThreshold : thresholds.warningPercent();
        if (!isPercent(alert) || !isPercent(warning)) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("invalid_threshold", "Thresholds must be between 0 and 100"));
        }

        log.info("API request: getSummary alert={}, warning={}", alert, warning);

        List<String> zoneTags = zoneTagProvider.getZoneTags();
        List<UsageRecord> records = monitorService.queryAllEnabled(
            productConfigService.getEnabledMetrics(zoneTags), zoneTags, QueryFilterOptions.none());
        return ResponseEntity.ok(monitorService.categorize(records, alert, warning));
    }

    /**
     * 查詢目前帳單週期。
     *
     * <p>端點：{@code GET /api/v1/usage/billing-period}
     */
    @GetMapping("/billing-period")
    public ResponseEntity<BillingPeriodResponse> getBillingPeriod() {
        return ResponseEntity.ok(toResponse(monitorService.currentBillingPeriod()));
    }

    /**
     * 查詢指標目錄與合併覆寫後的上限。
     *
     * <p>端點：{@code GET /api/v1/usage/products}
     */
    @GetMapping("/products")
    public ResponseEntity<List<ProductInfoResponse>> getProducts() {
        List<ProductInfoResponse> products = productConfigService
            .getConfiguredMetrics(zoneTagProvider.getZoneTags()).stream()
            .map(ProductInfoResponse::from)
            .toList();
        return ResponseEntity.ok(products);
    }

    /**
     * 查詢使用中的 zone 列表。
     *
     * <p>端點：{@code GET /api/v1/usage/zones}
     */
    @GetMapping("/zones")
    public ResponseEntity<List<String>> getZones() {
        return ResponseEntity.ok(zoneTagProvider.getZoneTags());
    }

    /**
     * 查詢 Zero Trust 席次用量。
     *
     * <p>端點：{@code GET /api/v1/usage/seats}，查詢失敗時狀態為 {@code ERROR} 並附錯誤訊息。
     */
    @GetMapping("/seats")
    public ResponseEntity<SeatUsage> getSeats() {
        log.info("API request: getSeats");
        return ResponseEntity.ok(seatUsageService.getSeatUsage());
    }

    /**
     * 查詢遮蔽憑證後的組態。
     *
     * <p>端點：{@code GET /api/v1/usage/config}
     */
    @GetMapping("/config")
    public ResponseEntity<ConfigResponse> getConfig() {
        return ResponseEntity.ok(ConfigResponse.from(
            properties,
            zoneTagProvider.getZoneTags(),
            toResponse(monitorService.currentBillingPeriod())));
    }

    /**
     * 比對後端 schema 與指標目錄使用的 dataset。
     *
     * <p>端點：{@code GET /api/v1/usage/datasets}
     */
    @GetMapping("/datasets")
    public ResponseEntity<DatasetDiscovery> getDatasets() {
        log.info("API request: getDatasets");
        return ResponseEntity.ok(datasetDiscoveryService.discover());
    }

    /**
     * 立即執行一次監控。
     *
     * <p>端點：{@code POST /api/v1/usage/check}
     */
    @PostMapping("/check")
    public ResponseEntity<MonitorRunResult> triggerCheck() {
        log.info("API request: triggerCheck");
        return ResponseEntity.ok(monitorJob.runCheck());
    }

    private BillingPeriodResponse toResponse(BillingPeriod period) {
        Instant now = Instant.now(clock);
        return new BillingPeriodResponse(
            period.start(),
            period.end(),
            period.zone().getId(),
            period.startDate(),
            period.endDate(),
            PeriodUtils.getDaysRemaining(period.end(), now),
            PeriodUtils.getElapsedFraction(period, now) * 100.0
        );
    }

    private static boolean isPercent(double value) {
        return value >= 0 && value <= 100;
    }
}
