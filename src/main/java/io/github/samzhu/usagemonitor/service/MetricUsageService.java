package io.github.samzhu.usagemonitor.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.usagemonitor.client.GraphQLResponse;
import io.github.samzhu.usagemonitor.client.QueryExecutor;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.ConfidenceInterval;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.exception.MetricConfigurationException;
import io.github.samzhu.usagemonitor.product.MetricScope;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.util.ConfidenceCombiner;

/**
 * 查詢單一指標的用量，處理 account 與 zone 兩種查詢範圍。
 *
 * <p>查詢流程：
 * <ul>
 *   <li>account 範圍 - 只查一次，後端回報的 {@code errors} 直接成為紀錄的錯誤</li>
 *   <li>zone 範圍 - 每個 zone 各查一次（在 zone 執行緒池上併發），用量加總、信賴區間合併</li>
 * </ul>
 *
 * <p>zone 查詢採盡力而為：單一 zone 失敗只記錄警告並以 0 計入，
 * 只有全部 zone 都失敗或沒有設定任何 zone 時，指標才帶有錯誤。
 *
 * <p>每個後端請求都先向呼叫端給的 {@link RequestPermits} 取得名額，
 * zone 執行緒池只決定分區查詢用幾條執行緒，不會增加在途請求上限。
 *
 * <p>此服務不會拋出例外，任何失敗都轉為帶有 {@code error} 的 {@link UsageRecord}。
 */
@Service
public class MetricUsageService {

    private static final Logger log = LoggerFactory.getLogger(MetricUsageService.class);

    static final String NO_ZONES_ERROR = "No zone tags configured";
    static final String NO_ACCOUNT_ERROR = "Account ID not configured";

    private final QueryExecutor queryExecutor;
    private final GraphQLQueryBuilder queryBuilder;
    private final UsageResultNormalizer normalizer;
    private final ExecutorService zoneQueryExecutor;
    private final UsageMonitorProperties properties;

    public MetricUsageService(
            QueryExecutor queryExecutor,
            GraphQLQueryBuilder queryBuilder,
            UsageResultNormalizer normalizer,
            ExecutorService zoneQueryExecutor,
            UsageMonitorProperties properties) {
        this.queryExecutor = queryExecutor;
        this.queryBuilder = queryBuilder;
        this.normalizer = normalizer;
        this.zoneQueryExecutor = zoneQueryExecutor;
        this.properties = properties;
    }

    /**
     * 查詢單一指標在帳單週期內的用量。
     *
     * @param metric 執行期指標
     * @param period 帳單週期
     * @param filters 流量過濾選項
     * @return 用量紀錄，失敗時帶有錯誤訊息且用量為 0
     */
    public UsageRecord queryMetric(MonitoredMetric metric, BillingPeriod period, QueryFilterOptions filters) {
        return queryMetric(metric, period, filters, RequestPermits.unbounded());
    }

    /**
     * 查詢單一指標在帳單週期內的用量，後端請求受 {@code permits} 限制。
     *
     * @param metric 執行期指標
     * @param period 帳單週期
     * @param filters 流量過濾選項
     * @param permits 同次執行共用的請求許可
     * @return 用量紀錄，失敗時帶有錯誤訊息且用量為 0
     */
    public UsageRecord queryMetric(MonitoredMetric metric, BillingPeriod period,
                                   QueryFilterOptions filters, RequestPermits permits) {
        long startTime = System.currentTimeMillis();
        try {
            UsageRecord record = metric.scope() == MetricScope.ZONE
                ? queryZones(metric, period, filters, permits, startTime)
                : queryAccount(metric, period, filters, permits, startTime);
            if (record.hasError()) {
                log.error("Metric {} failed: {}", metric.id(), record.error());
            } else {
                log.debug("Metric {} usage={} in {}ms", metric.id(), record.currentUsage(), record.queryDurationMs());
            }
            return record;
        } catch (MetricConfigurationException e) {
            log.error("Metric {} is misconfigured: {}", metric.id(), e.getMessage());
            return UsageRecord.failed(metric, period, e.getMessage(), elapsed(startTime));
        } catch (RuntimeException e) {
            log.error("Metric {} query failed: {}", metric.id(), e.getMessage(), e);
            return UsageRecord.failed(metric, period, e.getMessage(), elapsed(startTime));
        }
    }

    private UsageRecord queryAccount(MonitoredMetric metric, BillingPeriod period,
                                     QueryFilterOptions filters, RequestPermits permits, long startTime) {
        String accountId = properties.api().accountId();
        if (accountId == null || accountId.isBlank()) {
            throw new MetricConfigurationException(metric.id(), NO_ACCOUNT_ERROR);
        }

        GraphQLQuery query = queryBuilder.build(metric.definition(), period, accountId, filters);
        GraphQLResponse response = permits.call(() -> queryExecutor.execute(query.text(), query.variables()));
        if (response.hasErrors()) {
            return UsageRecord.failed(metric, period, response.errorMessage(), elapsed(startTime));
        }

        ExtractedUsage usage = normalizer.extract(response.data(), metric.definition());
        return normalizer.toRecord(metric, period, usage.value(), usage.confidence(), elapsed(startTime));
    }

    private UsageRecord queryZones(MonitoredMetric metric, BillingPeriod period,
                                   QueryFilterOptions filters, RequestPermits permits, long startTime) {
        List<String> zoneTags = metric.zoneTags();
        if (zoneTags.isEmpty()) {
            throw new MetricConfigurationException(metric.id(), NO_ZONES_ERROR);
        }

        List<CompletableFuture<ZoneOutcome>> futures = new ArrayList<>(zoneTags.size());
        for (String zoneTag : zoneTags) {
            futures.add(CompletableFuture
                .supplyAsync(() -> queryZone(metric, period, zoneTag, filters, permits), zoneQueryExecutor)
                .exceptionally(ex -> ZoneOutcome.failed(zoneTag, failureMessage(ex))));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            return UsageRecord.failed(metric, period, "Query interrupted", elapsed(startTime));
        } catch (ExecutionException e) {
            // exceptionally() 已吸收各 zone 的失敗
            throw new IllegalStateException("Unexpected zone query failure", e.getCause());
        }

        double total = 0;
        List<ConfidenceInterval> intervals = new ArrayList<>();
        Set<String> failures = new LinkedHashSet<>();
        int failedZones = 0;
        for (CompletableFuture<ZoneOutcome> future : futures) {
            ZoneOutcome outcome = future.join();
            if (outcome.error() != null) {
                log.warn("Zone {} query for {} failed, counting as zero: {}",
                    outcome.zoneTag(), metric.id(), outcome.error());
                failures.add(outcome.error());
                failedZones++;
                continue;
            }
            total += outcome.usage().value();
            outcome.usage().confidence().ifPresent(intervals::add);
        }

        if (failedZones == futures.size()) {
            return UsageRecord.failed(metric, period,
                "All zone queries failed: " + String.join("; ", failures), elapsed(startTime));
        }

        Optional<ConfidenceInterval> confidence = ConfidenceCombiner.combine(intervals);
        return normalizer.toRecord(metric, period, total, confidence, elapsed(startTime));
    }

    private ZoneOutcome queryZone(MonitoredMetric metric, BillingPeriod period, String zoneTag,
                                  QueryFilterOptions filters, RequestPermits permits) {
        GraphQLQuery query = queryBuilder.build(metric.definition(), period, zoneTag, filters);
        GraphQLResponse response = permits.call(() -> queryExecutor.execute(query.text(), query.variables()));
        if (response.hasErrors()) {
            return ZoneOutcome.failed(zoneTag, response.errorMessage());
        }
        return new ZoneOutcome(zoneTag, normalizer.extract(response.data(), metric.definition()), null);
    }

    /**
     * 只拆開 {@link CompletionException} 包裝，保留原始例外的訊息。
     */
    static String failureMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }

    /**
     * 單一 zone 的查詢結果，{@code error} 不為 null 表示失敗。
     */
    private record ZoneOutcome(String zoneTag, ExtractedUsage usage, String error) {

        static ZoneOutcome failed(String zoneTag, String error) {
            return new ZoneOutcome(zoneTag, null, error != null ? error : "Unknown error");
        }
    }
}
