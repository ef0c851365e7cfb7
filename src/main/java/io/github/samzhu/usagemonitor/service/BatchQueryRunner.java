package io.github.samzhu.usagemonitor.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;

/**
 * 以批次併發的方式查詢多個指標。
 *
 * <p>執行方式：
 * <ol>
 *   <li>將指標依序切成每批 {@code batchSize} 個</li>
 *   <li>同一批內的指標同時查詢；所有後端請求（含 zone 分區）共用一份 {@link RequestPermits}，
 *       同時在途的請求不超過 {@code batchSize}</li>
 *   <li>每批完成後等待 {@code batchDelay} 再開始下一批（最後一批除外）</li>
 * </ol>
 *
 * <p>整次執行受 {@code deadline} 限制：期限到時放棄在途查詢，
 * 尚未完成與尚未開始的指標都以逾時錯誤回報，已完成的結果照常保留。
 *
 * <p>輸出順序與輸入相同（依索引組裝，不依完成順序），且每個輸入指標恰好對應一筆紀錄。
 */
@Component
public class BatchQueryRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchQueryRunner.class);

    static final String DEADLINE_ERROR = "Query deadline exceeded";
    static final String INTERRUPTED_ERROR = "Query interrupted";

    private final MetricUsageService metricUsageService;
    private final UsageMonitorProperties.QueryConfig queryConfig;

    public BatchQueryRunner(MetricUsageService metricUsageService, UsageMonitorProperties properties) {
        this.metricUsageService = metricUsageService;
        this.queryConfig = properties.query();
    }

    /**
     * 查詢所有指標。
     *
     * @param metrics 依序排列的指標
     * @param period 帳單週期
     * @param filters 流量過濾選項
     * @return 與輸入同序的用量紀錄
     */
    public List<UsageRecord> runAll(List<MonitoredMetric> metrics, BillingPeriod period, QueryFilterOptions filters) {
        if (metrics.isEmpty()) {
            return List.of();
        }

        int batchSize = queryConfig.batchSize();
        List<List<MonitoredMetric>> batches = partition(metrics, batchSize);
        long deadlineNanos = System.nanoTime() + queryConfig.deadline().toNanos();
        List<UsageRecord> results = new ArrayList<>(metrics.size());
        RequestPermits permits = RequestPermits.of(batchSize);

        log.info("Querying {} metrics in {} batches (batchSize={})", metrics.size(), batches.size(), batchSize);

        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(batchSize, metrics.size()), metricThreadFactory());
        try {
            for (int i = 0; i < batches.size(); i++) {
                List<MonitoredMetric> batch = batches.get(i);
                boolean completed = runBatch(executor, batch, period, filters, permits, deadlineNanos, results);
                if (!completed) {
                    failRemaining(batches, i + 1, period, results, DEADLINE_ERROR);
                    break;
                }
                log.debug("Batch {}/{} completed", i + 1, batches.size());

                if (i < batches.size() - 1 && !pause(deadlineNanos)) {
                    failRemaining(batches, i + 1, period, results,
                        Thread.currentThread().isInterrupted() ? INTERRUPTED_ERROR : DEADLINE_ERROR);
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    /**
     * 將列表依序切成固定大小的批次，最後一批可能較小。
     */
    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            batches.add(List.copyOf(items.subList(from, Math.min(from + size, items.size()))));
        }
        return batches;
    }

    /**
     * 執行一批查詢並依序收集結果。
     *
     * @return false 表示期限已到或被中斷，本批未完成的指標已填入錯誤紀錄
     */
    private boolean runBatch(ExecutorService executor, List<MonitoredMetric> batch, BillingPeriod period,
                             QueryFilterOptions filters, RequestPermits permits,
                             long deadlineNanos, List<UsageRecord> results) {
        long batchStart = System.currentTimeMillis();
        List<Future<UsageRecord>> futures = new ArrayList<>(batch.size());
        for (MonitoredMetric metric : batch) {
            futures.add(executor.submit(() -> metricUsageService.queryMetric(metric, period, filters, permits)));
        }

        for (int j = 0; j < futures.size(); j++) {
            MonitoredMetric metric = batch.get(j);
            try {
                long remaining = deadlineNanos - System.nanoTime();
                results.add(futures.get(j).get(Math.max(0, remaining), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                log.error("Query deadline of {} exceeded while waiting for {}", queryConfig.deadline(), metric.id());
                abandon(batch, futures, j, period, batchStart, results, DEADLINE_ERROR);
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch query interrupted while waiting for {}", metric.id());
                abandon(batch, futures, j, period, batchStart, results, INTERRUPTED_ERROR);
                return false;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Metric {} query threw unexpectedly: {}", metric.id(), cause.getMessage(), cause);
                results.add(UsageRecord.failed(metric, period, cause.getMessage(),
                    System.currentTimeMillis() - batchStart));
            }
        }
        return true;
    }

    /**
     * 放棄本批從 {@code from} 開始的查詢，已完成者照常收集。
     */
    private static void abandon(List<MonitoredMetric> batch, List<Future<UsageRecord>> futures, int from,
                                BillingPeriod period, long batchStart, List<UsageRecord> results, String error) {
        for (int k = from; k < futures.size(); k++) {
            Future<UsageRecord> future = futures.get(k);
            if (future.isDone() && !future.isCancelled()) {
                try {
                    results.add(future.get());
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (ExecutionException e) {
                    log.debug("Discarding result of {}: {}", batch.get(k).id(), e.getMessage());
                }
            }
            future.cancel(true);
            results.add(UsageRecord.failed(batch.get(k), period, error, System.currentTimeMillis() - batchStart));
        }
    }

    private static void failRemaining(List<List<MonitoredMetric>> batches, int fromBatch,
                                      BillingPeriod period, List<UsageRecord> results, String error) {
        int skipped = 0;
        for (int i = fromBatch; i < batches.size(); i++) {
            for (MonitoredMetric metric : batches.get(i)) {
                results.add(UsageRecord.failed(metric, period, error, 0));
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("{} metrics were not queried: {}", skipped, error);
        }
    }

    /**
     * 批次間隔，不超過剩餘期限。
     *
     * @return false 表示期限已到或被中斷
     */
    private boolean pause(long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            return false;
        }
        Duration delay = queryConfig.batchDelay();
        long sleepNanos = Math.min(delay.toNanos(), remaining);
        if (sleepNanos <= 0) {
            return true;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(sleepNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return deadlineNanos - System.nanoTime() > 0;
    }

    private static ThreadFactory metricThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "metric-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
