package io.github.samzhu.usagemonitor.service;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

import io.github.samzhu.usagemonitor.exception.QueryExecutionException;

/**
 * 限制同時在途的後端請求數。
 *
 * <p>由 {@link BatchQueryRunner} 每次執行建立一份，大小等於批次大小，
 * account 查詢與各 zone 分區查詢都從同一份許可取得名額，
 * 因此 zone 扇出不會讓在途請求超過批次大小。
 *
 * <p>許可只在單一請求期間持有，不會在等待其他請求時持有，因此不會互相等待。
 */
public final class RequestPermits {

    private final Semaphore semaphore;

    private RequestPermits(Semaphore semaphore) {
        this.semaphore = semaphore;
    }

    /**
     * 建立最多 {@code maxInFlight} 個同時請求的許可。
     */
    public static RequestPermits of(int maxInFlight) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be at least 1: " + maxInFlight);
        }
        return new RequestPermits(new Semaphore(maxInFlight, true));
    }

    /**
     * 不限制同時請求數（單一指標查詢使用）。
     */
    public static RequestPermits unbounded() {
        return new RequestPermits(null);
    }

    /**
     * 取得許可後執行請求，完成後歸還。
     *
     * @throws QueryExecutionException 等待許可時被中斷
     */
    public <T> T call(Supplier<T> request) {
        if (semaphore == null) {
            return request.get();
        }
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Query interrupted", e);
        }
        try {
            return request.get();
        } finally {
            semaphore.release();
        }
    }
}
