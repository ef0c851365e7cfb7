package io.github.samzhu.usagemonitor.client;

import io.github.samzhu.usagemonitor.dto.ZeroTrustSeats;
import io.github.samzhu.usagemonitor.exception.QueryExecutionException;

/**
 * Zero Trust 席次來源。
 *
 * <p>Zero Trust 依席次計費，不在 GraphQL Analytics 中，需另外從使用者列表統計。
 */
public interface ZeroTrustSeatClient {

    /**
     * 統計帳號的 Zero Trust 席次。
     *
     * @param accountId 帳號 ID
     * @return 席次統計
     * @throws QueryExecutionException 非 2xx、網路錯誤或 API 回報失敗
     */
    ZeroTrustSeats fetchSeats(String accountId);
}
