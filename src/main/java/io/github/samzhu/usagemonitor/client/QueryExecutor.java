package io.github.samzhu.usagemonitor.client;

import java.util.Map;

import io.github.samzhu.usagemonitor.exception.QueryExecutionException;

/**
 * 查詢執行邊界，引擎唯一的 I/O 介面。
 *
 * <p>實作負責傳送查詢文字與綁定變數並回傳原始回應；
 * 傳輸失敗時拋出 {@link QueryExecutionException}。
 */
public interface QueryExecutor {

    /**
     * 執行查詢。
     *
     * @param query 查詢文字
     * @param variables 綁定變數
     * @return 原始回應
     * @throws QueryExecutionException 非 2xx、網路錯誤或無法解析回應
     */
    GraphQLResponse execute(String query, Map<String, Object> variables);
}
