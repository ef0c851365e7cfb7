package io.github.samzhu.usagemonitor.exception;

/**
 * 查詢執行失敗（傳輸層錯誤）。
 *
 * <p>非 2xx 回應、網路錯誤或無法解析的 JSON 都會包裝成此異常。
 * 訊息保留原始錯誤內容，供維運人員診斷。
 */
public class QueryExecutionException extends RuntimeException {

    private final int statusCode;

    public QueryExecutionException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * HTTP 狀態碼，非 HTTP 錯誤時為 0。
     */
    public int getStatusCode() {
        return statusCode;
    }
}
