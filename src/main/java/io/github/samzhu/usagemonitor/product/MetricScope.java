package io.github.samzhu.usagemonitor.product;

/**
 * 指標的查詢範圍。
 *
 * <p>{@link #ZONE} 需對每個 zone 各查一次再加總，{@link #ACCOUNT} 只查一次。
 */
public enum MetricScope {
    ZONE("zones", "zoneTag"),
    ACCOUNT("accounts", "accountTag");

    private final String resultKey;
    private final String tagVariable;

    MetricScope(String resultKey, String tagVariable) {
        this.resultKey = resultKey;
        this.tagVariable = tagVariable;
    }

    /**
     * 回應中 {@code viewer} 之下的結果陣列名稱。
     */
    public String resultKey() {
        return resultKey;
    }

    /**
     * 查詢變數中的範圍識別名稱。
     */
    public String tagVariable() {
        return tagVariable;
    }
}
