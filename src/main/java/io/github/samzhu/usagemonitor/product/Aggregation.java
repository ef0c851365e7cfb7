package io.github.samzhu.usagemonitor.product;

/**
 * 指標的聚合方式，決定查詢時請求哪一個結果欄位。
 *
 * <ul>
 *   <li>{@link #SUM} - 欄位位於 {@code sum { field }} 之下</li>
 *   <li>{@link #COUNT} - 頂層的 {@code count}，忽略 field</li>
 *   <li>{@link #AVG} - 欄位位於 {@code avg { field }} 之下</li>
 *   <li>{@link #MAX} - 欄位位於 {@code max { field }} 之下（例如儲存量）</li>
 * </ul>
 */
public enum Aggregation {
    SUM("sum"),
    COUNT("count"),
    AVG("avg"),
    MAX("max");

    private final String graphqlName;

    Aggregation(String graphqlName) {
        this.graphqlName = graphqlName;
    }

    /**
     * 查詢語法中使用的名稱。
     */
    public String graphqlName() {
        return graphqlName;
    }
}
