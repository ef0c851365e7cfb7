package io.github.samzhu.usagemonitor.product;

import java.util.List;

import io.github.samzhu.usagemonitor.exception.MetricConfigurationException;

/**
 * 單一監控指標（產品）的不可變定義。
 *
 * <p>描述要查詢哪個 dataset、聚合哪個欄位、如何聚合、查詢範圍、時間過濾語法，
 * 以及可選的維度過濾與單位轉換。定義在建立時即驗證，格式錯誤的定義在查詢前就會被拒絕：
 * <ul>
 *   <li>{@code aggregation != COUNT} 時 {@code field} 不可為空</li>
 *   <li>{@code id}、{@code dataset} 不可為空</li>
 * </ul>
 *
 * @param id 唯一識別碼
 * @param name 顯示名稱
 * @param category 產品分類
 * @param description 指標說明
 * @param unit 計量單位（例如 requests、bytes、ms）
 * @param dataset 後端 dataset 名稱
 * @param field 聚合欄位，{@code COUNT} 時可為空字串
 * @param aggregation 聚合方式
 * @param scope 查詢範圍
 * @param timeFilter 時間過濾語法
 * @param dimensionFilters 維度過濾條件（AND）
 * @param transform 單位轉換
 * @param unlimited 是否無上限（使用率恆為 0）
 * @param defaultLimit 預設週期上限，0 表示未設定
 * @param enabledByDefault 預設是否啟用
 * @param note 報表顯示的附註
 */
public record MetricDefinition(
    String id,
    String name,
    ProductCategory category,
    String description,
    String unit,
    String dataset,
    String field,
    Aggregation aggregation,
    MetricScope scope,
    TimeFilterKind timeFilter,
    List<DimensionFilter> dimensionFilters,
    UnitTransform transform,
    boolean unlimited,
    double defaultLimit,
    boolean enabledByDefault,
    String note
) {
    public MetricDefinition {
        if (id == null || id.isBlank()) {
            throw new MetricConfigurationException(id, "metric id must not be blank");
        }
        if (dataset == null || dataset.isBlank()) {
            throw new MetricConfigurationException(id, "dataset must not be blank");
        }
        if (aggregation == null) {
            aggregation = Aggregation.SUM;
        }
        if (field == null) {
            field = "";
        }
        if (aggregation != Aggregation.COUNT && field.isBlank()) {
            throw new MetricConfigurationException(id,
                "field is required for " + aggregation.graphqlName() + " aggregation");
        }
        if (scope == null) {
            throw new MetricConfigurationException(id, "scope must be set");
        }
        if (timeFilter == null) {
            timeFilter = TimeFilterKind.DATETIME;
        }
        dimensionFilters = dimensionFilters == null ? List.of() : List.copyOf(dimensionFilters);
        if (transform == null) {
            transform = UnitTransform.NONE;
        }
        if (defaultLimit < 0) {
            throw new MetricConfigurationException(id, "defaultLimit must be positive or zero");
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * MetricDefinition Builder。
     */
    public static class Builder {
        private final String id;
        private String name;
        private ProductCategory category;
        private String description;
        private String unit;
        private String dataset;
        private String field = "";
        private Aggregation aggregation = Aggregation.SUM;
        private MetricScope scope = MetricScope.ACCOUNT;
        private TimeFilterKind timeFilter = TimeFilterKind.DATETIME;
        private List<DimensionFilter> dimensionFilters = List.of();
        private UnitTransform transform = UnitTransform.NONE;
        private boolean unlimited;
        private double defaultLimit;
        private boolean enabledByDefault;
        private String note;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder category(ProductCategory category) { this.category = category; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder unit(String unit) { this.unit = unit; return this; }
        public Builder dataset(String dataset) { this.dataset = dataset; return this; }
        public Builder field(String field) { this.field = field; return this; }
        public Builder aggregation(Aggregation aggregation) { this.aggregation = aggregation; return this; }
        public Builder scope(MetricScope scope) { this.scope = scope; return this; }
        public Builder timeFilter(TimeFilterKind timeFilter) { this.timeFilter = timeFilter; return this; }
        public Builder dimensionFilters(List<DimensionFilter> dimensionFilters) { this.dimensionFilters = dimensionFilters; return this; }
        public Builder transform(UnitTransform transform) { this.transform = transform; return this; }
        public Builder unlimited(boolean unlimited) { this.unlimited = unlimited; return this; }
        public Builder defaultLimit(double defaultLimit) { this.defaultLimit = defaultLimit; return this; }
        public Builder enabledByDefault(boolean enabledByDefault) { this.enabledByDefault = enabledByDefault; return this; }
        public Builder note(String note) { this.note = note; return this; }

        public MetricDefinition build() {
            return new MetricDefinition(
                id, name, category, description, unit,
                dataset, field, aggregation, scope, timeFilter,
                dimensionFilters, transform, unlimited,
                defaultLimit, enabledByDefault, note
            );
        }
    }
}
