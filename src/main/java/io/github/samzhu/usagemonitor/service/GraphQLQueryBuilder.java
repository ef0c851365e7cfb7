package io.github.samzhu.usagemonitor.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.product.Aggregation;
import io.github.samzhu.usagemonitor.product.DimensionFilter;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.MetricScope;
import io.github.samzhu.usagemonitor.product.TimeFilterKind;

/**
 * 依指標定義組出 GraphQL Analytics 查詢。
 *
 * <p>組出的查詢形如：
 * <pre>
 * query AccountUsage($accountTag: String!, $start: Time!, $end: Time!) {
 *   viewer {
 *     accounts(filter: { accountTag: $accountTag }) {
 *       workersInvocationsAdaptive(
 *         filter: { datetime_geq: $start, datetime_lt: $end }
 *         limit: 10000
 *       ) {
 *         sum { requests }
 *         confidence(level: 0.95) { level sum { requests { estimate lower upper sampleSize isValid } } }
 *       }
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>規則：
 * <ul>
 *   <li>{@code COUNT} 只請求頂層 {@code count}，不引用 field</li>
 *   <li>信賴區間欄位只對支援抽樣中繼資料的 dataset 請求，否則後端會拒絕整個查詢</li>
 *   <li>流量過濾只加在支援的 dataset，不支援的組合直接略過</li>
 *   <li>時間值依 {@link TimeFilterKind} 格式化，三種語法不混用</li>
 * </ul>
 *
 * <p>組查詢不會失敗；格式錯誤的定義在 {@link MetricDefinition} 建立時就已被拒絕。
 *
 * @see <a href="https://developers.cloudflare.com/analytics/graphql-api/">GraphQL Analytics API</a>
 */
@Component
public class GraphQLQueryBuilder {

    /** 沒有 {@code confidence} 欄位的 dataset */
    static final Set<String> NO_CONFIDENCE_DATASETS = Set.of(
        "cacheReserveStorageAdaptiveGroups",
        "durableObjectsStorageGroups"
    );

    /** 支援 {@code requestSource} 過濾的 dataset */
    static final Set<String> REQUEST_SOURCE_DATASETS = Set.of("httpRequestsAdaptiveGroups");

    /** 支援 {@code edgeResponseStatus} 過濾的 dataset */
    static final Set<String> RESPONSE_STATUS_DATASETS = Set.of("httpRequestsAdaptiveGroups");

    static final int ROW_LIMIT = 10000;

    private final double confidenceLevel;

    public GraphQLQueryBuilder(UsageMonitorProperties properties) {
        this.confidenceLevel = properties.query().confidenceLevel();
    }

    /**
     * 組出查詢文字與變數。
     *
     * @param definition 指標定義
     * @param period 帳單週期
     * @param scopeTag zone tag 或 account tag
     * @param filters 流量過濾選項，可為 null
     * @return 查詢
     */
    public GraphQLQuery build(MetricDefinition definition, BillingPeriod period,
                              String scopeTag, QueryFilterOptions filters) {
        return new GraphQLQuery(
            buildText(definition, filters),
            variables(definition, period, scopeTag));
    }

    /**
     * 組出查詢文字。
     */
    public String buildText(MetricDefinition definition, QueryFilterOptions filters) {
        MetricScope scope = definition.scope();
        TimeFilterKind time = definition.timeFilter();
        String operation = scope == MetricScope.ZONE ? "ZoneUsage" : "AccountUsage";
        String tag = scope.tagVariable();

        String filter = time.startFilter() + ": $start, " + time.endFilter() + ": $end"
            + trafficFilters(definition.dataset(), filters)
            + dimensionFilters(definition.dimensionFilters());

        return """
            query %s($%s: String!, $start: %s!, $end: %s!) {
              viewer {
                %s(filter: { %s: $%s }) {
                  %s(
                    filter: { %s }
                    limit: %d
                  ) {
                    %s
                  }
                }
              }
            }
            """.formatted(
                operation, tag, time.graphqlType(), time.graphqlType(),
                scope.resultKey(), tag, tag,
                definition.dataset(),
                filter,
                ROW_LIMIT,
                aggregationFields(definition));
    }

    /**
     * 綁定變數：範圍識別與依時間語法格式化的週期起訖。
     */
    public Map<String, Object> variables(MetricDefinition definition, BillingPeriod period, String scopeTag) {
        TimeFilterKind time = definition.timeFilter();
        return Map.of(
            definition.scope().tagVariable(), scopeTag,
            "start", formatTime(period.start(), time, period.zone()),
            "end", formatTime(period.end(), time, period.zone()));
    }

    /**
     * 依時間語法格式化時間值。
     *
     * <ul>
     *   <li>{@code DATETIME} - ISO-8601 時間戳，例如 {@code 2024-03-01T00:00:00Z}</li>
     *   <li>{@code DATE} - 週期時區的日期，例如 {@code 2024-03-01}</li>
     *   <li>{@code DATETIME_HOUR} - 截斷到小時的 ISO-8601 時間戳</li>
     * </ul>
     */
    public static String formatTime(Instant instant, TimeFilterKind kind, ZoneId zone) {
        return switch (kind) {
            case DATE -> LocalDate.ofInstant(instant, zone).toString();
            case DATETIME_HOUR -> instant.truncatedTo(ChronoUnit.HOURS).toString();
            case DATETIME -> instant.toString();
        };
    }

    public static boolean supportsConfidence(String dataset) {
        return !NO_CONFIDENCE_DATASETS.contains(dataset);
    }

    private String aggregationFields(MetricDefinition definition) {
        Aggregation aggregation = definition.aggregation();
        String field = definition.field();
        String value = aggregation == Aggregation.COUNT
            ? "count"
            : aggregation.graphqlName() + " { " + field + " }";
        if (!supportsConfidence(definition.dataset())) {
            return value;
        }

        String intervalFields = "estimate lower upper sampleSize isValid";
        String nested = aggregation == Aggregation.COUNT
            ? intervalFields
            : field + " { " + intervalFields + " }";
        return value + "\n        confidence(level: " + confidenceLevel + ") { level "
            + aggregation.graphqlName() + " { " + nested + " } }";
    }

    private static String trafficFilters(String dataset, QueryFilterOptions filters) {
        if (filters == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (REQUEST_SOURCE_DATASETS.contains(dataset)) {
            if (filters.eyeballOnly()) {
                sb.append(", requestSource: \"eyeball\"");
            }
            if (filters.excludeEdgeWorkers()) {
                sb.append(", requestSource_neq: \"edgeworker\"");
            }
        }
        if (filters.excludeBlocked() && RESPONSE_STATUS_DATASETS.contains(dataset)) {
            sb.append(", edgeResponseStatus_neq: 403");
        }
        return sb.toString();
    }

    private static String dimensionFilters(List<DimensionFilter> dimensionFilters) {
        if (dimensionFilters.isEmpty()) {
            return "";
        }
        List<String> conditions = new ArrayList<>();
        for (DimensionFilter filter : dimensionFilters) {
            if (filter.multiValued()) {
                String values = filter.values().stream()
                    .map(GraphQLQueryBuilder::quote)
                    .collect(Collectors.joining(", "));
                conditions.add(filter.field() + ": [" + values + "]");
            } else {
                conditions.add(filter.field() + ": " + quote(filter.values().get(0)));
            }
        }
        return ", " + String.join(", ", conditions);
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
