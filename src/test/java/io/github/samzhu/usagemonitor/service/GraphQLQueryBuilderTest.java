package io.github.samzhu.usagemonitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import io.github.samzhu.usagemonitor.TestProperties;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.product.Aggregation;
import io.github.samzhu.usagemonitor.product.DimensionFilter;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.MetricScope;
import io.github.samzhu.usagemonitor.product.ProductCatalog;
import io.github.samzhu.usagemonitor.product.TimeFilterKind;

class GraphQLQueryBuilderTest {

    private static final QueryFilterOptions ALL_FILTERS = new QueryFilterOptions(true, true, true, null);

    private GraphQLQueryBuilder builder;
    private BillingPeriod period;

    @BeforeEach
    void setUp() {
        builder = new GraphQLQueryBuilder(TestProperties.defaults());
        period = new BillingPeriod(
            Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void shouldBuildAccountSumQueryWithConfidence() {
        // Given
        MetricDefinition definition = ProductCatalog.findById("workers_requests").orElseThrow();

        // When
        GraphQLQuery query = builder.build(definition, period, "acc123", QueryFilterOptions.none());

        // Then
        assertThat(query.text())
            .contains("query AccountUsage($accountTag: String!, $start: Time!, $end: Time!)")
            .contains("accounts(filter: { accountTag: $accountTag })")
            .contains("workersInvocationsAdaptive(")
            .contains("filter: { datetime_geq: $start, datetime_lt: $end }")
            .contains("limit: 10000")
            .contains("sum { requests }")
            .contains("confidence(level: 0.95) { level sum { requests { estimate lower upper sampleSize isValid } } }");
        assertThat(query.variables()).containsExactlyInAnyOrderEntriesOf(Map.of(
            "accountTag", "acc123",
            "start", "2024-03-01T00:00:00Z",
            "end", "2024-04-01T00:00:00Z"));
    }

    @ParameterizedTest
    @EnumSource(TimeFilterKind.class)
    void countQueryShouldNeverReferenceField(TimeFilterKind kind) {
        // Given: COUNT 定義即使帶有 field 也不應出現在查詢中
        MetricDefinition definition = MetricDefinition.builder("count_metric")
            .dataset("someAdaptiveGroups")
            .field("ignoredFieldName")
            .aggregation(Aggregation.COUNT)
            .scope(MetricScope.ZONE)
            .timeFilter(kind)
            .build();

        // When
        String text = builder.buildText(definition, ALL_FILTERS);

        // Then
        assertThat(text).doesNotContain("ignoredFieldName");
        assertThat(text).contains("count\n");
        assertThat(text).contains("confidence(level: 0.95) { level count { estimate lower upper sampleSize isValid } }");
    }

    @Test
    void shouldUseDateDialectForDateOnlyDatasets() {
        // Given
        MetricDefinition definition = ProductCatalog.findById("cached_bandwidth_zone").orElseThrow();
        BillingPeriod taipeiPeriod = new BillingPeriod(
            Instant.parse("2024-02-29T16:00:00Z"), Instant.parse("2024-03-31T16:00:00Z"), ZoneId.of("Asia/Taipei"));

        // When
        GraphQLQuery query = builder.build(definition, taipeiPeriod, "zone1", null);

        // Then: 日期只給日曆日期，不給時間戳
        assertThat(query.text())
            .contains("query ZoneUsage($zoneTag: String!, $start: Date!, $end: Date!)")
            .contains("zones(filter: { zoneTag: $zoneTag })")
            .contains("filter: { date_geq: $start, date_lt: $end }");
        assertThat(query.variables())
            .containsEntry("zoneTag", "zone1")
            .containsEntry("start", "2024-03-01")
            .containsEntry("end", "2024-04-01");
    }

    @Test
    void shouldTruncateHourDialectToHour() {
        assertThat(GraphQLQueryBuilder.formatTime(
                Instant.parse("2024-03-01T10:45:12Z"), TimeFilterKind.DATETIME_HOUR, ZoneOffset.UTC))
            .isEqualTo("2024-03-01T10:00:00Z");
        assertThat(GraphQLQueryBuilder.formatTime(
                Instant.parse("2024-03-01T10:45:12Z"), TimeFilterKind.DATETIME, ZoneOffset.UTC))
            .isEqualTo("2024-03-01T10:45:12Z");

        String text = builder.buildText(ProductCatalog.findById("zaraz_events").orElseThrow(), null);
        assertThat(text).contains("datetimeHour_geq: $start, datetimeHour_lt: $end");
    }

    @Test
    void shouldOmitConfidenceForDenylistedDatasets() {
        // Given
        MetricDefinition definition = ProductCatalog.findById("cache_reserve_storage").orElseThrow();

        // When
        String text = builder.buildText(definition, null);

        // Then
        assertThat(text).contains("max { storedBytes }");
        assertThat(text).doesNotContain("confidence");
    }

    @Test
    void shouldApplyTrafficFiltersOnlyToSupportedDataset() {
        // Given
        MetricDefinition http = ProductCatalog.findById("http_requests").orElseThrow();
        MetricDefinition workers = ProductCatalog.findById("workers_requests").orElseThrow();

        // When
        String httpText = builder.buildText(http, ALL_FILTERS);
        String workersText = builder.buildText(workers, ALL_FILTERS);

        // Then
        assertThat(httpText).contains(
            "filter: { datetime_geq: $start, datetime_lt: $end, requestSource: \"eyeball\", "
                + "requestSource_neq: \"edgeworker\", edgeResponseStatus_neq: 403 }");
        assertThat(workersText)
            .doesNotContain("requestSource")
            .doesNotContain("edgeResponseStatus");
    }

    @Test
    void shouldRenderListFiltersAsInAndScalarsAsEquality() {
        // Given
        MetricDefinition definition = MetricDefinition.builder("r2_ops")
            .dataset("r2OperationsAdaptiveGroups")
            .field("requests")
            .dimensionFilters(List.of(
                DimensionFilter.in("actionType_in", List.of("PutObject", "GetObject")),
                DimensionFilter.eq("bucketName", "media")))
            .build();

        // When
        String text = builder.buildText(definition, null);

        // Then
        assertThat(text).contains(
            "filter: { datetime_geq: $start, datetime_lt: $end, "
                + "actionType_in: [\"PutObject\", \"GetObject\"], bucketName: \"media\" }");
    }
}
