package io.github.samzhu.usagemonitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.usagemonitor.TestProperties;
import io.github.samzhu.usagemonitor.client.GraphQLResponse;
import io.github.samzhu.usagemonitor.client.QueryExecutor;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.QueryFilterOptions;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.dto.UsageSummary;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.product.ProductCatalog;

/**
 * 從後端 JSON 回應一路到分類摘要，只替換 {@link QueryExecutor}。
 */
class UsageMonitorEndToEndTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ExecutorService zoneExecutor;
    private UsageMonitorService monitorService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);
        UsageMonitorProperties properties = TestProperties.defaults();
        zoneExecutor = Executors.newFixedThreadPool(2);

        QueryExecutor queryExecutor = (query, variables) -> respond(variables);
        MetricUsageService metricUsageService = new MetricUsageService(queryExecutor,
            new GraphQLQueryBuilder(properties), new UsageResultNormalizer(), zoneExecutor, properties);
        monitorService = new UsageMonitorService(
            new BatchQueryRunner(metricUsageService, properties), new UsageCategorizer(clock), properties, clock);
    }

    @AfterEach
    void tearDown() {
        zoneExecutor.shutdownNow();
    }

    @Test
    void shouldClassifyBackendSumAgainstLimit() {
        // Given: account 回傳兩列共 900（上限 1000），每個 zone 回傳 300（兩 zone 共 600，上限 1000）
        List<MonitoredMetric> metrics = List.of(
            new MonitoredMetric(ProductCatalog.findById("workers_requests").orElseThrow(), 1000, true, null),
            new MonitoredMetric(ProductCatalog.findById("http_requests_zone").orElseThrow(), 1000, true, null));

        // When
        List<UsageRecord> records = monitorService.queryAllEnabled(
            metrics, List.of("z1", "z2"), QueryFilterOptions.none());
        UsageSummary summary = monitorService.categorize(records, 90, 75);

        // Then
        assertThat(summary.alerts()).singleElement().satisfies(record -> {
            assertThat(record.metricId()).isEqualTo("workers_requests");
            assertThat(record.currentUsage()).isEqualTo(900);
            assertThat(record.percentUsed()).isEqualTo(90.0);
        });
        assertThat(summary.healthy()).singleElement().satisfies(record -> {
            assertThat(record.metricId()).isEqualTo("http_requests_zone");
            assertThat(record.currentUsage()).isEqualTo(600);
            assertThat(record.confidence().sampleSize()).isEqualTo(40);
        });
        assertThat(summary.warnings()).isEmpty();
        assertThat(summary.errors()).isEmpty();
    }

    private GraphQLResponse respond(Map<String, Object> variables) {
        try {
            if (variables.containsKey("accountTag")) {
                return new GraphQLResponse(objectMapper.readTree("""
                    {"viewer": {"accounts": [{"workersInvocationsAdaptive": [
                      {"sum": {"requests": 500}},
                      {"sum": {"requests": 400}}
                    ]}]}}
                    """), null);
            }
            return new GraphQLResponse(objectMapper.readTree("""
                {"viewer": {"zones": [{"httpRequestsAdaptiveGroups": [
                  {"count": 300, "confidence": {"level": 0.95, "count":
                    {"estimate": 300, "lower": 290, "upper": 310, "sampleSize": 20, "isValid": true}}}
                ]}]}}
                """), null);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
