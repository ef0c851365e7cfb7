package io.github.samzhu.usagemonitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.usagemonitor.TestProperties;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties.ApiConfig;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties.MonitorConfig;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.MonitorRunResult;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.dto.UsageSummary;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;

class UsageMonitorJobTest {

    private static final Instant NOW = Instant.parse("2024-03-15T06:00:00Z");

    private UsageMonitorService monitorService;
    private ProductConfigService productConfigService;
    private ZoneTagProvider zoneTagProvider;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        monitorService = mock(UsageMonitorService.class);
        productConfigService = mock(ProductConfigService.class);
        zoneTagProvider = mock(ZoneTagProvider.class);
    }

    @Test
    void shouldSkipWhenCredentialsMissing() {
        // Given
        UsageMonitorProperties properties = new UsageMonitorProperties(
            new ApiConfig(null, "acc", "", null, null), null, null, null, null, null, null, null, null);
        UsageMonitorJob job = new UsageMonitorJob(monitorService, productConfigService, zoneTagProvider, properties, clock);

        // When
        MonitorRunResult result = job.runCheck();

        // Then
        assertThat(result.skipped()).isTrue();
        assertThat(result.hasFindings()).isFalse();
        assertThat(result.startedAt()).isEqualTo(NOW);
        verifyNoInteractions(monitorService, zoneTagProvider);
    }

    @Test
    void shouldQueryEnabledMetricsWithScheduledFilters() {
        // Given
        UsageSummary summary = new UsageSummary(List.of(), List.of(), List.of(), List.of(), NOW, 0);
        when(zoneTagProvider.getZoneTags()).thenReturn(List.of("z1", "z2"));
        when(productConfigService.getEnabledMetrics(List.of("z1", "z2"))).thenReturn(List.of());
        when(monitorService.queryAllEnabled(anyList(), anyList(), any())).thenReturn(List.of());
        when(monitorService.categorize(anyList(), eq(90.0), eq(75.0))).thenReturn(summary);
        UsageMonitorJob job = new UsageMonitorJob(
            monitorService, productConfigService, zoneTagProvider, TestProperties.defaults(), clock);

        // When
        MonitorRunResult result = job.runCheck();

        // Then: 預設只計算訪客流量並排除 403
        assertThat(result.skipped()).isFalse();
        assertThat(result.summary()).isSameAs(summary);
        assertThat(result.zoneCount()).isEqualTo(2);
        verify(monitorService).queryAllEnabled(eq(List.of()), eq(List.of("z1", "z2")),
            argThat(f -> f.eyeballOnly() && f.excludeBlocked() && !f.excludeEdgeWorkers() && f.zoneId() == null));
    }

    @Test
    void scheduledCheckShouldRespectDisabledFlag() {
        UsageMonitorProperties properties = new UsageMonitorProperties(
            null, null, null, null, null, null, null,
            new MonitorConfig(false, null, null, null, null), null);
        UsageMonitorJob job = new UsageMonitorJob(monitorService, productConfigService, zoneTagProvider, properties, clock);

        job.scheduledCheck();

        verify(monitorService, never()).queryAllEnabled(anyList(), anyList(), any());
    }

    @Test
    void shouldReportFindingsWhenSummaryHasAlerts() {
        // Given
        MonitoredMetric metric = new MonitoredMetric(
            MetricDefinition.builder("workers_requests").dataset("workersInvocationsAdaptive").field("requests").build(),
            100, true, null);
        BillingPeriod period = new BillingPeriod(
            Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z"), ZoneOffset.UTC);
        UsageRecord alert = UsageRecord.measured(metric, period, 95, null, 1);
        UsageSummary summary = new UsageSummary(List.of(alert), List.of(), List.of(), List.of(), NOW, 1);
        when(zoneTagProvider.getZoneTags()).thenReturn(List.of());
        when(productConfigService.getEnabledMetrics(List.of())).thenReturn(List.of(metric));
        when(monitorService.queryAllEnabled(anyList(), anyList(), any())).thenReturn(List.of(alert));
        when(monitorService.categorize(anyList(), eq(90.0), eq(75.0))).thenReturn(summary);
        UsageMonitorJob job = new UsageMonitorJob(
            monitorService, productConfigService, zoneTagProvider, TestProperties.defaults(), clock);

        // When
        MonitorRunResult result = job.runCheck();

        // Then
        assertThat(result.hasFindings()).isTrue();
        assertThat(result.metricCount()).isEqualTo(1);
    }
}
