package io.github.samzhu.usagemonitor.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.usagemonitor.TestProperties;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties.ApiConfig;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties.ProductOverride;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties.SeatConfig;
import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.DatasetDiscovery;
import io.github.samzhu.usagemonitor.dto.MonitorRunResult;
import io.github.samzhu.usagemonitor.dto.SeatUsage;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.dto.ZeroTrustSeats;
import io.github.samzhu.usagemonitor.product.Aggregation;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.service.DatasetDiscoveryService;
import io.github.samzhu.usagemonitor.service.ProductConfigService;
import io.github.samzhu.usagemonitor.service.SeatUsageService;
import io.github.samzhu.usagemonitor.service.UsageCategorizer;
import io.github.samzhu.usagemonitor.service.UsageMonitorJob;
import io.github.samzhu.usagemonitor.service.UsageMonitorService;
import io.github.samzhu.usagemonitor.service.ZoneTagProvider;

class UsageApiControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-21T00:00:00Z");

    private final BillingPeriod period = new BillingPeriod(
        Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z"), ZoneOffset.UTC);

    private UsageMonitorService monitorService;
    private ProductConfigService productConfigService;
    private ZoneTagProvider zoneTagProvider;
    private UsageMonitorJob monitorJob;
    private SeatUsageService seatUsageService;
    private DatasetDiscoveryService datasetDiscoveryService;
    private Clock clock;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        monitorService = mock(UsageMonitorService.class);
        productConfigService = mock(ProductConfigService.class);
        zoneTagProvider = mock(ZoneTagProvider.class);
        monitorJob = mock(UsageMonitorJob.class);
        seatUsageService = mock(SeatUsageService.class);
        datasetDiscoveryService = mock(DatasetDiscoveryService.class);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        UsageCategorizer categorizer = new UsageCategorizer(clock);

        when(monitorService.currentBillingPeriod()).thenReturn(period);
        when(monitorService.categorize(anyList(), anyDouble(), anyDouble())).thenAnswer(invocation ->
            categorizer.categorize(invocation.getArgument(0),
                invocation.<Double>getArgument(1), invocation.<Double>getArgument(2)));
        when(zoneTagProvider.getZoneTags()).thenReturn(List.of("z1"));

        mockMvc = mockMvc(TestProperties.defaults());
    }

    private MockMvc mockMvc(UsageMonitorProperties properties) {
        return MockMvcBuilders.standaloneSetup(new UsageApiController(
            monitorService, productConfigService, zoneTagProvider, monitorJob,
            seatUsageService, datasetDiscoveryService, properties, clock))
            .build();
    }

    @Test
    void shouldReturnUsageReportWithDisabledPlaceholders() throws Exception {
        // Given
        MonitoredMetric enabled = metric("requests", true);
        MonitoredMetric disabled = metric("optional", false);
        when(productConfigService.getConfiguredMetrics(List.of("z1"))).thenReturn(List.of(enabled, disabled));
        when(monitorService.queryAllConfigured(anyList(), eq(List.of("z1")), any())).thenReturn(List.of(
            UsageRecord.measured(enabled, period, 950, null, 40),
            UsageRecord.disabled(disabled, period)));

        // When & Then
        mockMvc.perform(get("/api/v1/usage").param("eyeballOnly", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.products.length()").value(2))
            .andExpect(jsonPath("$.products[0].metricId").value("requests"))
            .andExpect(jsonPath("$.products[1].enabled").value(false))
            .andExpect(jsonPath("$.summary.alerts").value(1))
            .andExpect(jsonPath("$.summary.disabled").value(1))
            .andExpect(jsonPath("$.billingPeriod.daysRemaining").value(11))
            .andExpect(jsonPath("$.totalQueryDurationMs").value(40));

        verify(monitorService).queryAllConfigured(anyList(), eq(List.of("z1")),
            argThat(f -> f.eyeballOnly() && !f.excludeBlocked() && f.zoneId() == null));
    }

    @Test
    void shouldNormalizeZoneIdFilter() throws Exception {
        when(productConfigService.getConfiguredMetrics(anyList())).thenReturn(List.of());
        when(monitorService.queryAllConfigured(anyList(), anyList(), any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/usage").param("zoneId", " 0123456789ABCDEF0123456789ABCDEF "))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.zoneId").value("0123456789abcdef0123456789abcdef"));
    }

    @Test
    void shouldRejectInvalidZoneId() throws Exception {
        mockMvc.perform(get("/api/v1/usage").param("zoneId", "not-a-zone"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_zone_id"));

        verify(monitorService, never()).queryAllConfigured(anyList(), anyList(), any());
    }

    @Test
    void shouldRejectThresholdOutOfRange() throws Exception {
        mockMvc.perform(get("/api/v1/usage/summary").param("alertThreshold", "150"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_threshold"));
    }

    @Test
    void shouldReturnSummaryWithCustomThresholds() throws Exception {
        // Given: 60% 在預設門檻下是健康，在 50/40 門檻下是告警
        MonitoredMetric enabled = metric("requests", true);
        when(productConfigService.getEnabledMetrics(List.of("z1"))).thenReturn(List.of(enabled));
        when(monitorService.queryAllEnabled(anyList(), anyList(), any()))
            .thenReturn(List.of(UsageRecord.measured(enabled, period, 600, null, 5)));

        mockMvc.perform(get("/api/v1/usage/summary")
                .param("alertThreshold", "50")
                .param("warningThreshold", "40"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.alerts.length()").value(1))
            .andExpect(jsonPath("$.healthy.length()").value(0));
    }

    @Test
    void shouldReturnBillingPeriod() throws Exception {
        mockMvc.perform(get("/api/v1/usage/billing-period"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.timezone").value("Z"))
            .andExpect(jsonPath("$.daysRemaining").value(11));
    }

    @Test
    void shouldListProducts() throws Exception {
        when(productConfigService.getConfiguredMetrics(List.of("z1")))
            .thenReturn(List.of(metric("requests", true), metric("optional", false)));

        mockMvc.perform(get("/api/v1/usage/products"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].id").value("requests"))
            .andExpect(jsonPath("$[0].limit").value(1000.0))
            .andExpect(jsonPath("$[1].enabled").value(false));
    }

    @Test
    void shouldTriggerCheck() throws Exception {
        when(monitorJob.runCheck()).thenReturn(MonitorRunResult.skipped("Missing account ID or API token", NOW));

        mockMvc.perform(post("/api/v1/usage/check"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.skipped").value(true))
            .andExpect(jsonPath("$.skipReason").value("Missing account ID or API token"));
    }

    @Test
    void shouldReturnSeatUsage() throws Exception {
        // Given
        when(seatUsageService.getSeatUsage()).thenReturn(new SeatUsage(
            new ZeroTrustSeats(60, 40, 30, 46), 50, 92.0, SeatUsage.SeatStatus.ALERT, null, 12));

        // When & Then
        mockMvc.perform(get("/api/v1/usage/seats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.seats.activeSeats").value(46))
            .andExpect(jsonPath("$.limit").value(50))
            .andExpect(jsonPath("$.status").value("ALERT"));
    }

    @Test
    void shouldReturnSeatErrorWithoutFailingRequest() throws Exception {
        when(seatUsageService.getSeatUsage()).thenReturn(SeatUsage.failed(0, "Seat request failed: 403", 3));

        mockMvc.perform(get("/api/v1/usage/seats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ERROR"))
            .andExpect(jsonPath("$.error").value("Seat request failed: 403"));
    }

    @Test
    void shouldReturnConfigWithoutCredentials() throws Exception {
        // Given
        ApiConfig api = new ApiConfig(null, "acc-secret-id", "tok-secret-value", null, null);
        UsageMonitorProperties properties = new UsageMonitorProperties(api, null, null, null, null,
            Map.of(
                "http_requests", new ProductOverride(3_000_000.0, null, null),
                "bandwidth", new ProductOverride(1000.0, false, null),
                "workers_requests", new ProductOverride(null, true, null)),
            null, null, new SeatConfig(50, null));

        // When & Then
        mockMvc(properties).perform(get("/api/v1/usage/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.thresholds.alertPercent").value(90.0))
            .andExpect(jsonPath("$.billing.timezone").value("UTC"))
            .andExpect(jsonPath("$.billing.currentPeriod.daysRemaining").value(11))
            .andExpect(jsonPath("$.contractCaps.length()").value(1))
            .andExpect(jsonPath("$.contractCaps[0].productId").value("http_requests"))
            .andExpect(jsonPath("$.contractCaps[0].limit").value(3_000_000.0))
            .andExpect(jsonPath("$.monitorCron").value("0 0 */6 * * *"))
            .andExpect(jsonPath("$.environment.hasApiToken").value(true))
            .andExpect(jsonPath("$.environment.hasAccountId").value(true))
            .andExpect(jsonPath("$.environment.zoneTagsConfigured").value(1))
            .andExpect(jsonPath("$.environment.seatLimitConfigured").value(true))
            .andExpect(content().string(not(containsString("tok-secret-value"))))
            .andExpect(content().string(not(containsString("acc-secret-id"))));
    }

    @Test
    void shouldReturnDatasetDiscovery() throws Exception {
        when(datasetDiscoveryService.discover()).thenReturn(new DatasetDiscovery(
            List.of("httpRequestsAdaptiveGroups", "newFeatureAdaptiveGroups"),
            List.of("httpRequestsAdaptiveGroups"),
            List.of("newFeatureAdaptiveGroups"),
            null));

        mockMvc.perform(get("/api/v1/usage/datasets"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.availableDatasets.length()").value(2))
            .andExpect(jsonPath("$.unconfiguredDatasets[0]").value("newFeatureAdaptiveGroups"));
    }

    private static MonitoredMetric metric(String id, boolean enabled) {
        MetricDefinition definition = MetricDefinition.builder(id)
            .name(id).dataset("d").aggregation(Aggregation.COUNT).unit("requests").build();
        return new MonitoredMetric(definition, 1000, enabled, null);
    }
}
