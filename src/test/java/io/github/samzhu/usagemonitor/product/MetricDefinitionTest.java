package io.github.samzhu.usagemonitor.product;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.samzhu.usagemonitor.exception.MetricConfigurationException;

class MetricDefinitionTest {

    @Test
    void shouldRejectMissingFieldForSumAggregation() {
        assertThatThrownBy(() -> MetricDefinition.builder("broken")
                .dataset("workersInvocationsAdaptive")
                .aggregation(Aggregation.SUM)
                .build())
            .isInstanceOf(MetricConfigurationException.class)
            .hasMessageContaining("field is required")
            .satisfies(e -> assertThat(((MetricConfigurationException) e).getMetricId()).isEqualTo("broken"));
    }

    @Test
    void shouldAllowEmptyFieldForCount() {
        MetricDefinition definition = MetricDefinition.builder("requests")
            .dataset("httpRequestsAdaptiveGroups")
            .aggregation(Aggregation.COUNT)
            .scope(MetricScope.ZONE)
            .build();

        assertThat(definition.field()).isEmpty();
        assertThat(definition.timeFilter()).isEqualTo(TimeFilterKind.DATETIME);
        assertThat(definition.transform()).isEqualTo(UnitTransform.NONE);
        assertThat(definition.dimensionFilters()).isEmpty();
    }

    @Test
    void shouldRejectBlankDatasetAndNegativeLimit() {
        assertThatThrownBy(() -> MetricDefinition.builder("x").aggregation(Aggregation.COUNT).build())
            .isInstanceOf(MetricConfigurationException.class);
        assertThatThrownBy(() -> MetricDefinition.builder("x")
                .dataset("d").aggregation(Aggregation.COUNT).defaultLimit(-1).build())
            .isInstanceOf(MetricConfigurationException.class);
    }

    @Test
    void shouldRejectScalarDimensionFilterWithSeveralValues() {
        assertThatThrownBy(() -> new DimensionFilter("actionType", List.of("a", "b"), false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldConvertMicrosecondsToMilliseconds() {
        assertThat(UnitTransform.MICROSECONDS_TO_MILLISECONDS.apply(2500)).isEqualTo(2.5);
        assertThat(UnitTransform.NONE.apply(2500)).isEqualTo(2500);
    }

    @Test
    void catalogShouldHaveUniqueIdsAndValidZoneVariants() {
        // Given
        List<MetricDefinition> all = ProductCatalog.all();
        Set<String> ids = new HashSet<>();

        // Then
        assertThat(all).isNotEmpty();
        all.forEach(d -> assertThat(ids.add(d.id())).as("duplicate id %s", d.id()).isTrue());
        assertThat(ProductCatalog.findById("http_requests")).get()
            .extracting(MetricDefinition::scope).isEqualTo(MetricScope.ACCOUNT);
        assertThat(ProductCatalog.findById("http_requests_zone")).get()
            .extracting(MetricDefinition::scope).isEqualTo(MetricScope.ZONE);
        assertThat(ProductCatalog.findById("workers_cpu_time")).get()
            .extracting(MetricDefinition::transform).isEqualTo(UnitTransform.MICROSECONDS_TO_MILLISECONDS);
        assertThat(ProductCatalog.findById("does_not_exist")).isEmpty();
    }

    @Test
    void catalogShouldKeepOptionalProductsDisabledByDefault() {
        // Given
        List<MetricDefinition> all = ProductCatalog.all();

        // Then
        assertThat(all).hasSize(65);
        assertThat(ProductCatalog.findById("argo_bandwidth")).get()
            .satisfies(d -> {
                assertThat(d.enabledByDefault()).isTrue();
                assertThat(d.scope()).isEqualTo(MetricScope.ZONE);
                assertThat(d.aggregation()).isEqualTo(Aggregation.SUM);
            });
        assertThat(ProductCatalog.findById("workers_ai_neurons")).get()
            .extracting(MetricDefinition::enabledByDefault).isEqualTo(false);
        assertThat(ProductCatalog.findById("rate_limiting_requests")).get()
            .extracting(MetricDefinition::unlimited).isEqualTo(true);
    }
}
