package io.github.samzhu.usagemonitor.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.usagemonitor.client.GraphQLResponse;
import io.github.samzhu.usagemonitor.client.QueryExecutor;
import io.github.samzhu.usagemonitor.dto.DatasetDiscovery;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.ProductCatalog;

/**
 * 以 schema introspection 找出後端提供、但目錄尚未使用的 dataset。
 *
 * <p>dataset 判斷方式：{@code OBJECT} 型別、名稱以 {@code Groups} 或 {@code Adaptive} 結尾，
 * 且不是 {@code __} 開頭的內建型別。
 *
 * <p>此服務不會拋出例外，失敗時回傳帶有 {@code error} 的結果。
 */
@Service
public class DatasetDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(DatasetDiscoveryService.class);

    static final String INTROSPECTION_QUERY = """
        {
          __schema {
            types {
              name
              kind
            }
          }
        }
        """;

    private final QueryExecutor queryExecutor;

    public DatasetDiscoveryService(QueryExecutor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    public DatasetDiscovery discover() {
        List<String> configured = configuredDatasets();
        try {
            GraphQLResponse response = queryExecutor.execute(INTROSPECTION_QUERY, Map.of());
            if (response.hasErrors()) {
                log.error("Schema introspection failed: {}", response.errorMessage());
                return new DatasetDiscovery(List.of(), configured, List.of(), response.errorMessage());
            }

            List<String> available = datasetTypes(response.data());
            List<String> unconfigured = available.stream()
                .filter(name -> !configured.contains(name))
                .toList();
            log.info("Discovered {} datasets, {} not in catalog", available.size(), unconfigured.size());
            return new DatasetDiscovery(available, configured, unconfigured, null);
        } catch (RuntimeException e) {
            log.error("Schema introspection failed: {}", e.getMessage(), e);
            return new DatasetDiscovery(List.of(), configured, List.of(), e.getMessage());
        }
    }

    static List<String> datasetTypes(JsonNode data) {
        List<String> names = new ArrayList<>();
        JsonNode types = data == null ? null : data.path("__schema").path("types");
        if (types == null || !types.isArray()) {
            return names;
        }
        for (JsonNode type : types) {
            String name = type.path("name").asText("");
            if ("OBJECT".equals(type.path("kind").asText())
                    && !name.startsWith("__")
                    && (name.endsWith("Groups") || name.endsWith("Adaptive"))) {
                names.add(name);
            }
        }
        return names;
    }

    private static List<String> configuredDatasets() {
        Set<String> datasets = new LinkedHashSet<>();
        for (MetricDefinition definition : ProductCatalog.all()) {
            datasets.add(definition.dataset());
        }
        return List.copyOf(datasets);
    }
}
