package io.github.samzhu.usagemonitor.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.usagemonitor.dto.BillingPeriod;
import io.github.samzhu.usagemonitor.dto.ConfidenceInterval;
import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.product.Aggregation;
import io.github.samzhu.usagemonitor.product.MetricDefinition;
import io.github.samzhu.usagemonitor.product.MonitoredMetric;
import io.github.samzhu.usagemonitor.util.ConfidenceCombiner;

/**
 * 將後端回應轉為統一的用量數值與用量紀錄。
 *
 * <p>回應結構：
 * <pre>
 * viewer → zones | accounts → [0] → &lt;dataset&gt; → [ row, row, ... ]
 * </pre>
 * 一個 dataset 可能回傳多筆分組列，必須全部加總而不是只取第一筆。
 * 結果陣列不存在或為空表示本週期沒有用量，回傳 0，不視為錯誤。
 */
@Component
public class UsageResultNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UsageResultNormalizer.class);

    /**
     * 擷取回應中的原始用量與信賴區間。
     *
     * <p>結構不符（例如缺少 {@code viewer}）時記錄錯誤並回傳 0，不會拋出例外；
     * 某些 dataset 在特定帳號上本來就不存在。
     *
     * @param data 回應的 {@code data} 節點
     * @param definition 指標定義
     * @return 原始用量
     */
    public ExtractedUsage extract(JsonNode data, MetricDefinition definition) {
        try {
            JsonNode viewer = data == null ? null : data.get("viewer");
            if (viewer == null || !viewer.isObject()) {
                throw new IllegalStateException("Response has no viewer object");
            }

            JsonNode scopes = viewer.path(definition.scope().resultKey());
            if (!scopes.isArray() || scopes.isEmpty()) {
                return ExtractedUsage.zero();
            }

            JsonNode rows = scopes.get(0).path(definition.dataset());
            if (!rows.isArray() || rows.isEmpty()) {
                return ExtractedUsage.zero();
            }

            double total = 0;
            List<ConfidenceInterval> partitions = new ArrayList<>();
            for (JsonNode row : rows) {
                total += aggregateValue(row, definition);
                confidenceOf(row, definition).ifPresent(partitions::add);
            }
            return new ExtractedUsage(total, ConfidenceCombiner.combine(partitions));
        } catch (RuntimeException e) {
            log.error("Failed to extract value for {}.{} ({}): {}",
                definition.dataset(), definition.field(), definition.aggregation(), e.getMessage(), e);
            return ExtractedUsage.zero();
        }
    }

    /**
     * 依合併後的原始值建立用量紀錄。
     *
     * <p>原始值大於 0 時才套用單位轉換，再依上限計算使用率。
     * 信賴區間保持原始單位。
     *
     * @param metric 執行期指標
     * @param period 帳單週期
     * @param rawValue 合併後的原始值
     * @param confidence 合併後的信賴區間
     * @param durationMs 查詢耗時
     * @return 用量紀錄
     */
    public UsageRecord toRecord(MonitoredMetric metric, BillingPeriod period, double rawValue,
                                Optional<ConfidenceInterval> confidence, long durationMs) {
        double usage = rawValue > 0 ? metric.definition().transform().apply(rawValue) : rawValue;
        return UsageRecord.measured(metric, period, usage, confidence.orElse(null), durationMs);
    }

    private static double aggregateValue(JsonNode row, MetricDefinition definition) {
        if (definition.aggregation() == Aggregation.COUNT) {
            return row.path("count").asDouble(0);
        }
        return row.path(definition.aggregation().graphqlName()).path(definition.field()).asDouble(0);
    }

    private static Optional<ConfidenceInterval> confidenceOf(JsonNode row, MetricDefinition definition) {
        JsonNode confidence = row.get("confidence");
        if (confidence == null || !confidence.isObject()) {
            return Optional.empty();
        }

        JsonNode nested = confidence.path(definition.aggregation().graphqlName());
        if (definition.aggregation() != Aggregation.COUNT) {
            nested = nested.path(definition.field());
        }
        if (!nested.isObject()) {
            return Optional.empty();
        }

        return Optional.of(ConfidenceInterval.of(
            nested.path("estimate").asDouble(0),
            nested.path("lower").asDouble(0),
            nested.path("upper").asDouble(0),
            nested.path("sampleSize").asLong(0),
            nested.path("isValid").asBoolean(false),
            confidence.path("level").asDouble(0.95)
        ));
    }
}
