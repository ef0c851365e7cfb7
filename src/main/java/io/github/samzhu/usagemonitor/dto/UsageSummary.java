package io.github.samzhu.usagemonitor.dto;

import java.time.Instant;
import java.util.List;

/**
 * 依嚴重程度分類後的用量摘要。
 *
 * <p>四個列表互斥且涵蓋全部輸入紀錄。
 *
 * @param alerts 達到告警門檻的紀錄（依使用率遞減）
 * @param warnings 達到警示門檻的紀錄（依使用率遞減）
 * @param healthy 健康的紀錄（保留原順序）
 * @param errors 查詢失敗的紀錄（保留原順序）
 * @param timestamp 分類時間
 * @param totalQueryDurationMs 所有紀錄查詢耗時總和
 */
public record UsageSummary(
    List<UsageRecord> alerts,
    List<UsageRecord> warnings,
    List<UsageRecord> healthy,
    List<UsageRecord> errors,
    Instant timestamp,
    long totalQueryDurationMs
) {
    public UsageSummary {
        alerts = List.copyOf(alerts);
        warnings = List.copyOf(warnings);
        healthy = List.copyOf(healthy);
        errors = List.copyOf(errors);
    }

    /**
     * 紀錄總數。
     */
    public int total() {
        return alerts.size() + warnings.size() + healthy.size() + errors.size();
    }

    public boolean hasFindings() {
        return !alerts.isEmpty() || !warnings.isEmpty();
    }
}
