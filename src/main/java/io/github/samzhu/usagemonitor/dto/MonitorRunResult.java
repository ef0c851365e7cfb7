package io.github.samzhu.usagemonitor.dto;

import java.time.Instant;

/**
 * 一次監控執行的結果。
 *
 * @param summary 分類後的摘要，略過執行時為 null
 * @param metricCount 查詢的指標數
 * @param zoneCount 使用的 zone 數
 * @param skipped 是否因組態不完整而略過
 * @param skipReason 略過原因
 * @param startedAt 開始時間
 * @param durationMs 總耗時（毫秒）
 */
public record MonitorRunResult(
    UsageSummary summary,
    int metricCount,
    int zoneCount,
    boolean skipped,
    String skipReason,
    Instant startedAt,
    long durationMs
) {

    public static MonitorRunResult skipped(String reason, Instant startedAt) {
        return new MonitorRunResult(null, 0, 0, true, reason, startedAt, 0);
    }

    /**
     * 本次執行是否有告警或警示。
     */
    public boolean hasFindings() {
        return summary != null && summary.hasFindings();
    }
}
