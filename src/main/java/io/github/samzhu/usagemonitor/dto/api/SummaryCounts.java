package io.github.samzhu.usagemonitor.dto.api;

import io.github.samzhu.usagemonitor.dto.UsageSummary;

/**
 * 各分類的紀錄數。
 */
public record SummaryCounts(
    int alerts,
    int warnings,
    int healthy,
    int errors,
    int disabled
) {

    public static SummaryCounts of(UsageSummary summary, int disabled) {
        return new SummaryCounts(
            summary.alerts().size(),
            summary.warnings().size(),
            summary.healthy().size(),
            summary.errors().size(),
            disabled
        );
    }
}
