package io.github.samzhu.usagemonitor.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import io.github.samzhu.usagemonitor.dto.UsageRecord;
import io.github.samzhu.usagemonitor.dto.UsageSummary;

/**
 * 依兩個門檻將用量紀錄分為告警、警示、健康與錯誤四類。
 *
 * <p>每筆紀錄依以下優先序判斷：
 * <ol>
 *   <li>有錯誤 → errors（不論使用率）</li>
 *   <li>{@code percentUsed >= alertThreshold} → alerts</li>
 *   <li>{@code percentUsed >= warningThreshold} → warnings</li>
 *   <li>其餘 → healthy</li>
 * </ol>
 * alerts 與 warnings 依使用率遞減排序（穩定排序），healthy 與 errors 保留原順序。
 * 無上限指標的使用率恆為 0，自然落在 healthy。
 */
@Component
public class UsageCategorizer {

    private static final Comparator<UsageRecord> BY_PERCENT_DESC =
        Comparator.comparingDouble(UsageRecord::percentUsed).reversed();

    private final Clock clock;

    public UsageCategorizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * 分類用量紀錄。
     *
     * @param records 用量紀錄
     * @param alertThreshold 告警門檻 (0-100)
     * @param warningThreshold 警示門檻 (0-100)
     * @return 用量摘要
     */
    public UsageSummary categorize(List<UsageRecord> records, double alertThreshold, double warningThreshold) {
        List<UsageRecord> alerts = new ArrayList<>();
        List<UsageRecord> warnings = new ArrayList<>();
        List<UsageRecord> healthy = new ArrayList<>();
        List<UsageRecord> errors = new ArrayList<>();
        long totalDuration = 0;

        for (UsageRecord record : records) {
            totalDuration += record.queryDurationMs();
            if (record.hasError()) {
                errors.add(record);
            } else if (record.percentUsed() >= alertThreshold) {
                alerts.add(record);
            } else if (record.percentUsed() >= warningThreshold) {
                warnings.add(record);
            } else {
                healthy.add(record);
            }
        }

        alerts.sort(BY_PERCENT_DESC);
        warnings.sort(BY_PERCENT_DESC);
        return new UsageSummary(alerts, warnings, healthy, errors, Instant.now(clock), totalDuration);
    }
}
