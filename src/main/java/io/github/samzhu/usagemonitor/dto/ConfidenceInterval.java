package io.github.samzhu.usagemonitor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 抽樣資料的信賴區間。
 *
 * <p>由後端回應中的抽樣中繼資料建立，跨 zone 或跨分組列合併後附加在用量紀錄上，
 * 不跨查詢保存。
 *
 * @param estimate 估計值
 * @param lower 區間下界
 * @param upper 區間上界
 * @param sampleSize 參與估計的樣本數
 * @param valid 樣本數是否足以支撐所宣稱的信賴水準
 * @param level 信賴水準，例如 0.95
 * @param confidencePercent 由區間寬度推導出的信心分數 (0-99)
 * @see <a href="https://developers.cloudflare.com/analytics/graphql-api/features/confidence-intervals/">Confidence Intervals</a>
 */
public record ConfidenceInterval(
    double estimate,
    double lower,
    double upper,
    long sampleSize,
    @JsonProperty("isValid") boolean valid,
    double level,
    double confidencePercent
) {

    /**
     * 以原始區間資料建立，並計算信心分數。
     */
    public static ConfidenceInterval of(double estimate, double lower, double upper,
                                        long sampleSize, boolean valid, double level) {
        return new ConfidenceInterval(estimate, lower, upper, sampleSize, valid, level,
            calculateConfidencePercent(estimate, lower, upper));
    }

    /**
     * 計算信心分數。
     *
     * <p>公式：{@code 100 - ((upper - lower) / estimate * 100 / 2)}，限制在 0 到 99 之間。
     * 估計值為 0 或非有限值時回傳 99（沒有資料，對 0 有最高信心）。
     * 上限 99 是刻意的：抽樣資料永遠不宣稱 100% 信心。
     *
     * @return 信心分數 (0-99)
     */
    public static double calculateConfidencePercent(double estimate, double lower, double upper) {
        if (estimate == 0 || !Double.isFinite(estimate)) {
            return 99;
        }
        double relativeRange = (upper - lower) / estimate * 100;
        double percent = 100 - relativeRange / 2;
        if (Double.isNaN(percent)) {
            return 0;
        }
        return Math.max(0, Math.min(99, percent));
    }
}
