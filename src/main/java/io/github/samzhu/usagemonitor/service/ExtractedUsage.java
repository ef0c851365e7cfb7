package io.github.samzhu.usagemonitor.service;

import java.util.Optional;

import io.github.samzhu.usagemonitor.dto.ConfidenceInterval;

/**
 * 從單一回應（單一分區）擷取出的原始用量，尚未套用單位轉換。
 *
 * @param value 所有分組列加總後的原始值
 * @param confidence 合併後的信賴區間，回應沒有抽樣資料時為空
 */
public record ExtractedUsage(
    double value,
    Optional<ConfidenceInterval> confidence
) {

    public static ExtractedUsage zero() {
        return new ExtractedUsage(0, Optional.empty());
    }
}
