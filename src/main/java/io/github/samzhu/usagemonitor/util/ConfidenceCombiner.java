package io.github.samzhu.usagemonitor.util;

import java.util.List;
import java.util.Optional;

import io.github.samzhu.usagemonitor.dto.ConfidenceInterval;

/**
 * 合併多個分區（zone 或分組列）的信賴區間。
 *
 * <p>合併規則與用量加總一致：
 * <ul>
 *   <li>{@code estimate}、{@code lower}、{@code upper}、{@code sampleSize} 加總（不是平均）</li>
 *   <li>{@code isValid} 取所有分區的 AND</li>
 *   <li>{@code level} 取任一分區（所有分區使用同一個信賴水準）</li>
 * </ul>
 * 所有運算皆可交換、可結合，分區的完成順序不影響結果。
 */
public final class ConfidenceCombiner {

    private ConfidenceCombiner() {
        // 工具類不允許實例化
    }

    /**
     * 合併所有分區。
     *
     * @param partitions 各分區的信賴區間
     * @return 合併後的區間；沒有任何分區時為空
     */
    public static Optional<ConfidenceInterval> combine(List<ConfidenceInterval> partitions) {
        if (partitions == null || partitions.isEmpty()) {
            return Optional.empty();
        }
        return partitions.stream().reduce(ConfidenceCombiner::merge);
    }

    /**
     * 合併兩個區間，並重新計算信心分數。
     */
    public static ConfidenceInterval merge(ConfidenceInterval a, ConfidenceInterval b) {
        return ConfidenceInterval.of(
            a.estimate() + b.estimate(),
            a.lower() + b.lower(),
            a.upper() + b.upper(),
            a.sampleSize() + b.sampleSize(),
            a.valid() && b.valid(),
            a.level()
        );
    }
}
