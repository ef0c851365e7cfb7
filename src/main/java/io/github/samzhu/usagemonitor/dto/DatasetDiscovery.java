package io.github.samzhu.usagemonitor.dto;

import java.util.List;

/**
 * 後端 schema 中可用的 dataset 與目錄中已設定的 dataset 比較。
 *
 * @param availableDatasets 後端 schema 提供的 dataset
 * @param configuredDatasets 目錄中已使用的 dataset
 * @param unconfiguredDatasets 後端提供但目錄尚未使用的 dataset
 * @param error 錯誤訊息，成功時為 null
 */
public record DatasetDiscovery(
    List<String> availableDatasets,
    List<String> configuredDatasets,
    List<String> unconfiguredDatasets,
    String error
) {
    public DatasetDiscovery {
        availableDatasets = List.copyOf(availableDatasets);
        configuredDatasets = List.copyOf(configuredDatasets);
        unconfiguredDatasets = List.copyOf(unconfiguredDatasets);
    }
}
