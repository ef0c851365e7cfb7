package io.github.samzhu.usagemonitor.service;

import java.util.List;

import org.springframework.stereotype.Component;

import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;

/**
 * 從組態讀取 zone 列表。
 *
 * <p>優先使用 {@code usage-monitor.zones.tags}，為空時退回單一的 {@code zones.zone-id}。
 */
@Component
public class ConfiguredZoneTagProvider implements ZoneTagProvider {

    private final UsageMonitorProperties.ZoneConfig zones;

    public ConfiguredZoneTagProvider(UsageMonitorProperties properties) {
        this.zones = properties.zones();
    }

    @Override
    public List<String> getZoneTags() {
        if (!zones.tags().isEmpty()) {
            return zones.tags();
        }
        if (zones.zoneId() != null && !zones.zoneId().isBlank()) {
            return List.of(zones.zoneId());
        }
        return List.of();
    }
}
