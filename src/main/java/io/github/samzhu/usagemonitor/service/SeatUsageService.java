package io.github.samzhu.usagemonitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.usagemonitor.client.ZeroTrustSeatClient;
import io.github.samzhu.usagemonitor.config.UsageMonitorProperties;
import io.github.samzhu.usagemonitor.dto.SeatUsage;
import io.github.samzhu.usagemonitor.dto.ZeroTrustSeats;

/**
 * 查詢 Zero Trust 席次並與合約上限比較。
 *
 * <p>門檻沿用 {@code usage-monitor.thresholds}；上限來自 {@code usage-monitor.seats.limit}，
 * 未設定時狀態為 {@link SeatUsage.SeatStatus#UNLIMITED}。
 *
 * <p>此服務不會拋出例外，失敗時回傳狀態為 {@link SeatUsage.SeatStatus#ERROR} 的結果。
 */
@Service
public class SeatUsageService {

    private static final Logger log = LoggerFactory.getLogger(SeatUsageService.class);

    static final String NOT_CONFIGURED_ERROR = "Missing account ID or API token";

    private final ZeroTrustSeatClient seatClient;
    private final UsageMonitorProperties properties;

    public SeatUsageService(ZeroTrustSeatClient seatClient, UsageMonitorProperties properties) {
        this.seatClient = seatClient;
        this.properties = properties;
    }

    public SeatUsage getSeatUsage() {
        long startTime = System.currentTimeMillis();
        int limit = properties.seats().limit();

        if (!properties.api().isConfigured()) {
            return SeatUsage.failed(limit, NOT_CONFIGURED_ERROR, 0);
        }

        try {
            ZeroTrustSeats seats = seatClient.fetchSeats(properties.api().accountId());
            UsageMonitorProperties.ThresholdConfig thresholds = properties.thresholds();
            SeatUsage usage = new SeatUsage(
                seats,
                limit,
                SeatUsage.calculateSeatUsagePercent(seats.activeSeats(), limit),
                SeatUsage.statusOf(seats.activeSeats(), limit,
                    thresholds.alertPercent(), thresholds.warningPercent()),
                null,
                System.currentTimeMillis() - startTime);
            log.info("Zero Trust seats: active={}, access={}, gateway={}, total={}, status={}",
                seats.activeSeats(), seats.accessSeats(), seats.gatewaySeats(), seats.totalUsers(), usage.status());
            return usage;
        } catch (RuntimeException e) {
            log.error("Failed to fetch Zero Trust seats: {}", e.getMessage(), e);
            return SeatUsage.failed(limit, e.getMessage(), System.currentTimeMillis() - startTime);
        }
    }
}
