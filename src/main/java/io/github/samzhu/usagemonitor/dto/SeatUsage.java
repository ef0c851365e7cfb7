package io.github.samzhu.usagemonitor.dto;

/**
 * Zero Trust 席次用量與合約上限比較結果。
 *
 * @param seats 席次統計，查詢失敗時為全 0
 * @param limit 合約席次上限，0 表示未設定
 * @param percentUsed 計費席次佔上限的百分比，未設定上限時為 0
 * @param status 席次狀態
 * @param error 錯誤訊息，成功時為 null
 * @param durationMs 查詢耗時（毫秒）
 */
public record SeatUsage(
    ZeroTrustSeats seats,
    int limit,
    double percentUsed,
    SeatStatus status,
    String error,
    long durationMs
) {

    /**
     * 席次狀態。
     */
    public enum SeatStatus {
        /** 未設定上限 */
        UNLIMITED,
        HEALTHY,
        WARNING,
        ALERT,
        /** 已達或超過上限 */
        CRITICAL,
        /** 查詢失敗 */
        ERROR
    }

    public static SeatUsage failed(int limit, String error, long durationMs) {
        return new SeatUsage(ZeroTrustSeats.empty(), limit, 0, SeatStatus.ERROR, error, durationMs);
    }

    /**
     * 計算席次使用率。
     *
     * <p>公式：{@code limit > 0 ? activeSeats / limit * 100 : 0}
     */
    public static double calculateSeatUsagePercent(long activeSeats, int limit) {
        if (limit <= 0) {
            return 0;
        }
        return (double) activeSeats / limit * 100.0;
    }

    /**
     * 依使用率判斷席次狀態，達到 100% 為 {@link SeatStatus#CRITICAL}。
     */
    public static SeatStatus statusOf(long activeSeats, int limit, double alertPercent, double warningPercent) {
        if (limit <= 0) {
            return SeatStatus.UNLIMITED;
        }
        double percent = calculateSeatUsagePercent(activeSeats, limit);
        if (percent >= 100) {
            return SeatStatus.CRITICAL;
        }
        if (percent >= alertPercent) {
            return SeatStatus.ALERT;
        }
        if (percent >= warningPercent) {
            return SeatStatus.WARNING;
        }
        return SeatStatus.HEALTHY;
    }
}
