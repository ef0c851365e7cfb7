package io.github.samzhu.usagemonitor.dto;

/**
 * Zero Trust 席次統計。
 *
 * @param totalUsers 組織內的使用者總數
 * @param accessSeats 佔用 Access 席次的使用者數
 * @param gatewaySeats 佔用 Gateway 席次的使用者數
 * @param activeSeats 佔用任一席次的使用者數（計費席次）
 */
public record ZeroTrustSeats(
    long totalUsers,
    long accessSeats,
    long gatewaySeats,
    long activeSeats
) {

    public static ZeroTrustSeats empty() {
        return new ZeroTrustSeats(0, 0, 0, 0);
    }
}
