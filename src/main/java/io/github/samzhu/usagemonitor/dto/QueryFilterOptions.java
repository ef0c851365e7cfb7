package io.github.samzhu.usagemonitor.dto;

/**
 * 流量過濾選項，用於逼近可計費流量。
 *
 * <p>這只是近似值，實際計費使用不同的資料來源。
 * 過濾條件只會加在支援它的 dataset 上，不支援的組合直接略過。
 *
 * @param eyeballOnly 只計算真實訪客（eyeball）請求
 * @param excludeEdgeWorkers 排除由 edge Worker 發出的請求
 * @param excludeBlocked 排除被安全機制阻擋 (403) 的請求
 * @param zoneId 只查詢單一 zone；為 null 時為全帳號檢視
 */
public record QueryFilterOptions(
    boolean eyeballOnly,
    boolean excludeEdgeWorkers,
    boolean excludeBlocked,
    String zoneId
) {

    /**
     * 不套用任何過濾。
     */
    public static QueryFilterOptions none() {
        return new QueryFilterOptions(false, false, false, null);
    }

    public boolean hasZoneRestriction() {
        return zoneId != null && !zoneId.isBlank();
    }
}
