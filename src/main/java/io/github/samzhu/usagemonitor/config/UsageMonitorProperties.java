package io.github.samzhu.usagemonitor.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * 用量監控服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link ApiConfig} - GraphQL Analytics API 連線設定</li>
 *   <li>{@link ThresholdConfig} - 告警與警示門檻</li>
 *   <li>{@link BillingConfig} - 帳單週期錨定日與時區</li>
 *   <li>{@link QueryConfig} - 批次大小、批次間隔、zone 併發數與整體期限</li>
 *   <li>{@link ZoneConfig} - zone 範圍指標要查詢的 zone</li>
 *   <li>{@link ProductOverride} - 各指標的上限與啟用覆寫</li>
 *   <li>{@link MonitorConfig} - 定時監控排程與流量過濾</li>
 *   <li>{@link SeatConfig} - Zero Trust 席次上限</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * usage-monitor:
 *   api:
 *     account-id: ${ACCOUNT_ID}
 *     api-token: ${API_TOKEN}
 *   thresholds:
 *     alert-percent: 90
 *     warning-percent: 75
 *   billing:
 *     start-day: 1
 *     timezone: UTC
 *   query:
 *     batch-size: 5
 *     batch-delay: 100ms
 *     deadline: 3m
 *   products:
 *     http_requests:
 *       limit: 3000000
 *       enabled: true
 * </pre>
 *
 * <p>合約設定以參數明確傳入引擎，沒有全域可變狀態。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@Validated
@ConfigurationProperties(prefix = "usage-monitor")
public record UsageMonitorProperties(
    ApiConfig api,
    @Valid ThresholdConfig thresholds,
    @Valid BillingConfig billing,
    @Valid QueryConfig query,
    ZoneConfig zones,
    Map<String, ProductOverride> products,
    Map<String, String> zoneVariants,
    MonitorConfig monitor,
    @Valid SeatConfig seats
) {
    public UsageMonitorProperties {
        if (api == null) {
            api = ApiConfig.defaults();
        }
        if (thresholds == null) {
            thresholds = ThresholdConfig.defaults();
        }
        if (billing == null) {
            billing = BillingConfig.defaults();
        }
        if (query == null) {
            query = QueryConfig.defaults();
        }
        if (zones == null) {
            zones = ZoneConfig.defaults();
        }
        products = products == null ? Map.of() : Map.copyOf(products);
        if (zoneVariants == null || zoneVariants.isEmpty()) {
            zoneVariants = defaultZoneVariants();
        } else {
            zoneVariants = Map.copyOf(zoneVariants);
        }
        if (monitor == null) {
            monitor = MonitorConfig.defaults();
        }
        if (seats == null) {
            seats = SeatConfig.defaults();
        }
    }

    /**
     * 帳號層級與 zone 層級重複的指標配對（account ID → zone ID）。
     *
     * <p>依 zone 過濾時隱藏帳號層級指標，全帳號檢視時隱藏 zone 變體。
     * 配對名單屬產品決策，可於 {@code usage-monitor.zone-variants} 覆寫。
     */
    public static Map<String, String> defaultZoneVariants() {
        return Map.of(
            "http_requests", "http_requests_zone",
            "bandwidth", "bandwidth_zone",
            "cached_bandwidth", "cached_bandwidth_zone"
        );
    }

    /**
     * GraphQL Analytics API 連線設定。
     *
     * @param endpoint GraphQL 端點
     * @param accountId 帳號 ID（account 範圍查詢的 accountTag）
     * @param apiToken 唯讀 API Token
     * @param connectTimeout 連線逾時，預設 5 秒
     * @param readTimeout 讀取逾時，預設 30 秒
     */
    public record ApiConfig(
        String endpoint,
        String accountId,
        String apiToken,
        Duration connectTimeout,
        Duration readTimeout
    ) {
        public static final String DEFAULT_ENDPOINT = "https://api.cloudflare.com/client/v4/graphql";

        public ApiConfig {
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = DEFAULT_ENDPOINT;
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(30);
            }
        }

        public boolean isConfigured() {
            return accountId != null && !accountId.isBlank()
                && apiToken != null && !apiToken.isBlank();
        }

        public static ApiConfig defaults() {
            return new ApiConfig(DEFAULT_ENDPOINT, null, null, Duration.ofSeconds(5), Duration.ofSeconds(30));
        }
    }

    /**
     * 分類門檻設定（百分比）。
     *
     * <p>預期 {@code alertPercent > warningPercent}，但不強制。
     *
     * @param alertPercent 告警門檻，預設 90
     * @param warningPercent 警示門檻，預設 75
     */
    public record ThresholdConfig(
        @DecimalMin("0") @DecimalMax("100") Double alertPercent,
        @DecimalMin("0") @DecimalMax("100") Double warningPercent
    ) {
        public ThresholdConfig {
            if (alertPercent == null) {
                alertPercent = 90.0;
            }
            if (warningPercent == null) {
                warningPercent = 75.0;
            }
        }

        public static ThresholdConfig defaults() {
            return new ThresholdConfig(90.0, 75.0);
        }
    }

    /**
     * 帳單週期設定。
     *
     * <p>時區在綁定時即解析，無效的時區 ID 會讓應用程式啟動失敗，而不是在每次查詢時才拋出。
     *
     * @param startDay 每月週期起始日 (1-28)，預設 1
     * @param timezone 計算週期使用的時區，預設 UTC
     */
    public record BillingConfig(
        @Min(1) @Max(28) int startDay,
        String timezone
    ) {
        public BillingConfig {
            if (startDay <= 0) {
                startDay = 1;
            }
            if (timezone == null || timezone.isBlank()) {
                timezone = "UTC";
            }
            try {
                ZoneId.of(timezone.trim());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid billing timezone: " + timezone, e);
            }
            timezone = timezone.trim();
        }

        public ZoneId zoneId() {
            return ZoneId.of(timezone);
        }

        public static BillingConfig defaults() {
            return new BillingConfig(1, "UTC");
        }
    }

    /**
     * 查詢執行設定。
     *
     * <p>批次大小限制同時在途的指標查詢數，批次間隔用來避開後端速率限制。
     * 總耗時上限約為 {@code ceil(N / batchSize) * (批次耗時 + batchDelay)}，並受 {@code deadline} 截斷。
     *
     * @param batchSize 每批同時查詢的指標數，預設 5
     * @param batchDelay 批次間隔，預設 100ms
     * @param zoneConcurrency zone 分區查詢的執行緒數，預設 5
     * @param deadline 單次執行的整體期限，預設 3 分鐘
     * @param confidenceLevel 信賴區間的信賴水準，預設 0.95
     */
    public record QueryConfig(
        @Min(1) int batchSize,
        Duration batchDelay,
        @Min(1) int zoneConcurrency,
        Duration deadline,
        @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "1", inclusive = false) double confidenceLevel
    ) {
        public QueryConfig {
            if (batchSize <= 0) {
                batchSize = 5;
            }
            if (batchDelay == null || batchDelay.isNegative()) {
                batchDelay = Duration.ofMillis(100);
            }
            if (zoneConcurrency <= 0) {
                zoneConcurrency = 5;
            }
            if (deadline == null || deadline.isZero() || deadline.isNegative()) {
                deadline = Duration.ofMinutes(3);
            }
            if (confidenceLevel <= 0) {
                confidenceLevel = 0.95;
            }
        }

        public static QueryConfig defaults() {
            return new QueryConfig(5, Duration.ofMillis(100), 5, Duration.ofMinutes(3), 0.95);
        }
    }

    /**
     * zone 設定。
     *
     * @param tags zone tag 列表
     * @param zoneId 單一 zone ID（{@code tags} 為空時使用）
     */
    public record ZoneConfig(
        List<String> tags,
        String zoneId
    ) {
        public ZoneConfig {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        public static ZoneConfig defaults() {
            return new ZoneConfig(List.of(), null);
        }
    }

    /**
     * 單一指標的覆寫設定，未設定的欄位沿用目錄預設。
     *
     * @param limit 週期上限
     * @param enabled 是否啟用
     * @param zoneTags 指定 zone
     */
    public record ProductOverride(
        Double limit,
        Boolean enabled,
        List<String> zoneTags
    ) {}

    /**
     * 定時監控設定。
     *
     * <p>預設只計算 eyeball 流量並排除被阻擋的請求，以逼近可計費流量。
     *
     * @param enabled 是否啟用排程
     * @param cron 排程 Cron 表達式，預設每 6 小時
     * @param eyeballOnly 只計算訪客流量
     * @param excludeBlocked 排除 403
     * @param excludeEdgeWorkers 排除 edge Worker 請求
     */
    public record MonitorConfig(
        Boolean enabled,
        String cron,
        Boolean eyeballOnly,
        Boolean excludeBlocked,
        Boolean excludeEdgeWorkers
    ) {
        public MonitorConfig {
            if (enabled == null) {
                enabled = true;
            }
            if (cron == null || cron.isBlank()) {
                cron = "0 0 */6 * * *";
            }
            if (eyeballOnly == null) {
                eyeballOnly = true;
            }
            if (excludeBlocked == null) {
                excludeBlocked = true;
            }
            if (excludeEdgeWorkers == null) {
                excludeEdgeWorkers = false;
            }
        }

        public static MonitorConfig defaults() {
            return new MonitorConfig(true, "0 0 */6 * * *", true, true, false);
        }
    }

    /**
     * Zero Trust 席次設定。
     *
     * <p>Zero Trust 依席次計費，不走 GraphQL Analytics，改由 REST API 的使用者列表計算。
     *
     * @param limit 合約席次上限，0 表示未設定（視為無上限）
     * @param endpoint REST API 基底位址
     */
    public record SeatConfig(
        @Min(0) int limit,
        String endpoint
    ) {
        public static final String DEFAULT_ENDPOINT = "https://api.cloudflare.com/client/v4";

        public SeatConfig {
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = DEFAULT_ENDPOINT;
            }
        }

        public static SeatConfig defaults() {
            return new SeatConfig(0, DEFAULT_ENDPOINT);
        }
    }
}
