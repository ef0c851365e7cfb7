package io.github.samzhu.usagemonitor.product;

import static io.github.samzhu.usagemonitor.product.Aggregation.COUNT;
import static io.github.samzhu.usagemonitor.product.Aggregation.MAX;
import static io.github.samzhu.usagemonitor.product.Aggregation.SUM;
import static io.github.samzhu.usagemonitor.product.MetricScope.ACCOUNT;
import static io.github.samzhu.usagemonitor.product.MetricScope.ZONE;

import java.util.List;
import java.util.Optional;

/**
 * 內建的指標定義目錄。
 *
 * <p>純資料表，不含任何可執行邏輯；單位轉換以 {@link UnitTransform} 列舉指定。
 * 每個定義的上限與啟用狀態可在組態 {@code usage-monitor.products.<id>} 中覆寫。
 *
 * <p>注意：
 * <ul>
 *   <li>httpRequestsAdaptiveGroups 的請求數用 {@code COUNT}，位元組用 {@code SUM}</li>
 *   <li>D1、DNS、AI Gateway 與日彙總 dataset 使用 {@code DATE} 時間過濾</li>
 *   <li>儲存量類指標是時間點數值，使用 {@code MAX}</li>
 * </ul>
 */
public final class ProductCatalog {

    private static final double GIB = 1024d * 1024 * 1024;
    private static final double TIB = GIB * 1024;

    private static final List<String> R2_CLASS_A_ACTIONS = List.of(
        "ListBuckets", "PutBucket", "ListObjects", "PutObject", "CopyObject",
        "CompleteMultipartUpload", "CreateMultipartUpload", "LifecycleStorageTierTransition",
        "ListMultipartUploads", "UploadPart", "UploadPartCopy", "ListParts",
        "PutBucketEncryption", "PutBucketCors", "PutBucketLifecycleConfiguration");

    private static final List<String> R2_CLASS_B_ACTIONS = List.of(
        "HeadBucket", "HeadObject", "GetObject", "UsageSummary", "GetBucketEncryption",
        "GetBucketLocation", "GetBucketCors", "GetBucketLifecycleConfiguration");

    private static final List<MetricDefinition> PRODUCTS = List.of(
        // ===== Compute =====
        MetricDefinition.builder("workers_requests")
            .name("Workers Requests").category(ProductCategory.COMPUTE)
            .description("Total number of requests handled by Workers")
            .unit("requests").defaultLimit(10_000_000)
            .dataset("workersInvocationsAdaptive").field("requests").aggregation(SUM).scope(ACCOUNT)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("workers_cpu_time")
            .name("Workers CPU Time").category(ProductCategory.COMPUTE)
            .description("Total CPU time consumed by Workers")
            .unit("ms").defaultLimit(30_000_000)
            .dataset("workersInvocationsAdaptive").field("cpuTimeUs").aggregation(SUM).scope(ACCOUNT)
            .transform(UnitTransform.MICROSECONDS_TO_MILLISECONDS)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("workers_duration")
            .name("Workers Duration").category(ProductCategory.COMPUTE)
            .description("Total wall-clock duration of Worker executions")
            .unit("ms").defaultLimit(100_000_000)
            .dataset("workersInvocationsAdaptive").field("duration").aggregation(SUM).scope(ACCOUNT)
            .enabledByDefault(true)
            .note("Wall-clock time (not billed). CPU time is the billable metric.")
            .build(),
        MetricDefinition.builder("pages_requests")
            .name("Pages Requests").category(ProductCategory.COMPUTE)
            .description("Total requests to Pages sites")
            .unit("requests")
            .dataset("pagesRequestsAdaptiveGroups").field("requests").aggregation(SUM).scope(ACCOUNT)
            .unlimited(true)
            .note("Static asset requests included. Pages Functions billed separately as Workers.")
            .build(),
        MetricDefinition.builder("queues_messages")
            .name("Queues Messages").category(ProductCategory.COMPUTE)
            .description("Total messages processed by Queues")
            .unit("messages").defaultLimit(1_000_000)
            .dataset("queuesAdaptiveGroups").field("messages").aggregation(SUM).scope(ACCOUNT)
            .note("Dataset may not be available on all accounts.")
            .build(),
        MetricDefinition.builder("workers_subrequests")
            .name("Workers Subrequests").category(ProductCategory.COMPUTE)
            .description("Subrequests (fetch calls) made by Workers")
            .unit("requests").defaultLimit(50_000_000)
            .dataset("workersSubrequestsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Dataset may not be available on all accounts.")
            .build(),
        MetricDefinition.builder("pages_functions_invocations")
            .name("Pages Functions Invocations").category(ProductCategory.COMPUTE)
            .description("Function invocations on Cloudflare Pages")
            .unit("invocations").defaultLimit(100_000)
            .dataset("pagesFunctionsInvocationsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Server-side functions in Pages. Enable if you use Pages Functions.")
            .build(),

        // ===== Storage =====
        MetricDefinition.builder("r2_class_a_operations")
            .name("R2 Class A Operations").category(ProductCategory.STORAGE)
            .description("R2 mutating operations (PUT, LIST, multipart uploads)")
            .unit("operations").defaultLimit(1_000_000)
            .dataset("r2OperationsAdaptiveGroups").field("requests").aggregation(SUM).scope(ACCOUNT)
            .dimensionFilters(List.of(DimensionFilter.in("actionType_in", R2_CLASS_A_ACTIONS)))
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("r2_class_b_operations")
            .name("R2 Class B Operations").category(ProductCategory.STORAGE)
            .description("R2 read operations (GET, HEAD)")
            .unit("operations").defaultLimit(10_000_000)
            .dataset("r2OperationsAdaptiveGroups").field("requests").aggregation(SUM).scope(ACCOUNT)
            .dimensionFilters(List.of(DimensionFilter.in("actionType_in", R2_CLASS_B_ACTIONS)))
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("r2_storage")
            .name("R2 Storage").category(ProductCategory.STORAGE)
            .description("Total storage used by R2 buckets")
            .unit("bytes").defaultLimit(10 * GIB)
            .dataset("r2StorageAdaptiveGroups").field("payloadSize").aggregation(MAX).scope(ACCOUNT)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("r2_egress")
            .name("R2 Egress").category(ProductCategory.STORAGE)
            .description("Data transferred out of R2")
            .unit("bytes")
            .dataset("r2OperationsAdaptiveGroups").field("responseBytes").aggregation(SUM).scope(ACCOUNT)
            .note("R2 has zero egress fees via Workers binding or the S3 API.")
            .build(),
        MetricDefinition.builder("kv_reads")
            .name("KV Reads").category(ProductCategory.STORAGE)
            .description("Total KV read operations")
            .unit("operations").defaultLimit(10_000_000)
            .dataset("workersKvStorageAdaptiveGroups").field("readOperations").aggregation(SUM).scope(ACCOUNT)
            .build(),
        MetricDefinition.builder("kv_writes")
            .name("KV Writes").category(ProductCategory.STORAGE)
            .description("Total KV write/delete/list operations")
            .unit("operations").defaultLimit(1_000_000)
            .dataset("workersKvStorageAdaptiveGroups").field("writeOperations").aggregation(SUM).scope(ACCOUNT)
            .build(),
        MetricDefinition.builder("d1_rows_read")
            .name("D1 Rows Read").category(ProductCategory.STORAGE)
            .description("Total rows read from D1 databases")
            .unit("rows").defaultLimit(25_000_000_000d)
            .dataset("d1AnalyticsAdaptiveGroups").field("rowsRead").aggregation(SUM).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("d1_rows_written")
            .name("D1 Rows Written").category(ProductCategory.STORAGE)
            .description("Total rows written to D1 databases")
            .unit("rows").defaultLimit(50_000_000)
            .dataset("d1AnalyticsAdaptiveGroups").field("rowsWritten").aggregation(SUM).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("durable_objects_requests")
            .name("Durable Objects Requests").category(ProductCategory.STORAGE)
            .description("Total requests to Durable Objects")
            .unit("requests").defaultLimit(1_000_000)
            .dataset("durableObjectsInvocationsAdaptiveGroups").field("requests").aggregation(SUM).scope(ACCOUNT)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("durable_objects_storage")
            .name("Durable Objects Storage").category(ProductCategory.STORAGE)
            .description("Storage used by Durable Objects (SQLite)")
            .unit("bytes").defaultLimit(5 * GIB)
            .dataset("durableObjectsStorageGroups").field("storedBytes").aggregation(MAX).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("durable_objects_subrequests")
            .name("Durable Objects Subrequests").category(ProductCategory.STORAGE)
            .description("Subrequests made by Durable Objects")
            .unit("requests").defaultLimit(10_000_000)
            .dataset("durableObjectsSubrequestsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Dataset may not be available on all accounts.")
            .build(),

        // ===== Network =====
        MetricDefinition.builder("http_requests")
            .name("HTTP Requests (Account)").category(ProductCategory.NETWORK)
            .description("Total HTTP requests across all zones in the account")
            .unit("requests").defaultLimit(100_000_000)
            .dataset("httpRequestsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .enabledByDefault(true)
            .note("Set limit based on your contract. DDoS traffic excluded from billing.")
            .build(),
        MetricDefinition.builder("http_requests_zone")
            .name("HTTP Requests").category(ProductCategory.NETWORK)
            .description("HTTP requests for this zone")
            .unit("requests").defaultLimit(100_000_000)
            .dataset("httpRequestsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .enabledByDefault(true)
            .note("Set limit based on your contract. DDoS traffic excluded from billing.")
            .build(),
        MetricDefinition.builder("bandwidth")
            .name("Bandwidth (Account)").category(ProductCategory.NETWORK)
            .description("Total bandwidth served across all zones in the account")
            .unit("bytes").defaultLimit(TIB)
            .dataset("httpRequestsAdaptiveGroups").field("edgeResponseBytes").aggregation(SUM).scope(ACCOUNT)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("bandwidth_zone")
            .name("Bandwidth").category(ProductCategory.NETWORK)
            .description("Bandwidth served for this zone")
            .unit("bytes").defaultLimit(TIB)
            .dataset("httpRequestsAdaptiveGroups").field("edgeResponseBytes").aggregation(SUM).scope(ZONE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("cached_bandwidth")
            .name("Cached Bandwidth (Account)").category(ProductCategory.NETWORK)
            .description("Bandwidth served from cache across all zones")
            .unit("bytes").defaultLimit(TIB)
            .dataset("httpRequests1dGroups").field("cachedBytes").aggregation(SUM).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("cached_bandwidth_zone")
            .name("Cached Bandwidth").category(ProductCategory.NETWORK)
            .description("Bandwidth served from cache for this zone")
            .unit("bytes").defaultLimit(TIB)
            .dataset("httpRequests1dGroups").field("cachedBytes").aggregation(SUM).scope(ZONE)
            .timeFilter(TimeFilterKind.DATE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("dns_queries")
            .name("DNS Queries (Account)").category(ProductCategory.NETWORK)
            .description("Total authoritative DNS queries across all zones")
            .unit("queries").defaultLimit(1_000_000_000)
            .dataset("dnsAnalyticsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("load_balancer_requests")
            .name("Load Balancer Requests").category(ProductCategory.NETWORK)
            .description("Requests handled by Load Balancing")
            .unit("requests").defaultLimit(10_000_000)
            .dataset("loadBalancingRequestsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("cache_reserve_operations")
            .name("Cache Reserve Operations").category(ProductCategory.NETWORK)
            .description("Read and write operations against Cache Reserve")
            .unit("operations").defaultLimit(10_000_000)
            .dataset("cacheReserveOperationsAdaptiveGroups").field("requests").aggregation(SUM).scope(ZONE)
            .enabledByDefault(true)
            .note("Requires Cache Reserve to be enabled on the zone. Shows 0 if not enabled.")
            .build(),
        MetricDefinition.builder("cache_reserve_storage")
            .name("Cache Reserve Storage").category(ProductCategory.NETWORK)
            .description("Data stored in Cache Reserve")
            .unit("bytes").defaultLimit(100 * GIB)
            .dataset("cacheReserveStorageAdaptiveGroups").field("storedBytes").aggregation(MAX).scope(ZONE)
            .enabledByDefault(true)
            .note("Requires Cache Reserve to be enabled on the zone. Shows 0 if not enabled.")
            .build(),
        MetricDefinition.builder("spectrum_bytes")
            .name("Spectrum Bytes").category(ProductCategory.NETWORK)
            .description("Bytes proxied through Spectrum")
            .unit("bytes").defaultLimit(TIB)
            .dataset("spectrumNetworkAnalyticsAdaptiveGroups").field("bytes").aggregation(SUM).scope(ACCOUNT)
            .build(),
        MetricDefinition.builder("argo_bandwidth")
            .name("Argo Smart Routing Bandwidth").category(ProductCategory.NETWORK)
            .description("Bandwidth using Argo Smart Routing")
            .unit("bytes").defaultLimit(5 * TIB)
            .dataset("httpRequestsAdaptiveGroups").field("edgeResponseBytes").aggregation(SUM).scope(ZONE)
            .enabledByDefault(true)
            .note("Set limit based on your contract.")
            .build(),
        MetricDefinition.builder("waiting_room_events")
            .name("Waiting Room Events").category(ProductCategory.NETWORK)
            .description("Visitors processed by Waiting Room")
            .unit("events")
            .dataset("waitingRoomAnalyticsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .note("Informational only. Waiting Room is billed per room.")
            .build(),
        MetricDefinition.builder("health_check_events")
            .name("Health Check Events").category(ProductCategory.NETWORK)
            .description("Health check events for Load Balancing origins")
            .unit("events")
            .dataset("healthCheckEventsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true)
            .note("Included with Load Balancing. Dataset may not be available on all accounts.")
            .build(),
        MetricDefinition.builder("magic_transit_bytes")
            .name("Magic Transit Bandwidth").category(ProductCategory.NETWORK)
            .description("Bandwidth processed by Magic Transit")
            .unit("bytes").defaultLimit(10 * TIB)
            .dataset("magicTransitNetworkAnalyticsAdaptiveGroups").field("bytes").aggregation(SUM).scope(ACCOUNT)
            .note("Enterprise feature.")
            .build(),
        MetricDefinition.builder("magic_wan_bytes")
            .name("Magic WAN Bandwidth").category(ProductCategory.NETWORK)
            .description("Bandwidth through Magic WAN connectors")
            .unit("bytes").defaultLimit(TIB)
            .dataset("magicWanConnectorMetricsAdaptiveGroups").field("bytes").aggregation(SUM).scope(ACCOUNT)
            .note("Enterprise feature.")
            .build(),

        // ===== Security =====
        MetricDefinition.builder("firewall_events")
            .name("WAF Events").category(ProductCategory.SECURITY)
            .description("Security events triggered by WAF rules")
            .unit("events")
            .dataset("firewallEventsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .unlimited(true).enabledByDefault(true)
            .note("WAF included with Enterprise.")
            .build(),
        MetricDefinition.builder("bot_management_requests")
            .name("Bot Management Requests").category(ProductCategory.SECURITY)
            .description("Requests scored by Bot Management")
            .unit("requests").defaultLimit(100_000_000)
            .dataset("httpRequestsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("magic_firewall_packets")
            .name("Magic Firewall Packets").category(ProductCategory.SECURITY)
            .description("Packets processed by Magic Firewall")
            .unit("packets")
            .dataset("magicFirewallNetworkAnalyticsAdaptiveGroups").field("packets").aggregation(SUM).scope(ACCOUNT)
            .unlimited(true).enabledByDefault(true)
            .build(),
        MetricDefinition.builder("rate_limiting_requests")
            .name("Rate Limiting Requests").category(ProductCategory.SECURITY)
            .description("Requests processed by Rate Limiting rules")
            .unit("requests")
            .dataset("httpRequestsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .unlimited(true).enabledByDefault(true)
            .note("Included with Enterprise.")
            .build(),
        MetricDefinition.builder("turnstile_challenges")
            .name("Turnstile Challenges").category(ProductCategory.SECURITY)
            .description("Turnstile challenges issued")
            .unit("challenges")
            .dataset("turnstileAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true)
            .note("Data retention is about 7 days, shorter than a billing period.")
            .build(),
        MetricDefinition.builder("page_shield_violations")
            .name("Page Shield Violations").category(ProductCategory.SECURITY)
            .description("Page Shield policy violations detected")
            .unit("violations")
            .dataset("pageShieldReportsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .note("Informational only. Page Shield is billed by HTTP requests.")
            .build(),
        MetricDefinition.builder("api_gateway_sessions")
            .name("API Gateway Sessions").category(ProductCategory.SECURITY)
            .description("API sessions tracked by API Gateway")
            .unit("sessions").defaultLimit(1_000_000)
            .dataset("apiGatewayMatchedSessionIDsAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .note("Informational only. API Shield is billed by HTTP requests.")
            .build(),
        MetricDefinition.builder("ddos_attacks")
            .name("DDoS Attacks Detected").category(ProductCategory.SECURITY)
            .description("DDoS attacks detected and mitigated")
            .unit("attacks")
            .dataset("dosdAttackAnalyticsGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true)
            .note("DDoS mitigation is not billed. The dataset uses a different filter format.")
            .build(),
        MetricDefinition.builder("dmarc_reports")
            .name("DMARC Reports").category(ProductCategory.SECURITY)
            .description("DMARC aggregate reports received")
            .unit("reports").defaultLimit(100_000)
            .dataset("dmarcReportsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Dataset may not be available on all accounts.")
            .build(),

        // ===== Media =====
        MetricDefinition.builder("stream_minutes_viewed")
            .name("Stream Minutes Viewed").category(ProductCategory.MEDIA)
            .description("Minutes of video delivered via Stream")
            .unit("minutes").defaultLimit(10_000)
            .dataset("streamMinutesViewedAdaptiveGroups").field("minutesViewed").aggregation(SUM).scope(ACCOUNT)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("stream_minutes_stored")
            .name("Stream Minutes Stored").category(ProductCategory.MEDIA)
            .description("Minutes of video stored on Stream")
            .unit("minutes").defaultLimit(1_000)
            .dataset("streamMinutesStoredAdaptiveGroups").field("minutesStored").aggregation(SUM).scope(ACCOUNT)
            .note("Billed per 1k minutes stored.")
            .build(),
        MetricDefinition.builder("images_delivered")
            .name("Images Delivered").category(ProductCategory.MEDIA)
            .description("Number of images delivered")
            .unit("images").defaultLimit(5_000_000)
            .dataset("imagesRequestsAdaptiveGroups").field("requests").aggregation(SUM).scope(ACCOUNT)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("images_transformations")
            .name("Images Transformations").category(ProductCategory.MEDIA)
            .description("Unique image transformations performed")
            .unit("transformations").defaultLimit(1_000_000)
            .dataset("imagesTransformationsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Billed once per 30 days per unique URL.")
            .build(),

        // ===== AI =====
        MetricDefinition.builder("workers_ai_requests")
            .name("Workers AI Requests").category(ProductCategory.AI)
            .description("Inference requests to Workers AI")
            .unit("requests").defaultLimit(10_000)
            .dataset("aiInferenceAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("workers_ai_neurons")
            .name("Workers AI Neurons").category(ProductCategory.AI)
            .description("Neurons used by Workers AI")
            .unit("neurons").defaultLimit(300_000)
            .dataset("aiInferenceAdaptiveGroups").field("neurons").aggregation(SUM).scope(ACCOUNT)
            .note("The neurons field is not exposed on every account. Request count is the default metric.")
            .build(),
        MetricDefinition.builder("ai_gateway_requests")
            .name("AI Gateway Requests").category(ProductCategory.AI)
            .description("Requests routed through AI Gateway")
            .unit("requests").defaultLimit(1_000_000)
            .dataset("aiGatewayRequestsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("vectorize_queries")
            .name("Vectorize Queries").category(ProductCategory.AI)
            .description("Queried vector dimensions")
            .unit("queries").defaultLimit(1_000_000)
            .dataset("vectorizeQueriesAdaptiveGroups").field("queries").aggregation(SUM).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .build(),
        MetricDefinition.builder("vectorize_storage")
            .name("Vectorize Storage").category(ProductCategory.AI)
            .description("Vector dimensions stored in Vectorize")
            .unit("dimensions").defaultLimit(5_000_000)
            .dataset("vectorizeStorageAdaptiveGroups").field("dimensions").aggregation(SUM).scope(ACCOUNT)
            .timeFilter(TimeFilterKind.DATE)
            .note("Dataset may not be available on all accounts.")
            .build(),

        // ===== Connectivity =====
        MetricDefinition.builder("gateway_dns_queries")
            .name("Gateway DNS Queries").category(ProductCategory.CONNECTIVITY)
            .description("DNS queries resolved by Gateway")
            .unit("queries")
            .dataset("gatewayResolverQueriesAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true).enabledByDefault(true)
            .note("Included with Zero Trust seats.")
            .build(),
        MetricDefinition.builder("gateway_http_requests")
            .name("Gateway HTTP Requests").category(ProductCategory.CONNECTIVITY)
            .description("HTTP requests filtered by Gateway")
            .unit("requests")
            .dataset("gatewayL7RequestsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true).enabledByDefault(true)
            .note("Included with Zero Trust seats.")
            .build(),
        MetricDefinition.builder("tunnel_requests")
            .name("Tunnel Requests").category(ProductCategory.CONNECTIVITY)
            .description("Requests served through Tunnels")
            .unit("requests")
            .dataset("cloudflareTunnelsAnalyticsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true)
            .build(),
        MetricDefinition.builder("access_requests")
            .name("Access Requests").category(ProductCategory.CONNECTIVITY)
            .description("Authentication requests to Cloudflare Access")
            .unit("requests")
            .dataset("accessRequestsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true)
            .note("Included with Zero Trust seats.")
            .build(),
        MetricDefinition.builder("access_login_requests")
            .name("Access Login Requests").category(ProductCategory.CONNECTIVITY)
            .description("Authentication attempts to Access applications")
            .unit("requests").defaultLimit(1_000_000)
            .dataset("accessLoginRequestsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Data retention is about 7 days, shorter than a billing period.")
            .build(),
        MetricDefinition.builder("browser_isolation_sessions")
            .name("Browser Isolation Sessions").category(ProductCategory.CONNECTIVITY)
            .description("Remote browser isolation sessions")
            .unit("sessions")
            .dataset("browserIsolationSessionsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true).enabledByDefault(true)
            .note("Included with Zero Trust seats.")
            .build(),
        MetricDefinition.builder("gateway_network_sessions")
            .name("Gateway Network Sessions").category(ProductCategory.CONNECTIVITY)
            .description("L4 network sessions through Gateway")
            .unit("sessions")
            .dataset("gatewayL4SessionsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true).enabledByDefault(true)
            .note("Included with Zero Trust seats.")
            .build(),
        MetricDefinition.builder("warp_devices")
            .name("WARP Device Sessions").category(ProductCategory.CONNECTIVITY)
            .description("Active WARP client device sessions")
            .unit("sessions")
            .dataset("warpDeviceAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .unlimited(true)
            .note("Informational only. Zero Trust is billed per seat.")
            .build(),

        // ===== Platform =====
        MetricDefinition.builder("zaraz_events")
            .name("Zaraz Events").category(ProductCategory.PLATFORM)
            .description("Events processed by Zaraz tag manager")
            .unit("events").defaultLimit(1_000_000)
            .dataset("zarazTrackAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .timeFilter(TimeFilterKind.DATETIME_HOUR)
            .enabledByDefault(true)
            .build(),
        MetricDefinition.builder("email_routing_messages")
            .name("Email Routing Messages").category(ProductCategory.PLATFORM)
            .description("Emails routed through Email Routing")
            .unit("messages")
            .dataset("emailRoutingAdaptiveGroups").aggregation(COUNT).scope(ZONE)
            .note("Inbound Email Routing is free.")
            .build(),
        MetricDefinition.builder("logpush_jobs")
            .name("Logpush Job Events").category(ProductCategory.PLATFORM)
            .description("Logpush job execution events")
            .unit("events")
            .dataset("logpushHealthAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Informational only. Logpush is included with Enterprise plans.")
            .build(),
        MetricDefinition.builder("web_analytics_events")
            .name("Web Analytics Events").category(ProductCategory.PLATFORM)
            .description("Real user monitoring page load events")
            .unit("events")
            .dataset("rumPageloadEventsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Web Analytics is free on all plans.")
            .build(),
        MetricDefinition.builder("web_vitals_events")
            .name("Web Vitals Events").category(ProductCategory.PLATFORM)
            .description("Core Web Vitals measurements collected")
            .unit("events")
            .dataset("rumWebVitalsEventsAdaptiveGroups").aggregation(COUNT).scope(ACCOUNT)
            .note("Part of Web Analytics.")
            .build()
    );

    private ProductCatalog() {
        // 資料表類別不允許實例化
    }

    /**
     * 取得所有指標定義，依目錄順序。
     */
    public static List<MetricDefinition> all() {
        return PRODUCTS;
    }

    /**
     * 依 ID 查找指標定義。
     */
    public static Optional<MetricDefinition> findById(String id) {
        return PRODUCTS.stream()
            .filter(p -> p.id().equals(id))
            .findFirst();
    }
}
