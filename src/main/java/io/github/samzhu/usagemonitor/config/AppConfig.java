package io.github.samzhu.usagemonitor.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link UsageMonitorProperties} 的型別安全配置綁定，並提供：
 * <ul>
 *   <li>{@link Clock} - 帳單週期與計時使用的時鐘，測試可替換</li>
 *   <li>{@link RestClient} - 呼叫 GraphQL Analytics API 與 REST API（Zero Trust 席次）</li>
 *   <li>zone 分區查詢用的固定大小執行緒池</li>
 * </ul>
 *
 * @see UsageMonitorProperties
 * @see <a href="https://docs.spring.io/spring-framework/reference/integration/rest-clients.html#rest-restclient">RestClient</a>
 */
@Configuration
@EnableConfigurationProperties(UsageMonitorProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClient analyticsRestClient(RestClient.Builder builder, UsageMonitorProperties properties) {
        return buildClient(builder.clone(), properties.api().endpoint(), properties.api());
    }

    @Bean
    public RestClient cloudflareRestClient(RestClient.Builder builder, UsageMonitorProperties properties) {
        return buildClient(builder.clone(), properties.seats().endpoint(), properties.api());
    }

    private static RestClient buildClient(RestClient.Builder builder, String baseUrl,
                                          UsageMonitorProperties.ApiConfig api) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(api.connectTimeout());
        requestFactory.setReadTimeout(api.readTimeout());

        RestClient.Builder configured = builder
            .baseUrl(baseUrl)
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (api.apiToken() != null && !api.apiToken().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + api.apiToken());
        }
        return configured.build();
    }

    /**
     * zone 分區查詢執行緒池，大小由 {@code usage-monitor.query.zone-concurrency} 決定。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService zoneQueryExecutor(UsageMonitorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.query().zoneConcurrency(), r -> {
            Thread t = new Thread(r, "zone-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
