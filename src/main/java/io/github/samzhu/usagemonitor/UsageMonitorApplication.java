package io.github.samzhu.usagemonitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Usage Monitor - 合約用量上限監控服務。
 *
 * <p>此服務定時查詢 GraphQL Analytics API，負責：
 * <ul>
 *   <li>依指標定義建立查詢（時間過濾語法、聚合方式、維度過濾）</li>
 *   <li>以限速批次併發執行大量查詢，zone 範圍指標逐 zone 分區查詢</li>
 *   <li>合併抽樣資料的信賴區間</li>
 *   <li>將結果正規化為統一的用量紀錄</li>
 *   <li>依告警／警示門檻分類</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Scheduler / REST → UsageMonitorService → BatchQueryRunner → MetricUsageService
 *                                                                  ↓
 *                                        GraphQLQueryBuilder → QueryExecutor → Analytics API
 *                                                                  ↓
 *                                           UsageResultNormalizer → ConfidenceCombiner
 *                                                                  ↓
 *                                                         UsageCategorizer
 * </pre>
 *
 * <p>GraphQL Analytics 為觀測性的抽樣資料，結果只是近似值，不可作為實際計費依據。
 */
@SpringBootApplication
@EnableScheduling
public class UsageMonitorApplication {

    private static final Logger log = LoggerFactory.getLogger(UsageMonitorApplication.class);

    public static void main(String[] args) {
        log.info("Starting Usage Monitor - contract usage cap tracking");
        SpringApplication.run(UsageMonitorApplication.class, args);
    }
}
