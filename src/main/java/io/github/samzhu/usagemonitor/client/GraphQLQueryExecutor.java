package io.github.samzhu.usagemonitor.client;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import io.github.samzhu.usagemonitor.exception.QueryExecutionException;

/**
 * 以 {@link RestClient} 呼叫 GraphQL Analytics API 的查詢執行器。
 *
 * <p>請求格式為 {@code POST {"query": ..., "variables": ...}}，認證使用 Bearer Token
 * （由 {@link io.github.samzhu.usagemonitor.config.AppConfig} 設定在預設標頭）。
 *
 * @see <a href="https://developers.cloudflare.com/analytics/graphql-api/">GraphQL Analytics API</a>
 */
@Component
public class GraphQLQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphQLQueryExecutor.class);

    private final RestClient restClient;

    public GraphQLQueryExecutor(@Qualifier("analyticsRestClient") RestClient analyticsRestClient) {
        this.restClient = analyticsRestClient;
    }

    @Override
    public GraphQLResponse execute(String query, Map<String, Object> variables) {
        long startTime = System.currentTimeMillis();
        try {
            GraphQLResponse response = restClient.post()
                .body(Map.of("query", query, "variables", variables))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, res) -> {
                    throw new QueryExecutionException(
                        "GraphQL request failed: " + res.getStatusCode().value() + " " + statusText(res),
                        res.getStatusCode().value());
                })
                .body(GraphQLResponse.class);

            if (response == null) {
                throw new QueryExecutionException("GraphQL request returned an empty body", 0);
            }

            log.debug("GraphQL query executed in {}ms, errors={}",
                System.currentTimeMillis() - startTime, response.errors().size());
            return response;
        } catch (RestClientException e) {
            throw new QueryExecutionException("GraphQL request failed: " + e.getMessage(), e);
        }
    }

    private static String statusText(ClientHttpResponse response) {
        try {
            return response.getStatusText();
        } catch (IOException e) {
            log.debug("Could not read status text: {}", e.getMessage());
            return "";
        }
    }
}
