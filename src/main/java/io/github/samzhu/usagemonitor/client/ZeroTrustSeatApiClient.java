package io.github.samzhu.usagemonitor.client;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.usagemonitor.dto.ZeroTrustSeats;
import io.github.samzhu.usagemonitor.exception.QueryExecutionException;

/**
 * 以 REST API 的 Access 使用者列表統計 Zero Trust 席次。
 *
 * <p>端點：{@code GET /accounts/{accountId}/access/users?per_page=1000&page=N}，
 * 依 {@code result_info.total_pages} 逐頁讀取。任一頁失敗即整體失敗，避免回報偏低的席次數。
 *
 * @see <a href="https://developers.cloudflare.com/cloudflare-one/team-and-resources/users/seat-management/">Seat management</a>
 */
@Component
public class ZeroTrustSeatApiClient implements ZeroTrustSeatClient {

    private static final Logger log = LoggerFactory.getLogger(ZeroTrustSeatApiClient.class);

    static final int PAGE_SIZE = 1000;

    private final RestClient restClient;

    public ZeroTrustSeatApiClient(@Qualifier("cloudflareRestClient") RestClient cloudflareRestClient) {
        this.restClient = cloudflareRestClient;
    }

    @Override
    public ZeroTrustSeats fetchSeats(String accountId) {
        List<AccessUser> users = new ArrayList<>();
        AccessUsersPage first = fetchPage(accountId, 1);
        users.addAll(first.result());

        ResultInfo info = first.resultInfo();
        int totalPages = info != null ? info.totalPages() : 1;
        for (int page = 2; page <= totalPages; page++) {
            users.addAll(fetchPage(accountId, page).result());
        }

        long access = users.stream().filter(AccessUser::accessSeat).count();
        long gateway = users.stream().filter(AccessUser::gatewaySeat).count();
        long active = users.stream().filter(u -> u.accessSeat() || u.gatewaySeat()).count();
        long total = info != null && info.totalCount() > 0 ? info.totalCount() : users.size();

        log.debug("Fetched {} Zero Trust users over {} pages", users.size(), totalPages);
        return new ZeroTrustSeats(total, access, gateway, active);
    }

    private AccessUsersPage fetchPage(String accountId, int page) {
        try {
            AccessUsersPage response = restClient.get()
                .uri("/accounts/{accountId}/access/users?per_page={perPage}&page={page}",
                    accountId, PAGE_SIZE, page)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, res) -> {
                    throw new QueryExecutionException(
                        "Seat request failed: " + res.getStatusCode().value(), res.getStatusCode().value());
                })
                .body(AccessUsersPage.class);

            if (response == null) {
                throw new QueryExecutionException("Seat request returned an empty body", 0);
            }
            if (!response.success()) {
                throw new QueryExecutionException("API error: " + String.join(", ",
                    response.errors().stream().map(ApiMessage::message).toList()), 0);
            }
            return response;
        } catch (RestClientException e) {
            throw new QueryExecutionException("Seat request failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AccessUsersPage(
        boolean success,
        List<ApiMessage> errors,
        List<AccessUser> result,
        @JsonProperty("result_info") ResultInfo resultInfo
    ) {
        public AccessUsersPage {
            errors = errors == null ? List.of() : errors;
            result = result == null ? List.of() : result;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiMessage(int code, String message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AccessUser(
        String id,
        String email,
        @JsonProperty("access_seat") boolean accessSeat,
        @JsonProperty("gateway_seat") boolean gatewaySeat
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResultInfo(
        int page,
        @JsonProperty("total_pages") int totalPages,
        @JsonProperty("total_count") long totalCount
    ) {}
}
