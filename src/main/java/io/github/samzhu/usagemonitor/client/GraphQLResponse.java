package io.github.samzhu.usagemonitor.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * GraphQL 回應。
 *
 * <p>後端回報的 {@code errors} 不是傳輸錯誤，由呼叫端決定如何處理。
 *
 * @param data 回應資料
 * @param errors 後端回報的錯誤，沒有錯誤時為空列表
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphQLResponse(
    JsonNode data,
    List<GraphQLError> errors
) {
    public GraphQLResponse {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * 以逗號串接所有錯誤訊息。
     */
    public String errorMessage() {
        return String.join(", ", errors.stream().map(GraphQLError::message).toList());
    }

    /**
     * 單一 GraphQL 錯誤。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GraphQLError(
        String message,
        List<Object> path
    ) {}
}
