package io.github.samzhu.usagemonitor.service;

import java.util.Map;

/**
 * 已組好的查詢文字與綁定變數。
 *
 * @param text 查詢文字
 * @param variables 綁定變數（範圍識別、start、end）
 */
public record GraphQLQuery(
    String text,
    Map<String, Object> variables
) {
    public GraphQLQuery {
        variables = Map.copyOf(variables);
    }
}
