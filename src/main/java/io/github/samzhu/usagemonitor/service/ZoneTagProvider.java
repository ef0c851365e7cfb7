package io.github.samzhu.usagemonitor.service;

import java.util.List;

/**
 * 提供 zone 範圍指標要查詢的 zone 列表。
 *
 * <p>空列表是合法的結果，此時 zone 範圍指標會回報設定錯誤。
 */
public interface ZoneTagProvider {

    List<String> getZoneTags();
}
