package io.github.samzhu.usagemonitor.product;

/**
 * 時間過濾語法。
 *
 * <p>不同 dataset 接受的過濾欄位與值精度不同，三種語法不可混用：
 * <ul>
 *   <li>{@link #DATETIME} - {@code datetime_geq / datetime_lt}，型別 {@code Time}，完整時間戳</li>
 *   <li>{@link #DATE} - {@code date_geq / date_lt}，型別 {@code Date}，只有日期</li>
 *   <li>{@link #DATETIME_HOUR} - {@code datetimeHour_geq / datetimeHour_lt}，型別 {@code Time}，截斷到小時</li>
 * </ul>
 */
public enum TimeFilterKind {
    DATETIME("datetime", "Time"),
    DATE("date", "Date"),
    DATETIME_HOUR("datetimeHour", "Time");

    private final String fieldName;
    private final String graphqlType;

    TimeFilterKind(String fieldName, String graphqlType) {
        this.fieldName = fieldName;
        this.graphqlType = graphqlType;
    }

    public String startFilter() {
        return fieldName + "_geq";
    }

    public String endFilter() {
        return fieldName + "_lt";
    }

    public String graphqlType() {
        return graphqlType;
    }
}
