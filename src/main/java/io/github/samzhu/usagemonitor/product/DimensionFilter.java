package io.github.samzhu.usagemonitor.product;

import java.util.List;

/**
 * 維度過濾條件。
 *
 * <p>多值條件輸出為 {@code field: ["a", "b"]}（IN），單值輸出為 {@code field: "a"}（等於）。
 * 多個條件之間以 AND 組合。
 *
 * @param field 過濾欄位名稱，例如 {@code actionType_in}
 * @param values 過濾值
 * @param multiValued 是否為多值（IN）條件
 */
public record DimensionFilter(
    String field,
    List<String> values,
    boolean multiValued
) {
    public DimensionFilter {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Dimension filter field must not be blank");
        }
        values = values == null ? List.of() : List.copyOf(values);
        if (!multiValued && values.size() != 1) {
            throw new IllegalArgumentException(
                "Scalar dimension filter '" + field + "' requires exactly one value");
        }
    }

    public static DimensionFilter eq(String field, String value) {
        return new DimensionFilter(field, List.of(value), false);
    }

    public static DimensionFilter in(String field, List<String> values) {
        return new DimensionFilter(field, values, true);
    }
}
