package io.github.samzhu.usagemonitor.product;

/**
 * 套用在合併後原始值上的單位轉換。
 *
 * <p>以列舉取代任意函式，讓指標定義維持可序列化、可由組態選擇。
 */
public enum UnitTransform {
    NONE {
        @Override
        public double apply(double value) {
            return value;
        }
    },
    MICROSECONDS_TO_MILLISECONDS {
        @Override
        public double apply(double value) {
            return value / 1000.0;
        }
    };

    public abstract double apply(double value);
}
