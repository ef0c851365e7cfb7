package io.github.samzhu.usagemonitor.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import io.github.samzhu.usagemonitor.dto.BillingPeriod;

class PeriodUtilsTest {

    @Test
    void shouldStartOnAnchorDayOfCurrentMonth() {
        // Given: 錨定日 1，今天 3/15
        Instant now = Instant.parse("2024-03-15T10:00:00Z");

        // When
        BillingPeriod period = PeriodUtils.currentBillingPeriod(1, ZoneOffset.UTC, now);

        // Then
        assertThat(period.start()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2024-04-01T00:00:00Z"));
    }

    @Test
    void shouldStartInPreviousMonthWhenBeforeAnchorDay() {
        // Given: 錨定日 15，今天 3/10（尚未到錨定日）
        Instant now = Instant.parse("2024-03-10T10:00:00Z");

        // When
        BillingPeriod period = PeriodUtils.currentBillingPeriod(15, ZoneOffset.UTC, now);

        // Then
        assertThat(period.start()).isEqualTo(Instant.parse("2024-02-15T00:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2024-03-15T00:00:00Z"));
    }

    @Test
    void shouldStartOnAnchorDayItself() {
        Instant now = Instant.parse("2024-03-15T00:00:00Z");

        BillingPeriod period = PeriodUtils.currentBillingPeriod(15, ZoneOffset.UTC, now);

        assertThat(period.start()).isEqualTo(Instant.parse("2024-03-15T00:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2024-04-15T00:00:00Z"));
    }

    @Test
    void shouldRollOverYearBoundary() {
        // Given: 1/5 且錨定日 20，週期從去年 12/20 開始
        Instant now = Instant.parse("2025-01-05T12:00:00Z");

        BillingPeriod period = PeriodUtils.currentBillingPeriod(20, ZoneOffset.UTC, now);

        assertThat(period.start()).isEqualTo(Instant.parse("2024-12-20T00:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2025-01-20T00:00:00Z"));
    }

    @Test
    void shouldUseMidnightOfConfiguredTimezone() {
        // Given: UTC 3/31 20:00 在台北已是 4/1
        ZoneId taipei = ZoneId.of("Asia/Taipei");
        Instant now = Instant.parse("2024-03-31T20:00:00Z");

        // When
        BillingPeriod period = PeriodUtils.currentBillingPeriod(1, taipei, now);

        // Then: 台北時間 4/1 00:00 = UTC 3/31 16:00
        assertThat(period.start()).isEqualTo(Instant.parse("2024-03-31T16:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2024-04-30T16:00:00Z"));
        assertThat(period.startDate()).hasToString("2024-04-01");
    }

    @Test
    void shouldRejectAnchorDayOutOfRange() {
        Instant now = Instant.parse("2024-03-15T00:00:00Z");

        assertThatThrownBy(() -> PeriodUtils.currentBillingPeriod(29, ZoneOffset.UTC, now))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PeriodUtils.currentBillingPeriod(0, ZoneOffset.UTC, now))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCalculateDaysRemaining() {
        Instant end = Instant.parse("2024-04-01T00:00:00Z");

        assertThat(PeriodUtils.getDaysRemaining(end, Instant.parse("2024-03-21T00:00:00Z"))).isEqualTo(11);
        assertThat(PeriodUtils.getDaysRemaining(end, Instant.parse("2024-04-02T00:00:00Z"))).isZero();
        assertThat(PeriodUtils.getDaysRemaining(null, Instant.parse("2024-03-21T00:00:00Z"))).isZero();
    }
}
