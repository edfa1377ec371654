package com.opsdesk.runner.query;

import com.opsdesk.runner.command.CommandException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCoercerTest {

    final ValueCoercer coercer = new ValueCoercer(ZoneOffset.UTC);

    @Test
    void coerce_enumByName_ignoresCase() {
        assertThat(coercer.coerce(" monday ", DayOfWeek.class, "day")).isEqualTo(DayOfWeek.MONDAY);
        assertThat(coercer.coerce(DayOfWeek.FRIDAY, DayOfWeek.class, "day")).isEqualTo(DayOfWeek.FRIDAY);
    }

    @Test
    void coerce_unknownEnumConstant_fails() {
        assertThatThrownBy(() -> coercer.coerce("someday", DayOfWeek.class, "day"))
                .isInstanceOf(CommandException.class)
                .hasMessageContaining("Cannot compare field 'day' (DayOfWeek) with 'someday'");
    }

    @Test
    void coerce_numbers_keepExactness() {
        assertThat(coercer.coerce(new BigDecimal("42"), Integer.class, "age")).isEqualTo(42);
        assertThat(coercer.coerce("7", long.class, "count")).isEqualTo(7L);
        assertThatThrownBy(() -> coercer.coerce("4.5", Integer.class, "age"))
                .isInstanceOf(CommandException.class);
    }

    @Test
    void coerce_dates_useTheRunnerZone() {
        assertThat(coercer.coerce("2026-03-15", Instant.class, "createdAt"))
                .isEqualTo(Instant.parse("2026-03-15T00:00:00Z"));
        assertThat(coercer.toLocalDate(Instant.parse("2026-03-15T23:30:00Z"))).isEqualTo(LocalDate.of(2026, 3, 15));
    }
}
