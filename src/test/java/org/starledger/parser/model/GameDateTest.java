package org.starledger.parser.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@Tag("unit")
class GameDateTest {

    @ParameterizedTest
    @CsvSource({
            "2200.01.01, 0",
            "2200.01.30, 29",
            "2200.02.01, 30",
            "2201.01.01, 360",
            "2231.04.17, 11266",
            "2199.12.30, -1"
    })
    void convertsDatesToDayIndex(String date, int days) {
        assertThat(GameDate.toDays(date)).isEqualTo(days);
        assertThat(GameDate.fromDays(days)).isEqualTo(date);
    }

    @Test
    void acceptsUnpaddedFields() {
        assertThat(GameDate.toDays("2205.3.2")).isEqualTo(5 * 360 + 2 * 30 + 1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2200.01", "2200-01-01", "year.01.01"})
    void rejectsMalformedDates(String date) {
        assertThatThrownBy(() -> GameDate.toDays(date)).isInstanceOf(IllegalArgumentException.class);
        assertThat(GameDate.tryToDays(date)).isEmpty();
    }

    @Test
    void lenientVariantTreatsNoneAndNullAsAbsent() {
        assertThat(GameDate.tryToDays(null)).isEmpty();
        assertThat(GameDate.tryToDays("none")).isEmpty();
        assertThat(GameDate.tryToDays("2200.01.02")).hasValue(1);
    }
}
