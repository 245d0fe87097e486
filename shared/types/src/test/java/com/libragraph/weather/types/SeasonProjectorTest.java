package com.libragraph.weather.types;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.Month;

import static com.libragraph.weather.types.SeasonProjector.EPOCH_YEAR;
import static org.assertj.core.api.Assertions.*;

class SeasonProjectorTest {

    @Test
    void epochYearsAreNotLeapYears() {
        assertThat(LocalDate.of(EPOCH_YEAR, 1, 1).isLeapYear()).isFalse();
        assertThat(LocalDate.of(EPOCH_YEAR + 1, 1, 1).isLeapYear()).isFalse();
    }

    @Test
    void leapDayBecomesTwentyEighth() {
        DateRange neutral = DateRange.of(LocalDate.of(2020, 2, 29)).asNeutralDateRange();

        assertThat(neutral.low().getDayOfMonth()).isEqualTo(28);
        assertThat(neutral.low().getMonth()).isEqualTo(Month.FEBRUARY);
        assertThat(neutral.low().getYear()).isEqualTo(EPOCH_YEAR);
        assertThat(neutral.high()).isEqualTo(neutral.low());
    }

    @Test
    void yearSpanMovesHighIntoSecondYear() {
        DateRange neutral = DateRange.of(LocalDate.of(2020, 12, 1), LocalDate.of(2021, 1, 1)).asNeutralDateRange();

        assertThat(neutral.low()).isEqualTo(LocalDate.of(EPOCH_YEAR, 12, 1));
        assertThat(neutral.high()).isEqualTo(LocalDate.of(EPOCH_YEAR + 1, 1, 1));
    }

    @Test
    void sameYearRangeStaysInEpochYear() {
        DateRange neutral = DateRange.of(LocalDate.of(2017, 3, 4), LocalDate.of(2017, 9, 30)).asNeutralDateRange();

        assertThat(neutral).isEqualTo(DateRange.of(LocalDate.of(EPOCH_YEAR, 3, 4), LocalDate.of(EPOCH_YEAR, 9, 30)));
    }

    @Test
    void projectionIsIdempotent() {
        DateRange winter = DateRange.of(LocalDate.of(2016, 10, 1), LocalDate.of(2017, 4, 30));
        DateRange summer = DateRange.of(LocalDate.of(2024, 2, 29), LocalDate.of(2024, 8, 31));

        assertThat(winter.asNeutralDateRange().asNeutralDateRange()).isEqualTo(winter.asNeutralDateRange());
        assertThat(summer.asNeutralDateRange().asNeutralDateRange()).isEqualTo(summer.asNeutralDateRange());
    }

    @Test
    void slotsForSameYearRange() {
        DateRange range = DateRange.of(LocalDate.of(2022, 1, 10), LocalDate.of(2022, 3, 5));
        assertThat(SeasonProjector.startSlot(range)).isEqualTo(1);
        assertThat(SeasonProjector.endSlot(range)).isEqualTo(3);
    }

    @Test
    void slotsForYearSpanningRange() {
        DateRange range = DateRange.of(LocalDate.of(2022, 10, 1), LocalDate.of(2023, 4, 30));
        assertThat(SeasonProjector.startSlot(range)).isEqualTo(10);
        assertThat(SeasonProjector.endSlot(range)).isEqualTo(16);
    }

    @Test
    void slotMonthWrapsIntoSecondYear() {
        assertThat(SeasonProjector.slotMonth(1)).isEqualTo(Month.JANUARY);
        assertThat(SeasonProjector.slotMonth(12)).isEqualTo(Month.DECEMBER);
        assertThat(SeasonProjector.slotMonth(13)).isEqualTo(Month.JANUARY);
        assertThat(SeasonProjector.slotMonth(24)).isEqualTo(Month.DECEMBER);
    }

    @Test
    void slotMonthRejectsOutOfRange() {
        assertThatIllegalArgumentException().isThrownBy(() -> SeasonProjector.slotMonth(0));
        assertThatIllegalArgumentException().isThrownBy(() -> SeasonProjector.slotMonth(25));
    }
}
