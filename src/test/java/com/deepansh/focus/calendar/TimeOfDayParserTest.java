package com.deepansh.focus.calendar;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeOfDayParserTest {

    @ParameterizedTest
    @CsvSource({
            "9:00 AM, 09:00",
            "9:00am, 09:00",
            "9 PM, 21:00",
            "12:15 AM, 00:15",
            "12:30 PM, 12:30",
            "14:30, 14:30",
            "0:05, 00:05"
    })
    void parse_acceptedFormats(String input, String expected) {
        assertThat(TimeOfDayParser.parse(input)).contains(LocalTime.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "noon", "9", "13 PM", "25:00", "9:75 AM"})
    void parse_rejectsUnreadableTimes(String input) {
        assertThat(TimeOfDayParser.parse(input)).isEmpty();
    }
}
