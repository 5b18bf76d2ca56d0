package com.deepansh.focus.calendar;

import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the clock times the model passes for today's events: "9:00 AM", "9 AM", "9:00am", "14:30".
 */
public final class TimeOfDayParser {

    private static final Pattern TIME = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?\\s*([AaPp][Mm])?$");

    private TimeOfDayParser() {}

    public static Optional<LocalTime> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = TIME.matcher(text.trim());
        if (!m.matches()) {
            return Optional.empty();
        }

        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        String meridiem = m.group(3);
        if (minute > 59) {
            return Optional.empty();
        }

        if (meridiem == null) {
            // a bare hour like "9" is ambiguous
            if (m.group(2) == null || hour > 23) {
                return Optional.empty();
            }
            return Optional.of(LocalTime.of(hour, minute));
        }

        if (hour < 1 || hour > 12) {
            return Optional.empty();
        }
        boolean pm = meridiem.equalsIgnoreCase("pm");
        int hour24 = (hour % 12) + (pm ? 12 : 0);
        return Optional.of(LocalTime.of(hour24, minute));
    }
}
