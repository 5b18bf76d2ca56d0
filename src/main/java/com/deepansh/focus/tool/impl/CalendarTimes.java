package com.deepansh.focus.tool.impl;

import com.deepansh.focus.calendar.TimeOfDayParser;
import com.deepansh.focus.tool.ToolArgumentException;

import java.time.LocalTime;

final class CalendarTimes {

    private CalendarTimes() {}

    static LocalTime parse(String field, String value) {
        return TimeOfDayParser.parse(value).orElseThrow(() -> new ToolArgumentException(
                "could not understand " + field + " '" + value + "'. Use a time like '9:00 AM' or '14:30'"));
    }
}
