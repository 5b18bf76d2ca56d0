package com.deepansh.focus.calendar;

import com.deepansh.focus.exception.FocusException;

public class CalendarException extends FocusException {

    public CalendarException(String message) {
        super(message);
    }

    public CalendarException(String message, Throwable cause) {
        super(message, cause);
    }
}
