package com.deepansh.focus.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * An event from the Google Calendar events resource. All-day events have no start or end time.
 */
@Value
@Builder
public class CalendarEvent {

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    String id;
    String summary;
    ZonedDateTime start;
    ZonedDateTime end;

    public boolean isAllDay() {
        return start == null;
    }

    public boolean startsAt(LocalTime time) {
        return start != null && start.toLocalTime().equals(time);
    }

    public String displayTime() {
        if (isAllDay()) {
            return "All day";
        }
        return DISPLAY.format(start) + " - " + (end != null ? DISPLAY.format(end) : "?");
    }

    static CalendarEvent fromJson(JsonNode item, ZoneId zone) {
        return CalendarEvent.builder()
                .id(item.path("id").asText(null))
                .summary(item.hasNonNull("summary") ? item.get("summary").asText() : "Untitled")
                .start(dateTime(item.path("start"), zone))
                .end(dateTime(item.path("end"), zone))
                .build();
    }

    private static ZonedDateTime dateTime(JsonNode node, ZoneId zone) {
        if (!node.hasNonNull("dateTime")) {
            return null;
        }
        return OffsetDateTime.parse(node.get("dateTime").asText()).atZoneSameInstant(zone);
    }
}
