package com.deepansh.focus.tool.impl;

import com.deepansh.focus.calendar.CalendarClient;
import com.deepansh.focus.calendar.CalendarException;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.Map;

@Component
public class UpdateCalendarEventTimeTool extends JsonArgumentsTool {

    private final CalendarClient calendarClient;

    public UpdateCalendarEventTimeTool(ObjectMapper objectMapper, CalendarClient calendarClient) {
        super(objectMapper);
        this.calendarClient = calendarClient;
    }

    @Override
    public String getName() {
        return "updateCalendarEventTime";
    }

    @Override
    public String getDescription() {
        return "Updates the start and/or end time of a specific event on the user's primary Google Calendar for today.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "summary", stringProperty("The title or summary of the event to update."),
                "originalStartTimeToday", stringProperty("The original start time of the event being updated (e.g., '9:00 AM', '14:30')."),
                "newStartTimeToday", stringProperty("The new start time for the event (e.g., '10:00 AM', '15:30')."),
                "newEndTimeToday", stringProperty("The new end time for the event (e.g., '11:00 AM', '16:00').")
        ), "summary", "originalStartTimeToday", "newStartTimeToday", "newEndTimeToday");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String summary = args.requireString("summary");
        String originalText = args.requireString("originalStartTimeToday");
        String newStartText = args.requireString("newStartTimeToday");
        String newEndText = args.requireString("newEndTimeToday");
        LocalTime original = CalendarTimes.parse("originalStartTimeToday", originalText);
        LocalTime newStart = CalendarTimes.parse("newStartTimeToday", newStartText);
        LocalTime newEnd = CalendarTimes.parse("newEndTimeToday", newEndText);

        boolean updated;
        try {
            updated = calendarClient.updateEventTime(summary, original, newStart, newEnd);
        } catch (CalendarException e) {
            return ToolResult.error("Failed to update event '" + summary + "': " + e.getMessage());
        }
        if (!updated) {
            return ToolResult.error("Could not find an event '" + summary + "' starting at " + originalText + " today.");
        }
        return ToolResult.ok("Event '" + summary + "' moved to " + newStartText + " - " + newEndText + ".");
    }
}
