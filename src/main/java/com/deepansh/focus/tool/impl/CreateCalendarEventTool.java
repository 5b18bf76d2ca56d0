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
public class CreateCalendarEventTool extends JsonArgumentsTool {

    private final CalendarClient calendarClient;

    public CreateCalendarEventTool(ObjectMapper objectMapper, CalendarClient calendarClient) {
        super(objectMapper);
        this.calendarClient = calendarClient;
    }

    @Override
    public String getName() {
        return "createCalendarEvent";
    }

    @Override
    public String getDescription() {
        return "Creates a new event on the user's primary Google Calendar for today.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "summary", stringProperty("The title or summary of the event."),
                "startTimeToday", stringProperty("The start time for today's event (e.g., '9:00 AM', '14:30')."),
                "endTimeToday", stringProperty("The end time for today's event (e.g., '10:30 AM', '15:00')."),
                "description", stringProperty("An optional longer description for the event.")
        ), "summary", "startTimeToday", "endTimeToday");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String summary = args.requireString("summary");
        String startText = args.requireString("startTimeToday");
        String endText = args.requireString("endTimeToday");
        LocalTime start = CalendarTimes.parse("startTimeToday", startText);
        LocalTime end = CalendarTimes.parse("endTimeToday", endText);

        try {
            calendarClient.createEvent(summary, start, end, args.optionalString("description"));
        } catch (CalendarException e) {
            return ToolResult.error("Failed to create event '" + summary + "': " + e.getMessage());
        }
        return ToolResult.ok("Event '" + summary + "' created for today from " + startText + " to " + endText + ".");
    }
}
