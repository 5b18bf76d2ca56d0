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
public class DeleteCalendarEventTool extends JsonArgumentsTool {

    private final CalendarClient calendarClient;

    public DeleteCalendarEventTool(ObjectMapper objectMapper, CalendarClient calendarClient) {
        super(objectMapper);
        this.calendarClient = calendarClient;
    }

    @Override
    public String getName() {
        return "deleteCalendarEvent";
    }

    @Override
    public String getDescription() {
        return "Deletes a specific event from the user's primary Google Calendar for today, identified by its summary and start time.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "summary", stringProperty("The title or summary of the event to delete."),
                "startTimeToday", stringProperty("The original start time of the event to delete (e.g., '9:00 AM', '14:30').")
        ), "summary", "startTimeToday");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String summary = args.requireString("summary");
        String startText = args.requireString("startTimeToday");
        LocalTime start = CalendarTimes.parse("startTimeToday", startText);

        boolean deleted;
        try {
            deleted = calendarClient.deleteEvent(summary, start);
        } catch (CalendarException e) {
            return ToolResult.error("Failed to delete event '" + summary + "': " + e.getMessage());
        }
        if (!deleted) {
            return ToolResult.error("Could not find an event '" + summary + "' starting at " + startText + " today.");
        }
        return ToolResult.ok("Event '" + summary + "' at " + startText + " deleted successfully.");
    }
}
