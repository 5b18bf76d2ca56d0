package com.deepansh.focus.tool.impl;

import com.deepansh.focus.calendar.CalendarClient;
import com.deepansh.focus.calendar.CalendarEvent;
import com.deepansh.focus.calendar.CalendarException;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@Slf4j
public class GetTodaysCalendarEventsTool extends JsonArgumentsTool {

    private final CalendarClient calendarClient;

    public GetTodaysCalendarEventsTool(ObjectMapper objectMapper, CalendarClient calendarClient) {
        super(objectMapper);
        this.calendarClient = calendarClient;
    }

    @Override
    public String getName() {
        return "getTodaysCalendarEvents";
    }

    @Override
    public String getDescription() {
        return "Gets the list of events scheduled on the user's primary Google Calendar for today.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of());
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        List<CalendarEvent> events;
        try {
            events = calendarClient.todaysEvents();
        } catch (CalendarException e) {
            log.warn("Could not fetch today's events: {}", e.getMessage());
            return ToolResult.error("Sorry, I couldn't fetch your calendar events: " + e.getMessage());
        }

        if (events.isEmpty()) {
            return ToolResult.ok("You have no calendar events scheduled for today.");
        }
        String list = events.stream()
                .map(e -> "• " + e.getSummary() + " (" + e.displayTime() + ")")
                .collect(Collectors.joining("\n"));
        return ToolResult.ok("Today's calendar events (" + events.size() + " total):\n" + list);
    }
}
