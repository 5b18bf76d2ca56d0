package com.deepansh.focus.calendar;

import com.deepansh.focus.config.FocusProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Google Calendar v3 client restricted to today's events on one calendar.
 *
 * Events are addressed the way the user talks about them: by summary and start time.
 * Every failure surfaces as a {@link CalendarException} with a readable message.
 */
@Component
@Slf4j
public class CalendarClient {

    private final FocusProperties.Calendar properties;
    private final RestClient restClient;
    private final Clock clock;
    private final ZoneId zone;

    @Autowired
    public CalendarClient(FocusProperties properties,
                          @Qualifier("focusRestClientBuilder") RestClient.Builder restClientBuilder) {
        this(properties.getCalendar(), restClientBuilder, Clock.systemDefaultZone());
    }

    public CalendarClient(FocusProperties.Calendar properties, RestClient.Builder restClientBuilder, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.zone = properties.getZoneId() == null || properties.getZoneId().isBlank()
                ? clock.getZone()
                : ZoneId.of(properties.getZoneId());
        this.restClient = restClientBuilder.clone()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public List<CalendarEvent> todaysEvents() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        String timeMin = today.atStartOfDay(zone).toInstant().toString();
        String timeMax = today.plusDays(1).atStartOfDay(zone).toInstant().toString();

        JsonNode response = call("list events", () -> restClient.get()
                .uri(uri -> uri.path("/calendars/{calendarId}/events")
                        .queryParam("timeMin", timeMin)
                        .queryParam("timeMax", timeMax)
                        .queryParam("singleEvents", true)
                        .queryParam("orderBy", "startTime")
                        .build(properties.getCalendarId()))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(JsonNode.class));

        List<CalendarEvent> events = new ArrayList<>();
        if (response != null) {
            for (JsonNode item : response.path("items")) {
                events.add(CalendarEvent.fromJson(item, zone));
            }
        }
        log.debug("Fetched {} calendar events for {}", events.size(), today);
        return events;
    }

    public CalendarEvent createEvent(String summary, LocalTime start, LocalTime end, String description) {
        requireOrdered(start, end);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", summary);
        if (description != null && !description.isBlank()) {
            body.put("description", description);
        }
        body.put("start", eventTime(start));
        body.put("end", eventTime(end));

        JsonNode created = call("create event", () -> restClient.post()
                .uri("/calendars/{calendarId}/events", properties.getCalendarId())
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class));

        log.info("Calendar event created [summary={}, start={}]", summary, start);
        return created != null
                ? CalendarEvent.fromJson(created, zone)
                : CalendarEvent.builder().summary(summary).start(today(start)).end(today(end)).build();
    }

    /**
     * Deletes today's event with this summary and start time. Returns false when none matches.
     */
    public boolean deleteEvent(String summary, LocalTime start) {
        Optional<CalendarEvent> event = findEvent(summary, start);
        if (event.isEmpty()) {
            return false;
        }
        call("delete event", () -> restClient.delete()
                .uri("/calendars/{calendarId}/events/{eventId}", properties.getCalendarId(), event.get().getId())
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .toBodilessEntity());
        log.info("Calendar event deleted [summary={}, start={}]", summary, start);
        return true;
    }

    /**
     * Moves today's event with this summary and start time. Returns false when none matches.
     */
    public boolean updateEventTime(String summary, LocalTime originalStart, LocalTime newStart, LocalTime newEnd) {
        requireOrdered(newStart, newEnd);
        Optional<CalendarEvent> event = findEvent(summary, originalStart);
        if (event.isEmpty()) {
            return false;
        }
        Map<String, Object> patch = Map.of("start", eventTime(newStart), "end", eventTime(newEnd));
        call("update event", () -> restClient.patch()
                .uri("/calendars/{calendarId}/events/{eventId}", properties.getCalendarId(), event.get().getId())
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(patch)
                .retrieve()
                .toBodilessEntity());
        log.info("Calendar event moved [summary={}, {} -> {}]", summary, originalStart, newStart);
        return true;
    }

    private Optional<CalendarEvent> findEvent(String summary, LocalTime start) {
        return todaysEvents().stream()
                .filter(e -> e.getSummary() != null && e.getSummary().trim().equalsIgnoreCase(summary.trim()))
                .filter(e -> e.startsAt(start))
                .findFirst();
    }

    private Map<String, Object> eventTime(LocalTime time) {
        return Map.of(
                "dateTime", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(today(time)),
                "timeZone", zone.getId());
    }

    private ZonedDateTime today(LocalTime time) {
        return LocalDate.now(clock.withZone(zone)).atTime(time).atZone(zone);
    }

    private static void requireOrdered(LocalTime start, LocalTime end) {
        if (!start.isBefore(end)) {
            throw new CalendarException("Start time must be before end time.");
        }
    }

    private String bearer() {
        String token = properties.getAccessToken();
        if (token == null || token.isBlank()) {
            throw new CalendarException("Calendar is not connected: no access token configured.");
        }
        return "Bearer " + token;
    }

    private <T> T call(String operation, CalendarCall<T> call) {
        try {
            return call.execute();
        } catch (RestClientResponseException e) {
            log.warn("Calendar {} failed with HTTP {}: {}", operation, e.getStatusCode().value(),
                    e.getResponseBodyAsString());
            throw new CalendarException("Calendar " + operation + " failed (HTTP " + e.getStatusCode().value() + ")", e);
        } catch (RestClientException e) {
            log.warn("Calendar {} failed: {}", operation, e.getMessage());
            throw new CalendarException("Calendar " + operation + " failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface CalendarCall<T> {
        T execute();
    }
}
