package com.deepansh.focus.health;

import com.deepansh.focus.config.FocusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Formats the newest health snapshot for the model.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthSummaryProvider {

    static final String DISABLED = "Health integration is disabled. Enable it in the settings "
            + "(focus.health.enabled) to get ADHD-specific insights based on your sleep and activity patterns.";
    static final String NO_DATA = "No health data has been recorded yet.";

    private final FocusProperties properties;
    private final HealthSnapshotRepository repository;

    public boolean isEnabled() {
        return properties.getHealth().isEnabled();
    }

    public String summary() {
        if (!isEnabled()) {
            return DISABLED;
        }
        Optional<HealthSnapshot> latest = repository.findFirstByOrderByRecordedAtDesc();
        if (latest.isEmpty()) {
            return NO_DATA;
        }
        HealthSnapshot snapshot = latest.get();
        log.debug("Health summary from snapshot recorded at {}", snapshot.getRecordedAt());

        StringBuilder sb = new StringBuilder("Health Summary (Last 24 Hours):\n\n");
        sb.append("Sleep: ").append(sleep(snapshot.getSleepMinutes())).append('\n');
        sb.append("Activity: ").append(snapshot.getSteps() != null
                ? snapshot.getSteps() + " steps today"
                : "No activity data available").append('\n');
        if (snapshot.getRestingHeartRate() != null) {
            sb.append("Resting heart rate: ").append(snapshot.getRestingHeartRate()).append(" bpm\n");
        }
        sb.append("\nThis data can help tailor ADHD task recommendations based on your current physical state.");
        return sb.toString();
    }

    private static String sleep(Integer minutes) {
        if (minutes == null || minutes <= 0) {
            return "No sleep data for last 24h";
        }
        return (minutes / 60) + "h " + (minutes % 60) + "m";
    }
}
