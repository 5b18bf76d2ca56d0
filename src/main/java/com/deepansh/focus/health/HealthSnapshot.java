package com.deepansh.focus.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last-24-hours health figures pushed by the user's device.
 *
 * Collection: focus_health_snapshots. Only the newest snapshot is read.
 */
@Document(collection = "focus_health_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSnapshot {

    @Id
    private String id;

    @Indexed
    private Instant recordedAt;

    /** Minutes asleep or in bed over the last 24 hours. */
    private Integer sleepMinutes;

    /** Steps since midnight. */
    private Integer steps;

    private Integer restingHeartRate;
}
