package com.deepansh.focus.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One entry on the to-do list.
 *
 * Collection: focus_tasks. List order is the priority order; {@code position}
 * holds it so a reorder is a rewrite of positions only.
 */
@Document(collection = "focus_tasks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TodoItem {

    @Id
    private String id;

    private String text;

    /** Short 3-5 word label for long descriptions. */
    private String summary;

    private boolean done;

    @Indexed
    private int position;

    /** Free text such as "~15 mins" or "1 hour". */
    private String estimatedDuration;

    private Difficulty difficulty;

    /** e.g. Research, Teaching, Life */
    private String category;

    /** e.g. "Paper XYZ", "LEAD 552" */
    private String projectOrPath;

    @CreatedDate
    private Instant createdAt;
}
