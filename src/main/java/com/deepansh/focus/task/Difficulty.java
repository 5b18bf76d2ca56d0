package com.deepansh.focus.task;

import java.util.Arrays;
import java.util.Optional;

public enum Difficulty {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Difficulty> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(d -> d.label.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
