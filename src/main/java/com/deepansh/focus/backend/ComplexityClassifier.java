package com.deepansh.focus.backend;

import com.deepansh.focus.model.Message;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Flags requests that are likely to need a long generation, such as planning or
 * brainstorming. Those get the extended backend deadline.
 */
public final class ComplexityClassifier {

    static final int LENGTH_THRESHOLD = 100;

    private static final Pattern PLANNING_WORDS =
            Pattern.compile("\\b(tools|build|ideas|how|create|develop)\\b");

    private ComplexityClassifier() {
    }

    public static boolean isComplex(String userText) {
        if (userText == null) {
            return false;
        }
        return userText.length() > LENGTH_THRESHOLD
                || PLANNING_WORDS.matcher(userText.toLowerCase(Locale.ROOT)).find();
    }

    /** Looks at the newest user message of a window. */
    public static boolean isComplex(List<Message> window) {
        for (int i = window.size() - 1; i >= 0; i--) {
            Message message = window.get(i);
            if (message.getRole() == Message.Role.user) {
                return isComplex(message.getContent());
            }
        }
        return false;
    }
}
