package com.deepansh.focus.scratchpad;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * The user's free-form notes, kept as a single Redis string.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScratchpadStore {

    static final String KEY = "focus:scratchpad";

    private final StringRedisTemplate redisTemplate;

    /** Returns the notes, or an empty string when nothing has been written. */
    public String read() {
        String notes = redisTemplate.opsForValue().get(KEY);
        return notes != null ? notes : "";
    }

    public void replace(String content) {
        redisTemplate.opsForValue().set(KEY, content);
        log.info("Scratchpad replaced [length={}]", content.length());
    }

    /** Appends on a new line, or writes the content as-is when the scratchpad is empty. */
    public void append(String content) {
        String current = read();
        String updated = current.isEmpty() ? content : current + "\n" + content;
        redisTemplate.opsForValue().set(KEY, updated);
        log.info("Scratchpad appended [length={}]", updated.length());
    }
}
