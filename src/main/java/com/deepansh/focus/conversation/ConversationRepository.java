package com.deepansh.focus.conversation;

import com.deepansh.focus.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed persistence of full conversation logs.
 *
 * Key pattern: focus:session:{sessionId}:messages, stored as a single JSON array
 * so each save replaces the whole log atomically. No TTL and no windowing: the log
 * is kept untruncated until the user clears it.
 */
@Component
@Slf4j
public class ConversationRepository {

    private static final String KEY_PREFIX = "focus:session:";
    private static final String KEY_SUFFIX = ":messages";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public ConversationRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the stored log, or an empty list if none exists or it cannot be read.
     */
    public List<Message> load(String sessionId) {
        String json = redisTemplate.opsForValue().get(buildKey(sessionId));

        if (json == null) {
            log.debug("No stored conversation for session: {}", sessionId);
            return new ArrayList<>();
        }

        try {
            List<Message> messages = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} messages for session: {}", messages.size(), sessionId);
            return messages;
        } catch (JsonProcessingException e) {
            log.error("Stored conversation for session {} is unreadable, starting fresh", sessionId, e);
            return new ArrayList<>();
        }
    }

    public void save(String sessionId, List<Message> messages) {
        try {
            String json = objectMapper.writeValueAsString(messages);
            redisTemplate.opsForValue().set(buildKey(sessionId), json);
            log.debug("Saved {} messages for session: {}", messages.size(), sessionId);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Conversation for session " + sessionId + " is not serializable", e);
        }
    }

    public void delete(String sessionId) {
        redisTemplate.delete(buildKey(sessionId));
        log.info("Deleted stored conversation for session: {}", sessionId);
    }

    public boolean exists(String sessionId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(sessionId)));
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId + KEY_SUFFIX;
    }
}
