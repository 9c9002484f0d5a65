package com.example.lawrag.infrastructure.session;

import com.example.lawrag.domain.model.ChatSession;
import com.example.lawrag.domain.port.SessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Sessions as JSON strings under {@code session:{id}}. Every save rewrites the value with SETEX,
 * which also restarts the expiry.
 */
@Component
public class RedisSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    static final String KEY_PREFIX = "session:";

    private final JedisPooled jedis;
    private final ObjectMapper objectMapper;

    public RedisSessionStore(JedisPooled jedis, ObjectMapper objectMapper) {
        this.jedis = jedis;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(ChatSession session, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize session " + session.getSessionId(), e);
        }
        jedis.setex(key(session.getSessionId()), ttlSeconds, json);
    }

    @Override
    public Optional<ChatSession> load(String sessionId) {
        String json = jedis.get(key(sessionId));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ChatSession.class));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt session document for " + sessionId, e);
        }
    }

    @Override
    public boolean exists(String sessionId) {
        return jedis.exists(key(sessionId));
    }

    @Override
    public boolean delete(String sessionId) {
        return jedis.del(key(sessionId)) > 0;
    }

    @Override
    public List<String> listIds() {
        return jedis.keys(KEY_PREFIX + "*").stream()
                .map(k -> k.substring(KEY_PREFIX.length()))
                .sorted()
                .toList();
    }

    @Override
    public boolean isHealthy() {
        try {
            jedis.exists(KEY_PREFIX + "health-probe");
            return true;
        } catch (JedisException e) {
            log.warn("event=redis_health_failed err={}", e.toString());
            return false;
        }
    }

    private static String key(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
