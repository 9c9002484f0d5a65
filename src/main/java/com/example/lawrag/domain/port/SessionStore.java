package com.example.lawrag.domain.port;

import com.example.lawrag.domain.model.ChatSession;
import java.util.List;
import java.util.Optional;

public interface SessionStore {

    void save(ChatSession session, long ttlSeconds);

    Optional<ChatSession> load(String sessionId);

    boolean exists(String sessionId);

    boolean delete(String sessionId);

    List<String> listIds();

    boolean isHealthy();
}
