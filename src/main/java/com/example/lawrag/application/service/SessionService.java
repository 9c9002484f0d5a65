package com.example.lawrag.application.service;

import com.example.lawrag.domain.model.ChatSession;
import com.example.lawrag.domain.model.SessionMessage;
import com.example.lawrag.domain.model.Source;
import com.example.lawrag.domain.port.SessionStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Conversation history. Sessions expire after the configured TTL of inactivity.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private final SessionStore sessionStore;
    private final long ttlSeconds;
    private final int promptHistoryMessages;

    public SessionService(
            SessionStore sessionStore,
            @Value("${lawrag.session.ttl-seconds:86400}") long ttlSeconds,
            @Value("${lawrag.session.history-messages:6}") int promptHistoryMessages
    ) {
        this.sessionStore = sessionStore;
        this.ttlSeconds = ttlSeconds;
        this.promptHistoryMessages = promptHistoryMessages;
    }

    public ChatSession createSession(String country, Map<String, Object> metadata) {
        String now = Instant.now().toString();
        ChatSession session = ChatSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .country(country)
                .createdAt(now)
                .updatedAt(now)
                .messages(new ArrayList<>())
                .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
                .build();
        sessionStore.save(session, ttlSeconds);
        log.info("event=session_created id={} country={}", session.getSessionId(), country);
        return session;
    }

    public Optional<ChatSession> getSession(String sessionId) {
        return sessionStore.load(sessionId);
    }

    public boolean sessionExists(String sessionId) {
        return sessionStore.exists(sessionId);
    }

    public boolean deleteSession(String sessionId) {
        return sessionStore.delete(sessionId);
    }

    public List<String> listSessions(int limit) {
        List<String> ids = sessionStore.listIds();
        return ids.size() > limit ? ids.subList(0, limit) : ids;
    }

    public boolean addUserMessage(String sessionId, String content) {
        return addMessage(sessionId, ROLE_USER, content, Map.of());
    }

    public boolean addAssistantMessage(String sessionId, String content, List<Source> sources) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (sources != null && !sources.isEmpty()) {
            List<Map<String, Object>> refs = new ArrayList<>(sources.size());
            for (Source s : sources) {
                Map<String, Object> ref = new LinkedHashMap<>();
                ref.put("law_name", s.lawName());
                ref.put("article_number", s.articleNumber());
                ref.put("page_number", s.pageNumber());
                refs.add(ref);
            }
            metadata.put("sources", refs);
        }
        return addMessage(sessionId, ROLE_ASSISTANT, content, metadata);
    }

    /**
     * Appends a message and refreshes the expiry. Returns false when the session does not exist.
     */
    public boolean addMessage(String sessionId, String role, String content, Map<String, Object> metadata) {
        Optional<ChatSession> loaded = sessionStore.load(sessionId);
        if (loaded.isEmpty()) {
            log.warn("event=session_missing id={} role={}", sessionId, role);
            return false;
        }
        ChatSession session = loaded.get();
        String now = Instant.now().toString();
        if (session.getMessages() == null) {
            session.setMessages(new ArrayList<>());
        }
        session.getMessages().add(SessionMessage.builder()
                .role(role)
                .content(content)
                .timestamp(now)
                .metadata(metadata == null ? Map.of() : metadata)
                .build());
        session.setUpdatedAt(now);
        sessionStore.save(session, ttlSeconds);
        return true;
    }

    public List<SessionMessage> history(String sessionId, Integer limit) {
        List<SessionMessage> messages = sessionStore.load(sessionId)
                .map(ChatSession::getMessages)
                .orElse(List.of());
        if (messages == null) {
            return List.of();
        }
        if (limit != null && limit > 0 && messages.size() > limit) {
            return messages.subList(messages.size() - limit, messages.size());
        }
        return messages;
    }

    /**
     * Last turns of the conversation as prompt text, or an empty string.
     */
    public String contextForPrompt(String sessionId) {
        return history(sessionId, promptHistoryMessages).stream()
                .map(m -> (ROLE_USER.equals(m.getRole()) ? "المستخدم" : "المساعد") + ": " + m.getContent())
                .collect(Collectors.joining("\n"));
    }
}
