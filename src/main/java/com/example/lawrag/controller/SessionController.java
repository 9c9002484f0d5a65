package com.example.lawrag.controller;

import com.example.lawrag.application.service.CollectionService;
import com.example.lawrag.application.service.SessionService;
import com.example.lawrag.controller.exception.BusinessException;
import com.example.lawrag.domain.dto.ResponseData;
import com.example.lawrag.domain.dto.SessionCreateRequest;
import com.example.lawrag.domain.model.ChatSession;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    static final int MAX_LIST = 100;

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    public ResponseEntity<ResponseData<ChatSession>> create(@RequestBody(required = false) SessionCreateRequest request) {
        String country = request == null || request.getCountry() == null ? "egypt" : request.getCountry();
        CollectionService.requireCountry(country);
        ChatSession session = sessionService.createSession(country, request == null ? null : request.getMetadata());
        ResponseData<ChatSession> response = ResponseData.<ChatSession>builder()
                .status(HttpStatus.CREATED.value())
                .message("Session created")
                .data(session)
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseData<List<String>> list(@RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseData.<List<String>>builder()
                .status(HttpStatus.OK.value())
                .message("OK")
                .data(sessionService.listSessions(Math.max(1, Math.min(limit, MAX_LIST))))
                .build();
    }

    @GetMapping("/{sessionId}")
    public ResponseData<ChatSession> get(@PathVariable("sessionId") String sessionId) {
        ChatSession session = sessionService.getSession(sessionId)
                .orElseThrow(() -> new BusinessException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId));
        return ResponseData.<ChatSession>builder()
                .status(HttpStatus.OK.value())
                .message("OK")
                .data(session)
                .build();
    }

    @DeleteMapping("/{sessionId}")
    public ResponseData<Map<String, Object>> delete(@PathVariable("sessionId") String sessionId) {
        if (!sessionService.deleteSession(sessionId)) {
            throw new BusinessException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }
        return ResponseData.<Map<String, Object>>builder()
                .status(HttpStatus.OK.value())
                .message("Session deleted")
                .data(Map.of("session_id", sessionId))
                .build();
    }
}
