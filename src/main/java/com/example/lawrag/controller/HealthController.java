package com.example.lawrag.controller;

import com.example.lawrag.domain.dto.ResponseData;
import com.example.lawrag.domain.port.SessionStore;
import com.example.lawrag.domain.port.VectorStore;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final VectorStore vectorStore;
    private final SessionStore sessionStore;

    public HealthController(VectorStore vectorStore, SessionStore sessionStore) {
        this.vectorStore = vectorStore;
        this.sessionStore = sessionStore;
    }

    @GetMapping("/health")
    public ResponseEntity<ResponseData<Map<String, Object>>> health() {
        boolean store = vectorStore.isHealthy();
        boolean sessions = sessionStore.isHealthy();

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("vector_store", store ? "up" : "down");
        components.put("session_store", sessions ? "up" : "down");

        // session store outage degrades but does not fail the check
        HttpStatus status = store ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(ResponseData.<Map<String, Object>>builder()
                .status(status.value())
                .message(store && sessions ? "healthy" : "degraded")
                .data(components)
                .build());
    }
}
