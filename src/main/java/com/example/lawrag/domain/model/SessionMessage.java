package com.example.lawrag.domain.model;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMessage {
    private String role;
    private String content;
    private String timestamp;
    private Map<String, Object> metadata;
}
