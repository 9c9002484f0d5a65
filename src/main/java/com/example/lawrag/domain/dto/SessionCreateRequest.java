package com.example.lawrag.domain.dto;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionCreateRequest {
    private String country;
    private Map<String, Object> metadata;
}
