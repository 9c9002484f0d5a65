package com.example.lawrag.application.query;

public record NormalizedQuery(String raw, String normalized) {
}
