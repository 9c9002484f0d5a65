package com.example.lawrag.infrastructure.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.lawrag.domain.port.AnswerGenerator.ContextBlock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChatCompletionAnswerGeneratorTest {

    @Test
    void contextBlocksAreNumberedAndSeparated() {
        String context = ChatCompletionAnswerGenerator.formatContext(List.of(
                new ContextBlock(1, "قانون العقوبات", 318, "يعاقب بالحبس"),
                new ContextBlock(2, "قانون العقوبات", 319, "يعاقب بالغرامة")));

        assertEquals("[1] قانون العقوبات - مادة 318:\nيعاقب بالحبس\n\n---\n\n[2] قانون العقوبات - مادة 319:\nيعاقب بالغرامة",
                context);
    }

    @Test
    void extractsFirstChoiceContent() {
        Map<String, Object> parsed = Map.of("choices", List.of(
                Map.of("message", Map.of("role", "assistant", "content", "  الجواب  "))));

        assertEquals("الجواب", ChatCompletionAnswerGenerator.extractContent(parsed));
    }

    @Test
    void missingChoicesIsAnError() {
        assertThrows(IllegalStateException.class, () -> ChatCompletionAnswerGenerator.extractContent(Map.of()));
        assertThrows(IllegalStateException.class,
                () -> ChatCompletionAnswerGenerator.extractContent(Map.of("choices", List.of())));
    }
}
