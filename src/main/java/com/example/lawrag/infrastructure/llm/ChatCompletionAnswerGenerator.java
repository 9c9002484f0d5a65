package com.example.lawrag.infrastructure.llm;

import com.example.lawrag.domain.port.AnswerGenerator;
import com.example.lawrag.util.ArabicNumerals;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Answer generator over any OpenAI-compatible {@code /v1/chat/completions} endpoint.
 */
@Service
public class ChatCompletionAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionAnswerGenerator.class);

    static final String BLOCK_SEPARATOR = "\n\n---\n\n";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final int readTimeoutMs;

    public ChatCompletionAnswerGenerator(
            ObjectMapper objectMapper,
            @Value("${lawrag.llm.base-url}") String baseUrl,
            @Value("${lawrag.llm.api-key:}") String apiKey,
            @Value("${lawrag.llm.model}") String model,
            @Value("${lawrag.llm.temperature:0.3}") double temperature,
            @Value("${lawrag.llm.max-tokens:2048}") int maxTokens,
            @Value("${lawrag.llm.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${lawrag.llm.read-timeout-ms:120000}") int readTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.readTimeoutMs = readTimeoutMs;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("event=llm_client_config baseUrl={} model={} temp={} maxTokens={} connectTimeoutMs={} readTimeoutMs={}",
                baseUrl, model, temperature, maxTokens, connectTimeoutMs, readTimeoutMs);
    }

    private static final String SYSTEM_TEMPLATE = """
            أنت مساعد قانوني متخصص في قوانين الدول العربية.
            أجب فقط اعتماداً على المواد القانونية الواردة في السياق.
            - اذكر اسم القانون ورقم المادة لكل معلومة تستند إليها، بصيغة: (اسم القانون - مادة رقم).
            - لا تخترع مواد أو أرقاماً غير موجودة في السياق.
            - إذا لم يكن السياق كافياً للإجابة فقل: "لم أجد معلومات كافية في المواد المتاحة".
            - أجب بلغة السؤال وبأسلوب واضح ومنظم.
            """;

    private static final String USER_TEMPLATE = """
            {history}المواد القانونية:
            {context}

            السؤال:
            {question}
            """;

    private static String render(String template, Map<String, String> vars) {
        if (template == null) return "";
        String out = template;
        for (Map.Entry<String, String> e : vars.entrySet()) {
            out = out.replace("{" + e.getKey() + "}", e.getValue() == null ? "" : e.getValue());
        }
        return out;
    }

    static String formatContext(List<ContextBlock> blocks) {
        return blocks.stream()
                .map(b -> "[" + b.index() + "] " + (b.lawName() == null ? "" : b.lawName())
                        + " - " + ArabicNumerals.formatArticleLabel(b.articleNumber()) + ":\n" + b.content())
                .collect(Collectors.joining(BLOCK_SEPARATOR));
    }

    @Override
    @Retryable(
            retryFor = {RuntimeException.class},
            maxAttemptsExpression = "#{${lawrag.llm.retries:2} + 1}",
            backoff = @Backoff(delay = 200, multiplier = 2.0)
    )
    public String generate(String query, List<ContextBlock> blocks, String history) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }

        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("context", formatContext(blocks));
        vars.put("question", query.trim());
        vars.put("history", history == null || history.isBlank() ? "" : "المحادثة السابقة:\n" + history.trim() + "\n\n");

        return chat(render(SYSTEM_TEMPLATE, vars), render(USER_TEMPLATE, vars));
    }

    @Override
    public String modelName() {
        return model;
    }

    private String chat(String system, String user) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", system),
                Map.of("role", "user", "content", user)
        ));

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize chat completion request", e);
        }

        URI uri = URI.create(baseUrl.endsWith("/") ? baseUrl + "v1/chat/completions" : baseUrl + "/v1/chat/completions");
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMillis(readTimeoutMs))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (!apiKey.isBlank()) {
            req.header("Authorization", "Bearer " + apiKey);
        }

        long t0 = System.nanoTime();
        try {
            HttpResponse<String> resp = httpClient.send(req.build(), HttpResponse.BodyHandlers.ofString());
            long ms = (System.nanoTime() - t0) / 1_000_000;

            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                log.warn("event=llm_http_error status={} ms={} body_snip={}",
                        resp.statusCode(), ms, snippet(resp.body()));
                throw new RuntimeException("LLM HTTP error: " + resp.statusCode());
            }

            String answer = extractContent(objectMapper.readValue(resp.body(), Map.class));
            log.info("event=llm_ok model={} ms={} chars_in={} chars_out={}", model, ms, user.length(), answer.length());
            return answer;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("LLM request interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("LLM request failed", e);
        }
    }

    static String extractContent(Map<?, ?> parsed) {
        Object choices = parsed.get("choices");
        if (!(choices instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalStateException("LLM response missing choices");
        }
        Object first = list.get(0);
        if (!(first instanceof Map<?, ?> m)) {
            throw new IllegalStateException("LLM response invalid choices format");
        }
        Object msg = m.get("message");
        if (!(msg instanceof Map<?, ?> mm)) {
            throw new IllegalStateException("LLM response missing message");
        }
        Object content = mm.get("content");
        return content == null ? "" : String.valueOf(content).trim();
    }

    private static String snippet(String s) {
        if (s == null) return "";
        String t = s.replaceAll("\\s+", " ").trim();
        return t.length() <= 200 ? t : t.substring(0, 200) + "...";
    }
}
