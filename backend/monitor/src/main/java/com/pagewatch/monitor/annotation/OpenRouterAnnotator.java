package com.pagewatch.monitor.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagewatch.core.model.Annotation;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.DetectedEntity;
import com.pagewatch.core.util.JsonUtils;
import com.pagewatch.monitor.api.Annotator;
import com.pagewatch.monitor.config.AnnotationConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies change records through an OpenAI-compatible chat completion endpoint.
 */
public final class OpenRouterAnnotator implements Annotator {
    private static final double TEMPERATURE = 0.1;
    private static final int MAX_TOKENS = 1000;

    private final HttpClient httpClient;
    private final AnnotationConfig config;

    public OpenRouterAnnotator(HttpClient httpClient, AnnotationConfig config) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    @Override
    public Optional<Annotation> annotate(ChangeRecord record, String credential) {
        String context = AnnotationPrompt.context(record);
        if (context.isEmpty()) {
            return Optional.empty();
        }
        ObjectMapper mapper = JsonUtils.objectMapper();
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", config.model());
        payload.put("temperature", TEMPERATURE);
        payload.put("max_tokens", MAX_TOKENS);
        ObjectNode message = payload.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", AnnotationPrompt.prompt(context));

        HttpRequest request = HttpRequest.newBuilder(URI.create(config.endpoint()))
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .timeout(config.timeout())
                .header("Authorization", "Bearer " + credential)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new IllegalStateException("Annotation request failed with status " + response.statusCode());
            }
            JsonNode content = mapper.readTree(response.body())
                    .path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new IllegalStateException("Annotation response carried no message content");
            }
            JsonNode verdict = mapper.readTree(stripCodeFences(content.asText()));
            if (verdict == null || !verdict.isObject()) {
                throw new IllegalStateException("Annotation reply is not a JSON object");
            }
            return Optional.of(toAnnotation(verdict));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Annotation request interrupted", e);
        } catch (IOException e) {
            throw new IllegalStateException("Annotation request failed", e);
        }
    }

    static String stripCodeFences(String reply) {
        String trimmed = reply.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstLineEnd = trimmed.indexOf('\n');
        if (firstLineEnd < 0) {
            return "";
        }
        String inner = trimmed.substring(firstLineEnd + 1);
        int closing = inner.lastIndexOf("```");
        return (closing < 0 ? inner : inner.substring(0, closing)).trim();
    }

    private static Annotation toAnnotation(JsonNode verdict) {
        List<DetectedEntity> entities = new ArrayList<>();
        for (JsonNode company : verdict.path("companies")) {
            String name = textOrNull(company.path("name"));
            if (name == null) {
                continue;
            }
            entities.add(new DetectedEntity(
                    name,
                    textOrNull(company.path("sector")),
                    textOrNull(company.path("confidence")),
                    textOrNull(company.path("evidence")),
                    textOrNull(company.path("source"))
            ));
        }
        String summary = textOrNull(verdict.path("analysis_summary"));
        return new Annotation(
                verdict.path("new_companies_detected").asBoolean(false),
                entities,
                textOrNull(verdict.path("added_company")),
                textOrNull(verdict.path("removed_company")),
                textOrNull(verdict.path("modified_company")),
                summary == null ? "Analysis completed" : summary
        );
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText("").trim();
        return text.isEmpty() || text.equalsIgnoreCase("null") ? null : text;
    }
}
