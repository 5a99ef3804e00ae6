package com.pagewatch.monitor.config;

import java.time.Duration;

public record AnnotationConfig(String endpoint, String model, Duration timeout) {
    public static final String DEFAULT_ENDPOINT = "https://openrouter.ai/api/v1/chat/completions";
    public static final String DEFAULT_MODEL = "deepseek/deepseek-r1:free";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public AnnotationConfig {
        endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static AnnotationConfig defaults() {
        return new AnnotationConfig(null, null, null);
    }
}
