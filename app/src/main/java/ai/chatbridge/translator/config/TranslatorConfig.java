package ai.chatbridge.translator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Provider and per-tier model names used for detection and translation calls.
 */
public record TranslatorConfig(LlmProvider provider, String fastModelName, String strongModelName, Optional<String> baseUrl) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        fastModelName = requireNonBlank(fastModelName, "fastModelName");
        strongModelName = requireNonBlank(strongModelName, "strongModelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
