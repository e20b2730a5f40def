package ai.chatbridge.translator.config;

import ai.chatbridge.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 * Bot behaviour (languages, limits, blocklists) lives in the persisted settings file instead.
 */
public record Config(
        Path dataDirectory,
        LogFormat logFormat,
        String logLevel,
        TranslationMode translationMode,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        Duration chunkDelay,
        List<String> quotaTimeZones
) {

    public Config {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        logLevel = logLevel == null || logLevel.isBlank() ? "INFO" : logLevel.trim();
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        chunkDelay = chunkDelay == null ? Duration.ZERO : chunkDelay;
        if (chunkDelay.isNegative()) {
            throw new IllegalArgumentException("chunkDelay must not be negative");
        }
        quotaTimeZones = quotaTimeZones == null ? List.of() : List.copyOf(quotaTimeZones);
    }
}
