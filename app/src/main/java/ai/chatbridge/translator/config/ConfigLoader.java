package ai.chatbridge.translator.config;

import ai.chatbridge.translator.cli.CliArguments;
import ai.chatbridge.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_DATA_DIR = "TRANSLATOR_DATA_DIR";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "LOG_LEVEL";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_FAST_MODEL = "LLM_FAST_MODEL";
    static final String ENV_LLM_STRONG_MODEL = "LLM_STRONG_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_CHUNK_DELAY_MILLIS = "CHAT_CHUNK_DELAY_MILLIS";
    static final String ENV_QUOTA_TIME_ZONES = "QUOTA_TIME_ZONES";

    private static final String DEFAULT_DATA_DIR = "TranslationBotFiles";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final long DEFAULT_CHUNK_DELAY_MILLIS = 500;
    private static final List<String> DEFAULT_QUOTA_TIME_ZONES = List.of("America/Los_Angeles", "US/Pacific", "PST8PDT");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path dataDirectory = Optional.ofNullable(arguments.dataDirectory())
                .or(() -> environmentReader.nonBlank(ENV_DATA_DIR).map(Path::of))
                .orElse(Path.of(DEFAULT_DATA_DIR));

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environmentReader.nonBlank(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);
        String logLevel = environmentReader.nonBlank(ENV_LOG_LEVEL).orElse("INFO");

        TranslationMode translationMode = Optional.ofNullable(arguments.translationMode())
                .or(() -> environmentReader.nonBlank(ENV_TRANSLATION_MODE).map(TranslationMode::from))
                .orElse(TranslationMode.PRODUCTION);

        LlmProvider provider = environmentReader.nonBlank(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.GEMINI);
        String fastModel = environmentReader.nonBlank(ENV_LLM_FAST_MODEL).orElse(defaultFastModelFor(provider));
        String strongModel = environmentReader.nonBlank(ENV_LLM_STRONG_MODEL).orElse(defaultStrongModelFor(provider));

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.nonBlank(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }

        Secrets secrets = new Secrets(environmentReader.nonBlank(ENV_GEMINI_API_KEY));

        long chunkDelayMillis = environmentReader.nonBlank(ENV_CHUNK_DELAY_MILLIS)
                .map(ConfigLoader::parseNonNegativeLong)
                .orElse(DEFAULT_CHUNK_DELAY_MILLIS);

        List<String> quotaTimeZones = environmentReader.nonBlank(ENV_QUOTA_TIME_ZONES)
                .map(ConfigLoader::parseList)
                .orElse(DEFAULT_QUOTA_TIME_ZONES);

        TranslatorConfig translatorConfig = new TranslatorConfig(provider, fastModel, strongModel, baseUrl);
        return new Config(dataDirectory, logFormat, logLevel, translationMode, translatorConfig, secrets,
                Duration.ofMillis(chunkDelayMillis), quotaTimeZones);
    }

    private String defaultFastModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "gemini-2.5-flash";
            case OLLAMA -> "llama3.1:8b";
        };
    }

    private String defaultStrongModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "gemini-2.5-pro";
            case OLLAMA -> "llama3.1:70b";
        };
    }

    private static long parseNonNegativeLong(String raw) {
        try {
            long value = Long.parseLong(raw);
            if (value < 0) {
                throw new IllegalArgumentException(ENV_CHUNK_DELAY_MILLIS + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_CHUNK_DELAY_MILLIS + " must be an integer", ex);
        }
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toList());
    }
}
