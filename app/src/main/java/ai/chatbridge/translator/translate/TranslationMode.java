package ai.chatbridge.translator.translate;

/**
 * Mode controlling which completion backend answers prompts.
 */
public enum TranslationMode {
    PRODUCTION,
    MOCK;

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (TranslationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported translation mode: " + raw);
    }
}
