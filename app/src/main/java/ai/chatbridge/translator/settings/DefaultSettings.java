package ai.chatbridge.translator.settings;

/**
 * Process-wide defaults: the auto-translate language pair and the bot persona ({@code lang-style}).
 */
public record DefaultSettings(String autoTranslateFrom, String autoTranslateTo, String defaultBotPersona) {

    public DefaultSettings {
        autoTranslateFrom = blankToDefault(autoTranslateFrom, "en");
        autoTranslateTo = blankToDefault(autoTranslateTo, "pt");
        defaultBotPersona = blankToDefault(defaultBotPersona, "en-normal");
    }

    public static DefaultSettings defaults() {
        return new DefaultSettings(null, null, null);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
