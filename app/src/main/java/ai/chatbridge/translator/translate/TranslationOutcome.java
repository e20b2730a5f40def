package ai.chatbridge.translator.translate;

/**
 * How a translate command ended. Every value corresponds to a chat reply or a deliberate silence.
 */
public enum TranslationOutcome {
    TRANSLATED,
    ECHOED,
    HELP_SHOWN,
    ALREADY_TRANSLATED,
    USER_BLOCKED,
    WORD_BLOCKED,
    QUOTA_EXCEEDED,
    UNRECOGNIZABLE,
    BACKEND_FAILED
}
