package ai.chatbridge.translator.config;

import java.util.Optional;

/**
 * Holds credentials for the completion backend.
 */
public record Secrets(Optional<String> geminiApiKey) {

    public Secrets {
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[geminiApiKey=" + (geminiApiKey.isPresent() ? "***" : "<unset>") + "]";
    }
}
