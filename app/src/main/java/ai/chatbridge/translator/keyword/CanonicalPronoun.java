package ai.chatbridge.translator.keyword;

import java.util.Optional;

/**
 * The three canonical pronoun classes every free-form pronoun phrase is normalized to.
 */
public enum CanonicalPronoun {
    NEUTRAL("they/them", "other"),
    FEMININE("she/her", "female"),
    MASCULINE("he/him", "male");

    private final String label;
    private final String genderKey;

    CanonicalPronoun(String label, String genderKey) {
        this.label = label;
        this.genderKey = genderKey;
    }

    /** Label used in prompts and stored tables, e.g. {@code she/her}. */
    public String label() {
        return label;
    }

    /** Branch name used by gender-select templates. */
    public String genderKey() {
        return genderKey;
    }

    public static Optional<CanonicalPronoun> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (CanonicalPronoun pronoun : values()) {
            if (pronoun.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(pronoun);
            }
        }
        return Optional.empty();
    }
}
