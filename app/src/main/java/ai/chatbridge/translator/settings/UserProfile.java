package ai.chatbridge.translator.settings;

import java.util.Objects;

/**
 * Per-user preferences. {@code pronouns} is free text and may be null.
 */
public record UserProfile(
        String username,
        String targetLanguage,
        String speakingLanguage,
        String speakingStyle,
        String pronouns
) {

    public static final String DEFAULT_TARGET = "default";
    public static final String DEFAULT_LANGUAGE = "en";
    public static final String DEFAULT_STYLE = "normal";

    public UserProfile {
        username = username == null ? "" : username;
        targetLanguage = targetLanguage == null || targetLanguage.isBlank() ? DEFAULT_TARGET : targetLanguage;
        speakingLanguage = speakingLanguage == null || speakingLanguage.isBlank() ? DEFAULT_LANGUAGE : speakingLanguage;
        speakingStyle = speakingStyle == null || speakingStyle.isBlank() ? DEFAULT_STYLE : speakingStyle;
        pronouns = pronouns == null || pronouns.isBlank() ? null : pronouns;
    }

    public boolean hasTarget() {
        return !DEFAULT_TARGET.equalsIgnoreCase(targetLanguage);
    }

    public boolean hasPronouns() {
        return pronouns != null;
    }

    public UserProfile withUsername(String value) {
        return new UserProfile(value, targetLanguage, speakingLanguage, speakingStyle, pronouns);
    }

    public UserProfile withTargetLanguage(String value) {
        return new UserProfile(username, value, speakingLanguage, speakingStyle, pronouns);
    }

    public UserProfile withSpeakingLanguage(String value) {
        return new UserProfile(username, targetLanguage, value, speakingStyle, pronouns);
    }

    public UserProfile withSpeakingStyle(String value) {
        return new UserProfile(username, targetLanguage, speakingLanguage, value, pronouns);
    }

    public UserProfile withPronouns(String value) {
        return new UserProfile(username, targetLanguage, speakingLanguage, speakingStyle, value);
    }

    /**
     * True when every preference matches {@code other}; the username is ignored.
     */
    public boolean sameSettingsAs(UserProfile other) {
        Objects.requireNonNull(other, "other");
        return targetLanguage.equals(other.targetLanguage)
                && speakingLanguage.equals(other.speakingLanguage)
                && speakingStyle.equals(other.speakingStyle)
                && Objects.equals(pronouns, other.pronouns);
    }
}
