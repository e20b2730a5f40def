package ai.chatbridge.translator.translate;

import ai.chatbridge.translator.keyword.CanonicalPronoun;
import ai.chatbridge.translator.segment.CommandSegmenter;
import ai.chatbridge.translator.segment.TextSegment;
import ai.chatbridge.translator.settings.BotSettings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the detection prompt and the per-segment translation prompts.
 */
public class PromptBuilder {

    public static final String UNDETERMINED = "und";
    public static final String UNRECOGNIZABLE_REPLY = "UNDEF";
    static final String DETECTION_INSTRUCTION =
            "Analyze the following text and respond with ONLY the two-letter ISO 639-1 language code.";
    static final String TEXT_MARKER = "--- TEXT TO TRANSLATE ---";

    private static final Pattern LANGUAGE_CODE = Pattern.compile("^[a-z]{2,3}$");

    private final BotSettings settings;

    public PromptBuilder(BotSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public String detectionPrompt(String text) {
        return DETECTION_INSTRUCTION + " If unrecognizable, respond with \"" + UNDETERMINED + "\"... Text: \"" + text + "\"";
    }

    /**
     * Lowercase 2-3 letter code from a detection reply, or {@code und} when the reply is anything else.
     */
    public static String sanitizeLanguageCode(String reply) {
        if (reply == null) {
            return UNDETERMINED;
        }
        String cleaned = reply.trim().toLowerCase(Locale.ROOT);
        return LANGUAGE_CODE.matcher(cleaned).matches() ? cleaned : UNDETERMINED;
    }

    public String translationPrompt(TextSegment segment, String username, String targetCode, String targetName,
                                    String detectedCode) {
        StringBuilder prompt = new StringBuilder();
        if (UNDETERMINED.equals(detectedCode)) {
            prompt.append("You are a language analysis bot. Your primary task is to distinguish between recognizable")
                    .append(" human language and random gibberish.")
                    .append(" CRITICAL RULE: If the user's text below is unrecognizable gibberish, you MUST respond with: ")
                    .append(UNRECOGNIZABLE_REPLY).append('.')
                    .append(" If it IS recognizable as a real language, translate it into ").append(targetName).append('.');
        } else {
            prompt.append("You are an expert translation bot. Translate the following text into ").append(targetName).append('.');
        }
        prompt.append(" Ensure the final translation is grammatically complete and proper, starting with a capital")
                .append(" letter and ending with appropriate punctuation.");

        appendGenderClause(prompt, segment, username, targetCode, targetName);

        if (!segment.properNouns().isEmpty()) {
            prompt.append(" PROPER NOUNS: The following words are proper nouns and MUST NOT be translated: [")
                    .append(String.join(", ", segment.properNouns())).append("].");
        }
        String tone = segment.tone();
        if (tone != null && !CommandSegmenter.NEUTRAL_TONE.equals(tone)) {
            String readableTone = settings.languageMap().getOrDefault(tone, tone);
            prompt.append(" TONE INSTRUCTION: The final translation MUST be in a '").append(readableTone).append("' style.");
        }
        prompt.append(" Provide only the translation... ").append(TEXT_MARKER).append(' ').append(segment.text());
        return prompt.toString();
    }

    private void appendGenderClause(StringBuilder prompt, TextSegment segment, String username, String targetCode,
                                    String targetName) {
        if (!segment.explicitPronouns().isEmpty()) {
            String pairs = segment.explicitPronouns().entrySet().stream()
                    .map(entry -> entry.getKey() + " = '" + entry.getValue().label() + "'")
                    .collect(Collectors.joining("; "));
            prompt.append(" The text contains placeholders like [P1]. Translate the surrounding text to match the gender")
                    .append(" of the corresponding pronoun: [").append(pairs).append("].")
                    .append(" CRITICAL: You MUST KEEP the placeholders like [P1] in your final translated response.");
            return;
        }
        if (segment.speakerPronoun().isPresent()) {
            CanonicalPronoun speaker = segment.speakerPronoun().get();
            prompt.append(" GENDER INSTRUCTIONS: The person speaking is '").append(username)
                    .append("', and their pronouns are '").append(speaker.label())
                    .append("'. If the text contains first-person references (like 'I', 'me', 'my'), apply these")
                    .append(" pronouns to the speaker.");
            settings.pronounHint(targetCode, targetName, speaker.label())
                    .ifPresent(hint -> prompt.append(' ').append(hint));
            return;
        }
        prompt.append(" GENDER INSTRUCTIONS: The gender of the speaker is unknown. You MUST use gender-neutral phrasing")
                .append(" (e.g., singular 'they' in English, or equivalent neutral forms) whenever grammatical gender")
                .append(" is ambiguous for the speaker.");
    }

    /**
     * Removes placeholder tokens the backend left in and collapses whitespace.
     */
    public static String stripPlaceholders(String translated, Map<String, CanonicalPronoun> placeholders) {
        String cleaned = translated;
        for (String placeholder : placeholders.keySet()) {
            cleaned = cleaned.replace(placeholder, "");
        }
        return cleaned.replaceAll("\\s+", " ").trim();
    }
}
