package ai.chatbridge.translator.segment;

import java.util.List;
import java.util.Optional;

/**
 * Parsed command line.
 *
 * @param languagePrefix target language code typed in front of the text, empty when none
 * @param stylePrefix style typed together with the language prefix
 * @param tone resolved tone, {@code neutral} unless a style or tone tag set one
 */
public record SegmentationResult(
        String languagePrefix,
        Optional<String> stylePrefix,
        String tone,
        boolean toneTagged,
        boolean forceStrong,
        boolean forceFast,
        List<TextSegment> segments
) {

    public SegmentationResult {
        languagePrefix = languagePrefix == null ? "" : languagePrefix;
        stylePrefix = stylePrefix == null ? Optional.empty() : stylePrefix;
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public boolean hasLanguagePrefix() {
        return !languagePrefix.isEmpty();
    }

    /**
     * Content that needs the stronger model: pronoun instructions, a tone tag or a forced style.
     */
    public boolean isComplex() {
        return toneTagged || stylePrefix.isPresent() || segments.stream().anyMatch(TextSegment::hasPronouns);
    }

    public String combinedText() {
        StringBuilder combined = new StringBuilder();
        for (TextSegment segment : segments) {
            if (combined.length() > 0) {
                combined.append(' ');
            }
            combined.append(segment.text());
        }
        return combined.toString();
    }
}
