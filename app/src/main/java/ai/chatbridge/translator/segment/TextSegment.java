package ai.chatbridge.translator.segment;

import ai.chatbridge.translator.keyword.CanonicalPronoun;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One independently translated piece of a command.
 *
 * @param text cleaned text with pronoun phrases replaced by placeholders such as {@code [P1]}
 * @param explicitPronouns placeholder to pronoun, in the order the placeholders appear
 */
public record TextSegment(
        String text,
        String tone,
        List<String> properNouns,
        Map<String, CanonicalPronoun> explicitPronouns,
        Optional<CanonicalPronoun> speakerPronoun
) {

    public TextSegment {
        properNouns = properNouns == null ? List.of() : List.copyOf(properNouns);
        explicitPronouns = explicitPronouns == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(explicitPronouns));
        speakerPronoun = speakerPronoun == null ? Optional.empty() : speakerPronoun;
    }

    public boolean hasPronouns() {
        return !explicitPronouns.isEmpty() || speakerPronoun.isPresent();
    }
}
