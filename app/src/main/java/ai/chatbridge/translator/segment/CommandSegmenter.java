package ai.chatbridge.translator.segment;

import ai.chatbridge.translator.keyword.CanonicalPronoun;
import ai.chatbridge.translator.keyword.PronounNormalizer;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.ModelTier;
import ai.chatbridge.translator.settings.UserProfile;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw translate command into a language/style prefix and annotated text segments.
 *
 * <p>Grammar: {@code [lang|lang-style] [&tag&...] [*protected*] [%pronoun%] text}. A leading backslash
 * disables prefix and tag parsing; {@code \%} keeps a literal percent sign.</p>
 */
public class CommandSegmenter {

    /** Stands in for an escaped percent sign until the reply is assembled. */
    public static final String ESCAPE_MARKER = "__ESCAPED_PERCENT__";
    public static final String NEUTRAL_TONE = "neutral";

    private static final Pattern TONE_TAG = Pattern.compile("(&[^&]+&)");
    private static final Pattern PROPER_NOUN = Pattern.compile("\\*([^*]+?)\\*");
    private static final Pattern PRONOUN_PHRASE = Pattern.compile("%([\\w\\s/-]+)%", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final BotSettings settings;
    private final PronounNormalizer pronounNormalizer;

    public CommandSegmenter(BotSettings settings, PronounNormalizer pronounNormalizer) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pronounNormalizer = Objects.requireNonNull(pronounNormalizer, "pronounNormalizer");
    }

    public SegmentationResult segment(String rawText, String commandToken, UserProfile profile) {
        Objects.requireNonNull(profile, "profile");
        String text = rawText == null ? "" : rawText.replace("\\%", ESCAPE_MARKER);
        boolean forceStrong = commandToken != null && commandToken.endsWith("!");
        String language = profile.speakingLanguage();

        String languagePrefix = "";
        Optional<String> stylePrefix = Optional.empty();
        boolean escaped = text.startsWith("\\");
        if (escaped) {
            text = text.substring(1).stripLeading();
        } else {
            String trimmed = text.trim();
            String[] split = trimmed.split("\\s+", 2);
            String token = split[0].toLowerCase(Locale.ROOT);
            String remainder = split.length > 1 ? split[1] : "";
            if (!remainder.isBlank()) {
                Prefix prefix = parsePrefix(token, language);
                if (prefix != null) {
                    languagePrefix = prefix.language();
                    stylePrefix = Optional.ofNullable(prefix.style());
                    text = remainder;
                }
            }
        }

        boolean forceFast = false;
        String tone = stylePrefix.orElse(NEUTRAL_TONE);
        boolean toneTagged = false;
        List<String> literals = new ArrayList<>();
        for (String piece : escaped ? List.of(text) : splitKeepingTags(text)) {
            if (TONE_TAG.matcher(piece).matches()) {
                String tag = piece.substring(1, piece.length() - 1).trim();
                Optional<String> model = settings.modelMap().resolve(tag, language);
                if (model.isPresent()) {
                    if (ModelTier.STRONG.id().equals(model.get())) {
                        forceStrong = true;
                    } else if (ModelTier.FAST.id().equals(model.get())) {
                        forceFast = true;
                    }
                    continue;
                }
                Optional<String> resolvedTone = settings.toneMap().resolve(tag, language);
                if (resolvedTone.isPresent()) {
                    tone = resolvedTone.get();
                    toneTagged = true;
                }
            } else {
                literals.add(piece);
            }
        }

        Optional<CanonicalPronoun> speaker = profile.hasPronouns()
                ? Optional.of(pronounNormalizer.normalize(profile.pronouns()))
                : Optional.empty();
        List<TextSegment> segments = new ArrayList<>();
        for (String literal : literals) {
            String trimmed = literal.trim();
            if (!trimmed.isEmpty()) {
                segments.add(buildSegment(trimmed, tone, speaker));
            }
        }
        return new SegmentationResult(languagePrefix, stylePrefix, tone, toneTagged, forceStrong, forceFast, segments);
    }

    /**
     * {@code lang-style} when any part resolves as a style or language, else a bare language code.
     */
    private Prefix parsePrefix(String token, String language) {
        if (token.contains("-")) {
            String prefixLanguage = null;
            String prefixStyle = null;
            for (String part : token.split("-")) {
                if (part.isEmpty()) {
                    continue;
                }
                Optional<String> style = settings.styleMap().resolve(part, language);
                if (style.isPresent()) {
                    prefixStyle = style.get();
                } else if (settings.isKnownLanguage(part)) {
                    prefixLanguage = part;
                }
            }
            if (prefixLanguage != null || prefixStyle != null) {
                return new Prefix(prefixLanguage == null ? "" : prefixLanguage, prefixStyle);
            }
        }
        if (settings.isKnownLanguage(token)) {
            return new Prefix(token, null);
        }
        return null;
    }

    private TextSegment buildSegment(String text, String tone, Optional<CanonicalPronoun> speaker) {
        List<String> properNouns = new ArrayList<>();
        Matcher nouns = PROPER_NOUN.matcher(text);
        StringBuilder withoutStars = new StringBuilder();
        while (nouns.find()) {
            properNouns.add(nouns.group(1));
            nouns.appendReplacement(withoutStars, Matcher.quoteReplacement(nouns.group(1)));
        }
        nouns.appendTail(withoutStars);

        Map<String, CanonicalPronoun> explicit = new LinkedHashMap<>();
        Matcher phrases = PRONOUN_PHRASE.matcher(withoutStars.toString());
        StringBuilder withPlaceholders = new StringBuilder();
        while (phrases.find()) {
            String placeholder = "[P" + (explicit.size() + 1) + "]";
            explicit.put(placeholder, pronounNormalizer.normalize(phrases.group(1)));
            phrases.appendReplacement(withPlaceholders, Matcher.quoteReplacement(placeholder));
        }
        phrases.appendTail(withPlaceholders);

        String cleaned = WHITESPACE.matcher(withPlaceholders.toString()).replaceAll(" ").trim();
        return new TextSegment(cleaned, tone, properNouns, explicit, speaker);
    }

    private static List<String> splitKeepingTags(String text) {
        List<String> pieces = new ArrayList<>();
        Matcher matcher = TONE_TAG.matcher(text);
        int last = 0;
        while (matcher.find()) {
            pieces.add(text.substring(last, matcher.start()));
            pieces.add(matcher.group());
            last = matcher.end();
        }
        pieces.add(text.substring(last));
        return pieces;
    }

    private record Prefix(String language, String style) {
    }
}
