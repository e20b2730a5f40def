package ai.chatbridge.translator.translate;

import ai.chatbridge.translator.quota.QuotaDecision;
import ai.chatbridge.translator.quota.QuotaTracker;
import ai.chatbridge.translator.reply.ChatReplier;
import ai.chatbridge.translator.reply.ResponseAssembler;
import ai.chatbridge.translator.segment.CommandSegmenter;
import ai.chatbridge.translator.segment.SegmentationResult;
import ai.chatbridge.translator.segment.TextSegment;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.ModelTier;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.template.MessageArguments;
import ai.chatbridge.translator.template.MessageLocalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a translate command from the blocklist check to the assembled reply.
 *
 * <p>Quota is checked twice: a non-committing check on the fast tier before any backend work, and a
 * committing check for the chosen tier right before the segments are translated. Nothing escapes
 * {@link #translate(TranslationRequest)}; unexpected failures are logged with the request context and
 * answered with the generic API error.</p>
 */
public class TranslationOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationOrchestrator.class);
    static final String DEFAULT_HELP_LINK = "https://translation.bot/help";

    private final BotSettings settings;
    private final MessageLocalizer localizer;
    private final CompletionClient completionClient;
    private final QuotaTracker quotaTracker;
    private final ChatReplier replier;
    private final CommandSegmenter segmenter;
    private final PromptBuilder promptBuilder;
    private final ResponseAssembler assembler;

    public TranslationOrchestrator(BotSettings settings, MessageLocalizer localizer, CompletionClient completionClient,
                                   QuotaTracker quotaTracker, ChatReplier replier) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.localizer = Objects.requireNonNull(localizer, "localizer");
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.quotaTracker = Objects.requireNonNull(quotaTracker, "quotaTracker");
        this.replier = Objects.requireNonNull(replier, "replier");
        this.segmenter = new CommandSegmenter(settings, localizer.pronounNormalizer());
        this.promptBuilder = new PromptBuilder(settings);
        this.assembler = new ResponseAssembler(localizer, settings);
    }

    public TranslationOutcome translate(TranslationRequest request) {
        Trace trace = new Trace(request.rawInput());
        try {
            return run(request, trace);
        } catch (RuntimeException ex) {
            LOGGER.error("Translation failed for user {} ({}): {}", request.username(), request.userId(), trace, ex);
            reply(request, "apiError");
            return TranslationOutcome.BACKEND_FAILED;
        }
    }

    private TranslationOutcome run(TranslationRequest request, Trace trace) {
        UserProfile profile = request.profile();
        if (settings.isUserBlocked(request.userId())) {
            LOGGER.info("Ignoring translate request from blocked user {}", request.userId());
            reply(request, "userBlocked");
            return TranslationOutcome.USER_BLOCKED;
        }
        QuotaDecision preCheck = quotaTracker.checkAndReserve(ModelTier.FAST, settings.apiLimits().forTier(ModelTier.FAST), 1, false);
        if (!preCheck.allowed()) {
            LOGGER.info("Skipping translation, {} before detection", preCheck.reason());
            return TranslationOutcome.QUOTA_EXCEEDED;
        }
        String input = request.rawInput().trim();
        if (input.isEmpty()) {
            String link = Optional.ofNullable(settings.helpLinks().get("en")).orElse(DEFAULT_HELP_LINK);
            reply(request, "helpTranslate", link);
            return TranslationOutcome.HELP_SHOWN;
        }
        Optional<String> blockedWord = settings.findBlockedWord(input);
        if (blockedWord.isPresent()) {
            LOGGER.info("Refusing translation containing blocked word '{}'", blockedWord.get());
            reply(request, "blocked");
            return TranslationOutcome.WORD_BLOCKED;
        }

        SegmentationResult segmentation = segmenter.segment(request.rawInput(), request.commandToken(), profile);
        if (segmentation.isEmpty()) {
            replier.send(request.rawInput());
            return TranslationOutcome.ECHOED;
        }

        QuotaDecision detectionQuota = quotaTracker.checkAndReserve(ModelTier.FAST,
                settings.apiLimits().forTier(ModelTier.FAST), 1, true);
        trace.quota = detectionQuota;
        if (!detectionQuota.allowed()) {
            replyLimit(request, detectionQuota);
            return TranslationOutcome.QUOTA_EXCEEDED;
        }
        Optional<String> detection = completionClient.complete(ModelTier.FAST,
                promptBuilder.detectionPrompt(segmentation.combinedText()));
        if (detection.isEmpty()) {
            LOGGER.warn("Language detection returned nothing");
            reply(request, "apiError");
            return TranslationOutcome.BACKEND_FAILED;
        }
        String detected = PromptBuilder.sanitizeLanguageCode(detection.get());
        trace.detected = detected;

        ModelTier tier = chooseTier(segmentation, detected);
        trace.tier = tier;
        String target = resolveTarget(segmentation, profile, detected);
        trace.target = target;
        String targetName = settings.languageMap().get(target);
        if (targetName == null) {
            LOGGER.error("Target language '{}' is missing from the language map", target);
            reply(request, "apiError");
            return TranslationOutcome.BACKEND_FAILED;
        }
        if (detected.equalsIgnoreCase(target) && !PromptBuilder.UNDETERMINED.equals(detected)
                && segmentation.stylePrefix().isEmpty()) {
            reply(request, "alreadyTranslated");
            return TranslationOutcome.ALREADY_TRANSLATED;
        }

        QuotaDecision decision = quotaTracker.checkAndReserve(tier, settings.apiLimits().forTier(tier),
                segmentation.segments().size(), true);
        trace.quota = decision;
        if (!decision.allowed()) {
            replyLimit(request, decision);
            return TranslationOutcome.QUOTA_EXCEEDED;
        }

        List<String> translated = new ArrayList<>();
        for (TextSegment segment : segmentation.segments()) {
            String prompt = promptBuilder.translationPrompt(segment, request.username(), target, targetName, detected);
            trace.prompt = prompt;
            Optional<String> answer = completionClient.complete(tier, prompt);
            if (answer.isEmpty()) {
                LOGGER.warn("Translation backend returned nothing for tier {}", tier.id());
                reply(request, "apiError");
                return TranslationOutcome.BACKEND_FAILED;
            }
            if (answer.get().trim().equalsIgnoreCase(PromptBuilder.UNRECOGNIZABLE_REPLY)) {
                reply(request, "unknownTranslation");
                return TranslationOutcome.UNRECOGNIZABLE;
            }
            translated.add(PromptBuilder.stripPlaceholders(answer.get(), segment.explicitPronouns()));
        }

        String message = assembler.assemble(request.username(), target, translated, profile);
        LOGGER.info("Translated for {}: {}", request.username(), trace);
        replier.send(message);
        return TranslationOutcome.TRANSLATED;
    }

    static ModelTier chooseTier(SegmentationResult segmentation, String detected) {
        if (segmentation.forceStrong()) {
            return ModelTier.STRONG;
        }
        if (segmentation.forceFast()) {
            return ModelTier.FAST;
        }
        if (PromptBuilder.UNDETERMINED.equals(detected) || segmentation.isComplex()) {
            return ModelTier.STRONG;
        }
        return ModelTier.FAST;
    }

    String resolveTarget(SegmentationResult segmentation, UserProfile profile, String detected) {
        if (segmentation.hasLanguagePrefix()) {
            return segmentation.languagePrefix();
        }
        if (profile.hasTarget()) {
            return detected.equalsIgnoreCase(profile.targetLanguage()) ? profile.speakingLanguage() : profile.targetLanguage();
        }
        String autoFrom = settings.defaultSettings().autoTranslateFrom();
        return detected.equalsIgnoreCase(autoFrom) ? settings.defaultSettings().autoTranslateTo() : autoFrom;
    }

    private void replyLimit(TranslationRequest request, QuotaDecision decision) {
        reply(request, decision.reason() == QuotaDecision.Reason.DAILY_LIMIT ? "dailyLimit" : "rateLimit");
    }

    private void reply(TranslationRequest request, String key, Object... values) {
        replier.reply(request.username(), localizer.message(request.profile(), key,
                MessageArguments.mentioning(ChatReplier.mention(request.username()), values)));
    }

    /**
     * What the pipeline knew when it stopped, for the log line.
     */
    private static final class Trace {
        private final String input;
        private String detected = "n/a";
        private String target = "n/a";
        private ModelTier tier;
        private String prompt = "";
        private QuotaDecision quota;

        private Trace(String input) {
            this.input = input;
        }

        @Override
        public String toString() {
            return "input='" + input + "', detected=" + detected + ", target=" + target
                    + ", tier=" + (tier == null ? "n/a" : tier.id())
                    + ", quota=" + (quota == null ? "n/a" : "day " + quota.dayTotal() + "/minute " + quota.minuteTotal())
                    + ", prompt='" + prompt + "'";
        }
    }
}
