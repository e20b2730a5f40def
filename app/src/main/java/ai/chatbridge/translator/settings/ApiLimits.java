package ai.chatbridge.translator.settings;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-tier request limits, stored under the tier ids used by the model-tag table.
 */
public record ApiLimits(
        @JsonProperty("flash") TierLimits fast,
        @JsonProperty("pro") TierLimits strong
) {

    static final TierLimits DEFAULT_FAST = new TierLimits(1000, 10000);
    static final TierLimits DEFAULT_STRONG = new TierLimits(150, 10000);

    public ApiLimits {
        fast = fast == null ? DEFAULT_FAST : fast;
        strong = strong == null ? DEFAULT_STRONG : strong;
    }

    public static ApiLimits defaults() {
        return new ApiLimits(DEFAULT_FAST, DEFAULT_STRONG);
    }

    public TierLimits forTier(ModelTier tier) {
        return switch (tier) {
            case FAST -> fast;
            case STRONG -> strong;
        };
    }
}
