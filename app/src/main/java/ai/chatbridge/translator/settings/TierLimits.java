package ai.chatbridge.translator.settings;

public record TierLimits(int requestsPerMinute, int requestsPerDay) {

    public TierLimits {
        if (requestsPerMinute < 0 || requestsPerDay < 0) {
            throw new IllegalArgumentException("Quota limits must not be negative");
        }
    }
}
