package ai.chatbridge.translator.quota;

import ai.chatbridge.translator.settings.ModelTier;
import ai.chatbridge.translator.settings.TierLimits;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Day and minute request windows per model tier.
 *
 * <p>A check adds the requested count to both windows and rejects when the day total, then the minute
 * total, would exceed the tier's limit. Only a committing check writes, and it writes through a
 * compare-and-set so concurrent commands can never push a window past its limit.</p>
 */
public class QuotaTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuotaTracker.class);
    static final int MAX_ATTEMPTS = 10;

    private final CounterStore store;
    private final QuotaWindowClock windowClock;

    public QuotaTracker(CounterStore store, QuotaWindowClock windowClock) {
        this.store = Objects.requireNonNull(store, "store");
        this.windowClock = Objects.requireNonNull(windowClock, "windowClock");
    }

    public QuotaDecision checkAndReserve(ModelTier tier, TierLimits limits, int requestedCount, boolean commit) {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(limits, "limits");
        if (requestedCount < 0) {
            throw new IllegalArgumentException("requestedCount must not be negative");
        }
        QuotaWindowClock.Window window = windowClock.current(tier);
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            long day = store.get(window.dayKey());
            long minute = store.get(window.minuteKey());
            long dayTotal = day + requestedCount;
            long minuteTotal = minute + requestedCount;
            if (dayTotal > limits.requestsPerDay()) {
                LOGGER.info("Daily quota for {} exhausted ({} > {})", tier.id(), dayTotal, limits.requestsPerDay());
                return QuotaDecision.reject(QuotaDecision.Reason.DAILY_LIMIT, dayTotal, minuteTotal);
            }
            if (minuteTotal > limits.requestsPerMinute()) {
                LOGGER.info("Minute quota for {} exhausted ({} > {})", tier.id(), minuteTotal, limits.requestsPerMinute());
                return QuotaDecision.reject(QuotaDecision.Reason.RATE_LIMIT, dayTotal, minuteTotal);
            }
            if (!commit) {
                return QuotaDecision.allow(dayTotal, minuteTotal);
            }
            boolean written = store.compareAndSet(
                    Map.of(window.dayKey(), day, window.minuteKey(), minute),
                    Map.of(window.dayKey(), dayTotal, window.minuteKey(), minuteTotal));
            if (written) {
                store.scheduleExpiry(window.minuteKey(), window.minuteEnd());
                store.scheduleExpiry(window.dayKey(), window.dayEnd());
                int purged = store.purgeExpired(window.now());
                if (purged > 0) {
                    LOGGER.debug("Purged {} expired quota counters", purged);
                }
                return QuotaDecision.allow(dayTotal, minuteTotal);
            }
            LOGGER.debug("Quota counters for {} changed concurrently, retrying (attempt {})", tier.id(), attempt);
        }
        LOGGER.warn("Giving up on quota reservation for {} after {} contended attempts", tier.id(), MAX_ATTEMPTS);
        return QuotaDecision.reject(QuotaDecision.Reason.RATE_LIMIT, store.get(window.dayKey()) + requestedCount,
                store.get(window.minuteKey()) + requestedCount);
    }
}
