package ai.chatbridge.translator.quota;

import java.time.Instant;
import java.util.Map;

/**
 * Shared counters for quota windows.
 */
public interface CounterStore {

    /** Current value, 0 when the key is absent. */
    long get(String key);

    /**
     * Writes every entry of {@code updated} only if each key in {@code expected} still holds the expected
     * value. All keys are compared and written as one atomic step.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(Map<String, Long> expected, Map<String, Long> updated);

    /** Marks a key for removal once {@code expiresAt} has passed. */
    void scheduleExpiry(String key, Instant expiresAt);

    /** Removes keys whose expiry lies before {@code now}; returns how many were removed. */
    int purgeExpired(Instant now);
}
