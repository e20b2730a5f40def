package ai.chatbridge.translator.quota;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

public class InMemoryCounterStore implements CounterStore {

    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();

    @Override
    public synchronized long get(String key) {
        return counters.getOrDefault(key, 0L);
    }

    @Override
    public synchronized boolean compareAndSet(Map<String, Long> expected, Map<String, Long> updated) {
        for (Map.Entry<String, Long> entry : expected.entrySet()) {
            if (counters.getOrDefault(entry.getKey(), 0L) != entry.getValue().longValue()) {
                return false;
            }
        }
        counters.putAll(updated);
        return true;
    }

    @Override
    public synchronized void scheduleExpiry(String key, Instant expiresAt) {
        expiries.put(key, expiresAt);
    }

    @Override
    public synchronized int purgeExpired(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, Instant>> iterator = expiries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Instant> entry = iterator.next();
            if (entry.getValue().isBefore(now)) {
                counters.remove(entry.getKey());
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }
}
