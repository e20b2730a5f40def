package ai.chatbridge.translator.quota;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.settings.ModelTier;
import ai.chatbridge.translator.settings.TierLimits;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileCounterStoreTest {

    @TempDir
    Path dataDir;

    @Test
    void absentKeyReadsAsZero() {
        assertThat(new JsonFileCounterStore(dataDir).get("minute_count_flash_x")).isZero();
    }

    @Test
    void compareAndSetPersistsAcrossInstances() {
        JsonFileCounterStore first = new JsonFileCounterStore(dataDir);

        assertThat(first.compareAndSet(Map.of("a", 0L), Map.of("a", 3L))).isTrue();

        JsonFileCounterStore second = new JsonFileCounterStore(dataDir);
        assertThat(second.get("a")).isEqualTo(3);
        assertThat(Files.exists(dataDir.resolve(JsonFileCounterStore.COUNTERS_FILE))).isTrue();
    }

    @Test
    void staleExpectationIsRejected() {
        JsonFileCounterStore store = new JsonFileCounterStore(dataDir);
        store.compareAndSet(Map.of("a", 0L), Map.of("a", 1L));

        assertThat(store.compareAndSet(Map.of("a", 0L), Map.of("a", 2L))).isFalse();
        assertThat(store.get("a")).isEqualTo(1);
    }

    @Test
    void purgesExpiredKeysOnly() {
        JsonFileCounterStore store = new JsonFileCounterStore(dataDir);
        store.compareAndSet(Map.of(), Map.of("old", 4L, "fresh", 2L));
        store.scheduleExpiry("old", Instant.parse("2026-01-01T00:00:00Z"));
        store.scheduleExpiry("fresh", Instant.parse("2026-01-02T00:00:00Z"));

        int removed = store.purgeExpired(Instant.parse("2026-01-01T12:00:00Z"));

        assertThat(removed).isEqualTo(1);
        assertThat(store.get("old")).isZero();
        assertThat(store.get("fresh")).isEqualTo(2);
    }

    @Test
    void concurrentReservationsNeverCommitPastTheMinuteLimit() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T18:30:15Z"), ZoneOffset.UTC);
        QuotaWindowClock windowClock = new QuotaWindowClock(clock, List.of("UTC"));
        TierLimits limits = new TierLimits(5, 1_000);
        AtomicInteger allowed = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                futures.add(pool.submit(() -> {
                    QuotaTracker tracker = new QuotaTracker(new JsonFileCounterStore(dataDir), windowClock);
                    start.await();
                    for (int i = 0; i < 5; i++) {
                        if (tracker.checkAndReserve(ModelTier.FAST, limits, 1, true).allowed()) {
                            allowed.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        long stored = new JsonFileCounterStore(dataDir).get(windowClock.current(ModelTier.FAST).minuteKey());
        assertThat(stored).isEqualTo(allowed.get());
        assertThat(stored).isBetween(1L, 5L);
    }
}
