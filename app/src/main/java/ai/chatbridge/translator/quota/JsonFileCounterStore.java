package ai.chatbridge.translator.quota;

import ai.chatbridge.translator.store.StoreException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link CounterStore} persisted in one JSON file. Every operation holds a JVM monitor for the file and an
 * OS lock on a sibling {@code .lock} file, so separate processes see each read-compare-write as one step.
 */
public class JsonFileCounterStore implements CounterStore {

    public static final String COUNTERS_FILE = "quota_counters.json";

    private static final Map<Path, Object> MONITORS = new ConcurrentHashMap<>();

    private final Path file;
    private final Path lockFile;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public JsonFileCounterStore(Path dataDirectory) {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        this.file = dataDirectory.resolve(COUNTERS_FILE).toAbsolutePath().normalize();
        this.lockFile = file.resolveSibling(COUNTERS_FILE + ".lock");
    }

    @Override
    public long get(String key) {
        return withLock(state -> state.counters().getOrDefault(key, 0L));
    }

    @Override
    public boolean compareAndSet(Map<String, Long> expected, Map<String, Long> updated) {
        return withLock(state -> {
            for (Map.Entry<String, Long> entry : expected.entrySet()) {
                if (state.counters().getOrDefault(entry.getKey(), 0L) != entry.getValue().longValue()) {
                    return false;
                }
            }
            state.counters().putAll(updated);
            write(state);
            return true;
        });
    }

    @Override
    public void scheduleExpiry(String key, Instant expiresAt) {
        withLock(state -> {
            state.expiries().put(key, expiresAt.toEpochMilli());
            write(state);
            return null;
        });
    }

    @Override
    public int purgeExpired(Instant now) {
        return withLock(state -> {
            int removed = 0;
            Iterator<Map.Entry<String, Long>> iterator = state.expiries().entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, Long> entry = iterator.next();
                if (entry.getValue() < now.toEpochMilli()) {
                    state.counters().remove(entry.getKey());
                    iterator.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                write(state);
            }
            return removed;
        });
    }

    private <T> T withLock(Function<CounterFile, T> action) {
        synchronized (MONITORS.computeIfAbsent(file, ignored -> new Object())) {
            try {
                Files.createDirectories(file.getParent());
                try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                     FileLock ignored = channel.lock()) {
                    return action.apply(read());
                }
            } catch (IOException ex) {
                throw new StoreException("Failed to access quota counters in " + file, ex);
            }
        }
    }

    private CounterFile read() {
        if (!Files.exists(file)) {
            return new CounterFile(new LinkedHashMap<>(), new LinkedHashMap<>());
        }
        try {
            CounterFile stored = mapper.readValue(file.toFile(), CounterFile.class);
            return new CounterFile(
                    stored.counters() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stored.counters()),
                    stored.expiries() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stored.expiries()));
        } catch (IOException ex) {
            throw new StoreException("Failed to parse quota counters in " + file, ex);
        }
    }

    private void write(CounterFile state) {
        try {
            Path temp = Files.createTempFile(file.getParent(), COUNTERS_FILE, ".tmp");
            mapper.writeValue(temp.toFile(), state);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new StoreException("Failed to write quota counters to " + file, ex);
        }
    }

    record CounterFile(Map<String, Long> counters, Map<String, Long> expiries) {
    }
}
