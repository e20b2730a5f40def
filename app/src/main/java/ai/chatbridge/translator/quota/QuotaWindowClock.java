package ai.chatbridge.translator.quota;

import ai.chatbridge.translator.settings.ModelTier;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names the day and minute counter windows for a tier in the reference time zone.
 */
public class QuotaWindowClock {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuotaWindowClock.class);
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm");

    private final Clock clock;
    private final ZoneId zone;

    public QuotaWindowClock(Clock clock, List<String> zoneCandidates) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = resolveZone(zoneCandidates);
    }

    static ZoneId resolveZone(List<String> candidates) {
        if (candidates != null) {
            for (String candidate : candidates) {
                try {
                    return ZoneId.of(candidate);
                } catch (DateTimeException ex) {
                    LOGGER.debug("Time zone {} is not available: {}", candidate, ex.getMessage());
                }
            }
        }
        LOGGER.warn("No quota time zone from {} is available, using UTC", candidates);
        return ZoneOffset.UTC;
    }

    public Window current(ModelTier tier) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        String dayKey = "daily_count_" + tier.id() + "_" + DAY_FORMAT.format(now);
        String minuteKey = "minute_count_" + tier.id() + "_" + MINUTE_FORMAT.format(now);
        Instant minuteEnd = now.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1).toInstant();
        Instant dayEnd = now.truncatedTo(ChronoUnit.DAYS).plusDays(1).toInstant();
        return new Window(dayKey, minuteKey, dayEnd, minuteEnd, now.toInstant());
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Counter keys of one moment plus the instants at which each window closes.
     */
    public record Window(String dayKey, String minuteKey, Instant dayEnd, Instant minuteEnd, Instant now) {
    }
}
