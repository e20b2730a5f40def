package ai.chatbridge.translator.store;

import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.UserProfile;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User-profile access on top of {@link BotStore}, including the proactive upsert every command performs.
 */
public class ProfileRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProfileRepository.class);

    private final BotStore store;
    private final BotSettings settings;

    public ProfileRepository(BotStore store, BotSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Returns the stored profile for {@code userId}, creating it from the persona on first sight and
     * resyncing the username when the platform reports a different one. Saves only when something changed.
     */
    public UserProfile getOrUpdate(String userId, String username) {
        Objects.requireNonNull(userId, "userId");
        Map<String, UserProfile> profiles = store.loadProfiles();
        UserProfile existing = profiles.get(userId);
        if (existing == null) {
            UserProfile created = createDefault().withUsername(username);
            profiles.put(userId, created);
            store.saveProfiles(profiles);
            LOGGER.info("Created profile for user {} ({})", userId, username);
            return created;
        }
        if (username != null && !username.isBlank() && !username.equals(existing.username())) {
            UserProfile renamed = existing.withUsername(username);
            profiles.put(userId, renamed);
            store.saveProfiles(profiles);
            LOGGER.info("Updated username for user {}: {} -> {}", userId, existing.username(), username);
            return renamed;
        }
        return existing;
    }

    public Optional<UserProfile> find(String userId) {
        return Optional.ofNullable(store.loadProfiles().get(userId));
    }

    /**
     * Reverse index: the id of the stored profile whose username equals {@code username}, ignoring case
     * and a leading {@code @}.
     */
    public Optional<String> findUserIdByUsername(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        String wanted = stripMention(username);
        return store.loadProfiles().entrySet().stream()
                .filter(entry -> entry.getValue().username().equalsIgnoreCase(wanted))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public void save(String userId, UserProfile profile) {
        Map<String, UserProfile> profiles = store.loadProfiles();
        profiles.put(Objects.requireNonNull(userId, "userId"), Objects.requireNonNull(profile, "profile"));
        store.saveProfiles(profiles);
    }

    /**
     * Profile derived from the configured persona {@code lang-style}. The language is kept only when it is
     * a known language; the style is resolved in the persona language first, then in any language.
     */
    public UserProfile createDefault() {
        String persona = settings.defaultSettings().defaultBotPersona();
        String language = UserProfile.DEFAULT_LANGUAGE;
        String style = UserProfile.DEFAULT_STYLE;
        if (persona != null && !persona.isBlank()) {
            String[] parts = persona.trim().split("-", 2);
            if (settings.isKnownLanguage(parts[0])) {
                language = parts[0];
            }
            if (parts.length > 1) {
                String styleKeyword = parts[1];
                style = settings.styleMap().lookup(language, styleKeyword)
                        .or(() -> settings.styleMap().languages().stream()
                                .map(candidate -> settings.styleMap().lookup(candidate, styleKeyword))
                                .flatMap(Optional::stream)
                                .findFirst())
                        .orElse(style);
            }
        }
        return new UserProfile("", UserProfile.DEFAULT_TARGET, language, style, null);
    }

    static String stripMention(String username) {
        String trimmed = username.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }
}
