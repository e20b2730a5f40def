package ai.chatbridge.translator.store;

import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.TemplateTable;
import ai.chatbridge.translator.settings.UserProfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BotStore} backed by pretty-printed JSON files in one data directory.
 */
public final class JsonFileBotStore implements BotStore {

    public static final String SETTINGS_FILE = "translation_config.json";
    public static final String TEMPLATES_FILE = "translation_templates.json";
    public static final String PROFILES_FILE = "translation_user_profiles.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileBotStore.class);
    private static final TypeReference<LinkedHashMap<String, UserProfile>> PROFILES_TYPE = new TypeReference<>() {
    };

    private final Path dataDirectory;
    private final ObjectMapper mapper;

    public JsonFileBotStore(Path dataDirectory) {
        this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory");
        this.mapper = objectMapper();
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public BotSettings loadSettings() {
        return readRequired(SETTINGS_FILE, BotSettings.class);
    }

    @Override
    public void saveSettings(BotSettings settings) {
        write(SETTINGS_FILE, Objects.requireNonNull(settings, "settings"));
    }

    @Override
    public TemplateTable loadTemplates() {
        return readRequired(TEMPLATES_FILE, TemplateTable.class);
    }

    @Override
    public Map<String, UserProfile> loadProfiles() {
        Path file = dataDirectory.resolve(PROFILES_FILE);
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, UserProfile> profiles = mapper.readValue(file.toFile(), PROFILES_TYPE);
            return profiles == null ? new LinkedHashMap<>() : profiles;
        } catch (IOException ex) {
            throw new StoreException("Failed to read " + file, ex);
        }
    }

    @Override
    public void saveProfiles(Map<String, UserProfile> profiles) {
        write(PROFILES_FILE, Objects.requireNonNull(profiles, "profiles"));
    }

    private <T> T readRequired(String fileName, Class<T> type) {
        Path file = dataDirectory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new StoreException("Required file is missing: " + file);
        }
        try {
            T value = mapper.readValue(file.toFile(), type);
            if (value == null) {
                throw new StoreException("Required file is empty: " + file);
            }
            return value;
        } catch (IOException ex) {
            throw new StoreException("Failed to parse " + file, ex);
        }
    }

    private void write(String fileName, Object value) {
        Path file = dataDirectory.resolve(fileName);
        try {
            Files.createDirectories(dataDirectory);
            Path temp = Files.createTempFile(dataDirectory, fileName, ".tmp");
            mapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.debug("Saved {}", file);
        } catch (IOException ex) {
            throw new StoreException("Failed to write " + file, ex);
        }
    }
}
