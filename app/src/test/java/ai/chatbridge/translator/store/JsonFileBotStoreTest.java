package ai.chatbridge.translator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.chatbridge.translator.Fixtures;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.ModelTier;
import ai.chatbridge.translator.settings.UserProfile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileBotStoreTest {

    @TempDir
    Path dataDir;

    @Test
    void loadsInstalledFixtures() {
        JsonFileBotStore store = new JsonFileBotStore(Fixtures.installInto(dataDir));

        BotSettings settings = store.loadSettings();

        assertThat(settings.apiLimits().forTier(ModelTier.STRONG).requestsPerMinute()).isEqualTo(150);
        assertThat(settings.settingMap().resolve("idioma", "es")).contains("target");
        assertThat(store.loadTemplates().find("es", "quote_start")).contains("«");
    }

    @Test
    void missingSettingsFileIsAnError() {
        JsonFileBotStore store = new JsonFileBotStore(dataDir);

        assertThatThrownBy(store::loadSettings)
                .isInstanceOf(StoreException.class)
                .hasMessageContaining(JsonFileBotStore.SETTINGS_FILE);
    }

    @Test
    void malformedTemplatesAreAnError() throws IOException {
        Files.writeString(dataDir.resolve(JsonFileBotStore.TEMPLATES_FILE), "{ not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new JsonFileBotStore(dataDir).loadTemplates())
                .isInstanceOf(StoreException.class);
    }

    @Test
    void profilesDefaultToEmptyAndRoundTrip() {
        JsonFileBotStore store = new JsonFileBotStore(dataDir);
        assertThat(store.loadProfiles()).isEmpty();

        Map<String, UserProfile> profiles = store.loadProfiles();
        profiles.put("42", new UserProfile("ana", "es", "pt", "pirate", "she/her"));
        store.saveProfiles(profiles);

        assertThat(new JsonFileBotStore(dataDir).loadProfiles())
                .containsEntry("42", new UserProfile("ana", "es", "pt", "pirate", "she/her"));
    }

    @Test
    void savedSettingsKeepBlocklistChanges() {
        JsonFileBotStore store = new JsonFileBotStore(Fixtures.installInto(dataDir));
        BotSettings settings = store.loadSettings();

        store.saveSettings(settings.withWordBlocklist(List.of("badword", "spoiler")));

        BotSettings reloaded = store.loadSettings();
        assertThat(reloaded.wordBlocklist()).containsExactly("badword", "spoiler");
        assertThat(reloaded.userBlocklist()).containsEntry("666", "troll");
        assertThat(reloaded.toneMap()).isEqualTo(settings.toneMap());
    }
}
