package ai.chatbridge.translator.store;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.Fixtures;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.DefaultSettings;
import ai.chatbridge.translator.settings.UserProfile;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProfileRepositoryTest {

    @TempDir
    Path dataDir;

    private ProfileRepository repository(BotSettings settings) {
        return new ProfileRepository(new JsonFileBotStore(Fixtures.installInto(dataDir)), settings);
    }

    private static BotSettings withPersona(String persona) {
        BotSettings base = Fixtures.settings();
        return new BotSettings(new DefaultSettings("en", "pt", persona), base.apiLimits(), base.wordBlocklist(),
                base.userBlocklist(), base.inferencePriority(), base.languageMap(), base.settingMap(), base.styleMap(),
                base.modelMap(), base.toneMap(), base.languagePronounMap(), base.helpLinks(),
                base.pronounNormalizationMap(), base.lowercaseLanguageNames(), base.commandAliases());
    }

    @Test
    void createsProfileOnFirstSight() {
        ProfileRepository repository = repository(Fixtures.settings());

        UserProfile profile = repository.getOrUpdate("7", "Ana");

        assertThat(profile).isEqualTo(new UserProfile("Ana", "default", "en", "normal", null));
        assertThat(repository.find("7")).contains(profile);
    }

    @Test
    void resyncsChangedUsername() {
        ProfileRepository repository = repository(Fixtures.settings());
        repository.save("7", new UserProfile("ana", "es", "es", "pirate", "she/her"));

        UserProfile profile = repository.getOrUpdate("7", "AnaRenamed");

        assertThat(profile).isEqualTo(new UserProfile("AnaRenamed", "es", "es", "pirate", "she/her"));
        assertThat(repository.find("7").orElseThrow().username()).isEqualTo("AnaRenamed");
    }

    @Test
    void findsUserIdByUsernameIgnoringCaseAndMention() {
        ProfileRepository repository = repository(Fixtures.settings());
        repository.getOrUpdate("7", "Ana");
        repository.getOrUpdate("8", "Bob");

        assertThat(repository.findUserIdByUsername("@BOB")).contains("8");
        assertThat(repository.findUserIdByUsername("carol")).isEmpty();
        assertThat(repository.findUserIdByUsername(" ")).isEmpty();
    }

    @Test
    void defaultProfileFollowsPersona() {
        assertThat(repository(withPersona("es-pirata")).createDefault())
                .isEqualTo(new UserProfile("", "default", "es", "pirate", null));
        assertThat(repository(withPersona("it-normale")).createDefault().speakingStyle()).isEqualTo("normal");
        assertThat(repository(withPersona("xx-pirate")).createDefault())
                .isEqualTo(new UserProfile("", "default", "en", "pirate", null));
    }
}
