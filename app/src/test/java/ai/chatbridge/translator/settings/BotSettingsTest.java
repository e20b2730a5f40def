package ai.chatbridge.translator.settings;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.Fixtures;
import org.junit.jupiter.api.Test;

class BotSettingsTest {

    private final BotSettings settings = Fixtures.settings();

    @Test
    void findsBlockedWordsIgnoringCase() {
        assertThat(settings.findBlockedWord("that is a BadWord!")).contains("badword");
        assertThat(settings.findBlockedWord("all good")).isEmpty();
    }

    @Test
    void pronounHintsMatchByCodeOrName() {
        assertThat(settings.pronounHint("es", "Spanish", "she/her")).isPresent();
        assertThat(settings.pronounHint("xx", "spanish", "she/her")).isPresent();
        assertThat(settings.pronounHint("es", "Spanish", "he/him")).isEmpty();
    }

    @Test
    void missingSectionsFallBackToDefaults() {
        BotSettings empty = new BotSettings(null, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null);

        assertThat(empty.defaultSettings().defaultBotPersona()).isEqualTo("en-normal");
        assertThat(empty.apiLimits().forTier(ModelTier.FAST).requestsPerMinute()).isEqualTo(1000);
        assertThat(empty.lowercasesLanguageNames("PT")).isTrue();
        assertThat(empty.lowercasesLanguageNames("en")).isFalse();
    }

    @Test
    void profileDefaultsAndComparison() {
        UserProfile profile = new UserProfile("ana", null, " ", null, " ");

        assertThat(profile.targetLanguage()).isEqualTo(UserProfile.DEFAULT_TARGET);
        assertThat(profile.hasTarget()).isFalse();
        assertThat(profile.hasPronouns()).isFalse();
        assertThat(profile.sameSettingsAs(profile.withUsername("other"))).isTrue();
        assertThat(profile.sameSettingsAs(profile.withPronouns("she/her"))).isFalse();
    }

    @Test
    void tierIdsRoundTrip() {
        assertThat(ModelTier.fromId("pro")).isEqualTo(ModelTier.STRONG);
        assertThat(ModelTier.FAST.id()).isEqualTo("flash");
    }
}
