package ai.chatbridge.translator.reply;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.Fixtures;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.DefaultSettings;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.template.MessageLocalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResponseAssemblerTest {

    private final UserProfile caller = new UserProfile("bob", "es", "es", "normal", "he/him");

    @Test
    void usesStreamerPersonaNotCaller() {
        ResponseAssembler assembler = new ResponseAssembler(Fixtures.localizer(), Fixtures.settings());

        String reply = assembler.assemble("bob", "es", List.of("Hola", "amigos"), caller);

        assertThat(reply).isEqualTo("@bob (Spanish): \"Hola amigos\"");
    }

    @Test
    void spanishPersonaUsesLocalizedNamesAndQuotes() {
        BotSettings base = Fixtures.settings();
        BotSettings spanish = new BotSettings(new DefaultSettings("en", "pt", "es-normal"), base.apiLimits(),
                base.wordBlocklist(), base.userBlocklist(), base.inferencePriority(), base.languageMap(),
                base.settingMap(), base.styleMap(), base.modelMap(), base.toneMap(), base.languagePronounMap(),
                base.helpLinks(), base.pronounNormalizationMap(), base.lowercaseLanguageNames(), base.commandAliases());
        MessageLocalizer localizer = Fixtures.localizer(spanish);
        ResponseAssembler assembler = new ResponseAssembler(localizer, spanish);

        String reply = assembler.assemble("bob", "pt", List.of("Olá"), caller);

        assertThat(reply).isEqualTo("@bob (portugués): «Olá»");
    }

    @Test
    void streamerVoiceKeepsCallerStyle() {
        ResponseAssembler assembler = new ResponseAssembler(Fixtures.localizer(), Fixtures.settings());

        UserProfile voice = assembler.streamerVoice(caller.withSpeakingStyle("pirate"));

        assertThat(voice.speakingLanguage()).isEqualTo("en");
        assertThat(voice.speakingStyle()).isEqualTo("pirate");
        assertThat(voice.pronouns()).isNull();
    }
}
