package ai.chatbridge.translator.keyword;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.Fixtures;
import ai.chatbridge.translator.settings.BotSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LanguageInferenceTest {

    private final BotSettings settings = Fixtures.settings();

    private LanguageInference inference(List<String> priority) {
        return new LanguageInference(settings.settingMap(), settings.styleMap(), priority);
    }

    @Test
    void keepsCurrentLanguageWhenEverythingValidates() {
        assertThat(inference(settings.inferencePriority()).infer(Map.of("target", "es"), "en")).isEqualTo("en");
    }

    @Test
    void picksTheOnlyLanguageWhereAllPairsValidate() {
        Map<String, String> arguments = new LinkedHashMap<>();
        arguments.put("idioma", "fr");
        arguments.put("hablo", "es");

        assertThat(inference(settings.inferencePriority()).infer(arguments, "en")).isEqualTo("es");
    }

    @Test
    void breaksTiesWithPriorityList() {
        assertThat(inference(List.of("es", "pt")).infer(Map.of("idioma", "es"), "en")).isEqualTo("es");
        assertThat(inference(List.of("pt", "es")).infer(Map.of("idioma", "es"), "en")).isEqualTo("pt");
    }

    @Test
    void tieWithoutPriorityKeepsCurrentLanguage() {
        assertThat(inference(List.of()).infer(Map.of("idioma", "es"), "en")).isEqualTo("en");
    }

    @Test
    void styleValuesMustExistInTheCandidateLanguage() {
        assertThat(inference(settings.inferencePriority()).infer(Map.of("estilo", "formal"), "en")).isEqualTo("es");
        assertThat(inference(settings.inferencePriority()).infer(Map.of("stile", "pirata"), "en")).isEqualTo("it");
    }

    @Test
    void noCandidateKeepsCurrentLanguage() {
        assertThat(inference(settings.inferencePriority()).infer(Map.of("colour", "blue"), "en")).isEqualTo("en");
    }
}
