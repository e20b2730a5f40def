package ai.chatbridge.translator.keyword;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class KeywordTableTest {

    private final KeywordTable table = new KeywordTable(Map.of(
            "en", Map.of("Pirate", "pirate", "formal", "formal"),
            "es", Map.of("pirata", "pirate")));

    @Test
    void resolvesInRequestedLanguageIgnoringCase() {
        assertThat(table.resolve("PIRATA", "es")).contains("pirate");
    }

    @Test
    void fallsBackToEnglish() {
        assertThat(table.resolve("formal", "es")).contains("formal");
        assertThat(table.resolve("pirate", "de")).contains("pirate");
    }

    @Test
    void unknownKeywordIsNotAnError() {
        assertThat(table.resolve("casual", "es")).isEmpty();
        assertThat(table.resolve("", "en")).isEmpty();
        assertThat(table.resolve(null, "en")).isEmpty();
    }

    @Test
    void lookupDoesNotFallBack() {
        assertThat(table.lookup("es", "formal")).isEmpty();
        assertThat(table.containsKeyword("en", "formal")).isTrue();
    }
}
