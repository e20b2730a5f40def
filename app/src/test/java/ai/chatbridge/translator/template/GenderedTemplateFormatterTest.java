package ai.chatbridge.translator.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class GenderedTemplateFormatterTest {

    private static final String TEMPLATE = "{0}: {gender, select, male {he is} female {she is} other {they are}} {1}";

    @Test
    void rendersSelectedBranchThenArguments() {
        assertThat(GenderedTemplateFormatter.format(TEMPLATE, "female", List.of("@ana", "here")))
                .isEqualTo("@ana: she is here");
        assertThat(GenderedTemplateFormatter.format(TEMPLATE, "male", List.of("@bo", "away")))
                .isEqualTo("@bo: he is away");
    }

    @Test
    void unknownGenderUsesOtherBranch() {
        assertThat(GenderedTemplateFormatter.format(TEMPLATE, "unknown", List.of("@x", "back")))
                .isEqualTo("@x: they are back");
    }

    @Test
    void missingArgumentLeavesTemplateUnformatted() {
        assertThat(GenderedTemplateFormatter.format("{0} and {1}", "other", List.of("a")))
                .isEqualTo("{0} and {1}");
    }

    @Test
    void escapedBracesSurvive() {
        assertThat(GenderedTemplateFormatter.format("{{literal}} {0}", "other", List.of("x")))
                .isEqualTo("{literal} x");
    }

    @Test
    void nullTemplateRendersEmpty() {
        assertThat(GenderedTemplateFormatter.format(null, "other", List.of())).isEmpty();
    }
}
