package ai.chatbridge.translator.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TemplateParserTest {

    @Test
    void plainTemplateIsOneLiteral() {
        List<TemplateNode> nodes = TemplateParser.parse("{0}, welcome!");

        assertThat(nodes).containsExactly(new TemplateNode.Literal("{0}, welcome!"));
    }

    @Test
    void splitsAroundSelectBlock() {
        List<TemplateNode> nodes = TemplateParser.parse("{0} said {gender, select, male {he} other {they}} left");

        assertThat(nodes).hasSize(3);
        assertThat(nodes.get(0)).isEqualTo(new TemplateNode.Literal("{0} said "));
        assertThat(nodes.get(1)).isInstanceOf(TemplateNode.Select.class);
        assertThat(((TemplateNode.Select) nodes.get(1)).variable()).isEqualTo("gender");
        assertThat(nodes.get(2)).isEqualTo(new TemplateNode.Literal(" left"));
    }

    @Test
    void optionBodiesMayContainPlaceholders() {
        TemplateNode.Select select = TemplateParser.parseSelect("gender, select, female {{1} herself} other {{1} themself}");

        assertThat(select).isNotNull();
        assertThat(select.render("female")).isEqualTo("{1} herself");
        assertThat(select.render("male")).isEqualTo("{1} themself");
    }

    @Test
    void unclosedSelectStaysLiteral() {
        String template = "{gender, select, male {he} other {they}";

        assertThat(TemplateParser.parse(template)).containsExactly(new TemplateNode.Literal(template));
    }

    @Test
    void rejectsBlocksThatAreNotSelects() {
        assertThat(TemplateParser.parseSelect("0")).isNull();
        assertThat(TemplateParser.parseSelect("gender, plural, one {x}")).isNull();
        assertThat(TemplateParser.parseSelect("gender, select, ")).isNull();
    }

    @Test
    void selectWithoutMatchingOrFallbackBranchRendersNothing() {
        TemplateNode.Select select = TemplateParser.parseSelect("gender, select, male {he}");

        assertThat(select.render("female")).isEmpty();
    }
}
