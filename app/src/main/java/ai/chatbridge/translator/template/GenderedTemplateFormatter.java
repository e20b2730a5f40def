package ai.chatbridge.translator.template;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a template: the gender-select block first, then positional placeholders.
 */
public final class GenderedTemplateFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenderedTemplateFormatter.class);

    private GenderedTemplateFormatter() {
    }

    /**
     * Never fails: malformed positional syntax leaves the select-rendered text unformatted.
     */
    public static String format(String template, String genderKey, List<?> arguments) {
        if (template == null) {
            return "";
        }
        StringBuilder rendered = new StringBuilder(template.length());
        for (TemplateNode node : TemplateParser.parse(template)) {
            rendered.append(node.render(genderKey));
        }
        String selected = rendered.toString();
        if (arguments == null || arguments.isEmpty()) {
            return selected;
        }
        try {
            return PositionalFormatter.format(selected, arguments);
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Could not apply {} arguments to template '{}': {}", arguments.size(), selected, ex.getMessage());
            return selected;
        }
    }
}
