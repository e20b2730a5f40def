package ai.chatbridge.translator.template;

import java.util.Map;

/**
 * One piece of a parsed message template.
 */
public interface TemplateNode {

    String render(String genderKey);

    record Literal(String text) implements TemplateNode {

        @Override
        public String render(String genderKey) {
            return text;
        }
    }

    /**
     * Gender-select block; a missing branch falls back to {@code other}, then to nothing.
     */
    record Select(String variable, Map<String, String> options) implements TemplateNode {

        public static final String FALLBACK_OPTION = "other";

        public Select {
            options = Map.copyOf(options);
        }

        @Override
        public String render(String genderKey) {
            String chosen = genderKey == null ? null : options.get(genderKey);
            if (chosen == null) {
                chosen = options.get(FALLBACK_OPTION);
            }
            return chosen == null ? "" : chosen;
        }
    }
}
