package ai.chatbridge.translator.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a template into literal runs and at most one gender-select block of the form
 * {@code {gender, select, male {..} female {..} other {..}}}.
 *
 * <p>Option bodies may contain nested braces, so extents are found by counting braces rather than by
 * pattern matching. A select block that does not close is left as literal text.</p>
 */
public final class TemplateParser {

    private static final String SELECT_KEYWORD = "select";

    private TemplateParser() {
    }

    public static List<TemplateNode> parse(String template) {
        List<TemplateNode> nodes = new ArrayList<>();
        if (template == null || template.isEmpty()) {
            return nodes;
        }
        int searchFrom = 0;
        while (searchFrom < template.length()) {
            int open = template.indexOf('{', searchFrom);
            if (open < 0) {
                break;
            }
            int close = matchingBrace(template, open);
            if (close < 0) {
                break;
            }
            TemplateNode.Select select = parseSelect(template.substring(open + 1, close));
            if (select != null) {
                if (open > 0) {
                    nodes.add(new TemplateNode.Literal(template.substring(0, open)));
                }
                nodes.add(select);
                if (close + 1 < template.length()) {
                    nodes.add(new TemplateNode.Literal(template.substring(close + 1)));
                }
                return nodes;
            }
            searchFrom = close + 1;
        }
        nodes.add(new TemplateNode.Literal(template));
        return nodes;
    }

    /**
     * Parses the inside of a candidate block, e.g. {@code gender, select, male {he} other {they}}.
     */
    static TemplateNode.Select parseSelect(String body) {
        String[] header = body.split(",", 3);
        if (header.length < 3 || !SELECT_KEYWORD.equals(header[1].trim())) {
            return null;
        }
        String variable = header[0].trim();
        if (variable.isEmpty() || variable.contains("{")) {
            return null;
        }
        Map<String, String> options = new LinkedHashMap<>();
        String rest = header[2];
        int index = 0;
        while (index < rest.length()) {
            int open = rest.indexOf('{', index);
            if (open < 0) {
                break;
            }
            String key = rest.substring(index, open).trim();
            int close = matchingBrace(rest, open);
            if (close < 0 || key.isEmpty()) {
                return null;
            }
            options.put(key, rest.substring(open + 1, close));
            index = close + 1;
        }
        if (options.isEmpty() || !rest.substring(index).isBlank()) {
            return null;
        }
        return new TemplateNode.Select(variable, options);
    }

    static int matchingBrace(String text, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char current = text.charAt(i);
            if (current == '{') {
                depth++;
            } else if (current == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
