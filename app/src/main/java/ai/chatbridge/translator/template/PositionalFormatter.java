package ai.chatbridge.translator.template;

import java.util.List;

/**
 * Replaces {@code {n}} placeholders with positional arguments. {@code {{} and {@code }}} are escaped braces.
 */
public final class PositionalFormatter {

    private PositionalFormatter() {
    }

    /**
     * @throws IllegalArgumentException when a placeholder is malformed or refers past the argument list
     */
    public static String format(String template, List<?> arguments) {
        StringBuilder result = new StringBuilder(template.length() + 16);
        int i = 0;
        while (i < template.length()) {
            char current = template.charAt(i);
            if (current == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    result.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed placeholder at " + i);
                }
                result.append(argumentAt(template.substring(i + 1, close).trim(), arguments));
                i = close + 1;
            } else if (current == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    result.append('}');
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("Unmatched '}' at " + i);
            } else {
                result.append(current);
                i++;
            }
        }
        return result.toString();
    }

    private static String argumentAt(String placeholder, List<?> arguments) {
        int index;
        try {
            index = Integer.parseInt(placeholder);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Placeholder is not an index: {" + placeholder + "}", ex);
        }
        if (index < 0 || index >= arguments.size()) {
            throw new IllegalArgumentException("Placeholder {" + index + "} has no argument");
        }
        return String.valueOf(arguments.get(index));
    }
}
