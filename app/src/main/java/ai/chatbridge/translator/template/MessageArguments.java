package ai.chatbridge.translator.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Arguments for a message template. When a mention is present it is bound to {@code {0}} and the values
 * follow from {@code {1}}; without one the values start at {@code {0}}.
 */
public record MessageArguments(String mention, List<Object> values) {

    public MessageArguments {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static MessageArguments none() {
        return new MessageArguments(null, List.of());
    }

    public static MessageArguments of(Object... values) {
        return new MessageArguments(null, Arrays.asList(values));
    }

    public static MessageArguments mentioning(String mention, Object... values) {
        return new MessageArguments(mention, Arrays.asList(values));
    }

    public boolean hasMention() {
        return mention != null;
    }

    public List<Object> positional() {
        List<Object> positional = new ArrayList<>(values.size() + 1);
        if (mention != null) {
            positional.add(mention);
        }
        positional.addAll(values);
        return positional;
    }
}
