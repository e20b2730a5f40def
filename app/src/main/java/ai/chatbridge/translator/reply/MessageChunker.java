package ai.chatbridge.translator.reply;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long messages into numbered chunks that fit a platform limit.
 *
 * <p>Each chunk is cut at the last whitespace that fits, or hard-cut when there is none, and
 * prefixed with {@code (i/n) }. Room for the prefix is reserved up front and widened when the chunk
 * count reaches two digits.</p>
 */
public final class MessageChunker {

    static final int PREFIX_RESERVATION = 7;

    private MessageChunker() {
    }

    public static List<String> split(String message, int limit) {
        if (message == null || message.isEmpty()) {
            return List.of();
        }
        if (message.length() <= limit) {
            return List.of(message);
        }
        int reservation = PREFIX_RESERVATION;
        List<String> pieces = cut(message, limit - reservation);
        while (prefixLength(pieces.size()) > reservation) {
            reservation = prefixLength(pieces.size());
            pieces = cut(message, limit - reservation);
        }
        List<String> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add("(" + (i + 1) + "/" + pieces.size() + ") " + pieces.get(i));
        }
        return chunks;
    }

    static List<String> cut(String message, int maxChunk) {
        if (maxChunk <= 0) {
            throw new IllegalArgumentException("Message limit leaves no room for text");
        }
        List<String> pieces = new ArrayList<>();
        String remaining = message;
        while (!remaining.isEmpty()) {
            if (remaining.length() <= maxChunk) {
                pieces.add(remaining);
                break;
            }
            int splitAt = lastWhitespace(remaining, maxChunk);
            if (splitAt <= 0) {
                splitAt = maxChunk;
            }
            pieces.add(remaining.substring(0, splitAt));
            remaining = remaining.substring(splitAt).trim();
        }
        return pieces;
    }

    private static int lastWhitespace(String text, int fromIndex) {
        for (int i = Math.min(fromIndex, text.length() - 1); i > 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static int prefixLength(int count) {
        return ("(" + count + "/" + count + ") ").length();
    }
}
