package org.parallang;

import java.util.*;

import static org.parallang.utils.AnsiColors.*;

/**
 * Echoes source text with every token wrapped in a terminal color.
 *
 * Whitespace and comments are copied unchanged. Characters reported as
 * {@link ScanError}s get a red background.
 */
public final class Highlighter {
    private Highlighter() {
    }

    public static String colorize(String source, List<Token> tokens) {
        return colorize(source, tokens, List.of());
    }

    public static String colorize(String source, List<Token> tokens, List<ScanError> errors) {
        // start offset -> (end offset, color)
        var spans = new TreeMap<Integer, Map.Entry<Integer, String>>();
        for (var token : tokens) {
            if (token.kind() != TokenKind.END_OF_INPUT) {
                spans.put(token.position().offset(), Map.entry(token.endOffset(), colorFor(token.kind())));
            }
        }
        for (var error : errors) {
            int start = error.position().offset();
            spans.put(start, Map.entry(start + Character.charCount(error.codePoint()), ANSI_RED_BACK));
        }

        var sb = new StringBuilder();
        int lastPos = 0;
        for (var span : spans.entrySet()) {
            int startPos = span.getKey();
            int endPos = span.getValue().getKey();

            // Text before the token
            if (startPos > lastPos) {
                sb.append(source, lastPos, startPos);
            }
            sb.append(span.getValue().getValue())
                .append(source, startPos, endPos)
                .append(ANSI_RESET);
            lastPos = endPos;
        }

        // Remaining text
        if (lastPos < source.length()) {
            sb.append(source.substring(lastPos));
        }
        return sb.toString();
    }

    static String colorFor(TokenKind kind) {
        return switch (kind.category()) {
            case KEYWORD -> ANSI_PURPLE;
            case IDENT -> ANSI_WHITE;
            case NUMBER -> ANSI_GREEN;
            case SYMBOL -> ANSI_CYAN;
            case END -> ANSI_RESET;
        };
    }
}
