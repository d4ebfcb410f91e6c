package org.parallang;

import java.util.Objects;

/**
 * Immutable token handed from the scanner to its consumer.
 *
 * {@code lexeme} is always the exact source text the token was scanned from,
 * and is empty for {@link TokenKind#END_OF_INPUT}.
 */
public record Token(TokenKind kind, String lexeme, Position position) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
        Objects.requireNonNull(position, "position");
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    // Offset one past the last character of the lexeme
    public int endOffset() {
        return position.offset() + lexeme.length();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case IDENTIFIER -> "Ident: " + '"' + lexeme + '"' + " @" + position;
            case NUMBER -> "Number: " + '"' + lexeme + '"' + " @" + position;
            case END_OF_INPUT -> "EndOfInput @" + position;
            default -> kind + ": " + '"' + lexeme + '"' + " @" + position;
        };
    }
}
