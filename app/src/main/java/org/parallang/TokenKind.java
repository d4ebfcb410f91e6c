package org.parallang;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of token kinds produced by the {@link Scanner}.
 *
 * Keywords and single-character symbols carry their fixed source text,
 * identifiers and numbers take their text from the scanned lexeme.
 */
public enum TokenKind {
    // literals
    IDENTIFIER(Category.IDENT, null),
    NUMBER(Category.NUMBER, null),

    // arithmetic
    PLUS(Category.SYMBOL, "+"),
    MINUS(Category.SYMBOL, "-"),
    STAR(Category.SYMBOL, "*"),
    SLASH(Category.SYMBOL, "/"),

    // punctuation
    ASSIGN(Category.SYMBOL, "="),
    SEMICOLON(Category.SYMBOL, ";"),
    LPAREN(Category.SYMBOL, "("),
    RPAREN(Category.SYMBOL, ")"),
    LBRACE(Category.SYMBOL, "{"),
    RBRACE(Category.SYMBOL, "}"),
    COMMA(Category.SYMBOL, ","),

    // functions
    FN(Category.KEYWORD, "fn"),
    // concurrency
    SPAWN(Category.KEYWORD, "spawn"),
    SYNC(Category.KEYWORD, "sync"),
    BARRIER(Category.KEYWORD, "barrier"),
    // jumps
    JUMP(Category.KEYWORD, "jump"),
    JZ(Category.KEYWORD, "jz"),
    JNZ(Category.KEYWORD, "jnz"),

    END_OF_INPUT(Category.END, "");

    public enum Category { IDENT, NUMBER, SYMBOL, KEYWORD, END }

    private static final Map<String, TokenKind> keywords = Arrays.stream(values())
        .filter(kind -> kind.category == Category.KEYWORD)
        .collect(Collectors.toUnmodifiableMap(kind -> kind.text, Function.identity()));

    private static final Map<Character, TokenKind> symbols = Arrays.stream(values())
        .filter(kind -> kind.category == Category.SYMBOL)
        .collect(Collectors.toUnmodifiableMap(kind -> kind.text.charAt(0), Function.identity()));

    private final Category category;
    private final String text;

    TokenKind(Category category, String text) {
        this.category = category;
        this.text = text;
    }

    public Category category() {
        return category;
    }

    // Fixed source text, empty for identifiers and numbers
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    // Exact, case-sensitive match against the reserved words
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(keywords.get(word));
    }

    public static Optional<TokenKind> symbol(char c) {
        return Optional.ofNullable(symbols.get(c));
    }
}
