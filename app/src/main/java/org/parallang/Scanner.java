package org.parallang;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.gson.GsonBuilder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

enum CharClass {
    // identifiers and numbers, '_' counts as a letter
    LETTER, DIGIT,
    // whitespaces
    WS, NL,
    // division or comment
    SLASH,
    // every other single-character token
    SYMBOL,
    /*
     * special
     */
    // end of input, never consumed
    END,
    // wildcard, MUST NOT be result of `classOf`
    OTHER,
    // represents a character outside of allowed alphabet
    NOT_A_CHAR;

    static CharClass classOf(int c) {
        if (c == Scanner.EOF) return END;
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_') return LETTER;
        if (c >= '0' && c <= '9') return DIGIT;

        return switch (c) {
            case ' ', '\t', '\r' -> WS;
            case '\n' -> NL;
            case '/' -> SLASH;
            case '+', '-', '*', '=', ';', '(', ')', '{', '}', ',' -> SYMBOL;
            default -> NOT_A_CHAR;
        };
    }
}

record StateBranch(Integer thisState, CharClass nextChar, Integer nextState) {
    static StateBranch f(Integer thisState, CharClass nextChar, Integer nextState) {
        return new StateBranch(thisState, nextChar, nextState);
    }
}

class StateTable {
    TreeMap<Pair<Integer, CharClass>, Integer> transitions;

    @Override
    public String toString() {
        var gson = new GsonBuilder()
            .setPrettyPrinting()
            .create();

        return gson.toJson(this);
    }

    int nextState(int thisState, CharClass cls) {
        var next = this.transitions.getOrDefault(
            Pair.of(thisState, cls),
            // No explicit branch for this class, try the wildcard
            this.transitions.get(Pair.of(thisState, CharClass.OTHER))
        );
        if (next == null) {
            throw new IllegalStateException("no transition from state " + thisState + " on " + cls);
        }
        return next;
    }

    static StateTable build() {
        var table = new StateTable();

        table.transitions = Stream.of(new StateBranch[] {
            // Identifiers and keywords
            StateBranch.f(0, CharClass.LETTER, 1),
            StateBranch.f(1, CharClass.LETTER, 1),
            StateBranch.f(1, CharClass.DIGIT, 1),
            // Finished, end with Identifier or Keyword
            StateBranch.f(1, CharClass.OTHER, 2),

            // Numbers, digits only
            StateBranch.f(0, CharClass.DIGIT, 3),
            StateBranch.f(3, CharClass.DIGIT, 3),
            // Finished, end with Number
            StateBranch.f(3, CharClass.OTHER, 4),

            // Comment (or division)
            StateBranch.f(0, CharClass.SLASH, 5),
            // Actually a comment
            StateBranch.f(5, CharClass.SLASH, 6),
            // Finished, not a comment, end with Slash
            StateBranch.f(5, CharClass.OTHER, 7),
            // Read everything
            StateBranch.f(6, CharClass.OTHER, 6),
            // Until newline or end of input, then start over
            StateBranch.f(6, CharClass.NL, 0),
            StateBranch.f(6, CharClass.END, 0),

            // Whitespace
            StateBranch.f(0, CharClass.WS, 0),
            StateBranch.f(0, CharClass.NL, 0),

            // Operators and punctuation
            StateBranch.f(0, CharClass.SYMBOL, 8),

            // Nothing left
            StateBranch.f(0, CharClass.END, 9),

            // Started with unexpected symbol, error
            StateBranch.f(0, CharClass.OTHER, 101)

        }).collect(Collectors.toMap(
            branch -> Pair.of(branch.thisState(), branch.nextChar()),
            branch -> branch.nextState(),
            (v1, v2) -> v2,
            TreeMap::new
        ));

        return table;
    }
}

/**
 * Turns source text into tokens, one {@link #nextToken()} call at a time.
 *
 * Each instance is bound to one source string and owns its cursor, so it must
 * not be shared between threads. Scanning the same text twice gives the same
 * tokens. Once {@link TokenKind#END_OF_INPUT} has been returned, further calls
 * to {@link #nextToken()} return that same token again.
 */
public class Scanner implements Iterator<Token> {
    /*
     * Static data
     */
    static final int EOF = -1;
    static final int initState = 0;
    static final Set<Integer> statesEnd = Set.of(2, 4, 7, 8, 9, 101);
    // accepting states reached on lookahead, the character stays unread
    static final Set<Integer> statesPutBack = Set.of(2, 4, 7);
    static final Set<Integer> statesError = Set.of(101);
    static final StateTable table = StateTable.build();

    /*
     * Globals
     */
    private static final Logger log = LogManager.getLogger("scanner");

    /*
     * Scanner state
     */
    private int offset = 0;
    private int line = 1;
    private int column = 1;
    private Token endToken = null;

    /*
     * Scanner data
     */
    private final String source;

    public Scanner(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    // Shorthand for `new Scanner(source).tokenizeAll()`
    public static List<Token> scan(String source) {
        return new Scanner(source).tokenizeAll();
    }

    // Where the next unread character sits
    public Position position() {
        return new Position(this.offset, this.line, this.column);
    }

    /**
     * Skips whitespace and comments, then scans and returns one token.
     *
     * @throws ScanException if the next significant character is not part of
     *         the alphabet; the cursor is already past it, so scanning can be
     *         resumed with another call
     */
    public Token nextToken() {
        if (this.endToken != null) {
            return this.endToken;
        }

        int state = Scanner.initState;
        var lexeme = new StringBuilder();
        var start = position();

        while (true) {
            int ch = peek();
            var cls = CharClass.classOf(ch);

            if (state == Scanner.initState) {
                start = position();
                lexeme.setLength(0);
            }

            int next = table.nextState(state, cls);
            log.debug("{} state: {} -> {} on {}", this.offset, state, next, cls);

            if (!statesPutBack.contains(next) && cls != CharClass.END) {
                advance();
                lexeme.appendCodePoint(ch);
            }
            state = next;

            if (statesEnd.contains(state)) {
                return accept(state, lexeme.toString(), start, ch);
            }
        }
    }

    /**
     * Scans the rest of the input, {@link TokenKind#END_OF_INPUT} included.
     *
     * @throws ScanException on the first invalid character, carrying the
     *         tokens scanned before it
     */
    public List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (true) {
            Token token;
            try {
                token = nextToken();
            } catch (ScanException e) {
                throw new ScanException(e.error(), tokens, e);
            }
            tokens.add(token);
            if (token.kind() == TokenKind.END_OF_INPUT) {
                return Collections.unmodifiableList(tokens);
            }
        }
    }

    // Like tokenizeAll, but records each invalid character and carries on past it
    public ScanReport tokenizeRecovering() {
        var tokens = new ArrayList<Token>();
        var errors = new ArrayList<ScanError>();
        while (true) {
            try {
                var token = nextToken();
                tokens.add(token);
                if (token.kind() == TokenKind.END_OF_INPUT) {
                    return new ScanReport(tokens, errors);
                }
            } catch (ScanException e) {
                errors.add(e.error());
            }
        }
    }

    // Lazy view over the remaining tokens, ends after END_OF_INPUT
    public Stream<Token> tokens() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    @Override
    public boolean hasNext() {
        return this.endToken == null;
    }

    @Override
    public Token next() {
        if (this.endToken != null) {
            throw new NoSuchElementException("end of input already reached");
        }
        return nextToken();
    }

    /*
     * Here go dragons
     */

    Token accept(int state, String lexeme, Position start, int ch) {
        if (statesError.contains(state)) {
            var error = new ScanError(ch, start);
            log.debug("error: {}", error);
            throw new ScanException(error);
        }

        Token token;
        switch (state) {
            case 2 -> {
                var kind = TokenKind.keyword(lexeme).orElse(TokenKind.IDENTIFIER);
                token = new Token(kind, lexeme, start);
            }
            case 4 -> {
                token = new Token(TokenKind.NUMBER, lexeme, start);
            }
            case 7 -> {
                token = new Token(TokenKind.SLASH, lexeme, start);
            }
            case 8 -> {
                var kind = TokenKind.symbol(lexeme.charAt(0))
                    .orElseThrow(() -> new IllegalStateException("not a symbol: " + lexeme));
                token = new Token(kind, lexeme, start);
            }
            case 9 -> {
                token = new Token(TokenKind.END_OF_INPUT, "", start);
                this.endToken = token;
            }
            default -> throw new IllegalStateException("not an accepting state: " + state);
        }

        log.debug(token);
        return token;
    }

    // Current code point, or EOF
    int peek() {
        if (this.offset >= this.source.length()) {
            return EOF;
        }
        return this.source.codePointAt(this.offset);
    }

    // Consume one code point and move the cursor
    void advance() {
        int ch = this.source.codePointAt(this.offset);
        this.offset += Character.charCount(ch);
        if (ch == '\n') {
            this.line++;
            this.column = 1;
        } else {
            this.column++;
        }
    }
}
