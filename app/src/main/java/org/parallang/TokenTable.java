package org.parallang;

import java.util.*;

/**
 * Renders scanned tokens as a table, one row per token.
 *
 * Identifiers and numbers are numbered in order of first appearance, each in
 * its own table, so repeated names share an index.
 */
public final class TokenTable {
    private static final String ROW = "%-7s %-15s %-20s %-12s %s";
    private static final String RULE = "-".repeat(71);

    private TokenTable() {
    }

    public static String format(List<Token> tokens) {
        var lines = new ArrayList<String>();
        lines.add(String.format(ROW, "n_rec", "lexeme", "token", "idxIdConst", "position"));
        lines.add(RULE);

        Map<String, Integer> idTable = new HashMap<>();
        Map<String, Integer> constTable = new HashMap<>();

        int nRec = 1;
        for (var token : tokens) {
            var idxIdConst = switch (token.kind()) {
                case IDENTIFIER -> String.valueOf(idTable.computeIfAbsent(token.lexeme(), key -> idTable.size() + 1));
                case NUMBER -> String.valueOf(constTable.computeIfAbsent(token.lexeme(), key -> constTable.size() + 1));
                default -> "";
            };
            lines.add(String.format(ROW, nRec, token.lexeme(), category(token.kind()), idxIdConst, token.position()));
            nRec++;
        }
        lines.add(RULE);
        return String.join("\n", lines);
    }

    static String category(TokenKind kind) {
        return switch (kind) {
            case IDENTIFIER -> "ident";
            case NUMBER -> "int_const";
            case PLUS, MINUS -> "add_op";
            case STAR, SLASH -> "mult_op";
            case ASSIGN -> "assign_op";
            case LPAREN, RPAREN, LBRACE, RBRACE -> "brackets_op";
            case SEMICOLON, COMMA -> "punct";
            case FN, SPAWN, SYNC, BARRIER, JUMP, JZ, JNZ -> "keyword";
            case END_OF_INPUT -> "eof";
        };
    }
}
