package org.parallang;

import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

// JSON rendering of a token stream, for tools that sit after the scanner
public final class TokenJson {
    private static final Gson gson = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    record Entry(String kind, String lexeme, int line, int column) {
        static Entry of(Token token) {
            return new Entry(token.kind().name(), token.lexeme(), token.line(), token.column());
        }
    }

    private TokenJson() {
    }

    public static String toJson(List<Token> tokens) {
        return gson.toJson(tokens.stream().map(Entry::of).toList());
    }
}
