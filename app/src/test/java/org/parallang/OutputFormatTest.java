package org.parallang;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import com.google.gson.Gson;
import com.google.gson.JsonArray;

import static org.parallang.utils.AnsiColors.*;

class OutputFormatTest {
    @Test
    void jsonListsEveryToken() {
        var json = TokenJson.toJson(Scanner.scan("spawn w;"));
        var array = new Gson().fromJson(json, JsonArray.class);

        assertEquals(4, array.size());
        var first = array.get(0).getAsJsonObject();
        assertEquals("SPAWN", first.get("kind").getAsString());
        assertEquals("spawn", first.get("lexeme").getAsString());
        assertEquals(1, first.get("line").getAsInt());
        assertEquals(1, first.get("column").getAsInt());

        var last = array.get(3).getAsJsonObject();
        assertEquals("END_OF_INPUT", last.get("kind").getAsString());
        assertEquals(9, last.get("column").getAsInt());
    }

    @Test
    void colorizesTokensAndKeepsTrivia() {
        var code = "sync x; // done";
        var out = Highlighter.colorize(code, Scanner.scan(code));

        assertEquals(
            ANSI_PURPLE + "sync" + ANSI_RESET + " "
                + ANSI_WHITE + "x" + ANSI_RESET
                + ANSI_CYAN + ";" + ANSI_RESET
                + " // done",
            out
        );
    }

    @Test
    void colorizesErrors() {
        var code = "1 @";
        var report = new Scanner(code).tokenizeRecovering();
        var out = Highlighter.colorize(code, report.tokens(), report.errors());

        assertEquals(ANSI_GREEN + "1" + ANSI_RESET + " " + ANSI_RED_BACK + "@" + ANSI_RESET, out);
    }

    @Test
    void stripsColorsToSource() {
        var code = "fn f(a) {\n  jnz a; // loop\n}\n";
        var out = Highlighter.colorize(code, Scanner.scan(code));

        assertEquals(code, out.replaceAll("\u001B\\[[0-9;]*m", ""));
    }
}
