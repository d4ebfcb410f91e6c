package org.parallang;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {
    @Test
    void pointsAtOffendingColumn() {
        var code = "x = 1 @ 2;";
        var error = assertThrows(ScanException.class, () -> Scanner.scan(code)).error();

        assertEquals(
            "1:7: E101 unexpected symbol '@'\n"
                + "x = 1 @ 2;\n"
                + "      ^",
            Diagnostics.render(code, error)
        );
    }

    @Test
    void keepsTabsInCaretLine() {
        var code = "sync;\n\tbarrier $;\n";
        var error = assertThrows(ScanException.class, () -> Scanner.scan(code)).error();

        assertEquals(
            "2:10: E101 unexpected symbol '$'\n"
                + "\tbarrier $;\n"
                + "\t        ^",
            Diagnostics.render(code, error)
        );
    }

    @Test
    void escapesControlCharacters() {
        var error = new ScanError(0x07, new Position(1, 1, 2));
        assertTrue(Diagnostics.render("a\u0007", error).startsWith("1:2: E101 unexpected symbol '\\u0007'\n"));
    }

    @Test
    void escapesUnpairedSurrogate() {
        var code = "a\uD800b";
        var error = assertThrows(ScanException.class, () -> Scanner.scan(code)).error();

        assertEquals(0xD800, error.codePoint());
        assertEquals("InvalidCharacter(\\uD800, line=1, column=2)", error.toString());
        assertTrue(Diagnostics.render(code, error).startsWith("1:2: E101 unexpected symbol '\\uD800'\n"));
    }
}
