package org.parallang;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {
    @Test
    void locatesOffsets() {
        var index = new LineIndex("ab\ncd\n\nef");

        assertEquals(4, index.lineCount());
        assertEquals(new Position(0, 1, 1), index.locate(0));
        assertEquals(new Position(2, 1, 3), index.locate(2));
        assertEquals(new Position(3, 2, 1), index.locate(3));
        assertEquals(new Position(6, 3, 1), index.locate(6));
        assertEquals(new Position(9, 4, 3), index.locate(9));
        assertThrows(IndexOutOfBoundsException.class, () -> index.locate(10));
    }

    @Test
    void lineTextDropsTerminators() {
        var index = new LineIndex("one\r\ntwo\n\nfour");

        assertEquals("one", index.lineText(1));
        assertEquals("two", index.lineText(2));
        assertEquals("", index.lineText(3));
        assertEquals("four", index.lineText(4));
        assertThrows(IndexOutOfBoundsException.class, () -> index.lineText(5));
    }

    @Test
    void agreesWithScannerPositions() {
        var code = "fn f(a) {\r\n\tjz a;  // skip\n  jump f;\n}\n\nspawn f(😀1);";
        var index = new LineIndex(code);

        var report = new Scanner(code).tokenizeRecovering();
        for (var token : report.tokens()) {
            assertEquals(token.position(), index.locate(token.position().offset()), token.toString());
        }
        assertEquals(1, report.errors().size());
        var error = report.errors().get(0);
        assertEquals(error.position(), index.locate(error.position().offset()));
    }
}
