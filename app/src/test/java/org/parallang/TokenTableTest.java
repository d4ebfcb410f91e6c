package org.parallang;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import static org.junit.jupiter.api.Assertions.*;

import au.com.origin.snapshots.Expect;
import au.com.origin.snapshots.junit5.SnapshotExtension;

import java.util.List;

@ExtendWith({SnapshotExtension.class})
class TokenTableTest {
    private Expect expect;

    @Test
    void formatsProgram() {
        var code = "spawn worker(n);\nsync;\nx = n * 10;";
        var formattedTable = TokenTable.format(Scanner.scan(code));

        expect.toMatchSnapshot(formattedTable);
    }

    @Test
    void repeatedNamesShareAnIndex() {
        var table = TokenTable.format(Scanner.scan("a b a 1 2 1"));
        var rows = table.split("\n");

        // header, rule, six tokens, end of input, rule
        assertEquals(10, rows.length);
        assertTrue(rows[4].startsWith("3       a               ident                1 "));
        assertTrue(rows[7].startsWith("6       1               int_const            1 "));
        assertTrue(rows[6].startsWith("5       2               int_const            2 "));
    }

    @Test
    void everyKindHasACategory() {
        for (var kind : TokenKind.values()) {
            assertFalse(TokenTable.category(kind).isEmpty(), kind.name());
        }
        assertEquals("keyword", TokenTable.category(TokenKind.BARRIER));
        assertEquals("eof", TokenTable.category(TokenKind.END_OF_INPUT));
    }

    @Test
    void emptyInputHasOnlyEndRow() {
        var rows = TokenTable.format(List.of(new Token(TokenKind.END_OF_INPUT, "", Position.START))).split("\n");
        assertEquals(4, rows.length);
        assertTrue(rows[2].contains("eof"));
    }
}
