package org.gdpm.gdscript.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceSpanTest {

    @Test
    void location_after_newlineStartsNextLine() {
        var loc = SourceLocation.at(3, 7, 20);

        assertEquals(SourceLocation.at(4, 1, 21), loc.after('\n'));
        assertEquals(SourceLocation.at(3, 8, 21), loc.after('x'));
        assertEquals("3:7", loc.toString());
    }

    @Test
    void at_coversOneCharacter() {
        var span = SourceSpan.at(SourceLocation.START);

        assertTrue(span.isSingleLine());
        assertEquals(SourceLocation.at(1, 2, 1), span.end());
    }

    @Test
    void isSingleLine_comparesLines() {
        assertTrue(SourceSpan.of(SourceLocation.at(1, 3, 2), SourceLocation.at(1, 10, 9)).isSingleLine());
        assertFalse(SourceSpan.of(SourceLocation.at(1, 3, 2), SourceLocation.at(2, 1, 12)).isSingleLine());
    }
}
