package org.gdpm.gdscript.error;

import org.gdpm.gdscript.tree.SourceLocation;
import org.gdpm.gdscript.tree.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final List<ContextFrame> TRACE = List.of(
        ContextFrame.at("function_decl", SourceLocation.at(1, 1, 0)),
        ContextFrame.at("indented_block", SourceLocation.at(1, 15, 14)));

    // === ParseError Tests ===

    @Test
    void message_listsTraceInnermostFirst() {
        var error = new ParseError.UnexpectedInput(SourceLocation.at(2, 1, 15), "k", "more indentation", TRACE);

        assertEquals("""
            Unexpected 'k' at 2:1, expected more indentation
              while parsing indented_block at 1:15
              while parsing function_decl at 1:1""", error.message());
        assertEquals("indented_block", error.innermostRule());
    }

    @Test
    void summary_describesEachErrorKind() {
        var eof = new ParseError.UnexpectedEof(SourceLocation.at(1, 5, 4), "':'", List.of());
        var deep = new ParseError.NestingTooDeep(SourceLocation.at(1, 9, 8), 8, List.of());

        assertEquals("Unexpected end of input at 1:5, expected ':'", eof.summary());
        assertEquals("Nesting deeper than 8 levels at 1:9", deep.summary());
        assertEquals("", deep.innermostRule());
    }

    // === Diagnostic Tests ===

    @Test
    void of_labelsExpectationAndAddsTraceNotes() {
        var error = new ParseError.UnexpectedInput(SourceLocation.at(2, 1, 15), "k", "more indentation", TRACE);

        var diagnostic = Diagnostic.of(error);

        assertEquals("expected more indentation", diagnostic.label());
        assertEquals(List.of("while parsing indented_block at 1:15", "while parsing function_decl at 1:1"),
                     diagnostic.notes());
    }

    @Test
    void format_showsExcerptWithCaret() {
        var source = "func _ready():\nkill()\n";
        var error = new ParseError.UnexpectedInput(SourceLocation.at(2, 1, 15), "k", "more indentation", TRACE);

        var formatted = Diagnostic.of(error).format(source, "player.gd");

        assertEquals("""
            error: Unexpected 'k' at 2:1, expected more indentation
              --> player.gd:2:1
              |
            1 | func _ready():
            2 | kill()
              | ^ expected more indentation
              |
              = while parsing indented_block at 1:15
              = while parsing function_decl at 1:1
            """, formatted);
    }

    @Test
    void format_underlinesSpanColumns() {
        var span = SourceSpan.of(SourceLocation.at(1, 5, 4), SourceLocation.at(1, 8, 7));

        var formatted = Diagnostic.error("bad name", span).withNote("see the naming guide").format("var foo = 1", null);

        assertTrue(formatted.contains("  --> 1:5\n"));
        assertTrue(formatted.contains("1 | var foo = 1\n  |     ^^^\n"));
        assertTrue(formatted.contains("= see the naming guide"));
    }
}
