package org.gdpm.gdscript.error;

import org.gdpm.gdscript.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of a parse error against its script source.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected 'k' at 4:1, expected more indentation
 *   --> player.gd:4:1
 *    |
 *  3 | func _ready():
 *  4 | kill()
 *    | ^ expected more indentation
 *    |
 *    = while parsing indented_block at 4:1
 *    = while parsing function_decl at 3:1
 * </pre>
 *
 * @param message primary message
 * @param span    span underlined in the excerpt
 * @param label   text shown after the underline, may be empty
 * @param notes   trailing notes, one per line
 */
public record Diagnostic(String message, SourceSpan span, String label, List<String> notes) {

    private static final int CONTEXT_LINES = 1;

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, "", List.of());
    }

    /**
     * Diagnostic for a parse error: the underline carries the expectation and the notes carry
     * the rule trace, innermost first.
     */
    public static Diagnostic of(ParseError error) {
        var diagnostic = error(error.summary(), SourceSpan.at(error.location()));
        if (error instanceof ParseError.UnexpectedInput input) {
            diagnostic = diagnostic.withLabel("expected " + input.expected());
        } else if (error instanceof ParseError.UnexpectedEof eof) {
            diagnostic = diagnostic.withLabel("expected " + eof.expected());
        }
        var trace = error.trace();
        for (int i = trace.size() - 1; i >= 0; i--) {
            diagnostic = diagnostic.withNote("while parsing " + trace.get(i));
        }
        return diagnostic;
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(message, span, label, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, label, newNotes);
    }

    /**
     * Format the diagnostic with a source excerpt.
     *
     * @param source   script text the span refers to
     * @param filename file name shown in the location line, or null
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int firstLine = Math.max(1, loc.line() - CONTEXT_LINES);
        int lastLine = Math.min(lines.length, loc.line());
        int gutterWidth = String.valueOf(Math.max(lastLine, 1)).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        for (int lineNum = firstLine; lineNum <= lastLine; lineNum++) {
            var content = stripCarriageReturn(lines[lineNum - 1]);
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(content).append("\n");
            if (lineNum == loc.line()) {
                sb.append(gutter).append("| ").append(underline(content)).append("\n");
            }
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private String underline(String content) {
        int startCol = span.start().column();
        int endCol = span.isSingleLine() ? span.end().column() : content.length() + 1;
        var sb = new StringBuilder(" ".repeat(Math.max(0, startCol - 1)));
        sb.append("^".repeat(Math.max(1, endCol - startCol)));
        if (!label.isEmpty()) {
            sb.append(" ").append(label);
        }
        return sb.toString();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
