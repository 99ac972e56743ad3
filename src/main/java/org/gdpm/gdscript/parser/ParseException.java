package org.gdpm.gdscript.parser;

import org.gdpm.gdscript.error.Diagnostic;
import org.gdpm.gdscript.error.ParseError;

/**
 * Script text that does not conform to the grammar.
 */
public final class ParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient ParseError error;
    private final String source;

    public ParseException(ParseError error, String source) {
        super(error.message());
        this.error = error;
        this.source = source;
    }

    public ParseError error() {
        return error;
    }

    public String source() {
        return source;
    }

    public Diagnostic diagnostic() {
        return Diagnostic.of(error);
    }

    /**
     * Rust-style report with a source excerpt, labelled with {@code filename}.
     */
    public String format(String filename) {
        return diagnostic().format(source, filename);
    }
}
