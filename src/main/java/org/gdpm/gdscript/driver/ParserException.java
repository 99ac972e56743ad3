package org.gdpm.gdscript.driver;

/**
 * Checked carrier for {@link ParserError}.
 */
public final class ParserException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient ParserError error;

    public ParserException(ParserError error) {
        super(error.message());
        this.error = error;
    }

    public ParserException(ParserError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ParserError error() {
        return error;
    }
}
