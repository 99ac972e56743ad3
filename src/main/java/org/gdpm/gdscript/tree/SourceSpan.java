package org.gdpm.gdscript.tree;

/**
 * A range of script text, start inclusive and end exclusive.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    /**
     * Single-character span starting at the location, used to underline an error position.
     */
    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location.after(' '));
    }

    public boolean isSingleLine() {
        return start.line() == end.line();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
