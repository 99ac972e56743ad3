package org.gdpm.gdscript.tree;

/**
 * One logical line of a block: a declaration, a statement, a bare expression or a comment.
 */
public sealed interface Line permits Decl, Stmt, Expr, Line.Comment {

    /**
     * Whole-line comment kept at the indentation of its block. Text excludes the leading '#'.
     */
    record Comment(String text) implements Line {}

    static Comment comment(String text) {
        return new Comment(text);
    }
}
