package org.gdpm.gdscript.tree;

/**
 * Guard expression with the block it controls: if/elif branches, loops and match cases.
 */
public record Condition(Expr expr, Block block) {

    public static Condition of(Expr expr, Line... lines) {
        return new Condition(expr, Block.of(lines));
    }
}
