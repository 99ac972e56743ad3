package org.gdpm.gdscript.tree;

/**
 * Expression node. Values are leaves (arrays, objects and calls hold nested expressions),
 * binary and unary nodes are the recursive cases.
 */
public sealed interface Expr extends Line permits Value, Expr.Binary, Expr.Unary {

    record Binary(Expr left, BinOp op, Expr right) implements Expr {}

    record Unary(UnOp op, Expr operand) implements Expr {}

    static Binary binary(Expr left, BinOp op, Expr right) {
        return new Binary(left, op, right);
    }

    static Unary unary(UnOp op, Expr operand) {
        return new Unary(op, operand);
    }

    static Binary attr(Expr owner, Expr member) {
        return new Binary(owner, BinOp.ATTR, member);
    }

    static Binary index(Expr target, Expr subscript) {
        return new Binary(target, BinOp.INDEX, subscript);
    }
}
