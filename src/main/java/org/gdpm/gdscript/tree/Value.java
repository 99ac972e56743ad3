package org.gdpm.gdscript.tree;

import java.util.List;

/**
 * Literal and atomic values.
 *
 * <p>String and node path literals keep their raw source text: escapes are not decoded,
 * and node paths keep the leading {@code $}.
 */
public sealed interface Value extends Expr permits Value.NullLit,
                                                   Value.BoolLit,
                                                   Value.IntLit,
                                                   Value.FloatLit,
                                                   Value.StringLit,
                                                   Value.NodePathLit,
                                                   Value.ArrayLit,
                                                   Value.ObjectLit,
                                                   Value.Ident,
                                                   Value.FunctionCall {

    record NullLit() implements Value {}

    record BoolLit(boolean value) implements Value {}

    record IntLit(long value) implements Value {}

    record FloatLit(double value) implements Value {}

    record StringLit(String raw) implements Value {}

    record NodePathLit(String raw) implements Value {}

    record ArrayLit(List<Expr> elements) implements Value {
        public ArrayLit {
            elements = List.copyOf(elements);
        }
    }

    record ObjectLit(List<Pair> pairs) implements Value {
        public ObjectLit {
            pairs = List.copyOf(pairs);
        }
    }

    record Ident(String name) implements Value {}

    record FunctionCall(String name, List<Expr> args) implements Value {
        public FunctionCall {
            args = List.copyOf(args);
        }
    }

    /**
     * Key/value entry of an object literal.
     */
    record Pair(Expr key, Expr value) {}

    static NullLit nullLit() {
        return new NullLit();
    }

    static BoolLit bool(boolean value) {
        return new BoolLit(value);
    }

    static IntLit integer(long value) {
        return new IntLit(value);
    }

    static FloatLit floating(double value) {
        return new FloatLit(value);
    }

    static StringLit string(String raw) {
        return new StringLit(raw);
    }

    static NodePathLit nodePath(String raw) {
        return new NodePathLit(raw);
    }

    static Ident ident(String name) {
        return new Ident(name);
    }

    static FunctionCall call(String name, Expr... args) {
        return new FunctionCall(name, List.of(args));
    }

    static ArrayLit array(Expr... elements) {
        return new ArrayLit(List.of(elements));
    }
}
