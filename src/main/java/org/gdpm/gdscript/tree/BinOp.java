package org.gdpm.gdscript.tree;

import java.util.Optional;

/**
 * Binary operators. {@link #ATTR} and {@link #INDEX} are produced by attribute chains and
 * subscripts rather than by an operator symbol.
 */
public enum BinOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    ATTR("."),
    INDEX("[]"),
    AND("&&"),
    OR("||"),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    IS("is"),
    IN("in"),
    AS("as");

    private final String symbol;

    BinOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Operator for a spelled-out symbol; keyword spellings {@code and}/{@code or} map to AND/OR.
     */
    public static Optional<BinOp> fromSymbol(String symbol) {
        if ("and".equals(symbol)) {
            return Optional.of(AND);
        }
        if ("or".equals(symbol)) {
            return Optional.of(OR);
        }
        for (var op : values()) {
            if (op.symbol.equals(symbol) && op != INDEX && op != ATTR) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
