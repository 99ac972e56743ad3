package org.gdpm.gdscript.tree;

import java.util.List;
import java.util.Optional;

/**
 * Control-flow and assignment statements.
 */
public sealed interface Stmt extends Line permits Stmt.If,
                                                  Stmt.While,
                                                  Stmt.For,
                                                  Stmt.Match,
                                                  Stmt.Assign,
                                                  Stmt.Return,
                                                  Stmt.Pass {

    enum AssignOp {
        ASSIGN("="),
        ADD_ASSIGN("+="),
        SUB_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/="),
        MOD_ASSIGN("%=");

        private final String symbol;

        AssignOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    record If(Condition branch, List<Condition> elifBranches, Optional<Block> elseBlock) implements Stmt {
        public If {
            elifBranches = List.copyOf(elifBranches);
        }
    }

    record While(Condition loop) implements Stmt {}

    /**
     * For loop. The condition expression is the {@code IN} binary of loop variable and iterable.
     */
    record For(Condition loop) implements Stmt {}

    record Match(Expr subject, List<Condition> cases) implements Stmt {
        public Match {
            cases = List.copyOf(cases);
        }
    }

    record Assign(Expr target, AssignOp op, Expr value) implements Stmt {}

    record Return(Optional<Expr> value) implements Stmt {}

    record Pass() implements Stmt {}
}
