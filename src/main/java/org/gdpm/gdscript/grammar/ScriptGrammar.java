package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.Expr;

import java.util.List;

/**
 * The GDScript grammar over one parsing context. Expression, statement, declaration and
 * block rules are mutually recursive and reach each other through this object.
 */
public final class ScriptGrammar {
    private final ParsingContext ctx;
    private final BaseGrammar base;
    private final ExpressionGrammar expressions;
    private final StatementGrammar statements;
    private final DeclarationGrammar declarations;
    private final BlockGrammar blocks;

    private ScriptGrammar(ParsingContext ctx) {
        this.ctx = ctx;
        this.base = new BaseGrammar(ctx);
        this.expressions = new ExpressionGrammar(ctx, base);
        this.statements = new StatementGrammar(ctx, this);
        this.declarations = new DeclarationGrammar(ctx, this);
        this.blocks = new BlockGrammar(ctx, this);
    }

    public static ScriptGrammar create(ParsingContext ctx) {
        return new ScriptGrammar(ctx);
    }

    /**
     * Whole script: a block at indentation 0, then nothing but blank or comment lines.
     * A script without any line yields an empty block.
     */
    public ParseResult<Block> file() {
        return ctx.rule("file", () -> {
            var start = ctx.location();
            base.skipEmptyLines();
            if (ctx.isAtEnd()) {
                return ctx.success(new Block(List.of()));
            }
            ctx.restoreLocation(start);
            var block = blocks.block(0);
            if (block.isFailure()) {
                return block;
            }
            base.skipEmptyLines();
            if (!ctx.isAtEnd()) {
                return ctx.failure("end of input");
            }
            return block;
        });
    }

    /**
     * A single expression spanning the whole input, surrounding blank space allowed.
     */
    public ParseResult<Expr> wholeExpression() {
        return ctx.rule("expression", () -> {
            var expr = expressions.expr();
            if (expr.isFailure()) {
                return expr;
            }
            base.wsl();
            if (!ctx.isAtEnd()) {
                return ctx.failure("end of input");
            }
            return ctx.success(expr.unwrap());
        });
    }

    public ParsingContext context() {
        return ctx;
    }

    public BaseGrammar base() {
        return base;
    }

    public ExpressionGrammar expressions() {
        return expressions;
    }

    public StatementGrammar statements() {
        return statements;
    }

    public DeclarationGrammar declarations() {
        return declarations;
    }

    public BlockGrammar blocks() {
        return blocks;
    }
}
