package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.BinOp;
import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.Condition;
import org.gdpm.gdscript.tree.Expr;
import org.gdpm.gdscript.tree.Stmt;
import org.gdpm.gdscript.tree.Value;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Statements. Rules take the indentation of the enclosing block: conditional blocks must be
 * indented deeper, and {@code elif}/{@code else} branches must line up with their {@code if}.
 */
public final class StatementGrammar {
    private final ParsingContext ctx;
    private final ScriptGrammar grammar;

    StatementGrammar(ParsingContext ctx, ScriptGrammar grammar) {
        this.ctx = ctx;
        this.grammar = grammar;
    }

    public ParseResult<Stmt> stmt(int indent) {
        return ctx.rule("stmt", () -> ctx.choice("statement",
                                                 () -> ifStmt(indent),
                                                 () -> whileStmt(indent),
                                                 () -> forStmt(indent),
                                                 () -> matchStmt(indent),
                                                 this::returnStmt,
                                                 this::pass,
                                                 this::assign));
    }

    /**
     * {@code expr:} followed by a block indented deeper than {@code indent}.
     */
    public ParseResult<Condition> condition(int indent) {
        return ctx.rule("condition", () -> {
            var expr = grammar.expressions().expr();
            if (expr.isFailure()) {
                return expr.propagate();
            }
            base().ws();
            var colon = base().literal(":");
            if (colon.isFailure()) {
                return colon.propagate();
            }
            var block = grammar.blocks().indentedBlock(indent);
            if (block.isFailure()) {
                return block.propagate();
            }
            return ctx.success(new Condition(expr.unwrap(), block.unwrap()));
        });
    }

    ParseResult<Stmt> ifStmt(int indent) {
        return ctx.rule("if_stmt", () -> {
            var branch = keywordCondition("if", indent);
            if (branch.isFailure()) {
                return branch.propagate();
            }
            var elifBranches = new ArrayList<Condition>();
            while (true) {
                var elif = ctx.rule("elif_stmt", () -> {
                    var aligned = alignedWith(indent);
                    return aligned.isFailure() ? aligned.<Condition>propagate() : keywordCondition("elif", indent);
                });
                if (elif.isFailure()) {
                    break;
                }
                elifBranches.add(elif.unwrap());
            }
            var elseBlock = elseBranch(indent);
            return ctx.success(new Stmt.If(branch.unwrap(),
                                           elifBranches,
                                           elseBlock.isSuccess() ? Optional.of(elseBlock.unwrap()) : Optional.empty()));
        });
    }

    private ParseResult<Block> elseBranch(int indent) {
        return ctx.rule("else_stmt", () -> {
            var aligned = alignedWith(indent);
            if (aligned.isFailure()) {
                return aligned.propagate();
            }
            var word = base().keyword("else");
            if (word.isFailure()) {
                return word.propagate();
            }
            base().ws();
            var colon = base().literal(":");
            if (colon.isFailure()) {
                return colon.propagate();
            }
            return grammar.blocks().indentedBlock(indent);
        });
    }

    /**
     * Skips blank and comment lines, then consumes exactly {@code indent} spaces.
     */
    private ParseResult<Integer> alignedWith(int indent) {
        base().skipEmptyLines();
        return base().sameIndent(indent);
    }

    ParseResult<Stmt> whileStmt(int indent) {
        return ctx.rule("while_stmt", () -> keywordCondition("while", indent).map(Stmt.While::new));
    }

    /**
     * {@code for x in xs:}; the loop variable and iterable arrive as one {@link BinOp#IN} expression.
     */
    ParseResult<Stmt> forStmt(int indent) {
        return ctx.rule("for_stmt", () -> keywordCondition("for", indent).map(Stmt.For::new));
    }

    private ParseResult<Condition> keywordCondition(String keyword, int indent) {
        var word = base().keyword(keyword);
        if (word.isFailure()) {
            return word.propagate();
        }
        base().ws();
        return condition(indent);
    }

    /**
     * {@code match subject:} then one or more cases, all at one indentation deeper than the match.
     */
    ParseResult<Stmt> matchStmt(int indent) {
        return ctx.rule("match_stmt", () -> {
            var word = base().keyword("match");
            if (word.isFailure()) {
                return word.propagate();
            }
            base().ws();
            var subject = grammar.expressions().expr();
            if (subject.isFailure()) {
                return subject.propagate();
            }
            base().ws();
            var colon = base().literal(":");
            if (colon.isFailure()) {
                return colon.propagate();
            }
            var eol = base().endOfLine();
            if (eol.isFailure()) {
                return eol.propagate();
            }
            var mark = ctx.location();
            base().skipEmptyLines();
            var caseIndent = base().moreIndent(indent);
            if (caseIndent.isFailure()) {
                return caseIndent.propagate();
            }
            ctx.restoreLocation(mark);
            var cases = new ArrayList<Condition>();
            while (true) {
                var matchCase = matchCase(caseIndent.unwrap());
                if (matchCase.isFailure()) {
                    break;
                }
                cases.add(matchCase.unwrap());
            }
            if (cases.isEmpty()) {
                return ctx.failure("match case");
            }
            return ctx.success(new Stmt.Match(subject.unwrap(), cases));
        });
    }

    private ParseResult<Condition> matchCase(int caseIndent) {
        return ctx.rule("match_case", () -> {
            var aligned = alignedWith(caseIndent);
            if (aligned.isFailure()) {
                return aligned.propagate();
            }
            return condition(caseIndent);
        });
    }

    /**
     * {@code return} with an optional value.
     */
    ParseResult<Stmt> returnStmt() {
        return ctx.rule("return_stmt", () -> {
            var word = base().keyword("return");
            if (word.isFailure()) {
                return word.propagate();
            }
            var mark = ctx.location();
            base().ws();
            var value = grammar.expressions().expr();
            if (value.isFailure()) {
                ctx.restoreLocation(mark);
                return ctx.success(new Stmt.Return(Optional.empty()));
            }
            return ctx.success(new Stmt.Return(Optional.of(value.unwrap())));
        });
    }

    ParseResult<Stmt> pass() {
        return ctx.rule("pass", () -> {
            var word = base().keyword("pass");
            return word.isFailure() ? word.propagate() : ctx.success(new Stmt.Pass());
        });
    }

    /**
     * {@code target op value}, where the target is an identifier, attribute chain or subscript.
     */
    ParseResult<Stmt> assign() {
        return ctx.rule("assign_stmt", () -> {
            var target = grammar.expressions().expr();
            if (target.isFailure()) {
                return target.propagate();
            }
            if (!isAssignable(target.unwrap())) {
                return ctx.failure("assignable target");
            }
            base().ws();
            var op = assignOperator();
            if (op.isEmpty()) {
                return ctx.failure("assignment operator");
            }
            base().ws();
            var value = grammar.expressions().expr();
            if (value.isFailure()) {
                return value.propagate();
            }
            return ctx.success(new Stmt.Assign(target.unwrap(), op.get(), value.unwrap()));
        });
    }

    private Optional<Stmt.AssignOp> assignOperator() {
        for (var op : Stmt.AssignOp.values()) {
            if (op == Stmt.AssignOp.ASSIGN) {
                continue;
            }
            if (ctx.consume(op.symbol())) {
                return Optional.of(op);
            }
        }
        if (ctx.peek() == '=' && ctx.peek(1) != '=') {
            ctx.advance();
            return Optional.of(Stmt.AssignOp.ASSIGN);
        }
        return Optional.empty();
    }

    private static boolean isAssignable(Expr target) {
        if (target instanceof Value.Ident) {
            return true;
        }
        return target instanceof Expr.Binary binary
               && (binary.op() == BinOp.ATTR || binary.op() == BinOp.INDEX);
    }

    private BaseGrammar base() {
        return grammar.base();
    }
}
