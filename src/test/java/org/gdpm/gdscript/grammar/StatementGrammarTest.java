package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.BinOp;
import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.Condition;
import org.gdpm.gdscript.tree.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.gdpm.gdscript.tree.Expr.attr;
import static org.gdpm.gdscript.tree.Expr.binary;
import static org.gdpm.gdscript.tree.Expr.index;
import static org.gdpm.gdscript.tree.Value.call;
import static org.gdpm.gdscript.tree.Value.ident;
import static org.gdpm.gdscript.tree.Value.integer;
import static org.junit.jupiter.api.Assertions.*;

class StatementGrammarTest {

    private ParsingContext ctx;

    private ParseResult<Stmt> stmt(String input) {
        ctx = ParsingContext.create(input);
        return ScriptGrammar.create(ctx).statements().stmt(0);
    }

    private Stmt parsed(String input) {
        var result = stmt(input);
        assertTrue(result.isSuccess(), () -> "failed to parse:\n" + input + "\n" + ctx.error().message());
        return result.unwrap();
    }

    // === If Tests ===

    @Test
    void if_withIndentedBody_parses() {
        var expected = new Stmt.If(Condition.of(integer(123456), ident("hello")), List.of(), Optional.empty());

        assertEquals(expected, parsed("if 123456:\n    hello"));
        assertEquals("", ctx.remainingInput());
    }

    @Test
    void if_bodyNotIndented_fails() {
        assertTrue(stmt("if 123456:\nhello").isFailure());
    }

    @Test
    void if_withElifAndElse_parses() {
        var result = (Stmt.If) parsed("""
            if a:
                pass
            elif b:
                pass
            elif c:
                pass
            else:
                pass
            """);

        assertEquals(ident("a"), result.branch().expr());
        assertEquals(2, result.elifBranches().size());
        assertEquals(ident("c"), result.elifBranches().get(1).expr());
        assertEquals(Optional.of(Block.of(new Stmt.Pass())), result.elseBlock());
    }

    @Test
    void if_misalignedElse_isLeftUnparsed() {
        var result = (Stmt.If) parsed("if a:\n    pass\n  else:\n    pass\n");

        assertTrue(result.elseBlock().isEmpty());
        assertTrue(ctx.remainingInput().startsWith("  else"));
    }

    @Test
    void if_bodyMayFollowBlankAndCommentLines() {
        var result = (Stmt.If) parsed("if a: # check\n\n  # note\n    pass\n");

        assertEquals(Block.of(new Stmt.Pass()), result.branch().block());
    }

    @Test
    void if_keywordPrefixIsNotKeyword() {
        var result = stmt("iffy = 1");

        assertInstanceOf(Stmt.Assign.class, result.unwrap());
    }

    // === Loop Tests ===

    @Test
    void while_parsesConditionAndBody() {
        var expected = new Stmt.While(Condition.of(binary(ident("x"), BinOp.LT, integer(10)),
                                                   new Stmt.Assign(ident("x"), Stmt.AssignOp.ADD_ASSIGN, integer(1))));

        assertEquals(expected, parsed("while x < 10:\n    x += 1\n"));
    }

    @Test
    void for_conditionIsInExpression() {
        var expected = new Stmt.For(Condition.of(binary(ident("x"), BinOp.IN, ident("array")),
                                                 call("print", ident("x"))));

        assertEquals(expected, parsed("for x in array:\n    print(x)\n"));
    }

    // === Match Tests ===

    @Test
    void match_collectsCasesAtCaseIndentation() {
        var expected = new Stmt.Match(ident("x"), List.of(
            Condition.of(integer(1), new Stmt.Pass()),
            Condition.of(ident("_"), new Stmt.Return(Optional.empty()))));

        assertEquals(expected, parsed("""
            match x:
                1:
                    pass

                _:
                    return
            """));
    }

    @Test
    void match_withoutCases_fails() {
        assertTrue(stmt("match x:\npass\n").isFailure());
    }

    // === Simple Statement Tests ===

    @Test
    void return_withValue() {
        assertEquals(new Stmt.Return(Optional.of(binary(ident("a"), BinOp.ADD, integer(1)))),
                     parsed("return a + 1"));
    }

    @Test
    void return_bare() {
        assertEquals(new Stmt.Return(Optional.empty()), parsed("return\n"));
        assertEquals("\n", ctx.remainingInput());
    }

    @Test
    void pass_parses() {
        assertEquals(new Stmt.Pass(), parsed("pass"));
    }

    // === Assignment Tests ===

    @Test
    void assign_toAttribute() {
        assertEquals(new Stmt.Assign(attr(ident("self"), ident("health")), Stmt.AssignOp.SUB_ASSIGN, ident("damage")),
                     parsed("self.health -= damage"));
    }

    @Test
    void assign_toSubscript() {
        assertEquals(new Stmt.Assign(index(ident("a"), integer(0)), Stmt.AssignOp.ASSIGN, integer(1)),
                     parsed("a[0] = 1"));
    }

    @Test
    void assign_allOperators() {
        assertEquals(Stmt.AssignOp.MUL_ASSIGN, ((Stmt.Assign) parsed("v *= 2")).op());
        assertEquals(Stmt.AssignOp.DIV_ASSIGN, ((Stmt.Assign) parsed("v /= 2")).op());
        assertEquals(Stmt.AssignOp.MOD_ASSIGN, ((Stmt.Assign) parsed("v %= 2")).op());
    }

    @Test
    void assign_toNonTarget_fails() {
        assertTrue(stmt("1 = 2").isFailure());
        assertTrue(stmt("a + b = 3").isFailure());
    }

    @Test
    void comparison_isNotAssignment() {
        assertTrue(stmt("a == b").isFailure());
    }
}
