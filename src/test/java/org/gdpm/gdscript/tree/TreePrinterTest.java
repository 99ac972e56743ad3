package org.gdpm.gdscript.tree;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TreePrinterTest {

    @Test
    void render_recordWithFields() {
        var rendered = TreePrinter.render(Block.of(new Decl.ClassName("Player")));

        assertEquals("""
            Block {
                lines: [
                    Decl.ClassName {
                        name: "Player",
                    },
                ],
            }""", rendered);
    }

    @Test
    void render_emptyRecordAndList() {
        assertEquals("Stmt.Pass", TreePrinter.render(new Stmt.Pass()));
        assertEquals("Block {\n    lines: [],\n}", TreePrinter.render(Block.of()));
    }

    @Test
    void render_optionalsAndEnums() {
        var rendered = TreePrinter.render(new Stmt.Return(Optional.empty()));
        assertTrue(rendered.contains("value: None"));

        var assign = TreePrinter.render(new Stmt.Assign(Value.ident("x"), Stmt.AssignOp.ADD_ASSIGN, Value.integer(1)));
        assertTrue(assign.contains("op: ADD_ASSIGN"));
        assertTrue(assign.contains("value: 1"));
    }

    @Test
    void render_someWrapsValue() {
        var arg = new Decl.FunctionArg("body", Optional.of(TypeName.of("PhysicsBody2D")), Optional.empty());
        var function = new Decl.Function(Optional.empty(), "f", List.of(arg), Optional.empty(), Block.of(new Stmt.Pass()));

        var rendered = TreePrinter.render(function);

        assertTrue(rendered.contains("type: Some(TypeName {"));
        assertTrue(rendered.contains("defaultValue: None"));
        assertTrue(rendered.contains("modifier: None"));
    }

    @Test
    void render_nestedListsIndentPerLevel() {
        var rendered = TreePrinter.render(Block.of(Value.array(Value.integer(1))));

        assertTrue(rendered.contains("\n        Value.ArrayLit {\n            elements: [\n"));
    }

    // === Operator Chain Tests ===

    @Test
    void render_singleBinaryListsLeftOpRight() {
        var rendered = TreePrinter.render(Expr.binary(Value.ident("a"), BinOp.ADD, Value.integer(1)));

        assertEquals("""
            Expr.Binary {
                left: Value.Ident {
                    name: "a",
                },
                op: ADD,
                right: Value.IntLit {
                    value: 1,
                },
            }""", rendered);
    }

    @Test
    void render_leftFoldedChainIsFlat() {
        var sum = Expr.binary(Expr.binary(Value.ident("a"), BinOp.ADD, Value.ident("b")), BinOp.SUB, Value.ident("c"));

        var rendered = TreePrinter.render(sum);

        assertEquals(1, count(rendered, "Expr.Binary {"));
        assertTrue(rendered.indexOf("op: ADD") < rendered.indexOf("op: SUB"));
        assertTrue(rendered.contains("    right: Value.Ident {\n        name: \"c\",\n"));
    }

    @Test
    void render_rightOperandChainStaysNested() {
        var product = Expr.binary(Value.ident("a"), BinOp.MUL, Expr.binary(Value.ident("b"), BinOp.ADD, Value.ident("c")));

        var rendered = TreePrinter.render(product);

        assertEquals(2, count(rendered, "Expr.Binary {"));
        assertTrue(rendered.contains("    right: Expr.Binary {\n"));
    }

    @Test
    void render_attributeChainGroupsRight() {
        var chain = Expr.attr(Value.ident("a"), Expr.attr(Value.ident("b"), Value.ident("c")));

        var rendered = TreePrinter.render(chain);

        assertEquals(1, count(rendered, "Expr.Binary {"));
        assertEquals(2, count(rendered, "op: ATTR"));
    }

    @Test
    void render_longChainDoesNotRecurse() {
        Expr sum = Value.integer(1);
        for (int i = 0; i < 20_000; i++) {
            sum = Expr.binary(sum, BinOp.ADD, Value.integer(1));
        }

        var rendered = TreePrinter.render(sum);

        assertTrue(rendered.startsWith("Expr.Binary {\n    left: Value.IntLit {"));
        assertEquals(20_000, count(rendered, "op: ADD"));
    }

    private static int count(String text, String part) {
        int count = 0;
        for (int i = text.indexOf(part); i >= 0; i = text.indexOf(part, i + part.length())) {
            count++;
        }
        return count;
    }
}
