package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.BinOp;
import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.Decl;
import org.gdpm.gdscript.tree.Stmt;
import org.gdpm.gdscript.tree.TypeName;
import org.gdpm.gdscript.tree.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.gdpm.gdscript.tree.Expr.binary;
import static org.gdpm.gdscript.tree.Value.ident;
import static org.gdpm.gdscript.tree.Value.integer;
import static org.junit.jupiter.api.Assertions.*;

class DeclarationGrammarTest {

    private ParsingContext ctx;

    private ParseResult<Decl> decl(String input) {
        ctx = ParsingContext.create(input);
        return ScriptGrammar.create(ctx).declarations().decl(0);
    }

    private Decl parsed(String input) {
        var result = decl(input);
        assertTrue(result.isSuccess(), () -> "failed to parse:\n" + input + "\n" + ctx.error().message());
        return result.unwrap();
    }

    private Decl.Var var(String input) {
        return assertInstanceOf(Decl.Var.class, parsed(input));
    }

    // === Variable Tests ===

    @Test
    void var_bare() {
        var expected = new Decl.Var(Optional.empty(), "x", false, Optional.empty(), Optional.empty(),
                                    Optional.empty(), Optional.empty());

        assertEquals(expected, parsed("var x"));
    }

    @Test
    void var_inferred() {
        var result = var("var x := 5");

        assertTrue(result.inferred());
        assertEquals(Optional.of(integer(5)), result.value());
        assertTrue(result.type().isEmpty());
    }

    @Test
    void var_typedWithValue() {
        var result = var("var x: int = 5");

        assertFalse(result.inferred());
        assertEquals(Optional.of(TypeName.of("int")), result.type());
        assertEquals(Optional.of(integer(5)), result.value());
    }

    @Test
    void var_exportWithSetterAndGetter() {
        var expected = new Decl.Var(Optional.of(Decl.VarModifier.EXPORT), "speed", false,
                                    Optional.of(TypeName.of("float")), Optional.of(Value.floating(10.0)),
                                    Optional.of("set_speed"), Optional.of("get_speed"));

        assertEquals(expected, parsed("export var speed: float = 10.0 setget set_speed, get_speed"));
    }

    @Test
    void var_onready() {
        var result = var("onready var sprite = $Sprite");

        assertEquals(Optional.of(Decl.VarModifier.ONREADY), result.modifier());
        assertEquals(Optional.of(Value.nodePath("$Sprite")), result.value());
    }

    @Test
    void var_setterOnly() {
        var result = var("var health = 100 setget set_health");

        assertEquals(Optional.of("set_health"), result.setter());
        assertTrue(result.getter().isEmpty());
    }

    @Test
    void var_getterOnly() {
        var result = var("var health setget , get_health");

        assertTrue(result.setter().isEmpty());
        assertEquals(Optional.of("get_health"), result.getter());
    }

    @Test
    void var_keywordNeedsBoundary() {
        assertTrue(decl("variable = 1").isFailure());
    }

    // === Constant Tests ===

    @Test
    void const_inferred() {
        assertEquals(new Decl.Const("MAX", true, Optional.empty(), integer(10)), parsed("const MAX := 10"));
    }

    @Test
    void const_typed() {
        assertEquals(new Decl.Const("MAX", false, Optional.of(TypeName.of("int")), integer(10)),
                     parsed("const MAX: int = 10"));
    }

    @Test
    void const_withoutValue_fails() {
        assertTrue(decl("const MAX").isFailure());
    }

    // === Script Header Tests ===

    @Test
    void extends_className() {
        assertEquals(new Decl.Extends(ident("Node2D")), parsed("extends Node2D"));
    }

    @Test
    void extends_dottedClassName() {
        assertEquals(new Decl.Extends(ident("Inventory.Item")), parsed("extends Inventory.Item"));
    }

    @Test
    void extends_scriptPath() {
        assertEquals(new Decl.Extends(Value.string("res://base.gd")), parsed("extends \"res://base.gd\""));
    }

    @Test
    void className_parses() {
        assertEquals(new Decl.ClassName("Player"), parsed("class_name Player"));
    }

    // === Signal and Enum Tests ===

    @Test
    void signal_withoutParameters() {
        assertEquals(new Decl.Signal("hit", List.of()), parsed("signal hit"));
    }

    @Test
    void signal_withParameters() {
        assertEquals(new Decl.Signal("health_changed", List.of("old_value", "new_value")),
                     parsed("signal health_changed(old_value, new_value)"));
    }

    @Test
    void enum_variantsWithValues() {
        var expected = new Decl.Enum("State", List.of(
            new Decl.EnumVariant("IDLE", Optional.empty()),
            new Decl.EnumVariant("RUN", Optional.of(integer(2))),
            new Decl.EnumVariant("JUMP", Optional.empty())));

        assertEquals(expected, parsed("enum State {IDLE, RUN = 2, JUMP,}"));
    }

    @Test
    void enum_spanningLines() {
        var result = assertInstanceOf(Decl.Enum.class, parsed("""
            enum Dir {
                UP,
                DOWN = 4,
            }"""));

        assertEquals(2, result.variants().size());
        assertEquals(Optional.of(integer(4)), result.variants().get(1).value());
    }

    // === Function Tests ===

    @Test
    void function_withModifierArgsAndReturnType() {
        var expected = new Decl.Function(
            Optional.of(Decl.FunctionModifier.STATIC),
            "add",
            List.of(new Decl.FunctionArg("a", Optional.of(TypeName.of("int")), Optional.empty()),
                    new Decl.FunctionArg("b", Optional.of(TypeName.of("int")), Optional.of(integer(2)))),
            Optional.of(TypeName.of("int")),
            Block.of(new Stmt.Return(Optional.of(binary(ident("a"), BinOp.ADD, ident("b"))))));

        assertEquals(expected, parsed("static func add(a: int, b: int = 2) -> int:\n    return a + b\n"));
    }

    @Test
    void function_withoutArgs() {
        var result = assertInstanceOf(Decl.Function.class, parsed("func _ready():\n    pass\n"));

        assertTrue(result.modifier().isEmpty());
        assertTrue(result.args().isEmpty());
        assertTrue(result.returnType().isEmpty());
        assertEquals(Block.of(new Stmt.Pass()), result.body());
    }

    @Test
    void function_inferredDefaultArgument() {
        var result = assertInstanceOf(Decl.Function.class, parsed("func f(x := 1):\n    pass\n"));

        assertEquals(new Decl.FunctionArg("x", Optional.empty(), Optional.of(integer(1))), result.args().get(0));
    }

    @Test
    void function_networkModifiers() {
        var remoteSync = assertInstanceOf(Decl.Function.class, parsed("remotesync func sync():\n    pass\n"));
        var remote = assertInstanceOf(Decl.Function.class, parsed("remote func call_me():\n    pass\n"));

        assertEquals(Optional.of(Decl.FunctionModifier.REMOTESYNC), remoteSync.modifier());
        assertEquals(Optional.of(Decl.FunctionModifier.REMOTE), remote.modifier());
    }

    @Test
    void function_withoutBody_fails() {
        assertTrue(decl("func f():\npass\n").isFailure());
    }

    // === Inner Class Tests ===

    @Test
    void class_holdsMembers() {
        var result = assertInstanceOf(Decl.Class.class, parsed("""
            class Inner:
                var x = 1

                func f():
                    pass
            """));

        assertEquals("Inner", result.name());
        assertEquals(2, result.body().size());
        assertInstanceOf(Decl.Var.class, result.body().line(0));
        assertInstanceOf(Decl.Function.class, result.body().line(1));
    }
}
