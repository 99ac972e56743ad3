package org.gdpm.gdscript.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Renders syntax trees as indented, field-labelled text for inspection.
 *
 * <pre>
 * Block {
 *     lines: [
 *         Decl.ClassName {
 *             name: "Player",
 *         },
 *     ],
 * }
 * </pre>
 *
 * <p>Operator chains print flat: the first operand as {@code left}, then one {@code op} and
 * {@code right} pair per link. Attribute chains group to the right ({@code a.b.c} is
 * {@code a.(b.c)}), every other chain groups to the left ({@code 1 + 2 - 3} is
 * {@code (1 + 2) - 3}). Long chains therefore render without deep recursion.
 */
public final class TreePrinter {
    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int depth;

    private TreePrinter() {}

    public static String render(Block block) {
        var printer = new TreePrinter();
        printer.block(block);
        return printer.sb.toString();
    }

    public static String render(Line line) {
        var printer = new TreePrinter();
        printer.line(line);
        return printer.sb.toString();
    }

    // === Structure ===

    private void block(Block block) {
        open("Block");
        field("lines", () -> list(block.lines(), this::line));
        close();
    }

    private void condition(Condition condition) {
        open("Condition");
        field("expr", () -> expr(condition.expr()));
        field("block", () -> block(condition.block()));
        close();
    }

    private void typeName(TypeName type) {
        open("TypeName");
        field("name", () -> text(type.name()));
        close();
    }

    private void line(Line line) {
        if (line instanceof Decl decl) {
            decl(decl);
        } else if (line instanceof Stmt stmt) {
            stmt(stmt);
        } else if (line instanceof Expr expr) {
            expr(expr);
        } else {
            var comment = (Line.Comment) line;
            open("Line.Comment");
            field("text", () -> text(comment.text()));
            close();
        }
    }

    // === Declarations ===

    private void decl(Decl decl) {
        if (decl instanceof Decl.Var variable) {
            open("Decl.Var");
            field("modifier", () -> optional(variable.modifier(), this::constant));
            field("name", () -> text(variable.name()));
            field("inferred", () -> sb.append(variable.inferred()));
            field("type", () -> optional(variable.type(), this::typeName));
            field("value", () -> optional(variable.value(), this::expr));
            field("setter", () -> optional(variable.setter(), this::text));
            field("getter", () -> optional(variable.getter(), this::text));
            close();
        } else if (decl instanceof Decl.Const constDecl) {
            open("Decl.Const");
            field("name", () -> text(constDecl.name()));
            field("inferred", () -> sb.append(constDecl.inferred()));
            field("type", () -> optional(constDecl.type(), this::typeName));
            field("value", () -> expr(constDecl.value()));
            close();
        } else if (decl instanceof Decl.Extends extend) {
            open("Decl.Extends");
            field("target", () -> expr(extend.target()));
            close();
        } else if (decl instanceof Decl.ClassName className) {
            open("Decl.ClassName");
            field("name", () -> text(className.name()));
            close();
        } else if (decl instanceof Decl.Enum enumeration) {
            open("Decl.Enum");
            field("name", () -> text(enumeration.name()));
            field("variants", () -> list(enumeration.variants(), this::enumVariant));
            close();
        } else if (decl instanceof Decl.Signal signal) {
            open("Decl.Signal");
            field("name", () -> text(signal.name()));
            field("params", () -> list(signal.params(), this::text));
            close();
        } else if (decl instanceof Decl.Function function) {
            open("Decl.Function");
            field("modifier", () -> optional(function.modifier(), this::constant));
            field("name", () -> text(function.name()));
            field("args", () -> list(function.args(), this::functionArg));
            field("returnType", () -> optional(function.returnType(), this::typeName));
            field("body", () -> block(function.body()));
            close();
        } else {
            var inner = (Decl.Class) decl;
            open("Decl.Class");
            field("name", () -> text(inner.name()));
            field("body", () -> block(inner.body()));
            close();
        }
    }

    private void enumVariant(Decl.EnumVariant variant) {
        open("Decl.EnumVariant");
        field("name", () -> text(variant.name()));
        field("value", () -> optional(variant.value(), this::expr));
        close();
    }

    private void functionArg(Decl.FunctionArg arg) {
        open("Decl.FunctionArg");
        field("name", () -> text(arg.name()));
        field("type", () -> optional(arg.type(), this::typeName));
        field("defaultValue", () -> optional(arg.defaultValue(), this::expr));
        close();
    }

    // === Statements ===

    private void stmt(Stmt stmt) {
        if (stmt instanceof Stmt.If ifStmt) {
            open("Stmt.If");
            field("branch", () -> condition(ifStmt.branch()));
            field("elifBranches", () -> list(ifStmt.elifBranches(), this::condition));
            field("elseBlock", () -> optional(ifStmt.elseBlock(), this::block));
            close();
        } else if (stmt instanceof Stmt.While whileStmt) {
            open("Stmt.While");
            field("loop", () -> condition(whileStmt.loop()));
            close();
        } else if (stmt instanceof Stmt.For forStmt) {
            open("Stmt.For");
            field("loop", () -> condition(forStmt.loop()));
            close();
        } else if (stmt instanceof Stmt.Match match) {
            open("Stmt.Match");
            field("subject", () -> expr(match.subject()));
            field("cases", () -> list(match.cases(), this::condition));
            close();
        } else if (stmt instanceof Stmt.Assign assign) {
            open("Stmt.Assign");
            field("target", () -> expr(assign.target()));
            field("op", () -> constant(assign.op()));
            field("value", () -> expr(assign.value()));
            close();
        } else if (stmt instanceof Stmt.Return ret) {
            open("Stmt.Return");
            field("value", () -> optional(ret.value(), this::expr));
            close();
        } else {
            sb.append("Stmt.Pass");
        }
    }

    // === Expressions ===

    private void expr(Expr expr) {
        if (expr instanceof Value value) {
            value(value);
        } else if (expr instanceof Expr.Binary binary) {
            binary(binary);
        } else {
            var unary = (Expr.Unary) expr;
            open("Expr.Unary");
            field("op", () -> constant(unary.op()));
            field("operand", () -> expr(unary.operand()));
            close();
        }
    }

    private void binary(Expr.Binary binary) {
        var operands = new ArrayList<Expr>();
        var ops = new ArrayList<BinOp>();
        Expr node = binary;
        if (binary.op() == BinOp.ATTR) {
            while (node instanceof Expr.Binary link && link.op() == BinOp.ATTR) {
                operands.add(link.left());
                ops.add(link.op());
                node = link.right();
            }
            operands.add(node);
        } else {
            while (node instanceof Expr.Binary link && link.op() != BinOp.ATTR) {
                operands.add(link.right());
                ops.add(link.op());
                node = link.left();
            }
            operands.add(node);
            Collections.reverse(operands);
            Collections.reverse(ops);
        }
        open("Expr.Binary");
        field("left", () -> expr(operands.get(0)));
        for (int i = 0; i < ops.size(); i++) {
            var op = ops.get(i);
            var right = operands.get(i + 1);
            field("op", () -> constant(op));
            field("right", () -> expr(right));
        }
        close();
    }

    private void value(Value value) {
        if (value instanceof Value.NullLit) {
            sb.append("Value.NullLit");
        } else if (value instanceof Value.BoolLit bool) {
            open("Value.BoolLit");
            field("value", () -> sb.append(bool.value()));
            close();
        } else if (value instanceof Value.IntLit integer) {
            open("Value.IntLit");
            field("value", () -> sb.append(integer.value()));
            close();
        } else if (value instanceof Value.FloatLit floating) {
            open("Value.FloatLit");
            field("value", () -> sb.append(floating.value()));
            close();
        } else if (value instanceof Value.StringLit string) {
            open("Value.StringLit");
            field("raw", () -> text(string.raw()));
            close();
        } else if (value instanceof Value.NodePathLit path) {
            open("Value.NodePathLit");
            field("raw", () -> text(path.raw()));
            close();
        } else if (value instanceof Value.ArrayLit array) {
            open("Value.ArrayLit");
            field("elements", () -> list(array.elements(), this::expr));
            close();
        } else if (value instanceof Value.ObjectLit object) {
            open("Value.ObjectLit");
            field("pairs", () -> list(object.pairs(), this::pair));
            close();
        } else if (value instanceof Value.Ident ident) {
            open("Value.Ident");
            field("name", () -> text(ident.name()));
            close();
        } else {
            var call = (Value.FunctionCall) value;
            open("Value.FunctionCall");
            field("name", () -> text(call.name()));
            field("args", () -> list(call.args(), this::expr));
            close();
        }
    }

    private void pair(Value.Pair pair) {
        open("Value.Pair");
        field("key", () -> expr(pair.key()));
        field("value", () -> expr(pair.value()));
        close();
    }

    // === Formatting ===

    private void open(String type) {
        sb.append(type).append(" {\n");
        depth++;
    }

    private void field(String name, Runnable value) {
        indent();
        sb.append(name).append(": ");
        value.run();
        sb.append(",\n");
    }

    private void close() {
        depth--;
        indent();
        sb.append('}');
    }

    private <T> void list(List<T> items, Consumer<T> element) {
        if (items.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append("[\n");
        depth++;
        for (var item : items) {
            indent();
            element.accept(item);
            sb.append(",\n");
        }
        depth--;
        indent();
        sb.append(']');
    }

    private <T> void optional(Optional<T> item, Consumer<T> element) {
        if (item.isEmpty()) {
            sb.append("None");
            return;
        }
        sb.append("Some(");
        element.accept(item.get());
        sb.append(')');
    }

    private void text(String text) {
        sb.append('"').append(text).append('"');
    }

    private void constant(Enum<?> constant) {
        sb.append(constant.name());
    }

    private void indent() {
        sb.append(INDENT.repeat(depth));
    }
}
