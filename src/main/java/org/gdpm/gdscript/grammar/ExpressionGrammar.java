package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.BinOp;
import org.gdpm.gdscript.tree.Expr;
import org.gdpm.gdscript.tree.UnOp;
import org.gdpm.gdscript.tree.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.gdpm.gdscript.grammar.BaseGrammar.isDigit;
import static org.gdpm.gdscript.grammar.BaseGrammar.isIdentPart;
import static org.gdpm.gdscript.grammar.BaseGrammar.isIdentStart;

/**
 * Expressions by precedence, loosest first:
 * <ol>
 *   <li>logical and relational: {@code && and || or >= <= > < == != is in as}</li>
 *   <li>additive: {@code + -}</li>
 *   <li>multiplicative and bitwise: {@code * / % | & ^}</li>
 *   <li>unary prefix: {@code - + ! not}</li>
 *   <li>subscript: {@code expr[expr]}</li>
 *   <li>parenthesized expression or value</li>
 * </ol>
 * Binary levels fold left. Attribute chains ({@code a.b(c)[0].d}) bind tightest and fold right.
 */
public final class ExpressionGrammar {
    private static final List<String> LOGIC_SYMBOLS = List.of("&&", "||", ">=", "<=", "==", "!=", ">", "<");
    private static final List<String> LOGIC_KEYWORDS = List.of("and", "or", "is", "in", "as");
    private static final List<String> BOOL_KEYWORDS = List.of("true", "True", "false", "False");

    private final ParsingContext ctx;
    private final BaseGrammar base;

    ExpressionGrammar(ParsingContext ctx, BaseGrammar base) {
        this.ctx = ctx;
        this.base = base;
    }

    // === Precedence Levels ===

    public ParseResult<Expr> expr() {
        return ctx.rule("expr", () -> ctx.memoized("expr", () -> ctx.nested(this::logic)));
    }

    ParseResult<Expr> logic() {
        return binaryLevel("expr_logic", this::math, this::logicOperator);
    }

    ParseResult<Expr> math() {
        return binaryLevel("expr_math", this::term, this::mathOperator);
    }

    ParseResult<Expr> term() {
        return binaryLevel("expr_term", this::unary, this::termOperator);
    }

    private ParseResult<Expr> binaryLevel(String label,
                                          Supplier<ParseResult<Expr>> operand,
                                          Supplier<Optional<BinOp>> operator) {
        return ctx.rule(label, () -> {
            var first = operand.get();
            if (first.isFailure()) {
                return first;
            }
            var left = first.unwrap();
            while (true) {
                var mark = ctx.location();
                base.operatorSpace();
                var op = operator.get();
                if (op.isEmpty()) {
                    ctx.restoreLocation(mark);
                    break;
                }
                base.operatorSpace();
                var right = operand.get();
                if (right.isFailure()) {
                    ctx.restoreLocation(mark);
                    break;
                }
                left = Expr.binary(left, op.get(), right.unwrap());
            }
            return ctx.success(left);
        });
    }

    public ParseResult<Expr> unary() {
        return ctx.rule("expr_un", () -> {
            base.ws();
            var op = unaryOperator();
            var operand = index();
            if (operand.isFailure()) {
                return operand;
            }
            return ctx.success(op.<Expr>map(o -> Expr.unary(o, operand.unwrap()))
                                 .orElse(operand.unwrap()));
        });
    }

    ParseResult<Expr> index() {
        return ctx.rule("expr_index", () -> {
            var primary = operation();
            if (primary.isFailure()) {
                return primary;
            }
            var result = primary.unwrap();
            while (ctx.peek() == '[') {
                var subscript = subscript();
                if (subscript.isFailure()) {
                    break;
                }
                result = Expr.index(result, subscript.unwrap());
                base.ws();
            }
            return ctx.success(result);
        });
    }

    ParseResult<Expr> operation() {
        return ctx.rule("expr_operation", () -> {
            base.ws();
            var primary = ctx.peek() == '(' ? parens() : value();
            if (primary.isFailure()) {
                return primary;
            }
            base.ws();
            return primary;
        });
    }

    ParseResult<Expr> parens() {
        return ctx.rule("expr_parens", () -> {
            var open = base.literal("(");
            if (open.isFailure()) {
                return open.propagate();
            }
            var inner = ctx.bracketed(() -> {
                base.wsl();
                var expr = expr();
                if (expr.isFailure()) {
                    return expr;
                }
                base.wsl();
                var close = base.literal(")");
                return close.isFailure() ? close.<Expr>propagate() : expr;
            });
            if (inner.isFailure()) {
                return inner;
            }
            return ctx.success(chain(inner.unwrap()));
        });
    }

    private ParseResult<Expr> subscript() {
        return ctx.rule("subscript", () -> {
            var open = base.literal("[");
            if (open.isFailure()) {
                return open.propagate();
            }
            return ctx.bracketed(() -> {
                base.wsl();
                var expr = expr();
                if (expr.isFailure()) {
                    return expr;
                }
                base.wsl();
                var close = base.literal("]");
                return close.isFailure() ? close.<Expr>propagate() : expr;
            });
        });
    }

    // === Operators ===

    private Optional<BinOp> logicOperator() {
        for (var symbol : LOGIC_SYMBOLS) {
            if (ctx.lookingAt(symbol)) {
                ctx.advance(symbol.length());
                return BinOp.fromSymbol(symbol);
            }
        }
        for (var word : LOGIC_KEYWORDS) {
            if (base.lookingAtKeyword(word)) {
                ctx.advance(word.length());
                return BinOp.fromSymbol(word);
            }
        }
        ctx.updateFurthest("binary operator");
        return Optional.empty();
    }

    private Optional<BinOp> mathOperator() {
        return symbolOperator("+-", "binary operator");
    }

    private Optional<BinOp> termOperator() {
        char c = ctx.peek();
        if ((c == '&' && ctx.peek(1) == '&') || (c == '|' && ctx.peek(1) == '|')) {
            return Optional.empty();
        }
        return symbolOperator("*/%|&^", "binary operator");
    }

    /**
     * Single-character operator from {@code symbols}, unless it starts a compound assignment.
     */
    private Optional<BinOp> symbolOperator(String symbols, String expected) {
        char c = ctx.peek();
        if (c == '\0' || symbols.indexOf(c) < 0 || ctx.peek(1) == '=') {
            ctx.updateFurthest(expected);
            return Optional.empty();
        }
        ctx.advance();
        return BinOp.fromSymbol(String.valueOf(c));
    }

    private Optional<UnOp> unaryOperator() {
        char c = ctx.peek();
        if (c == '-' && ctx.peek(1) != '=') {
            ctx.advance();
            return Optional.of(UnOp.MINUS);
        }
        if (c == '+' && ctx.peek(1) != '=') {
            ctx.advance();
            return Optional.of(UnOp.PLUS);
        }
        if (c == '!' && ctx.peek(1) != '=') {
            ctx.advance();
            return Optional.of(UnOp.NOT);
        }
        if (base.lookingAtKeyword("not")) {
            ctx.advance(3);
            base.ws();
            return Optional.of(UnOp.NOT);
        }
        return Optional.empty();
    }

    // === Values ===

    /**
     * A literal, identifier or call. Identifiers, calls, strings and node paths may continue
     * with an attribute chain.
     */
    public ParseResult<Expr> value() {
        return ctx.rule("value", () -> {
            char c = ctx.peek();
            if (base.lookingAtKeyword("null")) {
                return nullLiteral().map(v -> v);
            }
            if (BOOL_KEYWORDS.stream().anyMatch(base::lookingAtKeyword)) {
                return bool().map(v -> v);
            }
            if (c == '[') {
                return array().map(v -> v);
            }
            if (c == '{') {
                return object().map(v -> v);
            }
            if (c == '$') {
                return nodePath().map(this::chain);
            }
            if (isIdentStart(c)) {
                return callOrIdent().map(this::chain);
            }
            if (c == '"' || c == '\'') {
                return string().map(this::chain);
            }
            if (isDigit(c)) {
                var floating = floating();
                return floating.isSuccess() ? floating.map(v -> v) : integer().map(v -> v);
            }
            return ctx.failure("expression");
        });
    }

    /**
     * Attribute links after a head: {@code .name}, {@code .name(args)} and subscripts.
     * Subscripts fold onto the link they follow; links fold right into {@link BinOp#ATTR}.
     */
    private Expr chain(Expr head) {
        var links = new ArrayList<Expr>();
        links.add(head);
        while (true) {
            if (ctx.peek() == '[') {
                var subscript = subscript();
                if (subscript.isFailure()) {
                    break;
                }
                int last = links.size() - 1;
                links.set(last, Expr.index(links.get(last), subscript.unwrap()));
            } else if (ctx.peek() == '.' && isIdentStart(ctx.peek(1))) {
                var dot = ctx.location();
                ctx.advance();
                var member = callOrIdent();
                if (member.isFailure()) {
                    ctx.restoreLocation(dot);
                    break;
                }
                links.add(member.unwrap());
            } else {
                break;
            }
        }
        var result = links.get(links.size() - 1);
        for (int i = links.size() - 2; i >= 0; i--) {
            result = Expr.attr(links.get(i), result);
        }
        return result;
    }

    public ParseResult<Value> callOrIdent() {
        return ctx.rule("function_call", () -> {
            var name = base.identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            if (ctx.peek() != '(') {
                return ctx.success(Value.ident(name.unwrap()));
            }
            ctx.advance();
            var args = delimited(')', this::expr);
            if (args.isFailure()) {
                return args.propagate();
            }
            return ctx.success(new Value.FunctionCall(name.unwrap(), args.unwrap()));
        });
    }

    public ParseResult<Value.NullLit> nullLiteral() {
        return ctx.rule("null", () -> {
            var word = base.keyword("null");
            return word.isFailure() ? word.propagate() : ctx.success(Value.nullLit());
        });
    }

    public ParseResult<Value.BoolLit> bool() {
        return ctx.rule("boolean", () -> {
            for (var word : BOOL_KEYWORDS) {
                if (base.lookingAtKeyword(word)) {
                    ctx.advance(word.length());
                    return ctx.success(Value.bool(Character.toLowerCase(word.charAt(0)) == 't'));
                }
            }
            return ctx.failure("boolean");
        });
    }

    /**
     * Hexadecimal ({@code 0x1F}) or decimal integer. A hex prefix without valid digits leaves
     * just the {@code 0}; decimal digits stop at the first non-digit.
     */
    public ParseResult<Value.IntLit> integer() {
        return ctx.rule("int", () -> {
            var hex = hexInteger();
            if (hex.isSuccess()) {
                return hex;
            }
            if (!isDigit(ctx.peek())) {
                return ctx.failure("integer");
            }
            var start = ctx.location();
            skipDigits();
            var digits = ctx.substring(start.offset(), ctx.pos());
            try {
                return ctx.success(Value.integer(Long.parseLong(digits)));
            } catch (NumberFormatException e) {
                ctx.restoreLocation(start);
                return ctx.failure("integer within 64-bit range");
            }
        });
    }

    private ParseResult<Value.IntLit> hexInteger() {
        return ctx.rule("hex_int", () -> {
            if (!ctx.consume("0x")) {
                return ctx.failure("'0x'");
            }
            int start = ctx.pos();
            while (isIdentPart(ctx.peek()) && ctx.peek() != '_') {
                ctx.advance();
            }
            var digits = ctx.substring(start, ctx.pos());
            if (digits.isEmpty()) {
                return ctx.failure("hexadecimal digits");
            }
            try {
                return ctx.success(Value.integer(Long.parseLong(digits, 16)));
            } catch (NumberFormatException e) {
                return ctx.failure("hexadecimal digits");
            }
        });
    }

    /**
     * {@code digits.digits}; no exponent, both digit runs required.
     */
    public ParseResult<Value.FloatLit> floating() {
        return ctx.rule("float", () -> {
            int start = ctx.pos();
            if (!skipDigits()) {
                return ctx.failure("float");
            }
            if (ctx.peek() != '.') {
                return ctx.failure("'.'");
            }
            ctx.advance();
            if (!skipDigits()) {
                return ctx.failure("fraction digits");
            }
            return ctx.success(Value.floating(Double.parseDouble(ctx.substring(start, ctx.pos()))));
        });
    }

    private boolean skipDigits() {
        int start = ctx.pos();
        while (isDigit(ctx.peek())) {
            ctx.advance();
        }
        return ctx.pos() > start;
    }

    /**
     * Single- or double-quoted string. A backslash may escape only the delimiter, a backslash
     * or {@code n}; the raw text between the quotes is kept.
     */
    public ParseResult<Value.StringLit> string() {
        return ctx.rule("string", () -> {
            char quote = ctx.peek();
            if (quote != '"' && quote != '\'') {
                return ctx.failure("string");
            }
            ctx.advance();
            int start = ctx.pos();
            while (ctx.peek() != quote) {
                if (ctx.isAtEnd()) {
                    return ctx.failure("closing " + quote);
                }
                if (ctx.peek() == '\\') {
                    ctx.advance();
                    char escaped = ctx.peek();
                    if (escaped != quote && escaped != 'n' && escaped != '\\') {
                        return ctx.failure("escape sequence");
                    }
                }
                ctx.advance();
            }
            var raw = ctx.substring(start, ctx.pos());
            ctx.advance();
            return ctx.success(Value.string(raw));
        });
    }

    /**
     * {@code $Path/To/Node} or {@code $"quoted path"}; the raw text keeps the {@code $}.
     */
    public ParseResult<Value.NodePathLit> nodePath() {
        return ctx.rule("node_path", () -> {
            int start = ctx.pos();
            var dollar = base.literal("$");
            if (dollar.isFailure()) {
                return dollar.propagate();
            }
            if (ctx.peek() == '"' || ctx.peek() == '\'') {
                var quoted = string();
                if (quoted.isFailure()) {
                    return quoted.propagate();
                }
            } else {
                var segment = base.identifier();
                if (segment.isFailure()) {
                    return segment.propagate();
                }
                while (ctx.peek() == '/' && isIdentStart(ctx.peek(1))) {
                    ctx.advance();
                    base.identifier();
                }
            }
            return ctx.success(Value.nodePath(ctx.substring(start, ctx.pos())));
        });
    }

    public ParseResult<Value.ArrayLit> array() {
        return ctx.rule("array", () -> {
            var open = base.literal("[");
            if (open.isFailure()) {
                return open.propagate();
            }
            return delimited(']', this::expr).map(Value.ArrayLit::new);
        });
    }

    public ParseResult<Value.ObjectLit> object() {
        return ctx.rule("object", () -> {
            var open = base.literal("{");
            if (open.isFailure()) {
                return open.propagate();
            }
            return delimited('}', this::pair).map(Value.ObjectLit::new);
        });
    }

    private ParseResult<Value.Pair> pair() {
        return ctx.rule("pair", () -> {
            var key = expr();
            if (key.isFailure()) {
                return key.propagate();
            }
            base.wsl();
            var colon = base.literal(":");
            if (colon.isFailure()) {
                return colon.propagate();
            }
            base.wsl();
            var value = expr();
            if (value.isFailure()) {
                return value.propagate();
            }
            return ctx.success(new Value.Pair(key.unwrap(), value.unwrap()));
        });
    }

    /**
     * Comma-separated items up to {@code close}, after the opening bracket was consumed.
     * Line breaks, comments and a trailing comma are allowed.
     */
    <T> ParseResult<List<T>> delimited(char close, Supplier<ParseResult<T>> item) {
        return ctx.bracketed(() -> {
            var items = new ArrayList<T>();
            base.wsl();
            while (ctx.peek() != close) {
                var next = item.get();
                if (next.isFailure()) {
                    return next.propagate();
                }
                items.add(next.unwrap());
                base.wsl();
                if (ctx.peek() != ',') {
                    break;
                }
                ctx.advance();
                base.wsl();
            }
            var end = base.literal(String.valueOf(close));
            if (end.isFailure()) {
                return end.propagate();
            }
            return ctx.success(List.copyOf(items));
        });
    }
}
