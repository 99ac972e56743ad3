package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.Decl;
import org.gdpm.gdscript.tree.Expr;
import org.gdpm.gdscript.tree.TypeName;
import org.gdpm.gdscript.tree.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Declarations: script header ({@code class_name}, {@code extends}), members and inner classes.
 */
public final class DeclarationGrammar {
    private final ParsingContext ctx;
    private final ScriptGrammar grammar;

    DeclarationGrammar(ParsingContext ctx, ScriptGrammar grammar) {
        this.ctx = ctx;
        this.grammar = grammar;
    }

    public ParseResult<Decl> decl(int indent) {
        return ctx.rule("decl", () -> ctx.choice("declaration",
                                                 this::className,
                                                 this::extendsDecl,
                                                 this::signal,
                                                 this::enumDecl,
                                                 () -> classDecl(indent),
                                                 () -> function(indent),
                                                 this::constDecl,
                                                 this::varDecl));
    }

    ParseResult<Decl> className() {
        return ctx.rule("classname_decl", () -> {
            var word = keywordThenSpace("class_name");
            if (word.isFailure()) {
                return word.propagate();
            }
            return base().identifier().map(Decl.ClassName::new);
        });
    }

    /**
     * {@code extends "res://path.gd"} or {@code extends ClassName}.
     */
    ParseResult<Decl> extendsDecl() {
        return ctx.rule("extends_decl", () -> {
            var word = keywordThenSpace("extends");
            if (word.isFailure()) {
                return word.propagate();
            }
            if (ctx.peek() == '"' || ctx.peek() == '\'') {
                return grammar.expressions().string().map(Decl.Extends::new);
            }
            return base().typeName().map(type -> new Decl.Extends(Value.ident(type.name())));
        });
    }

    ParseResult<Decl> signal() {
        return ctx.rule("signal_decl", () -> {
            var word = keywordThenSpace("signal");
            if (word.isFailure()) {
                return word.propagate();
            }
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            base().ws();
            if (ctx.peek() != '(') {
                return ctx.success(new Decl.Signal(name.unwrap(), List.of()));
            }
            ctx.advance();
            return grammar.expressions()
                          .delimited(')', base()::identifier)
                          .map(params -> new Decl.Signal(name.unwrap(), params));
        });
    }

    ParseResult<Decl> enumDecl() {
        return ctx.rule("enum_decl", () -> {
            var word = keywordThenSpace("enum");
            if (word.isFailure()) {
                return word.propagate();
            }
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            base().ws();
            var open = base().literal("{");
            if (open.isFailure()) {
                return open.propagate();
            }
            return grammar.expressions()
                          .delimited('}', this::enumVariant)
                          .map(variants -> new Decl.Enum(name.unwrap(), variants));
        });
    }

    private ParseResult<Decl.EnumVariant> enumVariant() {
        return ctx.rule("enum_variant", () -> {
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            var value = initializer(true);
            if (value.isFailure()) {
                return value.propagate();
            }
            return ctx.success(new Decl.EnumVariant(name.unwrap(), value.unwrap()));
        });
    }

    /**
     * Inner class: {@code class Name:} and an indented body of declarations.
     */
    ParseResult<Decl> classDecl(int indent) {
        return ctx.rule("class_decl", () -> {
            var word = keywordThenSpace("class");
            if (word.isFailure()) {
                return word.propagate();
            }
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            base().ws();
            var colon = base().literal(":");
            if (colon.isFailure()) {
                return colon.propagate();
            }
            return grammar.blocks()
                          .indentedBlock(indent)
                          .map(body -> new Decl.Class(name.unwrap(), body));
        });
    }

    /**
     * {@code [modifier] func name(args) [-> Type]:} and an indented body.
     */
    ParseResult<Decl> function(int indent) {
        return ctx.rule("function_decl", () -> {
            var modifier = functionModifier();
            var word = keywordThenSpace("func");
            if (word.isFailure()) {
                return word.propagate();
            }
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            base().ws();
            var open = base().literal("(");
            if (open.isFailure()) {
                return open.propagate();
            }
            var args = grammar.expressions().delimited(')', this::functionArg);
            if (args.isFailure()) {
                return args.propagate();
            }
            base().ws();
            Optional<TypeName> returnType = Optional.empty();
            if (ctx.consume("->")) {
                base().ws();
                var type = base().typeName();
                if (type.isFailure()) {
                    return type.propagate();
                }
                returnType = Optional.of(type.unwrap());
                base().ws();
            }
            var colon = base().literal(":");
            if (colon.isFailure()) {
                return colon.propagate();
            }
            var body = grammar.blocks().indentedBlock(indent);
            if (body.isFailure()) {
                return body.propagate();
            }
            return ctx.success(new Decl.Function(modifier, name.unwrap(), args.unwrap(), returnType, body.unwrap()));
        });
    }

    private Optional<Decl.FunctionModifier> functionModifier() {
        for (var modifier : Decl.FunctionModifier.values()) {
            if (base().lookingAtKeyword(modifier.keyword())) {
                ctx.advance(modifier.keyword().length());
                base().ws();
                return Optional.of(modifier);
            }
        }
        return Optional.empty();
    }

    /**
     * {@code name[: Type][= default]}; {@code name := default} declares an inferred default.
     */
    private ParseResult<Decl.FunctionArg> functionArg() {
        return ctx.rule("function_arg", () -> {
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            base().ws();
            Optional<TypeName> type = Optional.empty();
            if (ctx.consume(":=")) {
                base().ws();
                var value = grammar.expressions().expr();
                if (value.isFailure()) {
                    return value.propagate();
                }
                return ctx.success(new Decl.FunctionArg(name.unwrap(), type, Optional.of(value.unwrap())));
            }
            var annotation = typeAnnotation();
            if (annotation.isFailure()) {
                return annotation.propagate();
            }
            type = annotation.unwrap();
            var value = initializer(false);
            if (value.isFailure()) {
                return value.propagate();
            }
            return ctx.success(new Decl.FunctionArg(name.unwrap(), type, value.unwrap()));
        });
    }

    /**
     * {@code const NAME := value} or {@code const NAME[: Type] = value}.
     */
    ParseResult<Decl> constDecl() {
        return ctx.rule("const_decl", () -> {
            var word = keywordThenSpace("const");
            if (word.isFailure()) {
                return word.propagate();
            }
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            base().ws();
            if (ctx.consume(":=")) {
                base().ws();
                return grammar.expressions().expr()
                              .map(value -> new Decl.Const(name.unwrap(), true, Optional.empty(), value));
            }
            var type = typeAnnotation();
            if (type.isFailure()) {
                return type.propagate();
            }
            var value = initializer(false);
            if (value.isFailure()) {
                return value.propagate();
            }
            if (value.unwrap().isEmpty()) {
                return ctx.failure("'='");
            }
            return ctx.success(new Decl.Const(name.unwrap(), false, type.unwrap(), value.unwrap().get()));
        });
    }

    /**
     * {@code [onready|export] var name [:= value | [: Type] [= value]] [setget setter[, getter]]}.
     */
    ParseResult<Decl> varDecl() {
        return ctx.rule("var_decl", () -> {
            var modifier = varModifier();
            var word = keywordThenSpace("var");
            if (word.isFailure()) {
                return word.propagate();
            }
            var name = base().identifier();
            if (name.isFailure()) {
                return name.propagate();
            }
            base().ws();
            boolean inferred = false;
            Optional<TypeName> type = Optional.empty();
            Optional<Expr> value;
            if (ctx.consume(":=")) {
                inferred = true;
                base().ws();
                var inferredValue = grammar.expressions().expr();
                if (inferredValue.isFailure()) {
                    return inferredValue.propagate();
                }
                value = Optional.of(inferredValue.unwrap());
            } else {
                var annotation = typeAnnotation();
                if (annotation.isFailure()) {
                    return annotation.propagate();
                }
                type = annotation.unwrap();
                var initial = initializer(false);
                if (initial.isFailure()) {
                    return initial.propagate();
                }
                value = initial.unwrap();
            }
            base().ws();
            var accessors = setget();
            if (accessors.isFailure()) {
                return accessors.propagate();
            }
            var setget = accessors.unwrap();
            return ctx.success(new Decl.Var(modifier, name.unwrap(), inferred, type, value,
                                            setget.setter(), setget.getter()));
        });
    }

    private Optional<Decl.VarModifier> varModifier() {
        for (var modifier : Decl.VarModifier.values()) {
            var word = modifier.name().toLowerCase(Locale.ROOT);
            if (base().lookingAtKeyword(word)) {
                ctx.advance(word.length());
                base().ws();
                return Optional.of(modifier);
            }
        }
        return Optional.empty();
    }

    private record Accessors(Optional<String> setter, Optional<String> getter) {
        static final Accessors NONE = new Accessors(Optional.empty(), Optional.empty());
    }

    /**
     * Optional {@code setget setter}, {@code setget setter, getter} or {@code setget , getter}.
     */
    private ParseResult<Accessors> setget() {
        if (!base().lookingAtKeyword("setget")) {
            return ctx.success(Accessors.NONE);
        }
        return ctx.rule("setget", () -> {
            ctx.advance("setget".length());
            base().ws();
            Optional<String> setter = Optional.empty();
            if (ctx.peek() != ',') {
                var name = base().identifier();
                if (name.isFailure()) {
                    return name.propagate();
                }
                setter = Optional.of(name.unwrap());
                base().ws();
            }
            if (ctx.peek() != ',') {
                return ctx.success(new Accessors(setter, Optional.empty()));
            }
            ctx.advance();
            base().ws();
            var getter = base().identifier();
            if (getter.isFailure()) {
                return getter.propagate();
            }
            return ctx.success(new Accessors(setter, Optional.of(getter.unwrap())));
        });
    }

    /**
     * Optional {@code : Type}.
     */
    private ParseResult<Optional<TypeName>> typeAnnotation() {
        if (ctx.peek() != ':') {
            return ctx.success(Optional.empty());
        }
        ctx.advance();
        base().ws();
        var type = base().typeName();
        if (type.isFailure()) {
            return type.propagate();
        }
        base().ws();
        return ctx.success(Optional.of(type.unwrap()));
    }

    /**
     * Optional {@code = value}. Inside brackets the value may start on the next line.
     */
    private ParseResult<Optional<Expr>> initializer(boolean multiline) {
        var mark = ctx.location();
        if (multiline) {
            base().wsl();
        } else {
            base().ws();
        }
        if (ctx.peek() != '=' || ctx.peek(1) == '=') {
            ctx.restoreLocation(mark);
            return ctx.success(Optional.empty());
        }
        ctx.advance();
        if (multiline) {
            base().wsl();
        } else {
            base().ws();
        }
        var value = grammar.expressions().expr();
        if (value.isFailure()) {
            return value.propagate();
        }
        return ctx.success(Optional.of(value.unwrap()));
    }

    private ParseResult<String> keywordThenSpace(String keyword) {
        var word = base().keyword(keyword);
        if (word.isSuccess()) {
            base().ws();
        }
        return word;
    }

    private BaseGrammar base() {
        return grammar.base();
    }
}
