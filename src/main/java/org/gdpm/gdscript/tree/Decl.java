package org.gdpm.gdscript.tree;

import java.util.List;
import java.util.Optional;

/**
 * Declarations: variables, constants, script headers, enums, signals, functions and inner classes.
 */
public sealed interface Decl extends Line permits Decl.Var,
                                                  Decl.Const,
                                                  Decl.Extends,
                                                  Decl.ClassName,
                                                  Decl.Enum,
                                                  Decl.Signal,
                                                  Decl.Function,
                                                  Decl.Class {

    enum VarModifier {
        ONREADY,
        EXPORT
    }

    /**
     * Function modifiers. Spelling order matters when matching: longer keywords share a prefix
     * with shorter ones ({@code remotesync} and {@code remote}).
     */
    enum FunctionModifier {
        STATIC("static"),
        REMOTESYNC("remotesync"),
        MASTERSYNC("mastersync"),
        PUPPETSYNC("puppetsync"),
        REMOTE("remote"),
        MASTER("master"),
        PUPPET("puppet");

        private final String keyword;

        FunctionModifier(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    /**
     * Variable declaration.
     *
     * @param modifier {@code onready} or {@code export}, if present
     * @param name     variable name
     * @param inferred true when declared with {@code :=}
     * @param type     declared type, absent when inferred or untyped
     * @param value    initializer
     * @param setter   setget setter function name
     * @param getter   setget getter function name
     */
    record Var(Optional<VarModifier> modifier,
               String name,
               boolean inferred,
               Optional<TypeName> type,
               Optional<Expr> value,
               Optional<String> setter,
               Optional<String> getter) implements Decl {}

    record Const(String name, boolean inferred, Optional<TypeName> type, Expr value) implements Decl {}

    /**
     * Base class reference: a {@link Value.StringLit} path or a {@link Value.Ident} class name.
     */
    record Extends(Value target) implements Decl {}

    record ClassName(String name) implements Decl {}

    record EnumVariant(String name, Optional<Expr> value) {}

    record Enum(String name, List<EnumVariant> variants) implements Decl {
        public Enum {
            variants = List.copyOf(variants);
        }
    }

    record Signal(String name, List<String> params) implements Decl {
        public Signal {
            params = List.copyOf(params);
        }
    }

    record FunctionArg(String name, Optional<TypeName> type, Optional<Expr> defaultValue) {}

    record Function(Optional<FunctionModifier> modifier,
                    String name,
                    List<FunctionArg> args,
                    Optional<TypeName> returnType,
                    Block body) implements Decl {
        public Function {
            args = List.copyOf(args);
        }
    }

    record Class(String name, Block body) implements Decl {}
}
