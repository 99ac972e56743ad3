package org.gdpm.gdscript;

import org.gdpm.gdscript.parser.GdScriptEngine;
import org.gdpm.gdscript.parser.ParserConfig;
import org.gdpm.gdscript.parser.ScriptParser;

/**
 * Entry point for creating GDScript parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = GdScript.parser();
 * var block = parser.parse("""
 *     extends Node
 *
 *     func _ready():
 *         print("ready")
 *     """);
 * }</pre>
 */
public final class GdScript {
    private GdScript() {}

    /**
     * Parser with the bundled defaults.
     */
    public static ScriptParser parser() {
        return parser(ParserConfig.DEFAULT);
    }

    public static ScriptParser parser(ParserConfig config) {
        return GdScriptEngine.create(config);
    }

    /**
     * Parser configured from {@code application.conf} over {@code reference.conf}.
     */
    public static ScriptParser configuredParser() {
        return parser(ParserConfig.load());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ParserConfig config = ParserConfig.DEFAULT;

        private Builder() {}

        public Builder packrat(boolean enabled) {
            this.config = config.withPackrat(enabled);
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.config = config.withMaxNestingDepth(depth);
            return this;
        }

        public ScriptParser build() {
            return parser(config);
        }
    }
}
