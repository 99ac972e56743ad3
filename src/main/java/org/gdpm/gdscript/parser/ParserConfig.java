package org.gdpm.gdscript.parser;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Parser configuration options.
 *
 * <p>Loaded from the {@code gdscript.parser} section (defaults in {@code reference.conf}):
 * <pre>
 * gdscript.parser {
 *   packrat = true
 *   max-nesting-depth = 200
 *   extension = ".gd"
 *   parallel = false
 * }
 * </pre>
 *
 * @param packratEnabled   memoize expression results per input offset
 * @param maxNestingDepth  deepest allowed nesting of expressions and blocks
 * @param scriptExtension  file suffix selected when parsing a directory
 * @param parallel         parse directory files concurrently (report order is kept)
 */
public record ParserConfig(boolean packratEnabled,
                           int maxNestingDepth,
                           String scriptExtension,
                           boolean parallel) {

    public static final String CONFIG_PATH = "gdscript.parser";

    public static final ParserConfig DEFAULT = new ParserConfig(true, 64, ".gd", false);

    public ParserConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("max-nesting-depth must be positive, got " + maxNestingDepth);
        }
        if (scriptExtension == null || scriptExtension.isBlank()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
    }

    /**
     * Configuration from the application config ({@code application.conf}, system properties)
     * layered over the bundled defaults.
     */
    public static ParserConfig load() {
        return from(ConfigFactory.load());
    }

    /**
     * Reads the {@code gdscript.parser} section; missing keys fall back to the bundled defaults.
     */
    public static ParserConfig from(Config root) {
        var section = root.withFallback(ConfigFactory.defaultReference())
                          .getConfig(CONFIG_PATH);
        return new ParserConfig(section.getBoolean("packrat"),
                                section.getInt("max-nesting-depth"),
                                section.getString("extension"),
                                section.getBoolean("parallel"));
    }

    public ParserConfig withPackrat(boolean enabled) {
        return new ParserConfig(enabled, maxNestingDepth, scriptExtension, parallel);
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(packratEnabled, depth, scriptExtension, parallel);
    }

    public ParserConfig withParallel(boolean enabled) {
        return new ParserConfig(packratEnabled, maxNestingDepth, scriptExtension, enabled);
    }
}
