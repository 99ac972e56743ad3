package org.gdpm.gdscript.parser;

import org.gdpm.gdscript.grammar.ScriptGrammar;
import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Recursive descent GDScript parser. Stateless between calls: every parse gets a fresh
 * {@link ParsingContext}, so one engine may serve several threads.
 */
public final class GdScriptEngine implements ScriptParser {
    private static final Logger log = LoggerFactory.getLogger(GdScriptEngine.class);

    private final ParserConfig config;

    private GdScriptEngine(ParserConfig config) {
        this.config = config;
    }

    public static GdScriptEngine create(ParserConfig config) {
        return new GdScriptEngine(config);
    }

    @Override
    public Block parse(String source) throws ParseException {
        long started = System.nanoTime();
        var block = run(source, ScriptGrammar::file);
        if (log.isDebugEnabled()) {
            log.debug("Parsed {} top-level lines in {} us", block.size(), (System.nanoTime() - started) / 1000);
        }
        return block;
    }

    @Override
    public Expr parseExpression(String source) throws ParseException {
        return run(source, ScriptGrammar::wholeExpression);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    private <T> T run(String source, Function<ScriptGrammar, ParseResult<T>> startRule) throws ParseException {
        var ctx = ParsingContext.create(source, config);
        ParseResult<T> result;
        try {
            result = startRule.apply(ScriptGrammar.create(ctx));
        } catch (StackOverflowError e) {
            var error = ctx.stackExhausted();
            log.debug("Stack exhausted below nesting limit {}: {}", config.maxNestingDepth(), error.summary());
            throw new ParseException(error, source);
        }
        if (result.isFailure() || ctx.hasFatalError()) {
            var error = ctx.error();
            log.debug("Parse failed: {}", error.summary());
            throw new ParseException(error, source);
        }
        return result.unwrap();
    }
}
