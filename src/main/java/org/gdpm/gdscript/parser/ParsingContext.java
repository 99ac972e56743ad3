package org.gdpm.gdscript.parser;

import org.gdpm.gdscript.error.ContextFrame;
import org.gdpm.gdscript.error.ParseError;
import org.gdpm.gdscript.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Mutable parsing state for one script: cursor, rule frames, furthest failure, nesting guards
 * and the packrat cache.
 *
 * <p>Rules run through {@link #rule(String, Supplier)}, which restores the cursor when the
 * rule fails, so a failed rule never consumes input.
 */
public final class ParsingContext {
    private static final Logger log = LoggerFactory.getLogger(ParsingContext.class);

    private static final int PREVIEW_LENGTH = 30;
    private static final char END = '\0';

    private final String input;
    private final ParserConfig config;
    private final Map<Long, ParseResult<?>> packratCache;
    private final Map<String, Integer> ruleIds;
    private final List<ContextFrame> frames;

    private int pos;
    private int line;
    private int column;
    private int nestingDepth;
    private int bracketDepth;

    private SourceLocation furthestLocation;
    private final Set<String> furthestExpected;
    private List<ContextFrame> furthestTrace;
    private ParseError fatalError;

    private ParsingContext(String input, ParserConfig config) {
        this.input = input;
        this.config = config;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.ruleIds = config.packratEnabled() ? new HashMap<>() : null;
        this.frames = new ArrayList<>();
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.furthestLocation = SourceLocation.START;
        this.furthestExpected = new LinkedHashSet<>();
        this.furthestTrace = List.of();
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config);
    }

    public static ParsingContext create(String input) {
        return new ParsingContext(input, ParserConfig.DEFAULT);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    public void restoreLocation(SourceLocation loc) {
        this.pos = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    /**
     * True at offset 0 or right after a line feed.
     */
    public boolean atLineStart() {
        return pos == 0 || input.charAt(pos - 1) == '\n';
    }

    // === Character Access ===

    /**
     * Current character, or {@code '\0'} at the end of input.
     */
    public char peek() {
        return peek(0);
    }

    public char peek(int ahead) {
        int index = pos + ahead;
        return index < input.length() ? input.charAt(index) : END;
    }

    public char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    public boolean lookingAt(String text) {
        return input.startsWith(text, pos);
    }

    /**
     * Consumes {@code text} if the input continues with it.
     */
    public boolean consume(String text) {
        if (!lookingAt(text)) {
            return false;
        }
        advance(text.length());
        return true;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    public String remainingInput() {
        return input.substring(pos);
    }

    public String input() {
        return input;
    }

    public ParserConfig config() {
        return config;
    }

    // === Results ===

    public <T> ParseResult<T> success(T value) {
        return ParseResult.Success.of(value, location());
    }

    /**
     * Records a failure at the cursor and returns it.
     */
    public <T> ParseResult<T> failure(String expected) {
        updateFurthest(expected);
        return ParseResult.Failure.at(location(), expected);
    }

    // === Rules ===

    /**
     * Runs a rule body inside a labelled frame. On failure the cursor goes back to where the
     * rule started.
     */
    public <T> ParseResult<T> rule(String label, Supplier<ParseResult<T>> body) {
        var start = location();
        if (fatalError != null) {
            return ParseResult.Failure.at(start, label);
        }
        frames.add(ContextFrame.at(label, start));
        try {
            var result = body.get();
            if (result.isFailure()) {
                restoreLocation(start);
            }
            if (log.isTraceEnabled()) {
                log.trace("{} {} at {}: '{}'", result.isSuccess() ? "matched" : "failed", label, start,
                          preview(start.offset()));
            }
            return result;
        } finally {
            frames.remove(frames.size() - 1);
        }
    }

    /**
     * Ordered choice: the first alternative that succeeds wins. Alternatives are expected to
     * restore the cursor when they fail.
     */
    @SafeVarargs
    public final <T> ParseResult<T> choice(String expected, Supplier<ParseResult<T>>... alternatives) {
        var start = location();
        for (var alternative : alternatives) {
            var result = alternative.get();
            if (result.isSuccess()) {
                return result;
            }
            restoreLocation(start);
        }
        return ParseResult.Failure.at(start, expected);
    }

    /**
     * Runs a body one nesting level deeper. Exceeding the configured depth is fatal: every
     * later rule fails and {@link #error()} reports {@link ParseError.NestingTooDeep}.
     */
    public <T> ParseResult<T> nested(Supplier<ParseResult<T>> body) {
        if (nestingDepth >= config.maxNestingDepth()) {
            if (fatalError == null) {
                fatalError = new ParseError.NestingTooDeep(location(), config.maxNestingDepth(), List.copyOf(frames));
            }
            return ParseResult.Failure.at(location(), "shallower nesting");
        }
        nestingDepth++;
        try {
            return body.get();
        } finally {
            nestingDepth--;
        }
    }

    /**
     * Runs a body between brackets, where expressions may span lines.
     */
    public <T> ParseResult<T> bracketed(Supplier<ParseResult<T>> body) {
        bracketDepth++;
        try {
            return body.get();
        } finally {
            bracketDepth--;
        }
    }

    public boolean inBrackets() {
        return bracketDepth > 0;
    }

    // === Error Tracking ===

    public void updateFurthest(String expected) {
        if (pos > furthestLocation.offset()) {
            furthestLocation = location();
            furthestExpected.clear();
            furthestExpected.add(expected);
            furthestTrace = List.copyOf(frames);
        } else if (pos == furthestLocation.offset()) {
            if (furthestExpected.isEmpty()) {
                furthestTrace = List.copyOf(frames);
            }
            furthestExpected.add(expected);
        }
    }

    public SourceLocation furthestLocation() {
        return furthestLocation;
    }

    public String furthestExpected() {
        return furthestExpected.isEmpty() ? "valid input" : String.join(" or ", furthestExpected);
    }

    public List<ContextFrame> furthestTrace() {
        return furthestTrace;
    }

    public boolean hasFatalError() {
        return fatalError != null;
    }

    /**
     * Records that the thread stack ran out before the nesting limit was reached. Reported as
     * {@link ParseError.NestingTooDeep} at the cursor.
     */
    public ParseError stackExhausted() {
        if (fatalError == null) {
            fatalError = new ParseError.NestingTooDeep(location(), config.maxNestingDepth(), List.copyOf(frames));
        }
        return fatalError;
    }

    /**
     * Error describing why the parse failed: the fatal error if one occurred, otherwise the
     * furthest failure with the rule trace that reached it.
     */
    public ParseError error() {
        if (fatalError != null) {
            return fatalError;
        }
        int offset = furthestLocation.offset();
        if (offset >= input.length()) {
            return new ParseError.UnexpectedEof(furthestLocation, furthestExpected(), furthestTrace);
        }
        return new ParseError.UnexpectedInput(furthestLocation, describe(input.charAt(offset)),
                                              furthestExpected(), furthestTrace);
    }

    private static String describe(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            default -> String.valueOf(c);
        };
    }

    private String preview(int from) {
        var end = Math.min(input.length(), from + PREVIEW_LENGTH);
        return input.substring(from, end).replace("\n", "\\n");
    }

    // === Packrat Cache ===

    /**
     * Memoizes a rule per offset. Results inside brackets are cached apart from results outside,
     * since whitespace handling differs.
     */
    @SuppressWarnings("unchecked")
    public <T> ParseResult<T> memoized(String ruleName, Supplier<ParseResult<T>> body) {
        if (packratCache == null) {
            return body.get();
        }
        var key = packratKey(inBrackets() ? ruleName + "[]" : ruleName, pos);
        var cached = (ParseResult<T>) packratCache.get(key);
        if (cached != null) {
            if (cached instanceof ParseResult.Success<T> success) {
                restoreLocation(success.endLocation());
            }
            return cached;
        }
        var result = body.get();
        packratCache.put(key, result);
        return result;
    }

    private long packratKey(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }
}
