package org.gdpm.gdscript.error;

import org.gdpm.gdscript.tree.SourceLocation;

import java.util.List;

/**
 * Grammar-level parse error with location and the rule trace leading to it.
 *
 * <p>The trace lists frames outermost first; {@link #message()} prints them innermost first.
 */
public sealed interface ParseError {

    SourceLocation location();

    List<ContextFrame> trace();

    String summary();

    default String message() {
        var sb = new StringBuilder(summary());
        var frames = trace();
        for (int i = frames.size() - 1; i >= 0; i--) {
            sb.append("\n  while parsing ").append(frames.get(i));
        }
        return sb.toString();
    }

    /**
     * Innermost rule of the trace, if any.
     */
    default String innermostRule() {
        var frames = trace();
        return frames.isEmpty() ? "" : frames.get(frames.size() - 1).label();
    }

    record UnexpectedInput(SourceLocation location,
                           String found,
                           String expected,
                           List<ContextFrame> trace) implements ParseError {
        public UnexpectedInput {
            trace = List.copyOf(trace);
        }

        @Override
        public String summary() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    record UnexpectedEof(SourceLocation location,
                         String expected,
                         List<ContextFrame> trace) implements ParseError {
        public UnexpectedEof {
            trace = List.copyOf(trace);
        }

        @Override
        public String summary() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Expressions or blocks nested deeper than the configured limit.
     */
    record NestingTooDeep(SourceLocation location,
                          int limit,
                          List<ContextFrame> trace) implements ParseError {
        public NestingTooDeep {
            trace = List.copyOf(trace);
        }

        @Override
        public String summary() {
            return "Nesting deeper than " + limit + " levels at " + location;
        }
    }
}
