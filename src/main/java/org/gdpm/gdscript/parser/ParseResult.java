package org.gdpm.gdscript.parser;

import org.gdpm.gdscript.tree.SourceLocation;

import java.util.function.Function;

/**
 * Result of applying one grammar rule: the produced value with the location after it,
 * or a failure that consumed nothing.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The produced value; throws if this is a failure.
     */
    T unwrap();

    /**
     * Re-types a failure so it can be returned from a rule producing another type.
     */
    <R> ParseResult<R> propagate();

    default <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()), success.endLocation());
        }
        return propagate();
    }

    record Success<T>(T value, SourceLocation endLocation) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public <R> ParseResult<R> propagate() {
            throw new IllegalStateException("Cannot propagate a successful result");
        }

        public static <T> Success<T> of(T value, SourceLocation endLocation) {
            return new Success<>(value, endLocation);
        }
    }

    /**
     * Failed rule. The location is where the rule started; the detailed, furthest failure is
     * kept by the {@link ParsingContext}.
     */
    record Failure<T>(SourceLocation location, String expected) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Parse failed at " + location + ", expected " + expected);
        }

        @Override
        public <R> ParseResult<R> propagate() {
            return new Failure<>(location, expected);
        }

        public static <T> Failure<T> at(SourceLocation location, String expected) {
            return new Failure<>(location, expected);
        }
    }
}
