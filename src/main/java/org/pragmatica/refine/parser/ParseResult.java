package org.pragmatica.refine.parser;

import org.pragmatica.refine.error.ParseError;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Result of running a rule - either success with a value or the first failure encountered.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Value of a successful parse.
     *
     * @throws NoSuchElementException if the parse failed
     */
    T unwrap();

    /**
     * Error of a failed parse.
     *
     * @throws NoSuchElementException if the parse succeeded
     */
    ParseError error();

    <R> R fold(Function<ParseError, R> onFailure, Function<T, R> onSuccess);

    /**
     * This failure re-typed for propagation out of a rule producing a different node.
     *
     * @throws NoSuchElementException if the parse succeeded
     */
    default <U> ParseResult<U> asFailure() {
        return failure(error());
    }

    default <U> ParseResult<U> map(Function<T, U> mapper) {
        return fold(ParseResult::failure, value -> success(mapper.apply(value)));
    }

    default <U> ParseResult<U> flatMap(Function<T, ParseResult<U>> mapper) {
        return fold(ParseResult::failure, mapper);
    }

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    record Success<T>(T value) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public ParseError error() {
            throw new NoSuchElementException("Parse succeeded, no error available");
        }

        @Override
        public <R> R fold(Function<ParseError, R> onFailure, Function<T, R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(ParseError cause) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new NoSuchElementException(cause.message());
        }

        @Override
        public ParseError error() {
            return cause;
        }

        @Override
        public <R> R fold(Function<ParseError, R> onFailure, Function<T, R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
