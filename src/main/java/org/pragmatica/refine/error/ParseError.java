package org.pragmatica.refine.error;

import org.pragmatica.refine.tree.SourceSpan;

/**
 * Parse error with the span of the offending token(s).
 */
public sealed interface ParseError {
    SourceSpan span();

    String message();

    /**
     * Token that no alternative of the current rule accepts.
     */
    record UnexpectedToken(
    SourceSpan span,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + span.start() + ", expected " + expected;
        }
    }

    /**
     * Input ended while a rule still needed tokens.
     */
    record UnexpectedEof(
    SourceSpan span,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + span.start() + ", expected " + expected;
        }
    }

    /**
     * Array length other than the {@code _} placeholder.
     */
    record InvalidArrayLength(
    SourceSpan span,
    String found) implements ParseError {
        @Override
        public String message() {
            return "Invalid array length '" + found + "' at " + span.start() + ", only '_' is supported";
        }
    }

    /**
     * Types or expressions nested deeper than the configured limit.
     */
    record NestingTooDeep(
    SourceSpan span,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Nesting deeper than " + limit + " levels at " + span.start();
        }
    }
}
