package org.pragmatica.refine.parser;

import org.pragmatica.refine.token.TokenKind;
import org.pragmatica.refine.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Separator-delimited lists and {@code A sep B} bindings shared by all rules.
 */
public final class Combinators {
    private Combinators() {}

    /**
     * Builds a node from the span covering a binding and its two halves.
     */
    @FunctionalInterface
    public interface Assembler<A, B, R> {
        R assemble(SourceSpan span, A first, B second);
    }

    /**
     * Elements separated by {@code separator}, stopping before {@code close}. The list may be empty and may end
     * with a separator; a leading separator or two separators in a row fail where the element was expected.
     * The closing token is left for the caller.
     */
    public static <T> ParseResult<List<T>> separated(TokenCursor cursor,
                                                     TokenKind separator,
                                                     TokenKind close,
                                                     Supplier<ParseResult<T>> element) {
        var elements = new ArrayList<T>();

        while (!cursor.check(close)) {
            var next = element.get();
            if (next.isFailure()) {
                return next.asFailure();
            }
            elements.add(next.unwrap());

            if (!cursor.eat(separator)) {
                break;
            }
        }

        return ParseResult.success(elements);
    }

    /**
     * {@code open element (separator element)* separator? close}
     */
    public static <T> ParseResult<List<T>> delimited(TokenCursor cursor,
                                                     TokenKind open,
                                                     TokenKind separator,
                                                     TokenKind close,
                                                     Supplier<ParseResult<T>> element) {
        var opening = cursor.expect(open);
        if (opening.isFailure()) {
            return opening.asFailure();
        }

        var elements = separated(cursor, separator, close, element);
        if (elements.isFailure()) {
            return elements;
        }

        var closing = cursor.expect(close);
        if (closing.isFailure()) {
            return closing.asFailure();
        }
        return elements;
    }

    /**
     * {@code first separator second}, e.g. {@code x: int} or {@code x: i32[n]}.
     */
    public static <A, B, R> ParseResult<R> binding(TokenCursor cursor,
                                                   Supplier<ParseResult<A>> first,
                                                   TokenKind separator,
                                                   Supplier<ParseResult<B>> second,
                                                   Assembler<A, B, R> assembler) {
        var start = cursor.location();

        var left = first.get();
        if (left.isFailure()) {
            return left.asFailure();
        }

        var sep = cursor.expect(separator);
        if (sep.isFailure()) {
            return sep.asFailure();
        }

        var right = second.get();
        if (right.isFailure()) {
            return right.asFailure();
        }

        return ParseResult.success(assembler.assemble(cursor.spanFrom(start), left.unwrap(), right.unwrap()));
    }
}
