package org.pragmatica.refine.parser;

import org.pragmatica.refine.tree.SpanFactory;

import java.util.Objects;

/**
 * Parser configuration options.
 *
 * @param spanFactory builds node spans from token boundaries
 * @param maxDepth    deepest nesting of types and expressions accepted before failing
 */
public record ParserConfig(
    SpanFactory spanFactory,
    int maxDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        SpanFactory.DIRECT,
        64
    );

    public ParserConfig {
        Objects.requireNonNull(spanFactory, "spanFactory");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }
}
