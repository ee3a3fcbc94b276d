package org.pragmatica.refine.tree;

/**
 * Combines the boundary locations of consumed tokens into the span stored on a node.
 *
 * <p>Annotation payloads are usually tokenized relative to the attribute that holds them;
 * {@link #relativeTo(SourceLocation)} puts the resulting spans back into file coordinates.
 */
@FunctionalInterface
public interface SpanFactory {

    SpanFactory DIRECT = SourceSpan::of;

    SourceSpan span(SourceLocation start, SourceLocation end);

    static SpanFactory relativeTo(SourceLocation base) {
        return (start, end) -> SourceSpan.of(start.relativeTo(base), end.relativeTo(base));
    }
}
