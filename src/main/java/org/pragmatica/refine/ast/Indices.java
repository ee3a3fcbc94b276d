package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Refinement arguments indexing a type, written between brackets.
 */
public record Indices(SourceSpan span, List<RefineArg> args) {
    public Indices {
        args = List.copyOf(args);
    }

    public static Indices empty(SourceSpan span) {
        return new Indices(span, List.of());
    }

    public boolean isEmpty() {
        return args.isEmpty();
    }
}
