package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * One index of an {@link Indices} list.
 */
public sealed interface RefineArg {
    SourceSpan span();

    /**
     * Fresh binder: {@code @n}
     */
    record Bind(SourceSpan span, Ident name) implements RefineArg {}

    record Expression(SourceSpan span, Expr expr) implements RefineArg {}

    /**
     * Anonymous abstraction for function-sorted indices: {@code |x, y| x < y}
     */
    record Abs(SourceSpan span, List<Ident> params, Expr body) implements RefineArg {
        public Abs {
            params = List.copyOf(params);
        }
    }
}
