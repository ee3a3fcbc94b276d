package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Sort of a refinement value. Function sorts are first order: inputs and output are base sort names.
 */
public sealed interface Sort {
    SourceSpan span();

    /**
     * Named sort: {@code int}, {@code bool}, ...
     */
    record Base(SourceSpan span, Ident name) implements Sort {}

    /**
     * Function sort: {@code (int, int) -> bool}
     */
    record Func(SourceSpan span, List<Ident> inputs, Ident output) implements Sort {
        public Func {
            inputs = List.copyOf(inputs);
        }
    }
}
