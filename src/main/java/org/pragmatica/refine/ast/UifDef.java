package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Uninterpreted function declaration: {@code fn foo(int, int) -> int}
 */
public record UifDef(SourceSpan span, Ident name, List<Ident> inputs, Ident output) {
    public UifDef {
        inputs = List.copyOf(inputs);
    }
}
