package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Refinement-level function definition: {@code nat(x: int) -> bool { 0 <= x }}
 */
public record Defn(SourceSpan span, Ident name, List<RefineParam> params, Sort sort, Expr expr) {
    public Defn {
        params = List.copyOf(params);
    }
}
