package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Named predicate template: {@code Pos(x: int) { x > 0 }}
 */
public record Qualifier(SourceSpan span, Ident name, List<RefineParam> params, Expr expr) {
    public Qualifier {
        params = List.copyOf(params);
    }
}
