package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Sort signature of a refined type: {@code is_atom: bool, nnf: bool}
 */
public record RefinedBy(SourceSpan span, List<RefineParam> params) {
    public RefinedBy {
        params = List.copyOf(params);
    }
}
