package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * One constructor of a refined algebraic data type: {@code (Box<Pred[@p]>) -> Pred[false, p.is_atom]}
 */
public record VariantDef(SourceSpan span, List<Ty> fields, VariantRet ret) {
    public VariantDef {
        fields = List.copyOf(fields);
    }

    /**
     * Refined return shape. Indices are empty, with a zero-width span after the path, when not written.
     */
    public record VariantRet(SourceSpan span, Path path, Indices indices) {}
}
