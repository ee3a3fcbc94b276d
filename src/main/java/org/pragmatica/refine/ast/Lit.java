package org.pragmatica.refine.ast;

import org.pragmatica.refine.token.LitKind;
import org.pragmatica.refine.tree.SourceSpan;

/**
 * Numeric or boolean literal with the spelling it was written with.
 */
public record Lit(SourceSpan span, LitKind kind, String symbol) {
    @Override
    public String toString() {
        return symbol;
    }
}
