package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Type alias: {@code type Nat(n) = i32{v : v >= n}}
 */
public record Alias(SourceSpan span, Ident name, List<Ident> params, Ty ty) {
    public Alias {
        params = List.copyOf(params);
    }
}
