package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Type name with generic arguments: {@code Vec<i32{v : v > 0}>}. Arguments are empty when none are written.
 */
public record Path(SourceSpan span, Ident ident, List<Ty> args) {
    public Path {
        args = List.copyOf(args);
    }
}
