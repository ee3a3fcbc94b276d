package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.Optional;

/**
 * Function parameter in a signature.
 */
public sealed interface Arg {
    SourceSpan span();

    /**
     * Strong reference parameter: {@code x: &strg i32[@n]}
     */
    record StrgRef(SourceSpan span, Ident bind, Ty ty) implements Arg {}

    /**
     * Parameter constrained by a predicate over itself: {@code x: i32{x > 0}}
     */
    record Constr(SourceSpan span, Ident bind, Path path, Expr pred) implements Arg {}

    /**
     * Parameter bound to an indexed type: {@code x: i32[@n]}
     */
    record Alias(SourceSpan span, Ident bind, Path path, Indices indices) implements Arg {}

    /**
     * Plain type, optionally named: {@code x: &i32}, {@code i32{v : v > 0}}
     */
    record Typed(SourceSpan span, Optional<Ident> bind, Ty ty) implements Arg {}
}
