package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Function signature.
 *
 * <pre>{@code
 * fn<n: int>(x: &strg i32[@n]) -> i32 requires n > 0 ensures x: i32[n + 1]
 * }</pre>
 *
 * @param generics refinement parameters between angle brackets, absent when not written
 * @param args     parameters in order
 * @param returns  return type, absent for unit-returning signatures
 * @param requires precondition
 * @param ensures  post-state types of strong references, empty when the clause is omitted
 */
public record FnSig(
 SourceSpan span,
 Optional<List<RefineParam>> generics,
 List<Arg> args,
 Optional<Ty> returns,
 Optional<Expr> requires,
 List<Ensures> ensures) {
    public FnSig {
        generics = generics.map(List::copyOf);
        args = List.copyOf(args);
        ensures = List.copyOf(ensures);
    }

    /**
     * One {@code name: Ty} entry of the ensures clause.
     */
    public record Ensures(SourceSpan span, Ident name, Ty ty) {}
}
