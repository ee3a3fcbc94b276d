package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Refinement-annotated types.
 */
public sealed interface Ty {

    SourceSpan span();

    /**
     * Plain path: {@code i32}, {@code Vec<T>}
     */
    record BaseTy(SourceSpan span, Path path) implements Ty {}

    /**
     * Path applied to indices: {@code i32[n + 1]}
     */
    record Indexed(SourceSpan span, Path path, Indices indices) implements Ty {}

    /**
     * Existential: {@code i32{v : v > 0}}
     */
    record Exists(SourceSpan span, Path path, Ident bind, Expr pred) implements Ty {}

    /**
     * Constrained type without a new binder: {@code {i32[@n] : n > 0}}
     */
    record Constr(SourceSpan span, Ty ty, Expr pred) implements Ty {}

    /**
     * Reference: {@code &T} or {@code &mut T}
     */
    record Ref(SourceSpan span, RefKind kind, Ty ty) implements Ty {}

    /**
     * Tuple: {@code (T1, T2)}
     */
    record Tuple(SourceSpan span, List<Ty> elements) implements Ty {
        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Array with placeholder length: {@code [T; _]}
     */
    record Array(SourceSpan span, Ty ty, ArrayLen len) implements Ty {}

    /**
     * Slice: {@code [T]}
     */
    record Slice(SourceSpan span, Ty ty) implements Ty {}

    enum RefKind {
        SHARED,
        MUT
    }

    /**
     * The {@code _} written in array length position.
     */
    record ArrayLen(SourceSpan span) {}
}
