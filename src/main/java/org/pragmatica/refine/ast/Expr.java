package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;

/**
 * Refinement predicates and expressions.
 */
public sealed interface Expr {

    SourceSpan span();

    record Literal(SourceSpan span, Lit lit) implements Expr {}

    record Var(SourceSpan span, Ident name) implements Expr {}

    /**
     * Field projection on a variable: {@code p.nnf}
     */
    record Dot(SourceSpan span, Ident var, Ident field) implements Expr {}

    /**
     * Application of a named function: {@code foo(x, 1)}
     */
    record App(SourceSpan span, Ident func, List<Expr> args) implements Expr {
        public App {
            args = List.copyOf(args);
        }
    }

    record IfThenElse(SourceSpan span, Expr cond, Expr then, Expr otherwise) implements Expr {}

    record BinaryOp(SourceSpan span, BinOp op, Expr left, Expr right) implements Expr {}
}
