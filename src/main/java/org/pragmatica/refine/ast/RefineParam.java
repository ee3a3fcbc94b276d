package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

/**
 * Refinement parameter {@code name: sort}.
 */
public record RefineParam(SourceSpan span, Ident name, Sort sort) {}
