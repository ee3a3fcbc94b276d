package org.pragmatica.refine.ast;

import org.pragmatica.refine.tree.SourceSpan;

/**
 * A name: variable, type, field or function.
 */
public record Ident(SourceSpan span, String name) {
    public boolean is(String text) {
        return name.equals(text);
    }

    @Override
    public String toString() {
        return name;
    }
}
