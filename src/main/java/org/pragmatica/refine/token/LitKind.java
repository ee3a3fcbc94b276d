package org.pragmatica.refine.token;

/**
 * Kind of literal carried by a {@link Token.Literal}.
 */
public enum LitKind {
    INTEGER,
    FLOAT,
    BOOL
}
