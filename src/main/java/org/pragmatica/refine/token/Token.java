package org.pragmatica.refine.token;

import org.pragmatica.refine.tree.SourceLocation;

/**
 * Tokens delivered by the lexer. Each token knows the locations of its first character
 * and of the position right after its last character.
 */
public sealed interface Token {
    SourceLocation start();

    SourceLocation end();

    /**
     * Human-readable form used in error messages.
     */
    String describe();

    default boolean is(TokenKind kind) {
        return false;
    }

    /**
     * Identifier with its interned name.
     */
    record Ident(SourceLocation start, SourceLocation end, String name) implements Token {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    /**
     * Literal with its kind and original spelling.
     */
    record Literal(SourceLocation start, SourceLocation end, LitKind kind, String symbol) implements Token {
        @Override
        public String describe() {
            return "literal '" + symbol + "'";
        }
    }

    /**
     * Keyword, punctuation, operator or end of input.
     */
    record Fixed(SourceLocation start, SourceLocation end, TokenKind kind) implements Token {
        @Override
        public boolean is(TokenKind expected) {
            return kind == expected;
        }

        @Override
        public String describe() {
            return kind.describe();
        }
    }

    static Token.Ident ident(SourceLocation start, SourceLocation end, String name) {
        return new Ident(start, end, name);
    }

    static Token.Literal literal(SourceLocation start, SourceLocation end, LitKind kind, String symbol) {
        return new Literal(start, end, kind, symbol);
    }

    static Token.Fixed fixed(SourceLocation start, SourceLocation end, TokenKind kind) {
        return new Fixed(start, end, kind);
    }

    static Token.Fixed eof(SourceLocation location) {
        return new Fixed(location, location, TokenKind.EOF);
    }
}
