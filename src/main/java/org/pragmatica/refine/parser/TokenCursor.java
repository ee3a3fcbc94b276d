package org.pragmatica.refine.parser;

import org.pragmatica.refine.ast.Ident;
import org.pragmatica.refine.error.ParseError;
import org.pragmatica.refine.token.Token;
import org.pragmatica.refine.token.TokenKind;
import org.pragmatica.refine.tree.SourceLocation;
import org.pragmatica.refine.tree.SourceSpan;

import java.util.List;
import java.util.function.Supplier;

/**
 * Position in a token list shared by the rule parsers of one parse.
 *
 * <p>Lookahead never goes further than a few tokens and the cursor never moves backwards.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private final ParserConfig config;
    private int pos;
    private int depth;
    private SourceLocation lastEnd;

    /**
     * @param tokens token list terminated by an {@link TokenKind#EOF} token
     */
    public TokenCursor(List<Token> tokens, ParserConfig config) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token list must end with an EOF token");
        }
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).is(TokenKind.EOF)) {
                throw new IllegalArgumentException("EOF token at position " + i + " before the end of the list");
            }
        }
        this.tokens = List.copyOf(tokens);
        this.config = config;
        this.pos = 0;
        this.depth = 0;
        this.lastEnd = tokens.get(0).start();
    }

    public Token peek() {
        return tokens.get(pos);
    }

    /**
     * Token {@code n} positions ahead of the current one; the EOF token once past the end.
     */
    public Token peek(int n) {
        return tokens.get(Math.min(pos + n, tokens.size() - 1));
    }

    public Token advance() {
        var token = peek();
        if (!isAtEnd()) {
            pos++;
            lastEnd = token.end();
        }
        return token;
    }

    public boolean isAtEnd() {
        return peek().is(TokenKind.EOF);
    }

    public boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    public boolean checkAt(int n, TokenKind kind) {
        return peek(n).is(kind);
    }

    public boolean isIdent() {
        return isIdentAt(0);
    }

    public boolean isIdentAt(int n) {
        return peek(n) instanceof Token.Ident;
    }

    /**
     * Consume the current token if it has the given kind.
     */
    public boolean eat(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    public ParseResult<Token> expect(TokenKind kind) {
        if (check(kind)) {
            return ParseResult.success(advance());
        }
        return unexpected(kind.describe());
    }

    public ParseResult<Ident> expectIdent() {
        if (peek() instanceof Token.Ident ident) {
            advance();
            return ParseResult.success(new Ident(spanOf(ident), ident.name()));
        }
        return unexpected("identifier");
    }

    /**
     * Require that the whole input was consumed by a successful rule.
     */
    public <T> ParseResult<T> expectEnd(ParseResult<T> result) {
        if (result.isSuccess() && !isAtEnd()) {
            return unexpected(TokenKind.EOF.describe());
        }
        return result;
    }

    /**
     * Failure at the current token.
     */
    public <T> ParseResult<T> unexpected(String expected) {
        var token = peek();
        if (token.is(TokenKind.EOF)) {
            return ParseResult.failure(new ParseError.UnexpectedEof(spanOf(token), expected));
        }
        return ParseResult.failure(new ParseError.UnexpectedToken(spanOf(token), token.describe(), expected));
    }

    /**
     * Run a rule that may recurse into types or expressions, failing instead of exceeding the depth limit.
     */
    public <T> ParseResult<T> nested(Supplier<ParseResult<T>> rule) {
        if (depth >= config.maxDepth()) {
            return ParseResult.failure(new ParseError.NestingTooDeep(spanOf(peek()), config.maxDepth()));
        }
        depth++;
        try {
            return rule.get();
        } finally {
            depth--;
        }
    }

    /**
     * Start of the next token, where the rule about to run begins.
     */
    public SourceLocation location() {
        return peek().start();
    }

    /**
     * Span from {@code start} to the end of the last consumed token. Zero width if nothing was consumed since.
     */
    public SourceSpan spanFrom(SourceLocation start) {
        var end = lastEnd.offset() >= start.offset() ? lastEnd : start;
        return config.spanFactory().span(start, end);
    }

    /**
     * Zero-width span at {@code location}.
     */
    public SourceSpan emptySpanAt(SourceLocation location) {
        return config.spanFactory().span(location, location);
    }

    /**
     * End of the last consumed token.
     */
    public SourceLocation lastEnd() {
        return lastEnd;
    }

    public SourceSpan spanOf(Token token) {
        return config.spanFactory().span(token.start(), token.end());
    }
}
