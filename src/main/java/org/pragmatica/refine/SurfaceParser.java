package org.pragmatica.refine;

import org.pragmatica.refine.ast.Alias;
import org.pragmatica.refine.ast.Defn;
import org.pragmatica.refine.ast.Expr;
import org.pragmatica.refine.ast.FnSig;
import org.pragmatica.refine.ast.Qualifier;
import org.pragmatica.refine.ast.RefinedBy;
import org.pragmatica.refine.ast.Ty;
import org.pragmatica.refine.ast.UifDef;
import org.pragmatica.refine.ast.VariantDef;
import org.pragmatica.refine.parser.DeclParser;
import org.pragmatica.refine.parser.ParseResult;
import org.pragmatica.refine.parser.ParserConfig;
import org.pragmatica.refine.parser.TokenCursor;
import org.pragmatica.refine.token.Token;
import org.pragmatica.refine.token.TokenKind;
import org.pragmatica.refine.tree.SourceLocation;
import org.pragmatica.refine.tree.SpanFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Entry point for parsing refinement annotations from lexer tokens.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = SurfaceParser.builder()
 *                           .spanFactory(SpanFactory.relativeTo(attributeStart))
 *                           .build();
 *
 * var sig = parser.parseFnSig(tokens);
 * }</pre>
 *
 * A parser holds configuration only; every call works on its own cursor, so one instance may be shared
 * between threads. The token list may omit the trailing EOF token.
 */
public final class SurfaceParser {
    private static final Logger LOG = LoggerFactory.getLogger(SurfaceParser.class);

    private static final SurfaceParser DEFAULT = new SurfaceParser(ParserConfig.DEFAULT);

    private final ParserConfig config;

    private SurfaceParser(ParserConfig config) {
        this.config = config;
    }

    public static SurfaceParser create() {
        return DEFAULT;
    }

    public static SurfaceParser create(ParserConfig config) {
        return new SurfaceParser(Objects.requireNonNull(config, "config"));
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * {@code type Name(params) = Ty}
     */
    public ParseResult<Alias> parseAlias(List<Token> tokens) {
        return run("alias", tokens, DeclParser::alias);
    }

    /**
     * {@code name: sort, ...}
     */
    public ParseResult<RefinedBy> parseRefinedBy(List<Token> tokens) {
        return run("refined_by", tokens, DeclParser::refinedBy);
    }

    /**
     * {@code fn name(sort, ...) -> sort}
     */
    public ParseResult<UifDef> parseUifDef(List<Token> tokens) {
        return run("uif", tokens, DeclParser::uifDef);
    }

    /**
     * {@code name(params) { expr }}
     */
    public ParseResult<Qualifier> parseQualifier(List<Token> tokens) {
        return run("qualifier", tokens, DeclParser::qualifier);
    }

    /**
     * {@code name(params) -> sort { expr }}
     */
    public ParseResult<Defn> parseDefn(List<Token> tokens) {
        return run("defn", tokens, DeclParser::defn);
    }

    /**
     * {@code fn<generics>(args) -> Ty requires expr ensures x: Ty, ...}
     */
    public ParseResult<FnSig> parseFnSig(List<Token> tokens) {
        return run("fn_sig", tokens, DeclParser::fnSig);
    }

    /**
     * {@code (fields) -> Path[indices]}
     */
    public ParseResult<VariantDef> parseVariant(List<Token> tokens) {
        return run("variant", tokens, DeclParser::variant);
    }

    public ParseResult<Expr> parseExpr(List<Token> tokens) {
        return run("expr", tokens, DeclParser::expr);
    }

    public ParseResult<Ty> parseType(List<Token> tokens) {
        return run("type", tokens, DeclParser::ty);
    }

    private <T> ParseResult<T> run(String rule, List<Token> tokens, Function<DeclParser, ParseResult<T>> entry) {
        var input = terminated(Objects.requireNonNull(tokens, "tokens"));
        LOG.debug("Parsing {} from {} tokens", rule, input.size());

        var result = entry.apply(new DeclParser(new TokenCursor(input, config)));
        if (result.isFailure()) {
            LOG.debug("Failed to parse {}: {}", rule, result.error().message());
        }
        return result;
    }

    private static List<Token> terminated(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            return tokens;
        }
        var end = tokens.isEmpty()
                  ? SourceLocation.START
                  : tokens.get(tokens.size() - 1).end();
        var result = new ArrayList<Token>(tokens.size() + 1);
        result.addAll(tokens);
        result.add(Token.eof(end));
        return result;
    }

    /**
     * Create a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SpanFactory spanFactory = ParserConfig.DEFAULT.spanFactory();
        private int maxDepth = ParserConfig.DEFAULT.maxDepth();

        private Builder() {}

        public Builder spanFactory(SpanFactory spanFactory) {
            this.spanFactory = spanFactory;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public SurfaceParser build() {
            return create(new ParserConfig(spanFactory, maxDepth));
        }
    }
}
