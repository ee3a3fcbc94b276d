package org.pragmatica.refine.parser;

import org.pragmatica.refine.ast.Alias;
import org.pragmatica.refine.ast.Defn;
import org.pragmatica.refine.ast.Expr;
import org.pragmatica.refine.ast.FnSig;
import org.pragmatica.refine.ast.Ident;
import org.pragmatica.refine.ast.Indices;
import org.pragmatica.refine.ast.Qualifier;
import org.pragmatica.refine.ast.RefineParam;
import org.pragmatica.refine.ast.RefinedBy;
import org.pragmatica.refine.ast.Ty;
import org.pragmatica.refine.ast.UifDef;
import org.pragmatica.refine.ast.VariantDef;
import org.pragmatica.refine.token.TokenKind;

import java.util.List;
import java.util.Optional;

/**
 * Top-level declarations. Every rule here must consume the whole token list.
 */
public final class DeclParser {

    private final TokenCursor cursor;
    private final ExprParser exprParser;
    private final TyParser tyParser;

    public DeclParser(TokenCursor cursor) {
        this.cursor = cursor;
        this.exprParser = new ExprParser(cursor);
        this.tyParser = new TyParser(cursor, exprParser);
    }

    public ParseResult<Expr> expr() {
        return cursor.expectEnd(exprParser.parseExpr());
    }

    public ParseResult<Ty> ty() {
        return cursor.expectEnd(tyParser.parseTy());
    }

    public ParseResult<Alias> alias() {
        return cursor.expectEnd(parseAlias());
    }

    public ParseResult<RefinedBy> refinedBy() {
        return cursor.expectEnd(parseRefinedBy());
    }

    public ParseResult<UifDef> uifDef() {
        return cursor.expectEnd(parseUifDef());
    }

    public ParseResult<Qualifier> qualifier() {
        return cursor.expectEnd(parseQualifier());
    }

    public ParseResult<Defn> defn() {
        return cursor.expectEnd(parseDefn());
    }

    public ParseResult<FnSig> fnSig() {
        return cursor.expectEnd(parseFnSig());
    }

    public ParseResult<VariantDef> variant() {
        return cursor.expectEnd(parseVariant());
    }

    // 'type' Ident ( '(' Ident, ... ')' )? '=' Ty
    private ParseResult<Alias> parseAlias() {
        var start = cursor.location();

        var keyword = cursor.expect(TokenKind.TYPE);
        if (keyword.isFailure()) {
            return keyword.asFailure();
        }

        var name = cursor.expectIdent();
        if (name.isFailure()) {
            return name.asFailure();
        }

        ParseResult<List<Ident>> params = ParseResult.success(List.of());
        if (cursor.check(TokenKind.L_PAREN)) {
            params = identList();
            if (params.isFailure()) {
                return params.asFailure();
            }
        }

        var eq = cursor.expect(TokenKind.EQ);
        if (eq.isFailure()) {
            return eq.asFailure();
        }

        var ty = tyParser.parseTy();
        if (ty.isFailure()) {
            return ty.asFailure();
        }
        return ParseResult.success(new Alias(cursor.spanFrom(start), name.unwrap(), params.unwrap(), ty.unwrap()));
    }

    // RefineParam, ...
    private ParseResult<RefinedBy> parseRefinedBy() {
        var start = cursor.location();
        return Combinators.separated(cursor, TokenKind.COMMA, TokenKind.EOF, tyParser::parseRefineParam)
                          .map(params -> new RefinedBy(cursor.spanFrom(start), params));
    }

    // 'fn' Ident '(' Ident, ... ')' '->' Ident
    private ParseResult<UifDef> parseUifDef() {
        var start = cursor.location();

        var keyword = cursor.expect(TokenKind.FN);
        if (keyword.isFailure()) {
            return keyword.asFailure();
        }

        var name = cursor.expectIdent();
        if (name.isFailure()) {
            return name.asFailure();
        }

        var inputs = identList();
        if (inputs.isFailure()) {
            return inputs.asFailure();
        }

        var arrow = cursor.expect(TokenKind.R_ARROW);
        if (arrow.isFailure()) {
            return arrow.asFailure();
        }

        return cursor.expectIdent()
                     .map(output -> new UifDef(cursor.spanFrom(start), name.unwrap(), inputs.unwrap(), output));
    }

    // Ident '(' RefineParam, ... ')' '{' Expr '}'
    private ParseResult<Qualifier> parseQualifier() {
        var start = cursor.location();

        var name = cursor.expectIdent();
        if (name.isFailure()) {
            return name.asFailure();
        }

        var params = refineParamList(TokenKind.L_PAREN, TokenKind.R_PAREN);
        if (params.isFailure()) {
            return params.asFailure();
        }

        return exprParser.parseBlock()
                         .map(expr -> new Qualifier(cursor.spanFrom(start), name.unwrap(), params.unwrap(), expr));
    }

    // Ident '(' RefineParam, ... ')' '->' Sort '{' Expr '}'
    private ParseResult<Defn> parseDefn() {
        var start = cursor.location();

        var name = cursor.expectIdent();
        if (name.isFailure()) {
            return name.asFailure();
        }

        var params = refineParamList(TokenKind.L_PAREN, TokenKind.R_PAREN);
        if (params.isFailure()) {
            return params.asFailure();
        }

        var arrow = cursor.expect(TokenKind.R_ARROW);
        if (arrow.isFailure()) {
            return arrow.asFailure();
        }

        var sort = tyParser.parseSort();
        if (sort.isFailure()) {
            return sort.asFailure();
        }

        return exprParser.parseBlock()
                         .map(expr -> new Defn(cursor.spanFrom(start),
                                               name.unwrap(),
                                               params.unwrap(),
                                               sort.unwrap(),
                                               expr));
    }

    // 'fn' ( '<' RefineParam, ... '>' )? '(' Arg, ... ')' ( '->' Ty )? ( 'requires' Expr )? ( 'ensures' Ensures, ... )?
    private ParseResult<FnSig> parseFnSig() {
        var start = cursor.location();

        var keyword = cursor.expect(TokenKind.FN);
        if (keyword.isFailure()) {
            return keyword.asFailure();
        }

        Optional<List<RefineParam>> generics = Optional.empty();
        if (cursor.check(TokenKind.LT)) {
            var params = refineParamList(TokenKind.LT, TokenKind.GT);
            if (params.isFailure()) {
                return params.asFailure();
            }
            generics = Optional.of(params.unwrap());
        }

        var args = Combinators.delimited(cursor,
                                         TokenKind.L_PAREN,
                                         TokenKind.COMMA,
                                         TokenKind.R_PAREN,
                                         tyParser::parseArg);
        if (args.isFailure()) {
            return args.asFailure();
        }

        Optional<Ty> returns = Optional.empty();
        if (cursor.eat(TokenKind.R_ARROW)) {
            var ty = tyParser.parseTy();
            if (ty.isFailure()) {
                return ty.asFailure();
            }
            returns = Optional.of(ty.unwrap());
        }

        Optional<Expr> requires = Optional.empty();
        if (cursor.eat(TokenKind.REQUIRES)) {
            var pred = exprParser.parseExpr();
            if (pred.isFailure()) {
                return pred.asFailure();
            }
            requires = Optional.of(pred.unwrap());
        }

        List<FnSig.Ensures> ensures = List.of();
        if (cursor.eat(TokenKind.ENSURES)) {
            var clauses = Combinators.separated(cursor, TokenKind.COMMA, TokenKind.EOF, this::parseEnsures);
            if (clauses.isFailure()) {
                return clauses.asFailure();
            }
            ensures = clauses.unwrap();
        }

        return ParseResult.success(new FnSig(cursor.spanFrom(start), generics, args.unwrap(), returns, requires, ensures));
    }

    private ParseResult<FnSig.Ensures> parseEnsures() {
        return Combinators.binding(cursor, cursor::expectIdent, TokenKind.COLON, tyParser::parseTy, FnSig.Ensures::new);
    }

    // ( ( '(' Ty, ... ')' | '{' Ty, ... '}' ) '->' )? Path ( '[' Indices ']' )?
    private ParseResult<VariantDef> parseVariant() {
        var start = cursor.location();

        ParseResult<List<Ty>> fields = ParseResult.success(List.of());
        if (cursor.check(TokenKind.L_PAREN)) {
            fields = variantFields(TokenKind.L_PAREN, TokenKind.R_PAREN);
        } else if (cursor.check(TokenKind.L_BRACE)) {
            fields = variantFields(TokenKind.L_BRACE, TokenKind.R_BRACE);
        }
        if (fields.isFailure()) {
            return fields.asFailure();
        }

        var retStart = cursor.location();
        var path = tyParser.parsePath();
        if (path.isFailure()) {
            return path.asFailure();
        }

        var indices = cursor.check(TokenKind.L_BRACKET)
                      ? tyParser.parseIndices()
                      : ParseResult.success(Indices.empty(cursor.emptySpanAt(cursor.lastEnd())));
        if (indices.isFailure()) {
            return indices.asFailure();
        }

        var ret = new VariantDef.VariantRet(cursor.spanFrom(retStart), path.unwrap(), indices.unwrap());
        return ParseResult.success(new VariantDef(cursor.spanFrom(start), fields.unwrap(), ret));
    }

    private ParseResult<List<Ty>> variantFields(TokenKind open, TokenKind close) {
        var fields = Combinators.delimited(cursor, open, TokenKind.COMMA, close, tyParser::parseTy);
        if (fields.isFailure()) {
            return fields;
        }
        var arrow = cursor.expect(TokenKind.R_ARROW);
        if (arrow.isFailure()) {
            return arrow.asFailure();
        }
        return fields;
    }

    private ParseResult<List<Ident>> identList() {
        return Combinators.delimited(cursor, TokenKind.L_PAREN, TokenKind.COMMA, TokenKind.R_PAREN, cursor::expectIdent);
    }

    private ParseResult<List<RefineParam>> refineParamList(TokenKind open, TokenKind close) {
        return Combinators.delimited(cursor, open, TokenKind.COMMA, close, tyParser::parseRefineParam);
    }
}
