package org.pragmatica.refine.parser;

import org.pragmatica.refine.ast.Arg;
import org.pragmatica.refine.ast.Ident;
import org.pragmatica.refine.ast.Indices;
import org.pragmatica.refine.ast.Path;
import org.pragmatica.refine.ast.RefineArg;
import org.pragmatica.refine.ast.RefineParam;
import org.pragmatica.refine.ast.Sort;
import org.pragmatica.refine.ast.Ty;
import org.pragmatica.refine.error.ParseError;
import org.pragmatica.refine.token.Token;
import org.pragmatica.refine.token.TokenKind;
import org.pragmatica.refine.tree.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * Types, their indices, sorts and function parameters.
 *
 * <p>Forms that share a prefix are told apart by the token(s) right after it:
 * <pre>
 *  Path {  Ident :      existential          i32{v : v > 0}
 *  Path [               indexed              i32[n + 1]
 *  Path                 plain                i32
 *  [ Ty ;               array                [i32; _]
 *  [ Ty ]               slice                [i32]
 * </pre>
 * and for parameters, after {@code Ident :}:
 * <pre>
 *  &amp; strg               strong reference     x: &amp;strg i32[@n]
 *  Path {  Ident :      named existential    x: i32{v : v > x}
 *  Path {               constrained          x: i32{x > 0}
 *  Path [               alias                x: i32[@n]
 *  anything else        named type           x: &amp;i32
 * </pre>
 */
public final class TyParser {

    private static final String ARRAY_LEN_PLACEHOLDER = "_";

    private final TokenCursor cursor;
    private final ExprParser exprParser;

    public TyParser(TokenCursor cursor, ExprParser exprParser) {
        this.cursor = cursor;
        this.exprParser = exprParser;
    }

    public ParseResult<Ty> parseTy() {
        return cursor.nested(this::parseTyKind);
    }

    private ParseResult<Ty> parseTyKind() {
        var start = cursor.location();

        if (cursor.isIdent()) {
            var path = parsePath();
            if (path.isFailure()) {
                return path.asFailure();
            }
            return parsePathSuffix(start, path.unwrap());
        }
        if (cursor.check(TokenKind.L_PAREN)) {
            return parseTuple(start);
        }
        if (cursor.check(TokenKind.AMP)) {
            return parseRef(start);
        }
        if (cursor.check(TokenKind.L_BRACE)) {
            return parseConstr(start);
        }
        if (cursor.check(TokenKind.L_BRACKET)) {
            return parseArrayOrSlice(start);
        }
        return cursor.unexpected("type");
    }

    // Path ( '{' Ident ':' Expr '}' | '[' Indices ']' )?
    private ParseResult<Ty> parsePathSuffix(SourceLocation start, Path path) {
        if (cursor.check(TokenKind.L_BRACE)) {
            return parseExists(start, path);
        }
        if (cursor.check(TokenKind.L_BRACKET)) {
            return parseIndices().map(indices -> new Ty.Indexed(cursor.spanFrom(start), path, indices));
        }
        return ParseResult.success(new Ty.BaseTy(path.span(), path));
    }

    private ParseResult<Ty> parseExists(SourceLocation start, Path path) {
        cursor.advance();

        var bind = cursor.expectIdent();
        if (bind.isFailure()) {
            return bind.asFailure();
        }

        var colon = cursor.expect(TokenKind.COLON);
        if (colon.isFailure()) {
            return colon.asFailure();
        }

        var pred = exprParser.parseExpr();
        if (pred.isFailure()) {
            return pred.asFailure();
        }

        var close = cursor.expect(TokenKind.R_BRACE);
        if (close.isFailure()) {
            return close.asFailure();
        }
        return ParseResult.success(new Ty.Exists(cursor.spanFrom(start), path, bind.unwrap(), pred.unwrap()));
    }

    private ParseResult<Ty> parseTuple(SourceLocation start) {
        return Combinators.delimited(cursor, TokenKind.L_PAREN, TokenKind.COMMA, TokenKind.R_PAREN, this::parseTy)
                          .map(elements -> new Ty.Tuple(cursor.spanFrom(start), elements));
    }

    // '&' 'mut'? Ty
    private ParseResult<Ty> parseRef(SourceLocation start) {
        cursor.advance();
        var kind = cursor.eat(TokenKind.MUT) ? Ty.RefKind.MUT : Ty.RefKind.SHARED;
        return parseTy().map(ty -> new Ty.Ref(cursor.spanFrom(start), kind, ty));
    }

    // '{' Ty ':' Expr '}'
    private ParseResult<Ty> parseConstr(SourceLocation start) {
        cursor.advance();

        var ty = parseTy();
        if (ty.isFailure()) {
            return ty;
        }

        var colon = cursor.expect(TokenKind.COLON);
        if (colon.isFailure()) {
            return colon.asFailure();
        }

        var pred = exprParser.parseExpr();
        if (pred.isFailure()) {
            return pred.asFailure();
        }

        var close = cursor.expect(TokenKind.R_BRACE);
        if (close.isFailure()) {
            return close.asFailure();
        }
        return ParseResult.success(new Ty.Constr(cursor.spanFrom(start), ty.unwrap(), pred.unwrap()));
    }

    // '[' Ty ';' '_' ']' | '[' Ty ']'
    private ParseResult<Ty> parseArrayOrSlice(SourceLocation start) {
        cursor.advance();

        var elem = parseTy();
        if (elem.isFailure()) {
            return elem;
        }

        if (!cursor.eat(TokenKind.SEMI)) {
            return cursor.expect(TokenKind.R_BRACKET)
                         .map(close -> new Ty.Slice(cursor.spanFrom(start), elem.unwrap()));
        }

        if (!(cursor.peek() instanceof Token.Ident length)) {
            return cursor.unexpected("'" + ARRAY_LEN_PLACEHOLDER + "'");
        }
        var lengthSpan = cursor.spanOf(length);
        if (!length.name().equals(ARRAY_LEN_PLACEHOLDER)) {
            return ParseResult.failure(new ParseError.InvalidArrayLength(lengthSpan, length.name()));
        }
        cursor.advance();

        return cursor.expect(TokenKind.R_BRACKET)
                     .map(close -> new Ty.Array(cursor.spanFrom(start), elem.unwrap(), new Ty.ArrayLen(lengthSpan)));
    }

    // Ident ( '<' Ty, ... '>' )?
    public ParseResult<Path> parsePath() {
        var start = cursor.location();

        var ident = cursor.expectIdent();
        if (ident.isFailure()) {
            return ident.asFailure();
        }

        if (!cursor.check(TokenKind.LT)) {
            return ParseResult.success(new Path(cursor.spanFrom(start), ident.unwrap(), List.of()));
        }
        return Combinators.delimited(cursor, TokenKind.LT, TokenKind.COMMA, TokenKind.GT, this::parseTy)
                          .map(args -> new Path(cursor.spanFrom(start), ident.unwrap(), args));
    }

    public ParseResult<Indices> parseIndices() {
        var start = cursor.location();
        return Combinators.delimited(cursor,
                                     TokenKind.L_BRACKET,
                                     TokenKind.COMMA,
                                     TokenKind.R_BRACKET,
                                     this::parseRefineArg)
                          .map(args -> new Indices(cursor.spanFrom(start), args));
    }

    // '@' Ident | '|' Ident, ... '|' Expr | '||' Expr | Expr
    private ParseResult<RefineArg> parseRefineArg() {
        var start = cursor.location();

        if (cursor.eat(TokenKind.AT)) {
            return cursor.expectIdent()
                         .map(name -> new RefineArg.Bind(cursor.spanFrom(start), name));
        }

        if (cursor.check(TokenKind.PIPE)) {
            var params = Combinators.delimited(cursor,
                                               TokenKind.PIPE,
                                               TokenKind.COMMA,
                                               TokenKind.PIPE,
                                               cursor::expectIdent);
            if (params.isFailure()) {
                return params.asFailure();
            }
            return parseAbsBody(start, params.unwrap());
        }

        // Lexers fuse an empty parameter list into '||'
        if (cursor.eat(TokenKind.OR_OR)) {
            return parseAbsBody(start, List.of());
        }

        return exprParser.parseExpr()
                         .map(expr -> new RefineArg.Expression(expr.span(), expr));
    }

    private ParseResult<RefineArg> parseAbsBody(SourceLocation start, List<Ident> params) {
        return exprParser.parseExpr()
                         .map(body -> new RefineArg.Abs(cursor.spanFrom(start), params, body));
    }

    // Ident | '(' Ident, ... ')' '->' Ident
    public ParseResult<Sort> parseSort() {
        var start = cursor.location();

        if (cursor.isIdent()) {
            return cursor.expectIdent()
                         .map(name -> new Sort.Base(name.span(), name));
        }

        if (!cursor.check(TokenKind.L_PAREN)) {
            return cursor.unexpected("sort");
        }

        var inputs = Combinators.delimited(cursor,
                                           TokenKind.L_PAREN,
                                           TokenKind.COMMA,
                                           TokenKind.R_PAREN,
                                           cursor::expectIdent);
        if (inputs.isFailure()) {
            return inputs.asFailure();
        }

        var arrow = cursor.expect(TokenKind.R_ARROW);
        if (arrow.isFailure()) {
            return arrow.asFailure();
        }

        return cursor.expectIdent()
                     .map(output -> new Sort.Func(cursor.spanFrom(start), inputs.unwrap(), output));
    }

    public ParseResult<RefineParam> parseRefineParam() {
        return Combinators.binding(cursor, cursor::expectIdent, TokenKind.COLON, this::parseSort, RefineParam::new);
    }

    public ParseResult<Arg> parseArg() {
        var start = cursor.location();

        if (!(cursor.isIdent() && cursor.checkAt(1, TokenKind.COLON))) {
            return parseTy().map(ty -> new Arg.Typed(ty.span(), Optional.empty(), ty));
        }

        var bind = cursor.expectIdent().unwrap();
        cursor.advance();

        if (cursor.check(TokenKind.AMP) && cursor.checkAt(1, TokenKind.STRG)) {
            cursor.advance();
            cursor.advance();
            return parseTy().map(ty -> new Arg.StrgRef(cursor.spanFrom(start), bind, ty));
        }

        if (!cursor.isIdent()) {
            return parseTy().map(ty -> new Arg.Typed(cursor.spanFrom(start), Optional.of(bind), ty));
        }

        var pathStart = cursor.location();
        var result = parsePath();
        if (result.isFailure()) {
            return result.asFailure();
        }
        var path = result.unwrap();

        if (cursor.check(TokenKind.L_BRACE) && !startsExistsBinder()) {
            return parseArgConstr(start, bind, path);
        }
        if (cursor.check(TokenKind.L_BRACKET)) {
            return parseIndices().map(indices -> new Arg.Alias(cursor.spanFrom(start), bind, path, indices));
        }
        return parsePathSuffix(pathStart, path)
            .map(ty -> new Arg.Typed(cursor.spanFrom(start), Optional.of(bind), ty));
    }

    // '{' Ident ':' opens an existential; a predicate can never contain ':'
    private boolean startsExistsBinder() {
        return cursor.isIdentAt(1) && cursor.checkAt(2, TokenKind.COLON);
    }

    // x: Path '{' Expr '}'
    private ParseResult<Arg> parseArgConstr(SourceLocation start, Ident bind, Path path) {
        return exprParser.parseBlock()
                         .map(pred -> new Arg.Constr(cursor.spanFrom(start), bind, path, pred));
    }
}
