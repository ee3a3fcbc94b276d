package org.pragmatica.refine.parser;

import org.pragmatica.refine.ast.BinOp;
import org.pragmatica.refine.ast.Expr;
import org.pragmatica.refine.ast.Lit;
import org.pragmatica.refine.token.Token;
import org.pragmatica.refine.token.TokenKind;
import org.pragmatica.refine.tree.SourceLocation;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Refinement expressions, one method per precedence level from loosest to tightest:
 *
 * <pre>
 *  1  &lt;=&gt;                     non-associative
 *  2  =&gt;                      left
 *  3  ||                      left
 *  4  &amp;&amp;                      left
 *  5  ==  &gt;  &gt;=  &lt;  &lt;=        non-associative
 *  6  +  -                    left
 *  7  *  %                    left
 *  8  if, literal, var.field, f(args), var, ( expr )
 * </pre>
 *
 * A non-associative level applies its operator at most once and leaves a second occurrence to the caller,
 * which then fails on it.
 */
public final class ExprParser {

    private static final Map<TokenKind, BinOp> IFF = Map.of(TokenKind.IFF, BinOp.IFF);
    private static final Map<TokenKind, BinOp> IMP = Map.of(TokenKind.FAT_ARROW, BinOp.IMP);
    private static final Map<TokenKind, BinOp> OR = Map.of(TokenKind.OR_OR, BinOp.OR);
    private static final Map<TokenKind, BinOp> AND = Map.of(TokenKind.AND_AND, BinOp.AND);
    private static final Map<TokenKind, BinOp> COMPARISON = Map.of(TokenKind.EQ_EQ, BinOp.EQ,
                                                                   TokenKind.GT, BinOp.GT,
                                                                   TokenKind.GE, BinOp.GE,
                                                                   TokenKind.LT, BinOp.LT,
                                                                   TokenKind.LE, BinOp.LE);
    private static final Map<TokenKind, BinOp> ADDITIVE = Map.of(TokenKind.PLUS, BinOp.ADD,
                                                                 TokenKind.MINUS, BinOp.SUB);
    private static final Map<TokenKind, BinOp> MULTIPLICATIVE = Map.of(TokenKind.STAR, BinOp.MUL,
                                                                       TokenKind.PERCENT, BinOp.MOD);

    private final TokenCursor cursor;

    public ExprParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    public ParseResult<Expr> parseExpr() {
        return cursor.nested(this::parseIff);
    }

    private ParseResult<Expr> parseIff() {
        return nonAssociative(IFF, this::parseImp);
    }

    private ParseResult<Expr> parseImp() {
        return leftAssociative(IMP, this::parseOr);
    }

    private ParseResult<Expr> parseOr() {
        return leftAssociative(OR, this::parseAnd);
    }

    private ParseResult<Expr> parseAnd() {
        return leftAssociative(AND, this::parseComparison);
    }

    private ParseResult<Expr> parseComparison() {
        return nonAssociative(COMPARISON, this::parseAdditive);
    }

    private ParseResult<Expr> parseAdditive() {
        return leftAssociative(ADDITIVE, this::parseMultiplicative);
    }

    private ParseResult<Expr> parseMultiplicative() {
        return leftAssociative(MULTIPLICATIVE, this::parsePrimary);
    }

    private ParseResult<Expr> nonAssociative(Map<TokenKind, BinOp> operators, Supplier<ParseResult<Expr>> operand) {
        var start = cursor.location();

        var left = operand.get();
        if (left.isFailure()) {
            return left;
        }

        var op = operatorAt(operators);
        if (op.isEmpty()) {
            return left;
        }
        cursor.advance();

        var right = operand.get();
        if (right.isFailure()) {
            return right;
        }
        return ParseResult.success(new Expr.BinaryOp(cursor.spanFrom(start), op.get(), left.unwrap(), right.unwrap()));
    }

    private ParseResult<Expr> leftAssociative(Map<TokenKind, BinOp> operators, Supplier<ParseResult<Expr>> operand) {
        var start = cursor.location();

        var result = operand.get();
        if (result.isFailure()) {
            return result;
        }
        var expr = result.unwrap();

        for (var op = operatorAt(operators); op.isPresent(); op = operatorAt(operators)) {
            cursor.advance();
            var right = operand.get();
            if (right.isFailure()) {
                return right;
            }
            expr = new Expr.BinaryOp(cursor.spanFrom(start), op.get(), expr, right.unwrap());
        }

        return ParseResult.success(expr);
    }

    private Optional<BinOp> operatorAt(Map<TokenKind, BinOp> operators) {
        if (cursor.peek() instanceof Token.Fixed fixed) {
            return Optional.ofNullable(operators.get(fixed.kind()));
        }
        return Optional.empty();
    }

    private ParseResult<Expr> parsePrimary() {
        var token = cursor.peek();
        var start = token.start();

        if (token.is(TokenKind.IF)) {
            return parseIfThenElse(start);
        }

        if (token instanceof Token.Literal literal) {
            cursor.advance();
            var span = cursor.spanOf(literal);
            return ParseResult.success(new Expr.Literal(span, new Lit(span, literal.kind(), literal.symbol())));
        }

        if (token instanceof Token.Ident) {
            return parseName(start);
        }

        if (token.is(TokenKind.L_PAREN)) {
            cursor.advance();
            var inner = parseExpr();
            if (inner.isFailure()) {
                return inner;
            }
            var close = cursor.expect(TokenKind.R_PAREN);
            if (close.isFailure()) {
                return close.asFailure();
            }
            return inner;
        }

        return cursor.unexpected("expression");
    }

    // var | var.field | f(args)
    private ParseResult<Expr> parseName(SourceLocation start) {
        var name = cursor.expectIdent().unwrap();

        if (cursor.check(TokenKind.L_PAREN)) {
            var args = Combinators.delimited(cursor,
                                             TokenKind.L_PAREN,
                                             TokenKind.COMMA,
                                             TokenKind.R_PAREN,
                                             this::parseExpr);
            if (args.isFailure()) {
                return args.asFailure();
            }
            return ParseResult.success(new Expr.App(cursor.spanFrom(start), name, args.unwrap()));
        }

        if (cursor.eat(TokenKind.DOT)) {
            var field = cursor.expectIdent();
            if (field.isFailure()) {
                return field.asFailure();
            }
            return ParseResult.success(new Expr.Dot(cursor.spanFrom(start), name, field.unwrap()));
        }

        return ParseResult.success(new Expr.Var(name.span(), name));
    }

    // if cond { then } else { otherwise }
    private ParseResult<Expr> parseIfThenElse(SourceLocation start) {
        cursor.advance();

        var cond = parseExpr();
        if (cond.isFailure()) {
            return cond;
        }

        var then = parseBlock();
        if (then.isFailure()) {
            return then;
        }

        var elseKeyword = cursor.expect(TokenKind.ELSE);
        if (elseKeyword.isFailure()) {
            return elseKeyword.asFailure();
        }

        var otherwise = parseBlock();
        if (otherwise.isFailure()) {
            return otherwise;
        }

        return ParseResult.success(new Expr.IfThenElse(cursor.spanFrom(start),
                                                       cond.unwrap(),
                                                       then.unwrap(),
                                                       otherwise.unwrap()));
    }

    /**
     * {@code { expr }} as used by conditionals, qualifiers and definitions.
     */
    public ParseResult<Expr> parseBlock() {
        var open = cursor.expect(TokenKind.L_BRACE);
        if (open.isFailure()) {
            return open.asFailure();
        }

        var body = parseExpr();
        if (body.isFailure()) {
            return body;
        }

        var close = cursor.expect(TokenKind.R_BRACE);
        if (close.isFailure()) {
            return close.asFailure();
        }
        return body;
    }
}
