package org.pragmatica.refine;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.refine.ast.Expr;
import org.pragmatica.refine.ast.Ident;
import org.pragmatica.refine.ast.RefineArg;
import org.pragmatica.refine.ast.RefineParam;
import org.pragmatica.refine.ast.Sort;
import org.pragmatica.refine.ast.Ty;
import org.pragmatica.refine.error.ParseError;
import org.pragmatica.refine.parser.ParserConfig;
import org.pragmatica.refine.token.LitKind;
import org.pragmatica.refine.token.SurfaceLexer;
import org.pragmatica.refine.token.Token;
import org.pragmatica.refine.tree.SourceLocation;
import org.pragmatica.refine.tree.SourceSpan;
import org.pragmatica.refine.tree.SpanFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SurfaceParserTest {

    private final SurfaceParser parser = SurfaceParser.create();

    @Nested
    class Aliases {

        @Test
        void aliasWithEmptyParams() {
            var alias = parser.parseAlias(SurfaceLexer.tokenize("type Nat() = i32{v : nat(v)}")).unwrap();

            assertEquals("Nat", alias.name().name());
            assertThat(alias.params()).isEmpty();
            var ty = assertInstanceOf(Ty.Exists.class, alias.ty());
            assertInstanceOf(Expr.App.class, ty.pred());
        }

        @Test
        void aliasWithoutParens_hasNoParams() {
            var alias = parser.parseAlias(SurfaceLexer.tokenize("type Foo = int")).unwrap();

            assertThat(alias.params()).isEmpty();
            assertInstanceOf(Ty.BaseTy.class, alias.ty());
        }

        @Test
        void aliasWithParams() {
            var alias = parser.parseAlias(SurfaceLexer.tokenize("type Lb(n) = i32{v : n <= v}")).unwrap();

            assertThat(alias.params()).extracting(Ident::name).containsExactly("n");
            assertEquals(0, alias.span().start().offset());
            assertEquals(28, alias.span().end().offset());
        }

        @Test
        void aliasWithoutKeyword_fails() {
            var error = parser.parseAlias(SurfaceLexer.tokenize("Nat = int")).error();

            var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
            assertEquals("'type'", unexpected.expected());
        }
    }

    @Nested
    class RefinedByParams {

        @Test
        void paramsAreCollectedInOrder() {
            var refinedBy = parser.parseRefinedBy(SurfaceLexer.tokenize("is_atom: bool, nnf: bool")).unwrap();

            assertThat(refinedBy.params()).extracting(p -> p.name().name()).containsExactly("is_atom", "nnf");
            var sort = assertInstanceOf(Sort.Base.class, refinedBy.params().get(1).sort());
            assertEquals("bool", sort.name().name());
        }

        @Test
        void emptyInput_givesEmptyList() {
            var refinedBy = parser.parseRefinedBy(SurfaceLexer.tokenize("")).unwrap();

            assertThat(refinedBy.params()).isEmpty();
        }

        @Test
        void functionSort_isAccepted() {
            var refinedBy = parser.parseRefinedBy(SurfaceLexer.tokenize("p: (int, int) -> bool")).unwrap();

            var sort = assertInstanceOf(Sort.Func.class, refinedBy.params().get(0).sort());
            assertThat(sort.inputs()).extracting(Ident::name).containsExactly("int", "int");
            assertEquals("bool", sort.output().name());
        }

        @Test
        void missingSort_fails() {
            var error = parser.parseRefinedBy(SurfaceLexer.tokenize("a: bool, b")).error();

            var eof = assertInstanceOf(ParseError.UnexpectedEof.class, error);
            assertEquals("':'", eof.expected());
        }
    }

    @Nested
    class Functions {

        @Test
        void uninterpretedFunction() {
            var uif = parser.parseUifDef(SurfaceLexer.tokenize("fn foo(int, int) -> int")).unwrap();

            assertEquals("foo", uif.name().name());
            assertThat(uif.inputs()).extracting(Ident::name).containsExactly("int", "int");
            assertEquals("int", uif.output().name());
        }

        @Test
        void qualifier() {
            var qualifier = parser.parseQualifier(SurfaceLexer.tokenize("MyQ(x: int, y: int) { x < y }")).unwrap();

            assertEquals("MyQ", qualifier.name().name());
            assertThat(qualifier.params()).hasSize(2);
            var body = assertInstanceOf(Expr.BinaryOp.class, qualifier.expr());
            assertEquals("<", body.op().symbol());
        }

        @Test
        void definition() {
            var defn = parser.parseDefn(SurfaceLexer.tokenize("nat(x: int) -> bool { 0 <= x }")).unwrap();

            assertEquals("nat", defn.name().name());
            assertThat(defn.params()).extracting(RefineParam::name).extracting(Ident::name).containsExactly("x");
            assertInstanceOf(Sort.Base.class, defn.sort());
            assertInstanceOf(Expr.BinaryOp.class, defn.expr());
            assertEquals(30, defn.span().end().offset());
        }

        @Test
        void qualifierRejectsSort() {
            assertTrue(parser.parseQualifier(SurfaceLexer.tokenize("nat(x: int) -> bool { 0 <= x }")).isFailure());
        }
    }

    @Nested
    class Signatures {

        @Test
        void minimalSignature_hasNoOptionalParts() {
            var sig = parser.parseFnSig(SurfaceLexer.tokenize("fn()")).unwrap();

            assertThat(sig.args()).isEmpty();
            assertTrue(sig.generics().isEmpty());
            assertTrue(sig.returns().isEmpty());
            assertTrue(sig.requires().isEmpty());
            assertThat(sig.ensures()).isEmpty();
        }

        @Test
        void returnWithoutEnsures_givesEmptyEnsures() {
            var sig = parser.parseFnSig(SurfaceLexer.tokenize("fn(x:int) -> bool")).unwrap();

            assertThat(sig.args()).hasSize(1);
            assertInstanceOf(Ty.BaseTy.class, sig.returns().orElseThrow());
            assertThat(sig.ensures()).isEmpty();
            assertTrue(sig.requires().isEmpty());
        }

        @Test
        void strongReferenceWithEnsures() {
            var sig = parser.parseFnSig(SurfaceLexer.tokenize("fn(x: &strg i32[@n]) -> i32 ensures x: i32[n+1]"))
                            .unwrap();

            assertThat(sig.ensures()).hasSize(1);
            var ensures = sig.ensures().get(0);
            assertEquals("x", ensures.name().name());
            var ty = assertInstanceOf(Ty.Indexed.class, ensures.ty());
            assertInstanceOf(RefineArg.Expression.class, ty.indices().args().get(0));
        }

        @Test
        void genericsAndRequires() {
            var sig = parser.parseFnSig(SurfaceLexer.tokenize("fn<n: int>(i32[n]) -> bool requires n > 0")).unwrap();

            assertThat(sig.generics().orElseThrow()).extracting(p -> p.name().name()).containsExactly("n");
            assertInstanceOf(Expr.BinaryOp.class, sig.requires().orElseThrow());
        }

        @Test
        void multipleEnsuresClauses() {
            var sig = parser.parseFnSig(SurfaceLexer.tokenize("fn(a: &strg i32, b: &strg i32) ensures a: i32, b: i32"))
                            .unwrap();

            assertThat(sig.ensures()).extracting(e -> e.name().name()).containsExactly("a", "b");
        }

        @Test
        void missingParameterList_fails() {
            var error = parser.parseFnSig(SurfaceLexer.tokenize("fn -> i32")).error();

            var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
            assertEquals("'('", unexpected.expected());
        }
    }

    @Nested
    class Variants {

        @Test
        void variantWithFieldsAndIndices() {
            var variant = parser.parseVariant(SurfaceLexer.tokenize("(Box<Pred[@p]>) -> Pred[false, p.is_atom]"))
                                .unwrap();

            assertThat(variant.fields()).hasSize(1);
            assertEquals("Pred", variant.ret().path().ident().name());
            var args = variant.ret().indices().args();
            assertThat(args).hasSize(2);
            var literal = assertInstanceOf(Expr.Literal.class,
                                           assertInstanceOf(RefineArg.Expression.class, args.get(0)).expr());
            assertEquals(LitKind.BOOL, literal.lit().kind());
            assertInstanceOf(Expr.Dot.class, assertInstanceOf(RefineArg.Expression.class, args.get(1)).expr());
        }

        @Test
        void variantWithoutFields() {
            var variant = parser.parseVariant(SurfaceLexer.tokenize("Pred[true, true]")).unwrap();

            assertThat(variant.fields()).isEmpty();
            assertThat(variant.ret().indices().args()).hasSize(2);
        }

        @Test
        void bracedFields_matchParenthesizedFields() {
            var braced = parser.parseVariant(SurfaceLexer.tokenize("{i32[@n], bool} -> Pair[n]")).unwrap();
            var parens = parser.parseVariant(SurfaceLexer.tokenize("(i32[@n], bool) -> Pair[n]")).unwrap();

            assertThat(braced.fields()).hasSize(2);
            assertThat(parens.fields()).hasSize(2);
        }

        @Test
        void omittedIndices_areEmptyAtPathEnd() {
            var variant = parser.parseVariant(SurfaceLexer.tokenize("(i32) -> Unit")).unwrap();

            var indices = variant.ret().indices();
            assertTrue(indices.isEmpty());
            assertEquals(indices.span().start(), indices.span().end());
            assertEquals(13, indices.span().start().offset());
            assertEquals(9, variant.ret().span().start().offset());
            assertEquals(13, variant.ret().span().end().offset());
        }

        @Test
        void fieldsWithoutArrow_fail() {
            var error = parser.parseVariant(SurfaceLexer.tokenize("(i32) Unit")).error();

            var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
            assertEquals("'->'", unexpected.expected());
        }
    }

    // === Properties shared by every entry point ===

    @Test
    void leftoverTokens_areRejected() {
        var error = parser.parseType(SurfaceLexer.tokenize("i32 bool")).error();

        var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
        assertEquals("identifier 'bool'", unexpected.found());
        assertEquals("end of input", unexpected.expected());
        assertEquals(4, unexpected.span().start().offset());
    }

    @Test
    void reparsingSameTokens_givesEqualTree() {
        var tokens = SurfaceLexer.tokenize("fn<n: int>(x: &strg i32[@n], y: i32{v : v > n}) -> i32 ensures x: i32[n]");

        assertEquals(parser.parseFnSig(tokens).unwrap(), parser.parseFnSig(tokens).unwrap());
    }

    @Test
    void spans_coverExactlyConsumedTokens() {
        var text = "fn(x: i32{v : v > 0}, y: &strg i32[@n]) -> bool";
        var sig = parser.parseFnSig(SurfaceLexer.tokenize(text)).unwrap();

        assertEquals(text, covered(text, sig.span()));
        assertEquals("x: i32{v : v > 0}", covered(text, sig.args().get(0).span()));
        assertEquals("y: &strg i32[@n]", covered(text, sig.args().get(1).span()));
        assertEquals("bool", covered(text, sig.returns().orElseThrow().span()));
    }

    @Test
    void missingEofToken_isAppended() {
        var tokens = SurfaceLexer.tokenize("a + 1");
        var withoutEof = tokens.subList(0, tokens.size() - 1);

        var expr = parser.parseExpr(withoutEof).unwrap();

        assertEquals(parser.parseExpr(tokens).unwrap(), expr);
    }

    @Test
    void emptyTokenList_failsAtStart() {
        var error = parser.parseType(List.of()).error();

        var eof = assertInstanceOf(ParseError.UnexpectedEof.class, error);
        assertEquals(SourceLocation.START, eof.span().start());
    }

    @Test
    void eofTokenInMiddle_isRejected() {
        var tokens = List.<Token>of(Token.eof(SourceLocation.START),
                                    Token.ident(SourceLocation.START, SourceLocation.at(1, 2, 1), "a"));

        assertThrows(IllegalArgumentException.class, () -> parser.parseExpr(tokens));
    }

    @Test
    void relativeSpanFactory_shiftsSpans() {
        var base = SourceLocation.at(3, 10, 100);
        var relative = SurfaceParser.builder()
                                    .spanFactory(SpanFactory.relativeTo(base))
                                    .build();

        var ty = relative.parseType(SurfaceLexer.tokenize("i32")).unwrap();

        assertEquals(SourceLocation.at(3, 10, 100), ty.span().start());
        assertEquals(SourceLocation.at(3, 13, 103), ty.span().end());
    }

    @Test
    void nestingBeyondLimit_fails() {
        var shallow = SurfaceParser.builder()
                                   .maxDepth(3)
                                   .build();

        assertTrue(shallow.parseExpr(SurfaceLexer.tokenize("((a))")).isSuccess());
        var error = shallow.parseExpr(SurfaceLexer.tokenize("((((a))))")).error();

        var tooDeep = assertInstanceOf(ParseError.NestingTooDeep.class, error);
        assertEquals(3, tooDeep.limit());
    }

    @Test
    void nestingAtDefaultLimit_succeeds() {
        var levels = ParserConfig.DEFAULT.maxDepth() - 1;

        var parens = "(".repeat(levels) + "a" + ")".repeat(levels);
        assertTrue(parser.parseExpr(SurfaceLexer.tokenize(parens)).isSuccess());

        var conditions = "if ".repeat(levels) + "a" + " { 1 } else { 2 }".repeat(levels);
        assertTrue(parser.parseExpr(SurfaceLexer.tokenize(conditions)).isSuccess());
    }

    @Test
    void nestingOneBeyondDefaultLimit_fails() {
        var levels = ParserConfig.DEFAULT.maxDepth();

        var parens = "(".repeat(levels) + "a" + ")".repeat(levels);
        assertInstanceOf(ParseError.NestingTooDeep.class, parser.parseExpr(SurfaceLexer.tokenize(parens)).error());

        var conditions = "if ".repeat(levels) + "a" + " { 1 } else { 2 }".repeat(levels);
        assertInstanceOf(ParseError.NestingTooDeep.class,
                         parser.parseExpr(SurfaceLexer.tokenize(conditions)).error());
    }

    @Test
    void deepNesting_doesNotOverflowStack() {
        var parens = "(".repeat(10_000) + "a" + ")".repeat(10_000);
        assertInstanceOf(ParseError.NestingTooDeep.class, parser.parseExpr(SurfaceLexer.tokenize(parens)).error());

        var conditions = "if ".repeat(10_000) + "a" + " { 1 } else { 2 }".repeat(10_000);
        assertInstanceOf(ParseError.NestingTooDeep.class,
                         parser.parseExpr(SurfaceLexer.tokenize(conditions)).error());
    }

    @Test
    void invalidDepth_isRejectedByBuilder() {
        assertThrows(IllegalArgumentException.class, () -> SurfaceParser.builder().maxDepth(0).build());
    }

    private static String covered(String source, SourceSpan span) {
        return source.substring(span.start().offset(), span.end().offset());
    }
}
