package org.pragmatica.refine.token;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keywords, punctuation and operators of the annotation language.
 */
public enum TokenKind {
    // Keywords
    FN("fn", true),
    TYPE("type", true),
    MUT("mut", true),
    STRG("strg", true),
    REQUIRES("requires", true),
    ENSURES("ensures", true),
    IF("if", true),
    ELSE("else", true),

    // Delimiters
    L_PAREN("("),
    R_PAREN(")"),
    L_BRACKET("["),
    R_BRACKET("]"),
    L_BRACE("{"),
    R_BRACE("}"),

    // Punctuation
    AT("@"),
    COLON(":"),
    DOT("."),
    COMMA(","),
    SEMI(";"),
    R_ARROW("->"),
    AMP("&"),
    PIPE("|"),
    EQ("="),

    // Operators
    IFF("<=>"),
    FAT_ARROW("=>"),
    OR_OR("||"),
    AND_AND("&&"),
    EQ_EQ("=="),
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    PERCENT("%"),

    EOF("end of input");

    private static final Map<String, TokenKind> KEYWORDS = Stream.of(values())
                                                                 .filter(TokenKind::isKeyword)
                                                                 .collect(Collectors.toMap(TokenKind::text,
                                                                                           Function.identity()));

    private final String text;
    private final boolean keyword;

    TokenKind(String text) {
        this(text, false);
    }

    TokenKind(String text, boolean keyword) {
        this.text = text;
        this.keyword = keyword;
    }

    public String text() {
        return text;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Keyword spelled by {@code word}, if any. Lexers use this to split reserved words from identifiers.
     */
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }

    public String describe() {
        return this == EOF ? text : "'" + text + "'";
    }
}
