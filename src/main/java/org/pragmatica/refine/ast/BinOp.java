package org.pragmatica.refine.ast;

/**
 * Binary operators of refinement expressions.
 */
public enum BinOp {
    IFF("<=>"),
    IMP("=>"),
    OR("||"),
    AND("&&"),
    EQ("=="),
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<="),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    MOD("%");

    private final String symbol;

    BinOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
