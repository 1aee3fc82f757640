package org.twistmodal.logic.formula.lexer;

public enum TokenKind {
    ATOM,
    NOT,
    AND,
    OR,
    LPAREN,
    RPAREN,
    // ->
    MAT_IMPLIES,
    // <->
    MAT_IFF,
    // =>
    IMPLIES,
    // <=>
    IFF,
    // [a], the value is the action
    BOX,
    // <a>, the value is the action
    DIAMOND,
    EOF
}
