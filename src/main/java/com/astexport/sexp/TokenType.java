package com.astexport.sexp;

public enum TokenType {
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    DASH,
    BAREWORD
}
