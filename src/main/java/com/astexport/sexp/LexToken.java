package com.astexport.sexp;

public record LexToken(TokenType type, String value, int position) {

    /**
     * 判断 token 是否为指定类型。
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }
}
