package com.astexport.sexp;

import java.util.ArrayList;
import java.util.List;

public class SexpLexer {
    /**
     * 将 S 表达式文本切分为词法 token 序列，任意输入都不会抛出异常。
     */
    public List<LexToken> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (isSpace(currentChar)) {
                index++;
                continue;
            }

            TokenType delimiterType = delimiterType(currentChar);
            if (delimiterType != null) {
                tokens.add(new LexToken(delimiterType, String.valueOf(currentChar), index));
                index++;
                continue;
            }

            int tokenStart = index;
            while (index < text.length()
                    && !isSpace(text.charAt(index))
                    && delimiterType(text.charAt(index)) == null) {
                index++;
            }
            tokens.add(new LexToken(TokenType.BAREWORD, text.substring(tokenStart, index), tokenStart));
        }

        return List.copyOf(tokens);
    }

    /**
     * 包括不换行空格（U+00A0、U+2007、U+202F）在内的 Unicode 空白。
     */
    private static boolean isSpace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    /**
     * 返回单字符分隔符对应的 token 类型，非分隔符返回 null。
     */
    private static TokenType delimiterType(char ch) {
        switch (ch) {
            case '(':
                return TokenType.LPAREN;
            case ')':
                return TokenType.RPAREN;
            case '[':
                return TokenType.LBRACKET;
            case ']':
                return TokenType.RBRACKET;
            case '-':
                return TokenType.DASH;
            default:
                return null;
        }
    }
}
