package com.astexport.sexp;

public class SexpParseException extends RuntimeException {
    private final int position;
    private final String sourceText;
    private final String suggestion;

    public SexpParseException(String message, int position, String sourceText) {
        super(buildMessage(message, position, sourceText == null ? "" : sourceText));
        this.position = position;
        this.sourceText = sourceText == null ? "" : sourceText;
        this.suggestion = suggestFix(position, this.sourceText);
    }

    public int getPosition() {
        return position;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * 只截取出错位置所在的那一行，并在其下方标出插入符。
     */
    private static String buildMessage(String message, int pos, String text) {
        int caretPos = Math.max(0, Math.min(pos, text.length()));
        int lineStart = text.lastIndexOf('\n', caretPos - 1) + 1;
        int lineEnd = text.indexOf('\n', caretPos);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        int lineNumber = 1;
        for (int index = 0; index < lineStart; index++) {
            if (text.charAt(index) == '\n') {
                lineNumber++;
            }
        }
        int column = caretPos - lineStart;
        String line = text.substring(lineStart, lineEnd);
        String pointer = " ".repeat(column) + "^";
        return "Parse error at position " + pos + " (line " + lineNumber + ", column " + (column + 1) + "): "
                + message + System.lineSeparator() + line + System.lineSeparator() + pointer;
    }

    private static String suggestFix(int pos, String text) {
        if (text.isBlank()) {
            return "请输入非空的 S 表达式";
        }
        long open = text.chars().filter(ch -> ch == '(').count();
        long close = text.chars().filter(ch -> ch == ')').count();
        if (open > close) {
            return "检测到 " + (open - close) + " 个未闭合的左括号，输入可能被截断";
        }
        if (close > open) {
            return "检测到 " + (close - open) + " 个多余的右括号";
        }
        if (pos >= text.length()) {
            return "输入在结构完整之前结束，请检查是否被截断";
        }
        return "请检查该位置附近的语法，例如括号或位置标注 [row, col] - [row, col]";
    }
}
