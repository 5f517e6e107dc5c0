package com.astexport.sexp;

import com.astexport.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 递归下降树构建器。实例持有解析游标，非线程安全，每次解析请单独使用。
 */
public class SexpParser {
    private static final Logger logger = LoggerFactory.getLogger(SexpParser.class);

    private final ParseMode mode;

    private List<LexToken> tokens;
    private int pos;
    private int depth;
    private String sourceText;
    private int recoveredIssues;

    public SexpParser() {
        this(ParseMode.LENIENT);
    }

    public SexpParser(ParseMode mode) {
        this.mode = mode == null ? ParseMode.LENIENT : mode;
    }

    public ParseMode getMode() {
        return mode;
    }

    /**
     * 将 S 表达式文本解析为单根语法树。
     */
    public ParseResult parse(String text) {
        reset(new SexpLexer().tokenize(text), text);

        if (tokens.isEmpty()) {
            recover("输入中没有任何 token", 0);
            return new ParseResult(null, 0, 0, recoveredIssues);
        }

        SexpNode root = parseNode();
        if (root == null) {
            if (!isAtEnd()) {
                recover("根位置出现意外的右括号", current().position());
            }
            return new ParseResult(null, tokens.size(), pos, recoveredIssues);
        }
        if (mode == ParseMode.STRICT && root instanceof SexpNode.Terminal) {
            throw new SexpParseException("根节点必须以左括号开始", tokens.get(0).position(), sourceText);
        }
        if (!isAtEnd()) {
            recover("根节点之后还有 " + (tokens.size() - pos) + " 个未解析的 token", current().position());
        }

        return new ParseResult(root, tokens.size(), pos, recoveredIssues);
    }

    /**
     * 从给定位置开始构建一个节点，返回节点（可能为 null）与下一个位置。
     */
    public ParseStep parseFrom(List<LexToken> tokenList, int position) {
        reset(tokenList == null ? List.of() : tokenList, "");
        this.pos = Math.max(0, Math.min(position, tokens.size()));
        SexpNode node = parseNode();
        return new ParseStep(node, pos);
    }

    /**
     * 按当前 token 前瞻分派：左括号开始内部节点，右括号表示此处没有节点，其余为终结节点。
     */
    private SexpNode parseNode() {
        if (isAtEnd()) {
            return null;
        }

        LexToken token = current();
        if (token.is(TokenType.LPAREN)) {
            return parseInterior();
        }
        if (token.is(TokenType.RPAREN)) {
            return null;
        }
        if (mode == ParseMode.STRICT && !token.is(TokenType.BAREWORD)) {
            throw new SexpParseException("意外的符号: " + token.value(), token.position(), sourceText);
        }

        pos++;
        return new SexpNode.Terminal(token.value());
    }

    /**
     * 解析 "(" tag [position] children ")"。超过 {@link Constants#MAX_TREE_DEPTH} 的子树整体丢弃。
     */
    private SexpNode parseInterior() {
        if (depth >= Constants.MAX_TREE_DEPTH) {
            recover("嵌套深度超过上限 " + Constants.MAX_TREE_DEPTH + "，已丢弃该子树", current().position());
            skipSubtree();
            return null;
        }

        LexToken open = advance();
        if (isAtEnd()) {
            recover("左括号之后缺少节点类型", endPosition());
            return null;
        }

        LexToken tagToken = advance();
        if (mode == ParseMode.STRICT && !tagToken.is(TokenType.BAREWORD)) {
            throw new SexpParseException("节点类型必须是普通词项: " + tagToken.value(), tagToken.position(), sourceText);
        }

        skipPositionAnnotation();

        List<SexpNode> children = new ArrayList<>();
        depth++;
        while (!isAtEnd() && !current().is(TokenType.RPAREN)) {
            SexpNode child = parseNode();
            if (child != null) {
                children.add(child);
            }
        }
        depth--;

        if (isAtEnd()) {
            recover("节点 " + tagToken.value() + " 缺少右括号", open.position());
        } else {
            pos++;
        }
        return new SexpNode.Interior(tagToken.value(), children);
    }

    /**
     * 从当前左括号起跳过到与之配对的右括号（含），输入提前结束时停在末尾。
     */
    private void skipSubtree() {
        int balance = 0;
        while (!isAtEnd()) {
            LexToken token = advance();
            if (token.is(TokenType.LPAREN)) {
                balance++;
            } else if (token.is(TokenType.RPAREN) && --balance == 0) {
                return;
            }
        }
    }

    /**
     * 跳过紧随类型标签的 [row, col] - [row, col] 位置标注。
     */
    private void skipPositionAnnotation() {
        if (isAtEnd() || !current().is(TokenType.LBRACKET)) {
            return;
        }
        skipBracketGroup();

        if (!isAtEnd() && current().is(TokenType.DASH)) {
            LexToken dash = advance();
            if (!isAtEnd() && current().is(TokenType.LBRACKET)) {
                skipBracketGroup();
            } else if (mode == ParseMode.STRICT) {
                throw new SexpParseException("位置范围的 '-' 之后缺少 '['", dash.position(), sourceText);
            }
        }
    }

    /**
     * 丢弃直到第一个右方括号（含）为止的全部 token，不识别嵌套。
     */
    private void skipBracketGroup() {
        LexToken open = advance();
        while (!isAtEnd() && !current().is(TokenType.RBRACKET)) {
            pos++;
        }
        if (isAtEnd()) {
            recover("位置标注缺少右方括号", open.position());
            return;
        }
        pos++;
    }

    /**
     * 宽松模式下记录一次恢复并继续，严格模式下直接抛出语法错误。
     */
    private void recover(String message, int position) {
        if (mode == ParseMode.STRICT) {
            throw new SexpParseException(message, position, sourceText);
        }
        recoveredIssues++;
        logger.debug("宽松模式恢复 (位置 {}): {}", position, message);
    }

    private void reset(List<LexToken> tokenList, String text) {
        this.tokens = tokenList;
        this.pos = 0;
        this.depth = 0;
        this.sourceText = text == null ? "" : text;
        this.recoveredIssues = 0;
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private LexToken current() {
        return tokens.get(pos);
    }

    private LexToken advance() {
        return tokens.get(pos++);
    }

    /**
     * 返回最后一个 token 之后的字符偏移，用于输入提前结束的错误定位。
     */
    private int endPosition() {
        if (!sourceText.isEmpty()) {
            return sourceText.length();
        }
        if (tokens.isEmpty()) {
            return 0;
        }
        LexToken last = tokens.get(tokens.size() - 1);
        return last.position() + last.value().length();
    }

    public record ParseResult(SexpNode root, int tokenCount, int consumedTokens, int recoveredIssues) {

        public boolean isComplete() {
            return root != null && recoveredIssues == 0 && consumedTokens == tokenCount;
        }
    }

    public record ParseStep(SexpNode node, int nextPosition) {
    }
}
