package com.astexport.sexp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 从外部解析器的原始输出中截取语法树部分，跳过其前面的警告信息。
 */
public final class SexpExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SexpExtractor.class);

    private SexpExtractor() {
    }

    /**
     * 返回以 rootPrefix 开头的第一行及其后的全部文本；找不到时回退为整段文本。
     */
    public static String extract(String rawOutput, String rootPrefix) {
        if (rawOutput == null) {
            return "";
        }
        String trimmed = rawOutput.strip();
        if (rootPrefix == null || rootPrefix.isBlank()) {
            return trimmed;
        }

        int lineStart = 0;
        while (lineStart < trimmed.length()) {
            int lineEnd = trimmed.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = trimmed.length();
            }
            String line = trimmed.substring(lineStart, lineEnd);
            int indent = line.length() - line.stripLeading().length();
            if (line.stripLeading().startsWith(rootPrefix)) {
                if (lineStart > 0) {
                    logger.debug("跳过 {} 个字符的前导输出", lineStart);
                }
                return trimmed.substring(lineStart + indent);
            }
            lineStart = lineEnd + 1;
        }

        logger.warn("输出中未找到以 '{}' 开头的行，将解析全部文本", rootPrefix);
        return trimmed;
    }
}
