package com.astexport.config;

import com.astexport.sexp.ParseMode;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 导出运行时配置
 * 
 * 由 CLI 参数注入，覆盖 Constants 默认值
 */
public class ExportConfig {
    private ParseMode parseMode = ParseMode.LENIENT;
    private String rootPrefix = Constants.DEFAULT_ROOT_PREFIX;
    private int sampleSize = Constants.DEFAULT_SAMPLE_SIZE;
    private Path outputPath = Paths.get(Constants.DEFAULT_OUTPUT_FILE);
    private boolean prettyPrint = true;

    public ParseMode getParseMode() {
        return parseMode;
    }

    public void setParseMode(ParseMode parseMode) {
        this.parseMode = parseMode;
    }

    public String getRootPrefix() {
        return rootPrefix;
    }

    public void setRootPrefix(String rootPrefix) {
        this.rootPrefix = rootPrefix;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(Path outputPath) {
        this.outputPath = outputPath;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    /**
     * 使用默认配置创建实例
     */
    public static ExportConfig defaults() {
        return new ExportConfig();
    }
}
