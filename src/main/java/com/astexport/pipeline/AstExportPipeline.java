package com.astexport.pipeline;

import com.astexport.analysis.TreeAnalyzer;
import com.astexport.analysis.TreeStatistics;
import com.astexport.config.ExportConfig;
import com.astexport.export.AstSerializer;
import com.astexport.sexp.SexpExtractor;
import com.astexport.sexp.SexpParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 文本 → token → 语法树 → 统计与记录 的完整流水线。每次运行互不共享状态。
 */
public class AstExportPipeline {
    private static final Logger logger = LoggerFactory.getLogger(AstExportPipeline.class);

    private final ExportConfig config;
    private final TreeAnalyzer analyzer;
    private final AstSerializer serializer;

    public AstExportPipeline() {
        this(ExportConfig.defaults());
    }

    public AstExportPipeline(ExportConfig config) {
        this(config, new AstSerializer());
    }

    public AstExportPipeline(ExportConfig config, AstSerializer serializer) {
        this.config = config;
        this.analyzer = new TreeAnalyzer();
        this.serializer = serializer;
    }

    /**
     * 解析外部解析器的原始输出并完成分析与序列化；严格模式下结构错误会抛出 SexpParseException。
     */
    public ExportResult run(String rawOutput) {
        long startNanos = System.nanoTime();

        String sexp = SexpExtractor.extract(rawOutput, config.getRootPrefix());
        SexpParser.ParseResult parseResult = new SexpParser(config.getParseMode()).parse(sexp);
        if (parseResult.recoveredIssues() > 0) {
            logger.warn("输入结构不完整，已按宽松模式恢复 {} 处问题（共 {} 个 token，消费 {} 个）",
                    parseResult.recoveredIssues(), parseResult.tokenCount(), parseResult.consumedTokens());
        }

        TreeStatistics statistics = analyzer.analyze(parseResult.root(), config.getSampleSize());
        Map<String, Object> record = serializer.toRecord(parseResult.root());

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("解析完成: {} 个 token, {} 个节点, {} 种类型, 用时 {}ms",
                parseResult.tokenCount(), statistics.nodeCount(), statistics.distinctTypeCount(), elapsedMs);

        return new ExportResult(
                parseResult.root(),
                statistics,
                record,
                parseResult.tokenCount(),
                parseResult.recoveredIssues(),
                elapsedMs
        );
    }

    /**
     * 以 UTF-8 读取文件后执行 {@link #run(String)}。
     */
    public ExportResult runFile(Path input) throws IOException {
        logger.info("读取输入文件: {}", input);
        return run(Files.readString(input, StandardCharsets.UTF_8));
    }

    /**
     * 将结果中的语法树写为 JSON 文件。
     */
    public void export(ExportResult result, Path target) throws IOException {
        serializer.writeJson(result.root(), target, config.isPrettyPrint());
        logger.info("语法树已导出到 {}", target);
    }

    public ExportConfig getConfig() {
        return config;
    }
}
