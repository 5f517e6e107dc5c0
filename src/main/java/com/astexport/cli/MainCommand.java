package com.astexport.cli;

import com.astexport.analysis.TreeStatistics;
import com.astexport.config.Constants;
import com.astexport.config.ExportConfig;
import com.astexport.pipeline.AstExportPipeline;
import com.astexport.pipeline.ExportResult;
import com.astexport.sexp.ParseMode;
import com.astexport.sexp.SexpParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "ast-export",
    description = "🌳 将解析器输出的 S 表达式语法树导出为 JSON 并统计结构",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ExportSubcommand.class,
        MainCommand.StatsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--strict"}, description = "严格模式：结构不完整时报错而不是尽力恢复")
    private boolean strict;

    @Option(names = {"--root-prefix"}, description = "语法树起始行前缀，留空则解析全部输入",
            defaultValue = Constants.DEFAULT_ROOT_PREFIX)
    private String rootPrefix;

    @Option(names = {"--sample"}, description = "展示的节点类型样例数量",
            defaultValue = "" + Constants.DEFAULT_SAMPLE_SIZE)
    private int sampleSize;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🌳 S 表达式语法树导出工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 由全局选项构造本次运行的配置。
     */
    ExportConfig buildConfig() {
        ExportConfig config = ExportConfig.defaults();
        config.setParseMode(strict ? ParseMode.STRICT : ParseMode.LENIENT);
        config.setRootPrefix(rootPrefix);
        config.setSampleSize(sanitizeSampleSize(sampleSize));
        return config;
    }

    private int sanitizeSampleSize(int rawSampleSize) {
        if (rawSampleSize < 0) {
            System.err.printf("⚠️ sample=%d 非法，已使用 0%n", rawSampleSize);
            return 0;
        }
        if (rawSampleSize > Constants.MAX_SAMPLE_SIZE) {
            System.err.printf("⚠️ sample=%d 超过上限 %d，已自动限制%n", rawSampleSize, Constants.MAX_SAMPLE_SIZE);
            return Constants.MAX_SAMPLE_SIZE;
        }
        return rawSampleSize;
    }

    /**
     * 读取输入文件或标准输入（"-"）并执行流水线。
     */
    private static ExportResult runPipeline(AstExportPipeline pipeline, String input) throws IOException {
        if (Constants.STDIN_MARKER.equals(input)) {
            String text = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            return pipeline.run(text);
        }
        return pipeline.runFile(Path.of(input));
    }

    private static void printStatistics(ExportResult result) {
        TreeStatistics statistics = result.statistics();
        System.out.println("📊 统计:");
        System.out.println("   节点总数: " + statistics.nodeCount());
        System.out.println("   内部节点: " + statistics.interiorCount());
        System.out.println("   终结节点: " + statistics.terminalCount());
        System.out.println("   最大深度: " + statistics.maxDepth());
        System.out.println("   类型数量: " + statistics.distinctTypeCount());
        System.out.println("   类型样例: " + statistics.sampleTypes());
        if (result.recoveredIssues() > 0) {
            System.out.println("⚠️ 输入结构不完整，已恢复 " + result.recoveredIssues() + " 处问题");
        }
    }

    private static void printParseError(SexpParseException exception) {
        System.err.println("❌ 解析失败: " + exception.getMessage());
        System.err.println("💡 " + exception.getSuggestion());
    }

    @Command(name = "export", description = "📤 解析 S 表达式并导出 JSON 语法树")
    static class ExportSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文件路径，- 表示标准输入", arity = "1")
        private String input;

        @Option(names = {"-o", "--output"}, description = "输出 JSON 文件路径", defaultValue = Constants.DEFAULT_OUTPUT_FILE)
        private Path output;

        @Option(names = {"--compact"}, description = "输出紧凑 JSON（不缩进）", defaultValue = "false")
        private boolean compact;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            ExportConfig config = main.buildConfig();
            config.setOutputPath(output);
            config.setPrettyPrint(!compact);
            AstExportPipeline pipeline = new AstExportPipeline(config);

            try {
                ExportResult result = runPipeline(pipeline, input);
                if (!result.hasTree()) {
                    System.err.println("❌ 输入中没有可导出的语法树");
                    return 1;
                }
                pipeline.export(result, config.getOutputPath());

                System.out.println("✅ AST exported to " + config.getOutputPath());
                System.out.println();
                printStatistics(result);
                System.out.println("⏱️ 用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (SexpParseException exception) {
                printParseError(exception);
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 导出失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "stats", description = "📊 只输出语法树统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文件路径，- 表示标准输入", arity = "1")
        private String input;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            AstExportPipeline pipeline = new AstExportPipeline(main.buildConfig());
            try {
                ExportResult result = runPipeline(pipeline, input);
                if ("json".equalsIgnoreCase(format)) {
                    printJsonReport(input, result);
                } else {
                    printStatistics(result);
                }
                return 0;
            } catch (SexpParseException exception) {
                printParseError(exception);
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 统计失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printJsonReport(String inputName, ExportResult result) throws IOException {
            TreeStatistics statistics = result.statistics();
            StatsReport report = new StatsReport(
                    inputName,
                    Instant.now(),
                    statistics.nodeCount(),
                    statistics.distinctTypeCount(),
                    statistics.sampleTypes(),
                    result.recoveredIssues(),
                    result.elapsedMs()
            );

            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }
    }

    public record StatsReport(
            String input,
            Instant generatedAt,
            int nodeCount,
            int distinctTypeCount,
            List<String> sampleTypes,
            int recoveredIssues,
            long elapsedMs
    ) {
    }
}
