package com.astexport;

import com.astexport.analysis.TreeAnalyzer;
import com.astexport.analysis.TreeStatistics;
import com.astexport.export.AstSerializer;
import com.astexport.sexp.SexpLexer;
import com.astexport.sexp.SexpNode;
import com.astexport.sexp.SexpParser;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 解析与分析性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ParseBenchmark {

    @Param({"100", "2000"})
    public int functionCount;

    private String text;
    private SexpNode tree;

    @Setup
    public void setup() {
        text = generateParseOutput(functionCount);
        tree = new SexpParser().parse(text).root();
    }

    @Benchmark
    public int benchmarkTokenize() {
        return new SexpLexer().tokenize(text).size();
    }

    @Benchmark
    public SexpNode benchmarkParse() {
        return new SexpParser().parse(text).root();
    }

    @Benchmark
    public TreeStatistics benchmarkAnalyze() {
        return new TreeAnalyzer().analyze(tree, 10);
    }

    @Benchmark
    public Map<String, Object> benchmarkSerialize() {
        return new AstSerializer().toRecord(tree);
    }

    /**
     * 生成与 tree-sitter 输出格式一致的测试文本
     */
    private static String generateParseOutput(int functions) {
        StringBuilder builder = new StringBuilder("(source_file [0, 0] - [").append(functions * 4).append(", 0]\n");
        for (int i = 0; i < functions; i++) {
            int row = i * 4;
            builder.append("  (function_declaration [").append(row).append(", 0] - [").append(row + 3).append(", 1]\n")
                    .append("    name: (identifier [").append(row).append(", 3] - [").append(row).append(", 7])\n")
                    .append("    body: (block [").append(row).append(", 10] - [").append(row + 3).append(", 1]\n")
                    .append("      (return_statement [").append(row + 1).append(", 4] - [").append(row + 1).append(", 13]\n")
                    .append("        (number_literal [").append(row + 1).append(", 11] - [").append(row + 1).append(", 12]))))\n");
        }
        return builder.append(")").toString();
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(ParseBenchmark.class.getSimpleName())
                .build();
        new Runner(options).run();
    }
}
