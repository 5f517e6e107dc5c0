package com.astexport.pipeline;

import com.astexport.config.Constants;
import com.astexport.config.ExportConfig;
import com.astexport.export.AstSerializer;
import com.astexport.sexp.ParseMode;
import com.astexport.sexp.SexpNode;
import com.astexport.sexp.SexpParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstExportPipelineTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("流水线输出树、统计与记录")
    void testRun() {
        AstExportPipeline pipeline = new AstExportPipeline();

        ExportResult result = pipeline.run("(source_file [0, 0] - [0, 9] (a b) c)");

        assertTrue(result.hasTree());
        assertEquals(4, result.statistics().nodeCount());
        assertEquals(List.of("a", "source_file", "terminal"), result.statistics().distinctTypes());
        assertEquals("source_file", result.record().get("type"));
        assertEquals(17, result.tokenCount());
        assertEquals(0, result.recoveredIssues());
        assertTrue(result.elapsedMs() >= 0);
    }

    @Test
    @DisplayName("相同输入得到相同结果")
    void testDeterministic() {
        AstExportPipeline pipeline = new AstExportPipeline();
        String text = "(source_file (x (y z)) (w) v)";

        ExportResult first = pipeline.run(text);
        ExportResult second = pipeline.run(text);

        assertEquals(first.root(), second.root());
        assertEquals(first.statistics(), second.statistics());
        assertEquals(first.record(), second.record());
    }

    @Test
    @DisplayName("宽松模式下恢复问题被计数")
    void testLenientRecovery() {
        ExportResult result = new AstExportPipeline().run("(source_file (a b)))");

        assertTrue(result.hasTree());
        assertEquals(1, result.recoveredIssues());
        assertEquals(3, result.statistics().nodeCount());
    }

    @Test
    @DisplayName("严格模式下抛出解析异常")
    void testStrictMode() {
        ExportConfig config = ExportConfig.defaults();
        config.setParseMode(ParseMode.STRICT);

        AstExportPipeline pipeline = new AstExportPipeline(config);

        assertSame(config, pipeline.getConfig());
        assertThrows(SexpParseException.class, () -> pipeline.run("(source_file (a b)"));
    }

    @Test
    @DisplayName("空输入得到空结果")
    void testEmptyInput() {
        ExportResult result = new AstExportPipeline().run("");

        assertFalse(result.hasTree());
        assertNull(result.record());
        assertEquals(0, result.statistics().nodeCount());
    }

    @Test
    @DisplayName("读取文件并导出 JSON")
    void testRunFileAndExport() throws Exception {
        Path input = tempDir.resolve("parse.txt");
        Files.writeString(input, "Warning: something\n(source_file (comment))\n");
        Path output = tempDir.resolve("ast.json");

        ExportConfig config = ExportConfig.defaults();
        config.setPrettyPrint(false);
        AstExportPipeline pipeline = new AstExportPipeline(config);
        ExportResult result = pipeline.runFile(input);
        pipeline.export(result, output);

        assertEquals("{\"type\":\"source_file\",\"children\":[{\"type\":\"comment\",\"children\":[]}]}",
                Files.readString(output));
        SexpNode restored = new AstSerializer().fromJson(Files.readString(output));
        assertEquals(result.root(), restored);
    }

    @Test
    @DisplayName("最大深度的树可以导出并读回")
    void testExportDeepestTree() throws Exception {
        int depth = Constants.MAX_TREE_DEPTH;
        String text = "(source_file " + "(n ".repeat(depth - 1) + ")".repeat(depth);
        Path output = tempDir.resolve("deep.json");

        AstExportPipeline pipeline = new AstExportPipeline();
        ExportResult result = pipeline.run(text);
        pipeline.export(result, output);

        assertEquals(0, result.recoveredIssues());
        assertEquals(depth, result.statistics().maxDepth());
        assertEquals(result.root(), new AstSerializer().fromJson(Files.readString(output)));
    }
}
