package com.astexport.export;

import com.astexport.config.Constants;
import com.astexport.sexp.SexpNode;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 语法树与嵌套记录（JSON）之间的转换。
 */
public class AstSerializer {
    static final String TYPE_FIELD = "type";
    static final String CHILDREN_FIELD = "children";
    static final String VALUE_FIELD = "value";

    private final ObjectMapper mapper;

    public AstSerializer() {
        this.mapper = createMapper();
    }

    /**
     * 内部节点渲染为 {type, children}，终结节点渲染为 {type: "terminal", value}；空树返回 null。
     */
    public Map<String, Object> toRecord(SexpNode node) {
        if (node == null) {
            return null;
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(TYPE_FIELD, node.type());
        if (node instanceof SexpNode.Terminal terminal) {
            record.put(VALUE_FIELD, terminal.value());
            return record;
        }
        List<Map<String, Object>> children = new ArrayList<>(node.children().size());
        for (SexpNode child : node.children()) {
            children.add(toRecord(child));
        }
        record.put(CHILDREN_FIELD, children);
        return record;
    }

    /**
     * 构造嵌套层数上限为 {@link Constants#MAX_JSON_NESTING_DEPTH} 的 ObjectMapper，
     * 保证深度不超过 {@link Constants#MAX_TREE_DEPTH} 的树都能写出并读回。
     */
    private static ObjectMapper createMapper() {
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(Constants.MAX_JSON_NESTING_DEPTH)
                        .build())
                .streamWriteConstraints(StreamWriteConstraints.builder()
                        .maxNestingDepth(Constants.MAX_JSON_NESTING_DEPTH)
                        .build())
                .build();
        return new ObjectMapper(factory);
    }

    public String toJson(SexpNode node, boolean pretty) throws IOException {
        StringWriter buffer = new StringWriter();
        try (JsonGenerator generator = mapper.getFactory().createGenerator(buffer)) {
            write(generator, node, pretty);
        }
        return buffer.toString();
    }

    /**
     * 将语法树写入 JSON 文件，必要时创建父目录。
     */
    public void writeJson(SexpNode node, Path target, boolean pretty) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (JsonGenerator generator = mapper.getFactory().createGenerator(target.toFile(), JsonEncoding.UTF8)) {
            write(generator, node, pretty);
        }
    }

    private void write(JsonGenerator generator, SexpNode node, boolean pretty) throws IOException {
        if (pretty) {
            generator.useDefaultPrettyPrinter();
        }
        writeNode(generator, node);
    }

    /**
     * 直接按记录结构流式写出节点，字段顺序与 {@link #toRecord(SexpNode)} 一致。
     */
    private void writeNode(JsonGenerator generator, SexpNode node) throws IOException {
        if (node == null) {
            generator.writeNull();
            return;
        }
        generator.writeStartObject();
        generator.writeStringField(TYPE_FIELD, node.type());
        if (node instanceof SexpNode.Terminal terminal) {
            generator.writeStringField(VALUE_FIELD, terminal.value());
        } else {
            generator.writeArrayFieldStart(CHILDREN_FIELD);
            for (SexpNode child : node.children()) {
                writeNode(generator, child);
            }
            generator.writeEndArray();
        }
        generator.writeEndObject();
    }

    /**
     * 从 JSON 记录还原语法树，记录结构不合法时抛出 IllegalArgumentException。
     */
    public SexpNode fromJson(String json) throws IOException {
        JsonNode tree = mapper.readTree(json);
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return null;
        }
        return fromRecord(tree, "$");
    }

    private SexpNode fromRecord(JsonNode record, String path) {
        if (!record.isObject()) {
            throw new IllegalArgumentException(path + " 不是对象");
        }
        JsonNode typeNode = record.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new IllegalArgumentException(path + " 缺少字符串字段 type");
        }

        String type = typeNode.asText();
        if (Constants.TERMINAL_TYPE.equals(type) && record.has(VALUE_FIELD)) {
            JsonNode valueNode = record.get(VALUE_FIELD);
            if (!valueNode.isTextual()) {
                throw new IllegalArgumentException(path + ".value 必须是字符串");
            }
            return new SexpNode.Terminal(valueNode.asText());
        }

        JsonNode childrenNode = record.get(CHILDREN_FIELD);
        if (childrenNode == null || !childrenNode.isArray()) {
            throw new IllegalArgumentException(path + " 缺少数组字段 children");
        }
        List<SexpNode> children = new ArrayList<>(childrenNode.size());
        for (int index = 0; index < childrenNode.size(); index++) {
            children.add(fromRecord(childrenNode.get(index), path + ".children[" + index + "]"));
        }
        return new SexpNode.Interior(type, children);
    }
}
