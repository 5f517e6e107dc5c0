package com.astexport.config;

/**
 * 全局常量定义
 * 
 * 包含节点类型约定、统计输出参数和命令行默认值
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 节点类型 ====================
    /** 终结节点的固定类型标签 */
    public static final String TERMINAL_TYPE = "terminal";

    // ==================== 结构上限 ====================
    /** 内部节点允许的最大嵌套深度（根节点深度为 1） */
    public static final int MAX_TREE_DEPTH = 1000;
    /** JSON 读写允许的最大嵌套层数：每层内部节点占一个对象和一个 children 数组，最深处再加一个终结节点对象 */
    public static final int MAX_JSON_NESTING_DEPTH = 2 * MAX_TREE_DEPTH + 1;

    // ==================== 统计参数 ====================
    /** 默认展示的节点类型样例数量 */
    public static final int DEFAULT_SAMPLE_SIZE = 10;
    /** 样例数量上限 */
    public static final int MAX_SAMPLE_SIZE = 1000;

    // ==================== 输入输出 ====================
    /** tree-sitter 输出中语法树根节点所在行的前缀 */
    public static final String DEFAULT_ROOT_PREFIX = "(source_file";
    /** 默认导出文件名 */
    public static final String DEFAULT_OUTPUT_FILE = "ast.json";
    /** 表示从标准输入读取的路径参数 */
    public static final String STDIN_MARKER = "-";
}
