package com.astexport.sexp;

/** 树构建器遇到畸形输入时的处理策略 */
public enum ParseMode {
    /** 尽力恢复，返回部分结果，从不抛出异常 */
    LENIENT,
    /** 任何结构问题都抛出 SexpParseException */
    STRICT
}
