package com.astexport.sexp;

import com.astexport.config.Constants;

import java.util.List;
import java.util.Objects;

/**
 * 语法树节点，构造完成后不可变。
 */
public sealed interface SexpNode permits SexpNode.Interior, SexpNode.Terminal {

    /** 节点类型标签，终结节点固定为 {@link Constants#TERMINAL_TYPE} */
    String type();

    /** 子节点列表，终结节点为空 */
    List<SexpNode> children();

    record Interior(String type, List<SexpNode> children) implements SexpNode {
        public Interior {
            Objects.requireNonNull(type, "type");
            children = List.copyOf(children);
        }
    }

    record Terminal(String value) implements SexpNode {
        public Terminal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String type() {
            return Constants.TERMINAL_TYPE;
        }

        @Override
        public List<SexpNode> children() {
            return List.of();
        }
    }
}
