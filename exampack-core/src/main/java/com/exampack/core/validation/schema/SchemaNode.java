package com.exampack.core.validation.schema;

/**
 * 模式描述节点
 * <p>
 * 四种节点类型各自携带约束，由 {@link SchemaValidator} 统一遍历，不依赖反射。
 */
public abstract class SchemaNode {

    public enum Kind {
        OBJECT,
        ARRAY,
        STRING,
        NUMBER
    }

    SchemaNode() {
    }

    public abstract Kind getKind();
}
