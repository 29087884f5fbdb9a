package com.exampack.core.validation.schema;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * 对象节点：必填键 + 已声明属性的子模式
 * <p>
 * 未声明的属性不做校验；不声明任何属性即接受任意对象。
 */
@Getter
@Builder
public final class ObjectSchema extends SchemaNode {

    @Singular
    private final List<String> requiredFields;

    @Singular
    private final Map<String, SchemaNode> properties;

    public static ObjectSchema any() {
        return ObjectSchema.builder().build();
    }

    @Override
    public Kind getKind() {
        return Kind.OBJECT;
    }
}
