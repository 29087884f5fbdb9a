package com.exampack.core.validation.schema;

import lombok.Builder;
import lombok.Getter;

/**
 * 数组节点：元素模式 + 最少元素数
 */
@Getter
@Builder
public final class ArraySchema extends SchemaNode {

    private final SchemaNode items;

    private final Integer minItems;

    public static ArraySchema of(SchemaNode items) {
        return ArraySchema.builder().items(items).build();
    }

    public static ArraySchema of(SchemaNode items, int minItems) {
        return ArraySchema.builder().items(items).minItems(minItems).build();
    }

    @Override
    public Kind getKind() {
        return Kind.ARRAY;
    }
}
