package com.exampack.core.validation.schema;

import lombok.Builder;
import lombok.Getter;

/**
 * 数值节点：闭区间上下界，均可缺省
 */
@Getter
@Builder
public final class NumberSchema extends SchemaNode {

    private final Double minimum;
    private final Double maximum;

    public static NumberSchema any() {
        return NumberSchema.builder().build();
    }

    public static NumberSchema atLeast(double minimum) {
        return NumberSchema.builder().minimum(minimum).build();
    }

    public static NumberSchema between(double minimum, double maximum) {
        return NumberSchema.builder().minimum(minimum).maximum(maximum).build();
    }

    @Override
    public Kind getKind() {
        return Kind.NUMBER;
    }
}
