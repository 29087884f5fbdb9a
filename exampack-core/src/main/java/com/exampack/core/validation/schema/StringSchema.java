package com.exampack.core.validation.schema;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 字符串节点：长度区间、正则、枚举
 */
@Getter
public final class StringSchema extends SchemaNode {

    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern pattern;
    private final List<String> allowedValues;

    @Builder
    private StringSchema(Integer minLength, Integer maxLength, String pattern,
            @Singular List<String> allowedValues) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.pattern = pattern != null ? Pattern.compile(pattern) : null;
        this.allowedValues = allowedValues;
    }

    public static StringSchema any() {
        return StringSchema.builder().build();
    }

    public static StringSchema matching(String regex) {
        return StringSchema.builder().pattern(regex).build();
    }

    public static StringSchema length(int min, int max) {
        return StringSchema.builder().minLength(min).maxLength(max).build();
    }

    public static StringSchema oneOf(String... values) {
        StringSchemaBuilder builder = StringSchema.builder();
        for (String value : values) {
            builder.allowedValue(value);
        }
        return builder.build();
    }

    @Override
    public Kind getKind() {
        return Kind.STRING;
    }
}
