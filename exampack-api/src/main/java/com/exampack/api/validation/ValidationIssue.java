package com.exampack.api.validation;

import lombok.Builder;
import lombok.Value;

/**
 * 单条校验问题
 * <p>
 * {@code line} 为条目在内容文件中的序号（从 1 开始），清单级问题为 null。
 */
@Value
@Builder
public class ValidationIssue {
    String file;
    Integer line;
    String field;
    String message;
    @Builder.Default
    IssueType type = IssueType.SCHEMA;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(file);
        if (line != null) {
            sb.append(':').append(line);
        }
        if (field != null && !field.isEmpty()) {
            sb.append(" [").append(field).append(']');
        }
        return sb.append(' ').append(message).toString();
    }
}
