package com.exampack.core.validation.schema;

import lombok.Value;

@Value
public class SchemaViolation {
    String field;
    String message;
}
