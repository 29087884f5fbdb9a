package com.exampack.core.validation.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 通用模式校验
 * <p>
 * 递归遍历模式树，对照 JSON 树收集违规项。类型不符时不再深入该节点。
 * 本类无状态、线程安全，任何输入都不会抛出异常。
 */
public final class SchemaValidator {

    public static final String ROOT = "<root>";

    private SchemaValidator() {
    }

    public static List<SchemaViolation> validate(SchemaNode schema, JsonNode value) {
        return validate(schema, value, "");
    }

    public static List<SchemaViolation> validate(SchemaNode schema, JsonNode value, String path) {
        List<SchemaViolation> violations = new ArrayList<>();
        walk(schema, value, path, violations);
        return violations;
    }

    private static void walk(SchemaNode schema, JsonNode value, String path, List<SchemaViolation> out) {
        switch (schema.getKind()) {
            case OBJECT:
                walkObject((ObjectSchema) schema, value, path, out);
                break;
            case ARRAY:
                walkArray((ArraySchema) schema, value, path, out);
                break;
            case STRING:
                walkString((StringSchema) schema, value, path, out);
                break;
            case NUMBER:
                walkNumber((NumberSchema) schema, value, path, out);
                break;
            default:
                throw new IllegalStateException("Unknown schema kind: " + schema.getKind());
        }
    }

    private static void walkObject(ObjectSchema schema, JsonNode value, String path, List<SchemaViolation> out) {
        if (value == null || !value.isObject()) {
            out.add(violation(path, "Expected object, got " + typeOf(value)));
            return;
        }
        for (String required : schema.getRequiredFields()) {
            if (!value.has(required)) {
                out.add(violation(child(path, required), "Missing required field"));
            }
        }
        Map<String, SchemaNode> properties = schema.getProperties();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            SchemaNode propertySchema = properties.get(field.getKey());
            if (propertySchema != null) {
                walk(propertySchema, field.getValue(), child(path, field.getKey()), out);
            }
        }
    }

    private static void walkArray(ArraySchema schema, JsonNode value, String path, List<SchemaViolation> out) {
        if (value == null || !value.isArray()) {
            out.add(violation(path, "Expected array, got " + typeOf(value)));
            return;
        }
        if (schema.getMinItems() != null && value.size() < schema.getMinItems()) {
            out.add(violation(path, "Array must have at least " + schema.getMinItems() + " items"));
        }
        if (schema.getItems() != null) {
            for (int i = 0; i < value.size(); i++) {
                walk(schema.getItems(), value.get(i), path + "[" + i + "]", out);
            }
        }
    }

    private static void walkString(StringSchema schema, JsonNode value, String path, List<SchemaViolation> out) {
        if (value == null || !value.isTextual()) {
            out.add(violation(path, "Expected string, got " + typeOf(value)));
            return;
        }
        String text = value.textValue();
        if (schema.getMinLength() != null && text.length() < schema.getMinLength()) {
            out.add(violation(path, "String must be at least " + schema.getMinLength() + " characters"));
        }
        if (schema.getMaxLength() != null && text.length() > schema.getMaxLength()) {
            out.add(violation(path, "String must be at most " + schema.getMaxLength() + " characters"));
        }
        if (schema.getPattern() != null && !schema.getPattern().matcher(text).matches()) {
            out.add(violation(path, "String does not match required pattern"));
        }
        if (!schema.getAllowedValues().isEmpty() && !schema.getAllowedValues().contains(text)) {
            out.add(violation(path, "Value must be one of: " + String.join(", ", schema.getAllowedValues())));
        }
    }

    private static void walkNumber(NumberSchema schema, JsonNode value, String path, List<SchemaViolation> out) {
        if (value == null || !value.isNumber()) {
            out.add(violation(path, "Expected number, got " + typeOf(value)));
            return;
        }
        double number = value.doubleValue();
        if (schema.getMinimum() != null && number < schema.getMinimum()) {
            out.add(violation(path, "Number must be at least " + format(schema.getMinimum())));
        }
        if (schema.getMaximum() != null && number > schema.getMaximum()) {
            out.add(violation(path, "Number must be at most " + format(schema.getMaximum())));
        }
    }

    // ==================== 辅助方法 ====================

    private static SchemaViolation violation(String path, String message) {
        return new SchemaViolation(path.isEmpty() ? ROOT : path, message);
    }

    private static String child(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    static String typeOf(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return "null";
        }
        if (value.isObject()) {
            return "object";
        }
        if (value.isArray()) {
            return "array";
        }
        if (value.isTextual()) {
            return "string";
        }
        if (value.isNumber()) {
            return "number";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        return value.getNodeType().name().toLowerCase();
    }

    private static String format(double bound) {
        if (bound == Math.rint(bound) && !Double.isInfinite(bound)) {
            return Long.toString((long) bound);
        }
        return Double.toString(bound);
    }
}
