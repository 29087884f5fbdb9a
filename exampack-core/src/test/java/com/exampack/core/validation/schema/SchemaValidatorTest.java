package com.exampack.core.validation.schema;

import com.exampack.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaValidator 单元测试")
public class SchemaValidatorTest {

    private static JsonNode json(String text) throws Exception {
        return JsonUtils.mapper().readTree(text);
    }

    @Nested
    @DisplayName("对象节点")
    class ObjectTests {

        private final ObjectSchema schema = ObjectSchema.builder()
                .requiredField("id")
                .property("id", StringSchema.matching("^[a-z]+$"))
                .property("nested", ObjectSchema.builder()
                        .requiredField("count")
                        .property("count", NumberSchema.atLeast(1))
                        .build())
                .build();

        @Test
        @DisplayName("缺失必填字段应报告字段路径")
        void missingRequiredField() throws Exception {
            List<SchemaViolation> violations = SchemaValidator.validate(schema, json("{}"));

            assertEquals(1, violations.size());
            assertEquals("id", violations.get(0).getField());
            assertEquals("Missing required field", violations.get(0).getMessage());
        }

        @Test
        @DisplayName("嵌套字段路径用点号连接")
        void nestedPath() throws Exception {
            List<SchemaViolation> violations = SchemaValidator.validate(schema,
                    json("{\"id\":\"abc\",\"nested\":{\"count\":0}}"));

            assertEquals(1, violations.size());
            assertEquals("nested.count", violations.get(0).getField());
            assertEquals("Number must be at least 1", violations.get(0).getMessage());
        }

        @Test
        @DisplayName("根节点类型不符时报告 <root>")
        void rootTypeMismatch() {
            List<SchemaViolation> violations = SchemaValidator.validate(schema, NullNode.getInstance());

            assertEquals(1, violations.size());
            assertEquals(SchemaValidator.ROOT, violations.get(0).getField());
            assertEquals("Expected object, got null", violations.get(0).getMessage());
        }

        @Test
        @DisplayName("未声明的字段不做校验")
        void unknownFieldsIgnored() throws Exception {
            assertTrue(SchemaValidator.validate(schema, json("{\"id\":\"abc\",\"extra\":42}")).isEmpty());
        }
    }

    @Nested
    @DisplayName("数组节点")
    class ArrayTests {

        @Test
        @DisplayName("元素路径带下标")
        void indexedPath() throws Exception {
            ArraySchema schema = ArraySchema.of(StringSchema.any());

            List<SchemaViolation> violations = SchemaValidator.validate(schema, json("[\"a\", 1]"));

            assertEquals(1, violations.size());
            assertEquals("[1]", violations.get(0).getField());
            assertEquals("Expected string, got number", violations.get(0).getMessage());
        }

        @Test
        @DisplayName("少于最小元素数时报错")
        void minItems() throws Exception {
            List<SchemaViolation> violations = SchemaValidator.validate(ArraySchema.of(StringSchema.any(), 1), json("[]"));

            assertEquals("Array must have at least 1 items", violations.get(0).getMessage());
        }
    }

    @Nested
    @DisplayName("标量节点")
    class ScalarTests {

        @Test
        @DisplayName("字符串长度上下限")
        void stringLength() throws Exception {
            StringSchema schema = StringSchema.length(2, 3);

            assertEquals("String must be at least 2 characters",
                    SchemaValidator.validate(schema, json("\"a\"")).get(0).getMessage());
            assertEquals("String must be at most 3 characters",
                    SchemaValidator.validate(schema, json("\"abcd\"")).get(0).getMessage());
            assertTrue(SchemaValidator.validate(schema, json("\"abc\"")).isEmpty());
        }

        @Test
        @DisplayName("枚举值")
        void enumeration() throws Exception {
            List<SchemaViolation> violations = SchemaValidator.validate(StringSchema.oneOf("easy", "med", "hard"),
                    json("\"extreme\""));

            assertEquals("Value must be one of: easy, med, hard", violations.get(0).getMessage());
        }

        @Test
        @DisplayName("数值区间，小数边界保留小数")
        void numberBounds() throws Exception {
            NumberSchema schema = NumberSchema.between(0, 0.5);

            assertEquals("Number must be at most 0.5", SchemaValidator.validate(schema, json("0.7")).get(0).getMessage());
            assertEquals("Expected number, got string", SchemaValidator.validate(schema, json("\"1\"")).get(0).getMessage());
        }

        @Test
        @DisplayName("正则必须匹配整个字符串，末尾换行不放行")
        void patternMatchesWholeString() throws Exception {
            StringSchema id = StringSchema.matching("^[a-zA-Z0-9_-]+$");
            StringSchema semver = StringSchema.matching("^\\d+\\.\\d+\\.\\d+$");

            assertTrue(SchemaValidator.validate(id, json("\"net-basics\"")).isEmpty());
            assertEquals("String does not match required pattern",
                    SchemaValidator.validate(id, json("\"net-basics\\n\"")).get(0).getMessage());
            assertTrue(SchemaValidator.validate(semver, json("\"1.0.0\"")).isEmpty());
            assertFalse(SchemaValidator.validate(semver, json("\"1.0.0\\n\"")).isEmpty());
        }
    }
}
