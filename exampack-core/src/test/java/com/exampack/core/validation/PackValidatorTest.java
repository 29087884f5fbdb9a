package com.exampack.core.validation;

import com.exampack.api.content.DifficultyMix;
import com.exampack.api.content.ExamSection;
import com.exampack.api.content.ExamTemplatePackItem;
import com.exampack.api.content.QuestionChoice;
import com.exampack.api.content.QuestionPackItem;
import com.exampack.api.content.TipPackItem;
import com.exampack.api.manifest.PackManifest;
import com.exampack.api.validation.IssueType;
import com.exampack.api.validation.PackValidationResult;
import com.exampack.api.validation.ValidationIssue;
import com.exampack.core.support.TestPacks;
import com.exampack.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PackValidator 单元测试")
public class PackValidatorTest {

    private PackValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PackValidator();
    }

    private static PackManifest validManifest() {
        return TestPacks.manifest("net-basics", "1.0.0").toBuilder()
                .checksum("a".repeat(64))
                .signature("abcd")
                .build();
    }

    private static QuestionPackItem singleChoice(String id) {
        return QuestionPackItem.builder()
                .id(id)
                .type("single")
                .stem("Which port does HTTPS use?")
                .topicIds(Collections.singletonList("net"))
                .choices(Arrays.asList(new QuestionChoice("a", "443"), new QuestionChoice("b", "80")))
                .correct(Collections.singletonList("a"))
                .difficulty("easy")
                .build();
    }

    private static ExamTemplatePackItem template(String id, DifficultyMix mix) {
        return ExamTemplatePackItem.builder()
                .id(id)
                .name("Practice exam")
                .durationMinutes(90)
                .sections(Collections.singletonList(ExamSection.builder()
                        .topicIds(Collections.singletonList("net"))
                        .count(10)
                        .difficultyMix(mix)
                        .build()))
                .build();
    }

    private static TipPackItem tip(String id) {
        return TipPackItem.builder()
                .id(id)
                .topicIds(Collections.singletonList("net"))
                .title("Ports")
                .body("Memorize the well-known ports.")
                .build();
    }

    @Nested
    @DisplayName("清单校验")
    class ManifestTests {

        @Test
        @DisplayName("合法清单没有错误")
        void validManifestPasses() {
            PackValidationResult result = validator.validateManifest(validManifest());

            assertTrue(result.isValid(), () -> result.getErrors().toString());
            assertTrue(result.getWarnings().isEmpty());
        }

        @Test
        @DisplayName("缺失必填字段在对象路径与树路径报告一致")
        void missingFieldReportedOnBothPaths() {
            PackManifest manifest = validManifest().toBuilder().author(null).build();
            JsonNode tree = JsonUtils.toTree(manifest);

            PackValidationResult typed = validator.validateManifest(manifest);
            PackValidationResult node = validator.validateManifestNode(tree);

            assertFalse(typed.isValid());
            assertEquals(typed.getErrors(), node.getErrors());
            assertEquals("author", typed.getErrors().get(0).getField());
            assertEquals(IssueType.SCHEMA, typed.getErrors().get(0).getType());
        }

        @Test
        @DisplayName("非法版本号与校验和格式")
        void patternViolations() {
            PackManifest manifest = validManifest().toBuilder().version("1.0").checksum("xyz").build();

            PackValidationResult result = validator.validateManifest(manifest);

            assertEquals(2, result.getErrors().size());
            assertTrue(result.getErrors().stream().allMatch(e -> e.getMessage().equals("String does not match required pattern")));
        }

        @Test
        @DisplayName("id、版本号与校验和末尾带换行时不合法")
        void trailingNewlineRejected() {
            PackManifest valid = validManifest();
            PackManifest manifest = valid.toBuilder()
                    .id("net-basics\n")
                    .version("1.0.0\n")
                    .checksum(valid.getChecksum() + "\n")
                    .build();

            PackValidationResult result = validator.validateManifest(manifest);

            assertFalse(result.isValid());
            assertEquals(3, result.getErrors().size());
        }

        @Test
        @DisplayName("totalQuestions 为 0 给出警告")
        void zeroQuestionsWarning() {
            PackManifest manifest = validManifest();
            manifest.getMetadata().setTotalQuestions(0);

            PackValidationResult result = validator.validateManifest(manifest);

            assertTrue(result.isValid());
            assertEquals(1, result.getWarnings().size());
            assertEquals("metadata.totalQuestions", result.getWarnings().get(0).getField());
        }

        @Test
        @DisplayName("null 清单报告为模式错误")
        void nullManifest() {
            PackValidationResult result = validator.validateManifest(null);

            assertFalse(result.isValid());
            assertEquals("Expected object, got null", result.getErrors().get(0).getMessage());
        }
    }

    @Nested
    @DisplayName("题目校验")
    class QuestionTests {

        @Test
        @DisplayName("重复 ID 的错误同时指出两处位置")
        void duplicateIds() {
            PackValidationResult result = validator.validateQuestions(Arrays.asList(singleChoice("q1"), singleChoice("q1")));

            assertFalse(result.isValid());
            assertEquals(1, result.getErrors().size());
            ValidationIssue issue = result.getErrors().get(0);
            assertEquals(Integer.valueOf(2), issue.getLine());
            assertEquals(IssueType.BUSINESS_RULE, issue.getType());
            assertEquals("Duplicate question ID: q1 (first defined at line 1, repeated at line 2)", issue.getMessage());
        }

        @Test
        @DisplayName("选择题至少两个选项且必须有正确答案")
        void choiceRules() {
            QuestionPackItem question = singleChoice("q1").toBuilder()
                    .choices(Collections.singletonList(new QuestionChoice("a", "443")))
                    .correct(Collections.emptyList())
                    .build();

            PackValidationResult result = validator.validateQuestions(Collections.singletonList(question));

            assertEquals(2, result.getErrors().size());
            assertEquals("choices", result.getErrors().get(0).getField());
            assertEquals("correct", result.getErrors().get(1).getField());
        }

        @Test
        @DisplayName("单选题多个正确答案只是警告")
        void singleWithTwoAnswers() {
            QuestionPackItem question = singleChoice("q1").toBuilder().correct(Arrays.asList("a", "b")).build();

            PackValidationResult result = validator.validateQuestions(Collections.singletonList(question));

            assertTrue(result.isValid());
            assertEquals(1, result.getWarnings().size());
        }

        @Test
        @DisplayName("排序题至少两项")
        void orderingRule() {
            QuestionPackItem question = QuestionPackItem.builder()
                    .id("q9").type("order").stem("Order the OSI layers")
                    .topicIds(Collections.singletonList("net"))
                    .correctOrder(Collections.singletonList("physical"))
                    .difficulty("hard")
                    .build();

            PackValidationResult result = validator.validateQuestions(Collections.singletonList(question));

            assertEquals(1, result.getErrors().size());
            assertEquals("correctOrder", result.getErrors().get(0).getField());
        }

        @Test
        @DisplayName("非图片附件给出警告，扩展名不区分大小写")
        void exhibitExtensions() {
            QuestionPackItem question = singleChoice("q1").toBuilder()
                    .exhibits(Arrays.asList("diagram.PNG", "notes.pdf"))
                    .build();

            PackValidationResult result = validator.validateQuestions(Collections.singletonList(question));

            assertTrue(result.isValid());
            assertEquals(1, result.getWarnings().size());
            assertTrue(result.getWarnings().get(0).getMessage().endsWith("notes.pdf"));
        }

        @Test
        @DisplayName("null 列表报告为错误而不是异常")
        void nullList() {
            PackValidationResult result = validator.validateQuestions(null);

            assertFalse(result.isValid());
            assertEquals("Expected array, got null", result.getErrors().get(0).getMessage());
        }
    }

    @Nested
    @DisplayName("模板与提示校验")
    class TemplateAndTipTests {

        @Test
        @DisplayName("难度配比 0.99 给出警告")
        void mixOffByOnePercent() {
            PackValidationResult result = validator.validateExamTemplates(
                    Collections.singletonList(template("t1", new DifficultyMix(0.5, 0.3, 0.19))));

            assertTrue(result.isValid());
            assertEquals(1, result.getWarnings().size());
            assertEquals("sections[0].difficultyMix", result.getWarnings().get(0).getField());
        }

        @Test
        @DisplayName("难度配比 1.0 没有警告，缺失的比例按 0 计")
        void mixExact() {
            PackValidationResult result = validator.validateExamTemplates(Arrays.asList(
                    template("t1", new DifficultyMix(0.5, 0.3, 0.2)),
                    template("t2", new DifficultyMix(0.4, 0.6, null))));

            assertTrue(result.isValid());
            assertTrue(result.getWarnings().isEmpty(), () -> result.getWarnings().toString());
        }

        @Test
        @DisplayName("模板时长越界")
        void durationOutOfRange() {
            ExamTemplatePackItem item = template("t1", null).toBuilder().durationMinutes(601).build();

            PackValidationResult result = validator.validateExamTemplates(Collections.singletonList(item));

            assertEquals("durationMinutes", result.getErrors().get(0).getField());
        }

        @Test
        @DisplayName("提示重复 ID")
        void duplicateTips() {
            PackValidationResult result = validator.validateTips(Arrays.asList(tip("a"), tip("b"), tip("a")));

            assertEquals(1, result.getErrors().size());
            assertEquals(Integer.valueOf(3), result.getErrors().get(0).getLine());
        }
    }

    @Nested
    @DisplayName("整包校验")
    class EntirePackTests {

        @Test
        @DisplayName("合法内容包有效")
        void validPack() {
            PackValidationResult result = validator.validateEntirePack(validManifest(),
                    Arrays.asList(singleChoice("q1"), singleChoice("q2")),
                    Collections.singletonList(template("t1", new DifficultyMix(0.2, 0.5, 0.3))),
                    Collections.singletonList(tip("tip1")));

            assertTrue(result.isValid(), () -> result.getErrors().toString());
            assertTrue(result.getWarnings().isEmpty(), () -> result.getWarnings().toString());
        }

        @Test
        @DisplayName("声明数量与实际不符只是交叉引用警告")
        void countMismatch() {
            PackValidationResult result = validator.validateEntirePack(validManifest(),
                    Collections.singletonList(singleChoice("q1")),
                    Collections.singletonList(template("t1", null)),
                    Collections.singletonList(tip("tip1")));

            assertTrue(result.isValid());
            assertEquals(1, result.getWarnings().size());
            ValidationIssue warning = result.getWarnings().get(0);
            assertEquals(IssueType.CROSS_REFERENCE, warning.getType());
            assertEquals("metadata.totalQuestions", warning.getField());
            assertEquals("Metadata count (2) doesn't match actual questions (1)", warning.getMessage());
        }

        @Test
        @DisplayName("任一部分无效则整体无效，错误全部汇总")
        void unionOfErrors() {
            List<TipPackItem> tips = new ArrayList<>();
            tips.add(tip("tip1").toBuilder().body("short").build());

            PackValidationResult result = validator.validateEntirePack(validManifest(),
                    Arrays.asList(singleChoice("q1"), singleChoice("q1")),
                    Collections.singletonList(template("t1", null)),
                    tips);

            assertFalse(result.isValid());
            assertEquals(2, result.getErrors().size());
            assertEquals("questions.jsonl", result.getErrors().get(0).getFile());
            assertEquals("tips.json", result.getErrors().get(1).getFile());
        }
    }
}
