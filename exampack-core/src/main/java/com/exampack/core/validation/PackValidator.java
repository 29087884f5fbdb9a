package com.exampack.core.validation;

import com.exampack.api.content.ExamTemplatePackItem;
import com.exampack.api.content.QuestionPackItem;
import com.exampack.api.content.TipPackItem;
import com.exampack.api.manifest.PackManifest;
import com.exampack.api.validation.IssueType;
import com.exampack.api.validation.PackValidationResult;
import com.exampack.api.validation.ValidationIssue;
import com.exampack.core.util.JsonUtils;
import com.exampack.core.validation.schema.ObjectSchema;
import com.exampack.core.validation.schema.PackSchemas;
import com.exampack.core.validation.schema.SchemaValidator;
import com.exampack.core.validation.schema.SchemaViolation;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 内容包校验器
 * <p>
 * 职责：
 * 1. 清单与三类内容条目的模式校验
 * 2. 业务规则：ID 唯一、题型约束、难度配比
 * 3. 清单声明数量与实际内容的交叉校验
 * <p>
 * 纯函数、无副作用、从不抛出异常。每个操作都提供对象版本与 JSON 树版本，
 * 对象版本先转为 JSON 树（忽略 null 字段）再委托给树版本，因此两条路径报告一致。
 */
public class PackValidator {

    public static final String MANIFEST_FILE = "manifest.json";
    public static final String QUESTIONS_FILE = "questions.jsonl";
    public static final String TEMPLATES_FILE = "examTemplates.json";
    public static final String TIPS_FILE = "tips.json";

    private static final double DIFFICULTY_MIX_TOLERANCE = 0.001;
    private static final Pattern IMAGE_FILE = Pattern.compile("\\.(png|jpg|jpeg|gif|svg)$", Pattern.CASE_INSENSITIVE);
    private static final List<String> CHOICE_TYPES = Arrays.asList("single", "multi", "scenario");

    // ==================== 清单 ====================

    public PackValidationResult validateManifest(PackManifest manifest) {
        return validateManifestNode(JsonUtils.toTree(manifest));
    }

    public PackValidationResult validateManifestNode(JsonNode manifest) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        errors.addAll(schemaIssues(PackSchemas.MANIFEST, manifest, MANIFEST_FILE, null));

        JsonNode totalQuestions = metadataField(manifest, "totalQuestions");
        if (totalQuestions != null && totalQuestions.isNumber() && totalQuestions.doubleValue() <= 0) {
            warnings.add(issue(MANIFEST_FILE, null, "metadata.totalQuestions",
                    "Pack should contain at least one question", IssueType.BUSINESS_RULE));
        }

        return PackValidationResult.of(errors, warnings);
    }

    // ==================== 题目 ====================

    public PackValidationResult validateQuestions(List<QuestionPackItem> questions) {
        return validateQuestionNodes(toNodes(questions), QUESTIONS_FILE);
    }

    public PackValidationResult validateQuestionNodes(List<? extends JsonNode> questions, String file) {
        if (questions == null) {
            return missingList(file);
        }
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        Map<String, Integer> firstSeen = new HashMap<>();

        for (int index = 0; index < questions.size(); index++) {
            JsonNode question = questions.get(index);
            int line = index + 1;

            errors.addAll(schemaIssues(PackSchemas.QUESTION, question, file, line));
            checkDuplicate(question, "question", firstSeen, file, line, errors);

            if (question == null || !question.isObject()) {
                continue;
            }
            String type = text(question, "type");
            if (CHOICE_TYPES.contains(type)) {
                if (sizeOf(question, "choices") < 2) {
                    errors.add(issue(file, line, "choices",
                            "Choice questions must have at least 2 choices", IssueType.BUSINESS_RULE));
                }
                int correctCount = sizeOf(question, "correct");
                if (correctCount == 0) {
                    errors.add(issue(file, line, "correct",
                            "Choice questions must have correct answers specified", IssueType.BUSINESS_RULE));
                }
                if ("single".equals(type) && correctCount > 1) {
                    warnings.add(issue(file, line, "correct",
                            "Single choice questions should have only one correct answer", IssueType.BUSINESS_RULE));
                }
            }
            if ("order".equals(type) && sizeOf(question, "correctOrder") < 2) {
                errors.add(issue(file, line, "correctOrder",
                        "Ordering questions must have at least 2 items in correct order", IssueType.BUSINESS_RULE));
            }

            JsonNode exhibits = question.get("exhibits");
            if (exhibits != null && exhibits.isArray()) {
                for (JsonNode exhibit : exhibits) {
                    if (exhibit.isTextual() && !IMAGE_FILE.matcher(exhibit.textValue()).find()) {
                        warnings.add(issue(file, line, "exhibits",
                                "Exhibit file should be an image: " + exhibit.textValue(), IssueType.BUSINESS_RULE));
                    }
                }
            }
        }

        return PackValidationResult.of(errors, warnings);
    }

    // ==================== 试卷模板 ====================

    public PackValidationResult validateExamTemplates(List<ExamTemplatePackItem> templates) {
        return validateExamTemplateNodes(toNodes(templates), TEMPLATES_FILE);
    }

    public PackValidationResult validateExamTemplateNodes(List<? extends JsonNode> templates, String file) {
        if (templates == null) {
            return missingList(file);
        }
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        Map<String, Integer> firstSeen = new HashMap<>();

        for (int index = 0; index < templates.size(); index++) {
            JsonNode template = templates.get(index);
            int line = index + 1;

            errors.addAll(schemaIssues(PackSchemas.EXAM_TEMPLATE, template, file, line));
            checkDuplicate(template, "template", firstSeen, file, line, errors);

            JsonNode sections = template != null ? template.get("sections") : null;
            if (sections == null || !sections.isArray()) {
                continue;
            }
            for (int sectionIndex = 0; sectionIndex < sections.size(); sectionIndex++) {
                JsonNode mix = sections.get(sectionIndex).get("difficultyMix");
                if (mix == null || !mix.isObject()) {
                    continue;
                }
                double total = proportion(mix, "easy") + proportion(mix, "med") + proportion(mix, "hard");
                if (Math.abs(total - 1.0) > DIFFICULTY_MIX_TOLERANCE) {
                    warnings.add(issue(file, line, "sections[" + sectionIndex + "].difficultyMix",
                            "Difficulty mix should sum to 1.0 (got " + total + ")", IssueType.BUSINESS_RULE));
                }
            }
        }

        return PackValidationResult.of(errors, warnings);
    }

    // ==================== 提示 ====================

    public PackValidationResult validateTips(List<TipPackItem> tips) {
        return validateTipNodes(toNodes(tips), TIPS_FILE);
    }

    public PackValidationResult validateTipNodes(List<? extends JsonNode> tips, String file) {
        if (tips == null) {
            return missingList(file);
        }
        List<ValidationIssue> errors = new ArrayList<>();
        Map<String, Integer> firstSeen = new HashMap<>();

        for (int index = 0; index < tips.size(); index++) {
            JsonNode tip = tips.get(index);
            int line = index + 1;
            errors.addAll(schemaIssues(PackSchemas.TIP, tip, file, line));
            checkDuplicate(tip, "tip", firstSeen, file, line, errors);
        }

        return PackValidationResult.of(errors, new ArrayList<>());
    }

    // ==================== 整包 ====================

    public PackValidationResult validateEntirePack(PackManifest manifest,
            List<QuestionPackItem> questions,
            List<ExamTemplatePackItem> templates,
            List<TipPackItem> tips) {
        return validateEntirePackNodes(JsonUtils.toTree(manifest), toNodes(questions), toNodes(templates),
                toNodes(tips));
    }

    public PackValidationResult validateEntirePackNodes(JsonNode manifest,
            List<? extends JsonNode> questions,
            List<? extends JsonNode> templates,
            List<? extends JsonNode> tips) {
        PackValidationResult manifestResult = validateManifestNode(manifest);
        PackValidationResult questionsResult = validateQuestionNodes(questions, fileName(manifest, "questions", QUESTIONS_FILE));
        PackValidationResult templatesResult = validateExamTemplateNodes(templates,
                fileName(manifest, "examTemplates", TEMPLATES_FILE));
        PackValidationResult tipsResult = validateTipNodes(tips, fileName(manifest, "tips", TIPS_FILE));

        // 交叉校验：数量不一致只给出警告，不阻断安装
        List<ValidationIssue> crossRefErrors = new ArrayList<>();
        List<ValidationIssue> crossRefWarnings = new ArrayList<>();
        checkDeclaredCount(manifest, "totalQuestions", "questions", questions, crossRefWarnings);
        checkDeclaredCount(manifest, "totalTemplates", "templates", templates, crossRefWarnings);
        checkDeclaredCount(manifest, "totalTips", "tips", tips, crossRefWarnings);

        List<PackValidationResult> parts = Arrays.asList(manifestResult, questionsResult, templatesResult, tipsResult);
        boolean valid = parts.stream().allMatch(PackValidationResult::isValid) && crossRefErrors.isEmpty();

        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (PackValidationResult part : parts) {
            errors.addAll(part.getErrors());
            warnings.addAll(part.getWarnings());
        }
        errors.addAll(crossRefErrors);
        warnings.addAll(crossRefWarnings);

        return PackValidationResult.of(valid, errors, warnings);
    }

    // ==================== 辅助方法 ====================

    private void checkDeclaredCount(JsonNode manifest, String metadataField, String label,
            List<? extends JsonNode> items, List<ValidationIssue> warnings) {
        JsonNode declared = metadataField(manifest, metadataField);
        if (declared == null || !declared.isNumber() || items == null) {
            return;
        }
        if (declared.doubleValue() != items.size()) {
            warnings.add(issue(MANIFEST_FILE, null, "metadata." + metadataField,
                    String.format("Metadata count (%s) doesn't match actual %s (%d)",
                            declared.asText(), label, items.size()),
                    IssueType.CROSS_REFERENCE));
        }
    }

    private static void checkDuplicate(JsonNode item, String kind, Map<String, Integer> firstSeen,
            String file, int line, List<ValidationIssue> errors) {
        String id = text(item, "id");
        if (id == null) {
            return;
        }
        Integer previous = firstSeen.putIfAbsent(id, line);
        if (previous != null) {
            errors.add(issue(file, line, "id",
                    String.format("Duplicate %s ID: %s (first defined at line %d, repeated at line %d)",
                            kind, id, previous, line),
                    IssueType.BUSINESS_RULE));
        }
    }

    private static List<ValidationIssue> schemaIssues(ObjectSchema schema, JsonNode value, String file, Integer line) {
        List<SchemaViolation> violations = SchemaValidator.validate(schema, value);
        return violations.stream()
                .map(v -> issue(file, line, v.getField(), v.getMessage(), IssueType.SCHEMA))
                .collect(Collectors.toList());
    }

    private static PackValidationResult missingList(String file) {
        List<ValidationIssue> errors = new ArrayList<>();
        errors.add(issue(file, null, SchemaValidator.ROOT, "Expected array, got null", IssueType.SCHEMA));
        return PackValidationResult.of(errors, new ArrayList<>());
    }

    private static ValidationIssue issue(String file, Integer line, String field, String message, IssueType type) {
        return ValidationIssue.builder()
                .file(file)
                .line(line)
                .field(field)
                .message(message)
                .type(type)
                .build();
    }

    private static List<JsonNode> toNodes(List<?> items) {
        if (items == null) {
            return null;
        }
        return items.stream().map(JsonUtils::toTree).collect(Collectors.toList());
    }

    private static JsonNode metadataField(JsonNode manifest, String field) {
        if (manifest == null || !manifest.isObject()) {
            return null;
        }
        JsonNode metadata = manifest.get("metadata");
        return metadata != null && metadata.isObject() ? metadata.get(field) : null;
    }

    private static String fileName(JsonNode manifest, String field, String fallback) {
        if (manifest != null && manifest.isObject()) {
            JsonNode files = manifest.get("files");
            if (files != null && files.isObject()) {
                String name = text(files, field);
                if (name != null && !name.isEmpty()) {
                    return name;
                }
            }
        }
        return fallback;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private static int sizeOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isArray() ? value.size() : 0;
    }

    private static double proportion(JsonNode mix, String field) {
        JsonNode value = mix.get(field);
        return value != null && value.isNumber() ? value.doubleValue() : 0.0;
    }
}
