package com.exampack.core.validation.schema;

/**
 * 内容包的四份模式声明
 */
public final class PackSchemas {

    static final String ID_PATTERN = "^[a-zA-Z0-9_-]+$";
    static final String SEMVER_PATTERN = "^\\d+\\.\\d+\\.\\d+$";
    static final String SHA256_PATTERN = "^[a-fA-F0-9]{64}$";
    static final String LANGUAGE_PATTERN = "^[a-z]{2}(-[A-Z]{2})?$";

    private static final ArraySchema STRING_LIST = ArraySchema.of(StringSchema.any());

    public static final ObjectSchema MANIFEST = ObjectSchema.builder()
            .requiredField("id")
            .requiredField("version")
            .requiredField("name")
            .requiredField("description")
            .requiredField("author")
            .requiredField("minAppVersion")
            .requiredField("checksum")
            .requiredField("signature")
            .requiredField("createdAt")
            .requiredField("files")
            .property("id", StringSchema.matching(ID_PATTERN))
            .property("version", StringSchema.matching(SEMVER_PATTERN))
            .property("name", StringSchema.length(1, 100))
            .property("description", StringSchema.length(1, 500))
            .property("author", StringSchema.length(1, 100))
            .property("minAppVersion", StringSchema.matching(SEMVER_PATTERN))
            .property("maxAppVersion", StringSchema.matching(SEMVER_PATTERN))
            .property("checksum", StringSchema.matching(SHA256_PATTERN))
            .property("signature", StringSchema.any())
            .property("createdAt", NumberSchema.atLeast(0))
            .property("files", ObjectSchema.builder()
                    .requiredField("questions")
                    .requiredField("examTemplates")
                    .requiredField("tips")
                    .property("questions", StringSchema.any())
                    .property("examTemplates", StringSchema.any())
                    .property("tips", StringSchema.any())
                    .property("media", STRING_LIST)
                    .build())
            .property("metadata", ObjectSchema.builder()
                    .property("totalQuestions", NumberSchema.atLeast(0))
                    .property("totalTips", NumberSchema.atLeast(0))
                    .property("totalTemplates", NumberSchema.atLeast(0))
                    .property("topics", STRING_LIST)
                    .property("supportedLanguages", ArraySchema.of(StringSchema.matching(LANGUAGE_PATTERN)))
                    .build())
            .build();

    public static final ObjectSchema QUESTION = ObjectSchema.builder()
            .requiredField("id")
            .requiredField("type")
            .requiredField("stem")
            .requiredField("topicIds")
            .requiredField("difficulty")
            .property("id", StringSchema.matching(ID_PATTERN))
            .property("type", StringSchema.oneOf("single", "multi", "scenario", "order"))
            .property("stem", StringSchema.builder().minLength(10).build())
            .property("topicIds", ArraySchema.of(StringSchema.any(), 1))
            .property("choices", ArraySchema.of(ObjectSchema.builder()
                    .requiredField("id")
                    .requiredField("text")
                    .property("id", StringSchema.any())
                    .property("text", StringSchema.builder().minLength(1).build())
                    .build()))
            .property("correct", STRING_LIST)
            .property("correctOrder", STRING_LIST)
            .property("exhibits", STRING_LIST)
            .property("difficulty", StringSchema.oneOf("easy", "med", "hard"))
            .property("explanation", StringSchema.any())
            .build();

    private static final NumberSchema PROPORTION = NumberSchema.between(0, 1);

    public static final ObjectSchema EXAM_TEMPLATE = ObjectSchema.builder()
            .requiredField("id")
            .requiredField("name")
            .requiredField("durationMinutes")
            .requiredField("sections")
            .property("id", StringSchema.matching(ID_PATTERN))
            .property("name", StringSchema.length(1, 100))
            .property("durationMinutes", NumberSchema.between(1, 600))
            .property("sections", ArraySchema.of(ObjectSchema.builder()
                    .requiredField("topicIds")
                    .requiredField("count")
                    .property("topicIds", ArraySchema.of(StringSchema.any(), 1))
                    .property("count", NumberSchema.atLeast(1))
                    .property("difficultyMix", ObjectSchema.builder()
                            .property("easy", PROPORTION)
                            .property("med", PROPORTION)
                            .property("hard", PROPORTION)
                            .build())
                    .build(), 1))
            .property("calculatorRules", ObjectSchema.any())
            .build();

    public static final ObjectSchema TIP = ObjectSchema.builder()
            .requiredField("id")
            .requiredField("topicIds")
            .requiredField("title")
            .requiredField("body")
            .property("id", StringSchema.matching(ID_PATTERN))
            .property("topicIds", ArraySchema.of(StringSchema.any(), 1))
            .property("title", StringSchema.length(1, 200))
            .property("body", StringSchema.builder().minLength(10).build())
            .property("tags", STRING_LIST)
            .property("relatedQuestionIds", STRING_LIST)
            .build();

    private PackSchemas() {
    }
}
