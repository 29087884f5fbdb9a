package com.exampack.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PackValidationResultTest {

    private static ValidationIssue issue(String message) {
        return ValidationIssue.builder()
                .file("questions.jsonl")
                .line(3)
                .field("correct")
                .message(message)
                .type(IssueType.BUSINESS_RULE)
                .build();
    }

    @Test
    @DisplayName("无错误即有效")
    void validityFollowsErrors() {
        assertTrue(PackValidationResult.of(Collections.emptyList(), Collections.singletonList(issue("w"))).isValid());
        assertFalse(PackValidationResult.of(Collections.singletonList(issue("e")), Collections.emptyList()).isValid());
        assertTrue(PackValidationResult.empty().isValid());
    }

    @Test
    @DisplayName("报告不受原列表后续修改影响")
    void defensiveCopy() {
        List<ValidationIssue> errors = new ArrayList<>();
        errors.add(issue("e"));
        PackValidationResult result = PackValidationResult.of(errors, Collections.emptyList());

        errors.clear();

        assertEquals(1, result.getErrors().size());
        assertThrows(UnsupportedOperationException.class, () -> result.getErrors().add(issue("x")));
    }

    @Test
    @DisplayName("问题描述包含文件、行号与字段")
    void issueToString() {
        assertEquals("questions.jsonl:3 [correct] Correct answer not found in choices",
                issue("Correct answer not found in choices").toString());
        assertEquals("manifest.json missing id",
                ValidationIssue.builder().file("manifest.json").message("missing id").build().toString());
    }
}
