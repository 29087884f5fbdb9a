package com.exampack.api.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验报告 (不可变)
 * <p>
 * 校验器从不抛出异常，所有结果都以本报告的形式返回。
 */
public final class PackValidationResult {

    private static final PackValidationResult EMPTY =
            new PackValidationResult(true, Collections.emptyList(), Collections.emptyList());

    private final boolean valid;
    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    private PackValidationResult(boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.valid = valid;
        this.errors = errors;
        this.warnings = warnings;
    }

    public static PackValidationResult empty() {
        return EMPTY;
    }

    /**
     * 根据错误列表推导有效性：无错误即有效
     */
    public static PackValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return of(errors.isEmpty(), errors, warnings);
    }

    public static PackValidationResult of(boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new PackValidationResult(valid,
                Collections.unmodifiableList(new ArrayList<>(errors)),
                Collections.unmodifiableList(new ArrayList<>(warnings)));
    }

    public boolean isValid() {
        return valid;
    }

    public List<ValidationIssue> getErrors() {
        return errors;
    }

    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return String.format("PackValidationResult{valid=%s, errors=%d, warnings=%d}",
                valid, errors.size(), warnings.size());
    }
}
