package com.exampack.core.security;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 完整性校验结果
 * <p>
 * 任一错误即视为不可信，不存在"部分信任"。
 */
@Value
public class VerificationResult {
    boolean valid;
    List<String> errors;
    List<String> warnings;

    public static VerificationResult of(List<String> errors, List<String> warnings) {
        return new VerificationResult(errors.isEmpty(),
                Collections.unmodifiableList(new ArrayList<>(errors)),
                Collections.unmodifiableList(new ArrayList<>(warnings)));
    }

    public static VerificationResult failure(String error) {
        return of(Collections.singletonList(error), Collections.emptyList());
    }
}
