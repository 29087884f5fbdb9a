package com.exampack.api.install;

import lombok.Value;

@Value
public class CompatibilityResult {
    boolean compatible;
    String reason;

    public static CompatibilityResult compatible() {
        return new CompatibilityResult(true, null);
    }

    public static CompatibilityResult incompatible(String reason) {
        return new CompatibilityResult(false, reason);
    }
}
