package com.exampack.api.install;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次安装尝试的最终结果
 */
@Value
public class PackInstallationResult {
    boolean success;
    String packId;
    String version;
    List<String> errors;
    List<String> warnings;

    public static PackInstallationResult success(String packId, String version, List<String> warnings) {
        return new PackInstallationResult(true, packId, version, Collections.emptyList(),
                Collections.unmodifiableList(new ArrayList<>(warnings)));
    }

    public static PackInstallationResult failure(String packId, String version, List<String> errors,
            List<String> warnings) {
        return new PackInstallationResult(false, packId, version,
                Collections.unmodifiableList(new ArrayList<>(errors)),
                Collections.unmodifiableList(new ArrayList<>(warnings)));
    }
}
