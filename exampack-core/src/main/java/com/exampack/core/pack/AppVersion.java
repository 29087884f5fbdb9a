package com.exampack.core.pack;

import java.util.regex.Pattern;

/**
 * 点分数字版本比较
 * <p>
 * 逐段比较，缺失的段按 0 处理；非数字段同样按 0 处理。
 */
public final class AppVersion {

    private static final Pattern DIGITS = Pattern.compile("\\d{1,18}");

    private AppVersion() {
    }

    /**
     * @return 负数、0、正数分别表示 v1 小于、等于、大于 v2
     */
    public static int compare(String v1, String v2) {
        String[] parts1 = split(v1);
        String[] parts2 = split(v2);
        int length = Math.max(parts1.length, parts2.length);
        for (int i = 0; i < length; i++) {
            long part1 = i < parts1.length ? toNumber(parts1[i]) : 0L;
            long part2 = i < parts2.length ? toNumber(parts2[i]) : 0L;
            if (part1 != part2) {
                return part1 < part2 ? -1 : 1;
            }
        }
        return 0;
    }

    private static String[] split(String version) {
        if (version == null || version.trim().isEmpty()) {
            return new String[0];
        }
        return version.trim().split("\\.");
    }

    private static long toNumber(String part) {
        return DIGITS.matcher(part).matches() ? Long.parseLong(part) : 0L;
    }
}
