package com.exampack.core.pack;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AppVersionTest {

    @Test
    @DisplayName("逐段数值比较")
    void numericComparison() {
        assertTrue(AppVersion.compare("1.9.9", "2.0.0") < 0);
        assertTrue(AppVersion.compare("1.10.0", "1.9.0") > 0);
        assertEquals(0, AppVersion.compare("2.5.0", "2.5.0"));
    }

    @Test
    @DisplayName("缺失的段按 0 处理")
    void missingPartsAreZero() {
        assertEquals(0, AppVersion.compare("2", "2.0.0"));
        assertTrue(AppVersion.compare("2.0.1", "2.0") > 0);
    }

    @Test
    @DisplayName("非数字段按 0 处理")
    void nonNumericPartsAreZero() {
        assertEquals(0, AppVersion.compare("1.x.0", "1.0.0"));
        assertEquals(0, AppVersion.compare("1.0.0-beta", "1.0"));
        assertEquals(0, AppVersion.compare(null, "0.0"));
    }
}
