package com.exampack.core.archive;

import com.exampack.core.exception.PackSecurityException;
import com.exampack.core.support.TestPacks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PackArchive 单元测试")
public class PackArchiveTest {

    private static final PackArchive.Limits LIMITS = new PackArchive.Limits(100, 1024 * 1024, 100);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("解压内容文件并跳过 manifest.json")
    void extract() throws IOException {
        Map<String, String> files = new LinkedHashMap<>(TestPacks.validContent());
        files.put("manifest.json", "{}");
        files.put("media/diagram.svg", "<svg/>");

        PackArchive archive = PackArchive.read("net", TestPacks.zip(files), LIMITS);
        archive.extractTo(tempDir);

        assertEquals(5, archive.entryNames().size());
        assertEquals(TestPacks.TIPS_JSON, new String(Files.readAllBytes(tempDir.resolve("tips.json")), StandardCharsets.UTF_8));
        assertTrue(Files.exists(tempDir.resolve("media/diagram.svg")));
        assertFalse(Files.exists(tempDir.resolve("manifest.json")));
    }

    @Test
    @DisplayName("路径穿越被拒绝")
    void traversal() {
        byte[] zip = TestPacks.zip(Collections.singletonMap("../evil.txt", "x"));

        assertThrows(PackSecurityException.class, () -> PackArchive.read("net", zip, LIMITS));
    }

    @Test
    @DisplayName("绝对路径被拒绝")
    void absolutePath() {
        byte[] zip = TestPacks.zip(Collections.singletonMap("/etc/passwd", "x"));

        assertThrows(PackSecurityException.class, () -> PackArchive.read("net", zip, LIMITS));
    }

    @Test
    @DisplayName("超过条目数限制")
    void tooManyEntries() {
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < 3; i++) {
            files.put("f" + i, "x");
        }

        assertThrows(PackSecurityException.class,
                () -> PackArchive.read("net", TestPacks.zip(files), new PackArchive.Limits(2, 1024, 100)));
    }

    @Test
    @DisplayName("异常的压缩比被视为压缩炸弹")
    void compressionRatio() {
        StringBuilder zeros = new StringBuilder();
        for (int i = 0; i < 200_000; i++) {
            zeros.append('0');
        }
        byte[] zip = TestPacks.zip(Collections.singletonMap("bomb.txt", zeros.toString()));

        PackSecurityException ex = assertThrows(PackSecurityException.class, () -> PackArchive.read("net", zip, LIMITS));
        assertTrue(ex.getMessage().startsWith("Suspicious compression ratio"));
    }

    @Test
    @DisplayName("不是 ZIP 的数据")
    void notAZip() {
        assertThrows(IOException.class,
                () -> PackArchive.read("net", "plain text".getBytes(StandardCharsets.UTF_8), LIMITS));
    }

    @Test
    @DisplayName("条目名不是 UTF-8 时按损坏的 ZIP 处理")
    void nonUtf8EntryName() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bytes, StandardCharsets.ISO_8859_1)) {
            zos.putNextEntry(new ZipEntry("media/caf\u00e9.png"));
            zos.write(new byte[]{1, 2, 3});
            zos.closeEntry();
        }

        ZipException ex = assertThrows(ZipException.class, () -> PackArchive.read("net", bytes.toByteArray(), LIMITS));
        assertTrue(ex.getMessage().startsWith("Malformed entry name"));
    }
}
