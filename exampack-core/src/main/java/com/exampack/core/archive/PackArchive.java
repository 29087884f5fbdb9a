package com.exampack.core.archive;

import com.exampack.core.exception.PackSecurityException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * 内容包归档（ZIP）
 * <p>
 * 一次性读入内存并做防护检查：条目数、解压总量、压缩比、路径穿越。
 * 清单由分发方单独提供，归档内的 manifest.json 不参与解压。
 */
@Slf4j
public final class PackArchive {

    public static final String MANIFEST_ENTRY = "manifest.json";

    private final String packId;
    private final Map<String, byte[]> entries;

    private PackArchive(String packId, Map<String, byte[]> entries) {
        this.packId = packId;
        this.entries = entries;
    }

    /**
     * 解析归档
     *
     * @throws PackSecurityException 超出防护限制或包含非法路径
     * @throws IOException           ZIP 结构损坏或条目名无法解码
     */
    public static PackArchive read(String packId, byte[] data, Limits limits) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        long totalUncompressed = 0;
        byte[] buffer = new byte[8192];

        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(data))) {
            ZipEntry entry;
            while ((entry = nextEntry(zis)) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                if (entries.size() >= limits.getMaxEntries()) {
                    throw new PackSecurityException(packId, "Too many archive entries (limit " + limits.getMaxEntries() + ")");
                }
                String name = normalizeEntryName(packId, entry.getName());
                if (entries.containsKey(name)) {
                    throw new PackSecurityException(packId, "Duplicate archive entry: " + name);
                }

                ByteArrayOutputStream out = new ByteArrayOutputStream();
                int n;
                while ((n = zis.read(buffer)) > 0) {
                    totalUncompressed += n;
                    if (totalUncompressed > limits.getMaxUncompressedBytes()) {
                        throw new PackSecurityException(packId, "Archive exceeds uncompressed size limit of "
                                + limits.getMaxUncompressedBytes() + " bytes");
                    }
                    out.write(buffer, 0, n);
                }
                entries.put(name, out.toByteArray());
            }
        }

        if (entries.isEmpty() && data.length > 0 && !looksLikeZip(data)) {
            throw new IOException("Not a ZIP archive");
        }
        long ratio = totalUncompressed / Math.max(1, data.length);
        if (ratio > limits.getMaxCompressionRatio()) {
            throw new PackSecurityException(packId, "Suspicious compression ratio: " + ratio + "x");
        }
        log.debug("[{}] Archive read: {} entries, {} bytes uncompressed", packId, entries.size(), totalUncompressed);
        return new PackArchive(packId, entries);
    }

    // 条目名不是合法 UTF-8 时 ZipInputStream 抛出 IllegalArgumentException
    private static ZipEntry nextEntry(ZipInputStream zis) throws IOException {
        try {
            return zis.getNextEntry();
        } catch (IllegalArgumentException e) {
            ZipException ze = new ZipException("Malformed entry name: " + e.getMessage());
            ze.initCause(e);
            throw ze;
        }
    }

    public Set<String> entryNames() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Optional<byte[]> entry(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public Optional<InputStream> open(String name) {
        return entry(name).map(ByteArrayInputStream::new);
    }

    /**
     * 解压到目标目录（目录需已存在），跳过 manifest.json
     */
    public void extractTo(Path directory) throws IOException {
        Path root = directory.toAbsolutePath().normalize();
        for (Map.Entry<String, byte[]> e : entries.entrySet()) {
            if (MANIFEST_ENTRY.equals(e.getKey())) {
                continue;
            }
            Path target = root.resolve(e.getKey()).normalize();
            if (!target.startsWith(root)) {
                throw new PackSecurityException(packId, "Entry escapes pack directory: " + e.getKey());
            }
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, e.getValue());
        }
    }

    static String normalizeEntryName(String packId, String name) {
        String p = name.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        if (p.startsWith("/") || p.matches("^[A-Za-z]:.*")) {
            throw new PackSecurityException(packId, "Absolute path in archive: " + name);
        }
        for (String segment : p.split("/")) {
            if ("..".equals(segment)) {
                throw new PackSecurityException(packId, "Path traversal detected: " + name);
            }
        }
        if (p.isEmpty()) {
            throw new PackSecurityException(packId, "Empty entry name in archive");
        }
        return p;
    }

    // 本地文件头 PK\3\4 或空归档的目录结束标记 PK\5\6
    private static boolean looksLikeZip(byte[] data) {
        return data.length >= 4 && data[0] == 'P' && data[1] == 'K'
                && ((data[2] == 3 && data[3] == 4) || (data[2] == 5 && data[3] == 6));
    }

    /**
     * 解压防护参数
     */
    @Value
    public static class Limits {
        int maxEntries;
        long maxUncompressedBytes;
        long maxCompressionRatio;
    }
}
