package com.exampack.core.store;

import com.exampack.api.exception.InvalidArgumentException;
import com.exampack.core.spi.PackMetadataStore;
import com.exampack.core.util.FileUtils;
import com.exampack.core.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 基于文件的元数据存储
 * <p>
 * 目录结构：
 * <pre>
 * secure/
 *   ├── {packId}.meta.json
 *   └── {packId}.key
 * </pre>
 * 先写临时文件再原子移动，读者不会看到半截记录。
 */
@Slf4j
public class FilePackMetadataStore implements PackMetadataStore {

    private static final String META_SUFFIX = ".meta.json";
    private static final String KEY_SUFFIX = ".key";
    private static final Pattern SAFE_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private final Path directory;

    public FilePackMetadataStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public void save(String packId, PackMetadataRecord record) throws IOException {
        Path target = metaFile(packId);
        Files.createDirectories(directory);
        Path tmp = Files.createTempFile(directory, packId, ".tmp");
        try {
            JsonUtils.writePretty(tmp, record);
            restrictToOwner(tmp);
            FileUtils.moveAtomically(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("[{}] Metadata record saved to {}", packId, target);
    }

    @Override
    public Optional<PackMetadataRecord> find(String packId) {
        Path file = metaFile(packId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonUtils.read(file, PackMetadataRecord.class));
        } catch (IOException e) {
            log.warn("[{}] Unreadable metadata record {}: {}", packId, file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void pinPublicKey(String packId, String publicKeyHex) throws IOException {
        Path target = keyFile(packId);
        Files.createDirectories(directory);
        Path tmp = Files.createTempFile(directory, packId, ".tmp");
        try {
            Files.write(tmp, publicKeyHex.getBytes(StandardCharsets.UTF_8));
            restrictToOwner(tmp);
            FileUtils.moveAtomically(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public Optional<String> findPublicKey(String packId) {
        Path file = keyFile(packId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String key = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).trim();
            return key.isEmpty() ? Optional.empty() : Optional.of(key);
        } catch (IOException e) {
            log.warn("[{}] Unreadable pinned key {}: {}", packId, file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void remove(String packId) throws IOException {
        Files.deleteIfExists(metaFile(packId));
        Files.deleteIfExists(keyFile(packId));
    }

    private Path metaFile(String packId) {
        return directory.resolve(checkId(packId) + META_SUFFIX);
    }

    private Path keyFile(String packId) {
        return directory.resolve(checkId(packId) + KEY_SUFFIX);
    }

    private static String checkId(String packId) {
        if (packId == null || !SAFE_ID.matcher(packId).matches()) {
            throw new InvalidArgumentException("packId", packId, "Invalid pack id: " + packId);
        }
        return packId;
    }

    private static void restrictToOwner(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Owner-only permissions not applied to {}: {}", file, e.getMessage());
        }
    }
}
