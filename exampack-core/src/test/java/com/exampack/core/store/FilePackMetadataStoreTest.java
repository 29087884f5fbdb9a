package com.exampack.core.store;

import com.exampack.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilePackMetadataStore 单元测试")
public class FilePackMetadataStoreTest {

    @TempDir
    Path tempDir;

    private FilePackMetadataStore store;

    @BeforeEach
    void setUp() {
        store = new FilePackMetadataStore(tempDir.resolve("secure"));
    }

    private static PackMetadataRecord record() {
        return PackMetadataRecord.builder()
                .installTime(1_700_000_000_000L)
                .version("1.2.0")
                .checksum("ab".repeat(32))
                .signature("cd".repeat(64))
                .verified(true)
                .build();
    }

    @Test
    @DisplayName("保存后可读回同样的记录")
    void roundTrip() throws Exception {
        store.save("net-basics", record());

        Optional<PackMetadataRecord> loaded = store.find("net-basics");

        assertTrue(loaded.isPresent());
        assertEquals(record(), loaded.get());
        assertTrue(Files.exists(tempDir.resolve("secure/net-basics.meta.json")));
    }

    @Test
    @DisplayName("覆盖写入不留下临时文件")
    void overwrite() throws Exception {
        store.save("net-basics", record());
        store.save("net-basics", record().toBuilder().version("1.3.0").build());

        assertEquals("1.3.0", store.find("net-basics").get().getVersion());
        try (Stream<Path> files = Files.list(tempDir.resolve("secure"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    @DisplayName("remove 同时删除记录与固定公钥，重复删除不报错")
    void removeBoth() throws Exception {
        store.save("net-basics", record());
        store.pinPublicKey("net-basics", "ef".repeat(32));
        assertEquals(Optional.of("ef".repeat(32)), store.findPublicKey("net-basics"));

        store.remove("net-basics");
        store.remove("net-basics");

        assertFalse(store.find("net-basics").isPresent());
        assertFalse(store.findPublicKey("net-basics").isPresent());
    }

    @Test
    @DisplayName("损坏的记录视为不存在")
    void corruptRecord() throws Exception {
        Files.createDirectories(tempDir.resolve("secure"));
        Files.write(tempDir.resolve("secure/net-basics.meta.json"), "{not json".getBytes());

        assertFalse(store.find("net-basics").isPresent());
    }

    @Test
    @DisplayName("拒绝可能逃逸目录的 packId")
    void unsafeId() {
        assertThrows(InvalidArgumentException.class, () -> store.find("../etc"));
    }
}
