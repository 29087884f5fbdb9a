package com.exampack.core.loader;

import com.exampack.api.manifest.PackManifest;
import com.exampack.core.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public class PackManifestLoader {

    public static final String MANIFEST_NAME = "manifest.json";

    /**
     * 读取已安装目录中的清单
     *
     * @return 清单，目录或文件不存在、无法解析时返回 null
     */
    public static PackManifest parseFromDirectory(Path packDirectory) {
        Path file = packDirectory.resolve(MANIFEST_NAME);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return JsonUtils.read(file, PackManifest.class);
        } catch (IOException e) {
            log.warn("Failed to parse {}: {}", file, e.getMessage());
            return null;
        }
    }

    /**
     * 解析清单字节（分发服务器返回或归档内的 manifest.json）
     */
    public static PackManifest parse(byte[] data) throws IOException {
        return JsonUtils.mapper().readValue(data, PackManifest.class);
    }

    public static void write(Path packDirectory, PackManifest manifest) throws IOException {
        JsonUtils.writePretty(packDirectory.resolve(MANIFEST_NAME), manifest);
    }
}
