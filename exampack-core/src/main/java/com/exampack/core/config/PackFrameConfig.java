package com.exampack.core.config;

import com.exampack.api.exception.InvalidArgumentException;
import com.exampack.core.archive.PackArchive;
import com.exampack.core.util.YamlCompatUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * 内容包管理器配置
 * <p>
 * 对应 exampack.yml 的根节点，字段初始值即默认配置。
 */
@Slf4j
@Data
public class PackFrameConfig {

    public static final String DEFAULT_RESOURCE = "exampack.yml";

    // ==================== 目录 ====================

    /**
     * 已安装内容包根目录，每个内容包一个子目录
     */
    private String packsDirectory = "packs";

    /**
     * 下载临时目录
     */
    private String tempDirectory = "pack_downloads";

    /**
     * 元数据安全存储目录（FilePackMetadataStore 使用）
     */
    private String secureStoreDirectory = "secure";

    // ==================== 下载 ====================

    /**
     * 单次下载硬超时（秒）
     */
    private long downloadTimeoutSeconds = 300;

    /**
     * 建立连接超时（秒）
     */
    private long connectTimeoutSeconds = 30;

    private int downloadBufferSize = 8192;

    /**
     * 下载线程数
     */
    private int downloadThreads = 2;

    // ==================== 清理 ====================

    /**
     * 临时文件保留时长（小时），超过后由 cleanupTempFiles 删除
     */
    private long tempFileMaxAgeHours = 24;

    // ==================== 安全 ====================

    /**
     * 受信任的 Ed25519 公钥（32 字节原始公钥的十六进制）
     */
    private String trustedPublicKey;

    /**
     * 内容包超过该天数仅给出警告
     */
    private long packMaxAgeDays = 365;

    // ==================== 归档防护 ====================

    private int maxArchiveEntries = 10_000;

    private long maxUncompressedBytes = 512L * 1024 * 1024;

    private long maxCompressionRatio = 100;

    // ==================== 分发目录 ====================

    private String catalogBaseUrl = "https://cdn.examengine.com/api/v1";

    private long catalogTimeoutSeconds = 30;

    // ==================== 工厂方法 ====================

    public static PackFrameConfig defaults() {
        return new PackFrameConfig();
    }

    /**
     * 从 YAML 流加载，缺省的键保持默认值
     */
    public static PackFrameConfig load(InputStream inputStream) {
        try (InputStream is = inputStream) {
            PackFrameConfig config = YamlCompatUtils.createLoaderYaml(PackFrameConfig.class).load(is);
            if (config == null) {
                config = defaults();
            }
            config.validate();
            return config;
        } catch (IOException | YAMLException e) {
            throw new InvalidArgumentException("config", "Failed to load pack configuration: " + e.getMessage(), e);
        }
    }

    /**
     * 从类路径加载，资源不存在时返回默认配置
     */
    public static PackFrameConfig loadFromClasspath(String resource) {
        InputStream is = PackFrameConfig.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            log.info("No {} found on classpath, using default pack configuration", resource);
            return defaults();
        }
        return load(is);
    }

    public static PackFrameConfig loadFromClasspath() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * 校验
     */
    public void validate() {
        requireNotBlank("packsDirectory", packsDirectory);
        requireNotBlank("tempDirectory", tempDirectory);
        requirePositive("downloadTimeoutSeconds", downloadTimeoutSeconds);
        requirePositive("connectTimeoutSeconds", connectTimeoutSeconds);
        requirePositive("downloadBufferSize", downloadBufferSize);
        requirePositive("downloadThreads", downloadThreads);
        requirePositive("tempFileMaxAgeHours", tempFileMaxAgeHours);
        requirePositive("maxArchiveEntries", maxArchiveEntries);
        requirePositive("maxUncompressedBytes", maxUncompressedBytes);
        requirePositive("maxCompressionRatio", maxCompressionRatio);
        requirePositive("catalogTimeoutSeconds", catalogTimeoutSeconds);
    }

    // ==================== 派生值 ====================

    public Path packsPath() {
        return Paths.get(packsDirectory);
    }

    public Path tempPath() {
        return Paths.get(tempDirectory);
    }

    public Path secureStorePath() {
        return Paths.get(secureStoreDirectory);
    }

    public Duration downloadTimeout() {
        return Duration.ofSeconds(downloadTimeoutSeconds);
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    public Duration tempFileMaxAge() {
        return Duration.ofHours(tempFileMaxAgeHours);
    }

    public Duration packMaxAge() {
        return Duration.ofDays(packMaxAgeDays);
    }

    public Duration catalogTimeout() {
        return Duration.ofSeconds(catalogTimeoutSeconds);
    }

    public PackArchive.Limits archiveLimits() {
        return new PackArchive.Limits(maxArchiveEntries, maxUncompressedBytes, maxCompressionRatio);
    }

    private static void requireNotBlank(String name, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidArgumentException(name, name + " cannot be blank");
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new InvalidArgumentException(name, value, name + " must be positive");
        }
    }
}
