package com.exampack.core.pack;

import com.exampack.api.catalog.AvailablePack;
import com.exampack.api.event.PackEvent;
import com.exampack.api.event.lifecycle.PackInstallFailedEvent;
import com.exampack.api.event.lifecycle.PackInstalledEvent;
import com.exampack.api.event.lifecycle.PackInstallingEvent;
import com.exampack.api.event.lifecycle.PackRolledBackEvent;
import com.exampack.api.event.lifecycle.PackUninstalledEvent;
import com.exampack.api.exception.InvalidArgumentException;
import com.exampack.api.exception.PackDownloadException;
import com.exampack.api.exception.PackDownloadException.Reason;
import com.exampack.api.install.CompatibilityResult;
import com.exampack.api.install.DownloadProgress;
import com.exampack.api.install.DownloadStatus;
import com.exampack.api.install.PackInstallationResult;
import com.exampack.api.install.PackStatus;
import com.exampack.api.install.PackStorageInfo;
import com.exampack.api.install.ProgressListener;
import com.exampack.api.install.StorageUsage;
import com.exampack.api.manifest.PackFiles;
import com.exampack.api.manifest.PackManifest;
import com.exampack.api.validation.IssueType;
import com.exampack.api.validation.PackValidationResult;
import com.exampack.api.validation.ValidationIssue;
import com.exampack.core.archive.PackArchive;
import com.exampack.core.config.PackFrameConfig;
import com.exampack.core.event.EventBus;
import com.exampack.core.exception.PackSecurityException;
import com.exampack.core.loader.PackContentLoader;
import com.exampack.core.loader.PackContentLoader.LoadedContent;
import com.exampack.core.loader.PackManifestLoader;
import com.exampack.core.security.PackVerifier;
import com.exampack.core.security.VerificationResult;
import com.exampack.core.spi.PackIntegrityVerifier;
import com.exampack.core.spi.PackMetadataStore;
import com.exampack.core.spi.PackTransport;
import com.exampack.core.spi.PackTransport.TransportResponse;
import com.exampack.core.store.FilePackMetadataStore;
import com.exampack.core.store.PackMetadataRecord;
import com.exampack.core.transport.UrlConnectionPackTransport;
import com.exampack.core.util.FileUtils;
import com.exampack.core.util.JsonUtils;
import com.exampack.core.validation.PackValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 内容包管理器
 * <p>
 * 职责：
 * 1. 兼容性检查 (Compatibility)
 * 2. 下载：可取消、可上报进度、硬超时 (Download)
 * 3. 完整性校验与内容校验，二者都在改动安装目录之前完成 (Verify / Validate)
 * 4. 备份 - 写入 - 提交/回滚 的原子安装 (Install)
 * 5. 卸载、存储统计与临时文件清理 (Uninstall / Storage)
 * <p>
 * 同一 packId 的安装与卸载由调用方串行化，不同 packId 之间相互独立。
 */
@Slf4j
public class PackManager {

    // ==================== 常量 ====================
    private static final String BACKUP_MARKER = "_backup_";
    private static final String ARCHIVE_NAME = "pack.zip";
    private static final String DOWNLOAD_SUFFIX = ".zip";
    private static final String PART_SUFFIX = ".part";
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final Pattern PACK_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    // ==================== 核心依赖 ====================

    private final PackFrameConfig config;
    private final PackIntegrityVerifier verifier;
    private final PackValidator validator;
    private final PackMetadataStore metadataStore;
    private final PackTransport transport;
    private final EventBus eventBus;
    private final PackContentLoader contentLoader = new PackContentLoader();
    private final Clock clock;

    // ==================== 运行状态 ====================

    /**
     * 进行中的状态：Key=PackId，安装或下载结束后移除
     */
    private final Map<String, PackStatus> inFlight = new ConcurrentHashMap<>();

    /**
     * 进行中的下载：Key=PackId
     */
    private final Map<String, DownloadHandle> downloads = new ConcurrentHashMap<>();

    // ==================== 基础设施 ====================

    private final ExecutorService downloadExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final AtomicInteger threadNumber = new AtomicInteger(1);
    private final AtomicLong transferSequence = new AtomicLong();

    public PackManager(PackFrameConfig config,
            PackIntegrityVerifier verifier,
            PackValidator validator,
            PackMetadataStore metadataStore,
            PackTransport transport,
            EventBus eventBus) {
        this(config, verifier, validator, metadataStore, transport, eventBus, Clock.systemUTC());
    }

    public PackManager(PackFrameConfig config,
            PackIntegrityVerifier verifier,
            PackValidator validator,
            PackMetadataStore metadataStore,
            PackTransport transport,
            EventBus eventBus,
            Clock clock) {
        config.validate();
        this.config = config;
        this.verifier = verifier;
        this.validator = validator != null ? validator : new PackValidator();
        this.metadataStore = metadataStore;
        this.transport = transport != null ? transport : new UrlConnectionPackTransport();
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.clock = clock;

        this.downloadExecutor = Executors.newFixedThreadPool(config.getDownloadThreads(), r -> {
            Thread t = new Thread(r, "exampack-download-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(
                    (thread, e) -> log.error("Download thread {} error: {}", thread.getName(), e.getMessage()));
            return t;
        });
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "exampack-download-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 按配置组装默认实现：Ed25519 校验器、文件元数据存储、URLConnection 传输
     */
    public static PackManager create(PackFrameConfig config) {
        return new PackManager(config,
                PackVerifier.fromConfig(config),
                new PackValidator(),
                new FilePackMetadataStore(config.secureStorePath()),
                new UrlConnectionPackTransport(),
                new EventBus());
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    // ==================== 查询 API ====================

    public boolean isPackInstalled(String packId) {
        return isPackInstalled(packId, null);
    }

    /**
     * @param version 为 null 时只判断是否安装
     */
    public boolean isPackInstalled(String packId, String version) {
        if (!isValidPackId(packId)) {
            return false;
        }
        PackManifest manifest = PackManifestLoader.parseFromDirectory(packDirectory(packId));
        if (manifest == null) {
            return false;
        }
        return version == null || version.equals(manifest.getVersion());
    }

    /**
     * 非法 packId（例如分发目录下发的 {@code ../x}）视为未安装
     */
    public String getInstalledVersion(String packId) {
        if (!isValidPackId(packId)) {
            return null;
        }
        PackManifest manifest = PackManifestLoader.parseFromDirectory(packDirectory(packId));
        return manifest != null ? manifest.getVersion() : null;
    }

    public PackStatus getPackStatus(String packId) {
        PackStatus status = packId != null ? inFlight.get(packId) : null;
        if (status != null) {
            return status;
        }
        return isPackInstalled(packId) ? PackStatus.INSTALLED : PackStatus.NOT_INSTALLED;
    }

    public CompatibilityResult checkCompatibility(PackManifest manifest, String appVersion) {
        String min = manifest.getMinAppVersion();
        if (min != null && AppVersion.compare(appVersion, min) < 0) {
            return CompatibilityResult.incompatible(
                    String.format("App version %s is below minimum required %s", appVersion, min));
        }
        String max = manifest.getMaxAppVersion();
        if (max != null && !max.isEmpty() && AppVersion.compare(appVersion, max) > 0) {
            return CompatibilityResult.incompatible(
                    String.format("App version %s is above maximum supported %s", appVersion, max));
        }
        return CompatibilityResult.compatible();
    }

    /**
     * 用本地安装状态回填分发目录条目
     */
    public List<AvailablePack> resolveInstallState(List<AvailablePack> available) {
        return available.stream()
                .map(pack -> {
                    String installedVersion = getInstalledVersion(pack.getId());
                    return pack.toBuilder()
                            .installed(installedVersion != null)
                            .installedVersion(installedVersion)
                            .build();
                })
                .collect(Collectors.toList());
    }

    // ==================== 下载 API ====================

    /**
     * 异步下载到 {@code <tempDir>/<packId>.zip}
     * <p>
     * 同一 packId 再次下载会取代前一次传输。失败时 future 以 {@link PackDownloadException} 结束，
     * 未完成的临时文件留给 {@link #cleanupTempFiles()} 处理。
     */
    public CompletableFuture<Path> downloadPack(String packId, String url, ProgressListener listener) {
        checkPackId(packId);
        if (url == null || url.trim().isEmpty()) {
            throw new InvalidArgumentException("url", "Download URL cannot be empty");
        }
        URI uri = URI.create(url.trim());
        ProgressListener progress = ProgressListener.nullToNone(listener);

        DownloadHandle handle = new DownloadHandle(packId);
        DownloadHandle previous = downloads.put(packId, handle);
        if (previous != null) {
            log.info("[{}] New download supersedes the one in progress", packId);
            previous.abort(Reason.SUPERSEDED, "Download superseded by a newer request");
        }
        inFlight.put(packId, PackStatus.DOWNLOADING);

        long timeoutMillis = config.downloadTimeout().toMillis();
        handle.timeoutTask = timeoutScheduler.schedule(
                () -> handle.abort(Reason.TIMEOUT, "Download timed out after " + config.downloadTimeout().getSeconds() + "s"),
                timeoutMillis, TimeUnit.MILLISECONDS);
        handle.future.whenComplete((path, error) -> {
            if (handle.future.isCancelled()) {
                handle.abort(Reason.CANCELLED, "Download cancelled");
            }
            finishDownload(handle);
        });

        downloadExecutor.execute(() -> runDownload(handle, uri, progress));
        return handle.future;
    }

    /**
     * 取消下载，未在下载时为空操作
     */
    public void cancelDownload(String packId) {
        DownloadHandle handle = downloads.remove(packId);
        if (handle == null) {
            return;
        }
        log.info("[{}] Cancelling download", packId);
        handle.abort(Reason.CANCELLED, "Download cancelled");
    }

    /**
     * 兼容性检查 - 下载 - 安装
     * <p>
     * 不兼容时不发起传输，直接返回失败结果；下载失败时 future 以 {@link PackDownloadException} 结束。
     */
    public CompletableFuture<PackInstallationResult> downloadAndInstall(PackManifest manifest, String url,
            String appVersion, ProgressListener listener) {
        CompatibilityResult compatibility = checkCompatibility(manifest, appVersion);
        if (!compatibility.isCompatible()) {
            log.warn("[{}] Skipping download: {}", manifest.getId(), compatibility.getReason());
            return CompletableFuture.completedFuture(PackInstallationResult.failure(manifest.getId(),
                    manifest.getVersion(), Collections.singletonList(compatibility.getReason()),
                    Collections.emptyList()));
        }
        return downloadPack(manifest.getId(), url, listener)
                .thenApplyAsync(path -> installPack(manifest.getId(), path, manifest, listener), downloadExecutor);
    }

    // ==================== 安装 API ====================

    /**
     * 校验并安装已下载的内容包
     * <p>
     * 完整性校验与内容校验失败时安装目录保持原样；写入阶段失败时回滚到安装前的目录。
     */
    public PackInstallationResult installPack(String packId, Path tempPath, PackManifest manifest,
            ProgressListener listener) {
        checkPackId(packId);
        ProgressListener progress = ProgressListener.nullToNone(listener);
        if (manifest == null) {
            return fail(packId, null, progress, Collections.singletonList("Pack manifest is required"),
                    Collections.emptyList());
        }
        String version = manifest.getVersion();
        String resultId = manifest.getId() != null ? manifest.getId() : packId;
        log.info("[{}] Installing pack v{} from {}", packId, version, tempPath);

        inFlight.put(packId, PackStatus.VERIFYING);
        try {
            progress.onProgress(DownloadProgress.stage(packId, DownloadStatus.VERIFYING, 0));
            List<String> warnings = new ArrayList<>();

            // 1. 完整性
            byte[] data;
            try {
                data = Files.readAllBytes(tempPath);
            } catch (IOException e) {
                return fail(resultId, version, progress,
                        Collections.singletonList("Installation failed: cannot read pack file: " + e.getMessage()),
                        warnings);
            }
            String pinnedKey = metadataStore.findPublicKey(packId).orElse(null);
            VerificationResult verification = verifier.verifyPackIntegrity(data, manifest, pinnedKey);
            if (!verification.isValid()) {
                List<String> errors = new ArrayList<>();
                errors.add("Pack verification failed");
                errors.addAll(verification.getErrors());
                return fail(resultId, version, progress, errors, verification.getWarnings());
            }
            warnings.addAll(verification.getWarnings());

            // 2. 内容
            if (!packId.equals(manifest.getId())) {
                return fail(resultId, version, progress, validationFailure(
                        "Pack id mismatch: requested " + packId + ", manifest declares " + manifest.getId()), warnings);
            }
            PackArchive archive;
            try {
                archive = PackArchive.read(packId, data, config.archiveLimits());
            } catch (IOException | PackSecurityException e) {
                return fail(resultId, version, progress, validationFailure("Unreadable pack archive: " + e.getMessage()),
                        warnings);
            }
            PackValidationResult content = validateContent(manifest, archive);
            content.getWarnings().forEach(w -> warnings.add(w.toString()));
            if (!content.isValid()) {
                List<String> errors = new ArrayList<>();
                errors.add("Pack validation failed");
                content.getErrors().forEach(e -> errors.add(e.toString()));
                return fail(resultId, version, progress, errors, warnings);
            }

            // 3. 前置事件 (可拦截)
            inFlight.put(packId, PackStatus.INSTALLING);
            progress.onProgress(DownloadProgress.stage(packId, DownloadStatus.INSTALLING, 50));
            try {
                eventBus.publish(new PackInstallingEvent(packId, version, tempPath));
            } catch (RuntimeException e) {
                return fail(resultId, version, progress,
                        Collections.singletonList("Installation vetoed: " + e.getMessage()), warnings);
            }

            // 4-6. 备份、写入、记录
            String previousVersion = getInstalledVersion(packId);
            Path packDir = packDirectory(packId);
            PackDirectoryTransaction tx = null;
            try {
                Files.createDirectories(config.packsPath());
                tx = PackDirectoryTransaction.begin(packId, packDir,
                        config.packsPath().resolve(packId + BACKUP_MARKER + clock.millis()));
                Files.createDirectories(packDir);
                archive.extractTo(packDir);
                Files.write(packDir.resolve(ARCHIVE_NAME), data);
                PackManifestLoader.write(packDir, manifest);
                metadataStore.save(packId, PackMetadataRecord.builder()
                        .installTime(clock.millis())
                        .version(version)
                        .checksum(manifest.getChecksum())
                        .signature(manifest.getSignature())
                        .verified(true)
                        .build());
            } catch (IOException | RuntimeException e) {
                log.error("[{}] Install step failed, rolling back", packId, e);
                List<String> errors = new ArrayList<>();
                errors.add("Installation failed: " + e.getMessage());
                boolean restored = tx == null || tx.rollback();
                if (!restored) {
                    errors.add("Rollback failed: previous installation could not be restored"
                            + (tx.hasBackup() ? " (backup left at " + tx.getBackupDirectory() + ")" : ""));
                }
                publishQuietly(new PackRolledBackEvent(packId, version, restored, e.getMessage()));
                return fail(resultId, version, progress, errors, warnings);
            }

            // 7. 提交与清理
            tx.commit();
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException e) {
                log.warn("[{}] Failed to delete temp file {}: {}", packId, tempPath, e.getMessage());
            }

            publishQuietly(new PackInstalledEvent(packId, version, packDir, previousVersion));
            progress.onProgress(DownloadProgress.stage(packId, DownloadStatus.COMPLETE, 100));
            log.info("[{}] Pack v{} installed{}", packId, version,
                    previousVersion != null ? " (replaced v" + previousVersion + ")" : "");
            return PackInstallationResult.success(resultId, version, warnings);
        } finally {
            inFlight.remove(packId);
        }
    }

    /**
     * 卸载，目录不存在视为成功
     */
    public boolean uninstallPack(String packId) {
        checkPackId(packId);
        String version = getInstalledVersion(packId);
        try {
            FileUtils.deleteRecursively(packDirectory(packId));
            metadataStore.remove(packId);
        } catch (IOException e) {
            log.error("[{}] Failed to uninstall pack", packId, e);
            return false;
        }
        log.info("[{}] Pack uninstalled", packId);
        publishQuietly(new PackUninstalledEvent(packId, version));
        return true;
    }

    /**
     * 篡改检测：已安装归档与安装时记录的摘要比对
     */
    public VerificationResult verifyInstalledPack(String packId) {
        checkPackId(packId);
        Optional<PackMetadataRecord> record = metadataStore.find(packId);
        if (!record.isPresent()) {
            return VerificationResult.failure("No installation record for pack " + packId);
        }
        Path archive = packDirectory(packId).resolve(ARCHIVE_NAME);
        if (!Files.isRegularFile(archive)) {
            return VerificationResult.failure("Installed pack archive is missing");
        }
        try {
            return verifier.detectTampering(record.get().getChecksum(), Files.readAllBytes(archive));
        } catch (IOException e) {
            log.warn("[{}] Cannot read installed archive: {}", packId, e.getMessage());
            return VerificationResult.failure("Installed pack archive is unreadable: " + e.getMessage());
        }
    }

    // ==================== 存储 API ====================

    public StorageUsage getStorageUsage() {
        try {
            StorageUsage.StorageUsageBuilder builder = StorageUsage.builder();
            long packsSize = 0;
            Path packsDir = config.packsPath();
            if (Files.isDirectory(packsDir)) {
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(packsDir, Files::isDirectory)) {
                    for (Path dir : stream) {
                        String name = dir.getFileName().toString();
                        if (name.contains(BACKUP_MARKER)) {
                            continue;
                        }
                        long size = FileUtils.directorySize(dir);
                        String version = getInstalledVersion(name);
                        builder.pack(new PackStorageInfo(name, size, version != null ? version : "unknown"));
                        packsSize += size;
                    }
                }
            }
            long tempSize = FileUtils.directorySize(config.tempPath());
            return builder.packsSize(packsSize)
                    .tempSize(tempSize)
                    .totalSize(packsSize + tempSize)
                    .build();
        } catch (IOException e) {
            log.warn("Failed to compute storage usage: {}", e.getMessage());
            return StorageUsage.empty();
        }
    }

    /**
     * 删除超过保留时长的临时文件
     *
     * @return 删除的文件数
     */
    public int cleanupTempFiles() {
        Path tempDir = config.tempPath();
        if (!Files.isDirectory(tempDir)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(config.tempFileMaxAge());
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(tempDir, Files::isRegularFile)) {
            for (Path file : stream) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        deleted++;
                    }
                } catch (IOException e) {
                    log.warn("Failed to delete temp file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan temp directory {}: {}", tempDir, e.getMessage());
        }
        if (deleted > 0) {
            log.info("Removed {} stale temp file(s) from {}", deleted, tempDir);
        }
        return deleted;
    }

    // ==================== 生命周期 ====================

    /**
     * 取消所有下载并停止下载线程
     */
    public void shutdown() {
        log.info("Shutting down PackManager...");
        for (String packId : new ArrayList<>(downloads.keySet())) {
            cancelDownload(packId);
        }
        shutdownExecutorNow(timeoutScheduler);
        shutdownExecutorNow(downloadExecutor);
        log.info("PackManager shutdown complete.");
    }

    // ==================== 内部方法 ====================

    private void runDownload(DownloadHandle handle, URI uri, ProgressListener progress) {
        String packId = handle.packId;
        Path tempDir = config.tempPath();
        Path target = tempDir.resolve(packId + DOWNLOAD_SUFFIX);
        Path part = tempDir.resolve(packId + DOWNLOAD_SUFFIX + "." + transferSequence.incrementAndGet() + PART_SUFFIX);

        try {
            Files.createDirectories(tempDir);
            log.info("[{}] Downloading {}", packId, uri);
            try (TransportResponse response = transport.open(uri, config.connectTimeout())) {
                handle.attach(response);
                long total = response.getContentLength();
                long downloaded = 0;
                byte[] buffer = new byte[config.getDownloadBufferSize()];
                try (InputStream in = response.getInputStream();
                        OutputStream out = Files.newOutputStream(part, StandardOpenOption.CREATE,
                                StandardOpenOption.TRUNCATE_EXISTING)) {
                    int n;
                    while (!handle.isAborted() && (n = in.read(buffer)) != -1) {
                        out.write(buffer, 0, n);
                        downloaded += n;
                        if (total > 0) {
                            progress.onProgress(DownloadProgress.downloading(packId, downloaded, total));
                        }
                    }
                }
                handle.checkAborted();
                if (total > 0 && downloaded != total) {
                    throw new IOException("Connection closed after " + downloaded + " of " + total + " bytes");
                }
            }
            handle.checkAborted();
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("[{}] Download complete: {} ({} bytes)", packId, target, Files.size(target));
            handle.future.complete(target);
        } catch (PackDownloadException e) {
            handle.future.completeExceptionally(e);
        } catch (IOException | RuntimeException e) {
            handle.future.completeExceptionally(handle.toDownloadException(e));
        }
    }

    private void finishDownload(DownloadHandle handle) {
        handle.timeoutTask.cancel(false);
        downloads.remove(handle.packId, handle);
        if (!downloads.containsKey(handle.packId)) {
            inFlight.remove(handle.packId, PackStatus.DOWNLOADING);
        }
        if (handle.future.isCompletedExceptionally()) {
            log.warn("[{}] Download ended without result ({})", handle.packId,
                    handle.abortReason != null ? handle.abortReason : Reason.NETWORK);
        }
    }

    private PackValidationResult validateContent(PackManifest manifest, PackArchive archive) {
        PackFiles files = manifest.getFiles();
        String questionsFile = nameOr(files != null ? files.getQuestions() : null, PackValidator.QUESTIONS_FILE);
        String templatesFile = nameOr(files != null ? files.getExamTemplates() : null, PackValidator.TEMPLATES_FILE);
        String tipsFile = nameOr(files != null ? files.getTips() : null, PackValidator.TIPS_FILE);

        LoadedContent questions = contentLoader.load(archive, questionsFile);
        LoadedContent templates = contentLoader.load(archive, templatesFile);
        LoadedContent tips = contentLoader.load(archive, tipsFile);

        PackValidationResult result = validator.validateEntirePackNodes(JsonUtils.toTree(manifest),
                questions.getItems(), templates.getItems(), tips.getItems());

        List<ValidationIssue> errors = new ArrayList<>(result.getErrors());
        List<ValidationIssue> warnings = new ArrayList<>(result.getWarnings());
        errors.addAll(questions.getIssues());
        errors.addAll(templates.getIssues());
        errors.addAll(tips.getIssues());

        if (files != null && files.getMedia() != null) {
            for (String media : files.getMedia()) {
                if (media != null && !archive.entry(media).isPresent()) {
                    warnings.add(ValidationIssue.builder()
                            .file(PackValidator.MANIFEST_FILE)
                            .field("files.media")
                            .message("Media file not found in pack archive: " + media)
                            .type(IssueType.CROSS_REFERENCE)
                            .build());
                }
            }
        }
        return PackValidationResult.of(result.isValid() && errors.size() == result.getErrors().size(),
                errors, warnings);
    }

    private PackInstallationResult fail(String packId, String version, ProgressListener progress,
            List<String> errors, List<String> warnings) {
        log.warn("[{}] Install failed: {}", packId, errors);
        progress.onProgress(DownloadProgress.error(packId, errors.isEmpty() ? "Unknown error" : errors.get(0)));
        publishQuietly(new PackInstallFailedEvent(packId, version, errors));
        return PackInstallationResult.failure(packId, version, errors, warnings);
    }

    private static List<String> validationFailure(String detail) {
        List<String> errors = new ArrayList<>();
        errors.add("Pack validation failed");
        errors.add(detail);
        return errors;
    }

    // 后置事件：结果已确定，监听器异常不再影响结果
    private void publishQuietly(PackEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed for {}: {}", event, e.getMessage());
        }
    }

    private Path packDirectory(String packId) {
        return config.packsPath().resolve(packId);
    }

    private static boolean isValidPackId(String packId) {
        return packId != null && PACK_ID.matcher(packId).matches();
    }

    private static void checkPackId(String packId) {
        if (!isValidPackId(packId)) {
            throw new InvalidArgumentException("packId", packId, "Invalid pack id: " + packId);
        }
    }

    private static String nameOr(String name, String fallback) {
        return name != null && !name.isEmpty() ? name : fallback;
    }

    private void shutdownExecutorNow(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 单次下载的控制句柄
     * <p>
     * 中止是协作式的：读取循环检查标记，同时关闭源流以唤醒阻塞的读取。
     */
    private static final class DownloadHandle {
        private final String packId;
        private final CompletableFuture<Path> future = new CompletableFuture<>();
        private volatile Reason abortReason;
        private volatile String abortMessage;
        private volatile TransportResponse response;
        private volatile ScheduledFuture<?> timeoutTask;

        DownloadHandle(String packId) {
            this.packId = packId;
        }

        synchronized void abort(Reason reason, String message) {
            if (abortReason != null || future.isDone() && !future.isCancelled()) {
                return;
            }
            abortReason = reason;
            abortMessage = message;
            future.completeExceptionally(new PackDownloadException(packId, reason, message));
            closeResponse();
        }

        synchronized void attach(TransportResponse response) {
            this.response = response;
            if (abortReason != null) {
                closeResponse();
            }
        }

        boolean isAborted() {
            return abortReason != null;
        }

        void checkAborted() {
            if (abortReason != null) {
                throw new PackDownloadException(packId, abortReason, abortMessage);
            }
        }

        PackDownloadException toDownloadException(Exception e) {
            if (abortReason != null) {
                return new PackDownloadException(packId, abortReason, abortMessage, e);
            }
            if (e instanceof SocketTimeoutException) {
                return new PackDownloadException(packId, Reason.TIMEOUT, "Download timed out: " + e.getMessage(), e);
            }
            return new PackDownloadException(packId, Reason.NETWORK,
                    "Download failed due to network error: " + e.getMessage(), e);
        }

        private void closeResponse() {
            TransportResponse current = response;
            if (current == null) {
                return;
            }
            try {
                current.close();
            } catch (IOException e) {
                log.debug("[{}] Error closing aborted transfer: {}", packId, e.getMessage());
            }
        }
    }
}
