package com.exampack.core.pack;

import com.exampack.core.util.FileUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 安装目录事务
 * <p>
 * begin：已有目录原子重命名为备份；commit：删除备份；rollback：删除新目录并还原备份。
 * 还原失败只记录并报告，不再修复。
 */
@Slf4j
public final class PackDirectoryTransaction {

    @Getter
    private final String packId;
    @Getter
    private final Path packDirectory;
    private final Path backupDirectory;
    private boolean finished;

    private PackDirectoryTransaction(String packId, Path packDirectory, Path backupDirectory) {
        this.packId = packId;
        this.packDirectory = packDirectory;
        this.backupDirectory = backupDirectory;
    }

    /**
     * 开启事务
     *
     * @param backupDirectory 备份位置，目标目录存在时才会用到
     */
    public static PackDirectoryTransaction begin(String packId, Path packDirectory, Path backupDirectory)
            throws IOException {
        if (Files.exists(packDirectory)) {
            FileUtils.moveAtomically(packDirectory, backupDirectory);
            log.info("[{}] Existing installation moved to {}", packId, backupDirectory.getFileName());
            return new PackDirectoryTransaction(packId, packDirectory, backupDirectory);
        }
        return new PackDirectoryTransaction(packId, packDirectory, null);
    }

    public boolean hasBackup() {
        return backupDirectory != null;
    }

    public Path getBackupDirectory() {
        return backupDirectory;
    }

    /**
     * 提交：删除备份（尽力而为）
     */
    public void commit() {
        checkOpen();
        finished = true;
        if (backupDirectory == null) {
            return;
        }
        try {
            FileUtils.deleteRecursively(backupDirectory);
        } catch (IOException e) {
            log.warn("[{}] Failed to delete backup {}, it will be left on disk: {}",
                    packId, backupDirectory, e.getMessage());
        }
    }

    /**
     * 回滚：删除新写入的目录并还原备份
     *
     * @return 是否恢复到事务开始前的状态
     */
    public boolean rollback() {
        checkOpen();
        finished = true;
        try {
            FileUtils.deleteRecursively(packDirectory);
        } catch (IOException e) {
            log.error("[{}] Failed to remove partially installed directory {}", packId, packDirectory, e);
            return false;
        }
        if (backupDirectory == null) {
            return true;
        }
        try {
            FileUtils.moveAtomically(backupDirectory, packDirectory);
            log.info("[{}] Previous installation restored from backup", packId);
            return true;
        } catch (IOException e) {
            log.error("[{}] Failed to restore backup {} to {}, manual recovery required",
                    packId, backupDirectory, packDirectory, e);
            return false;
        }
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Transaction for pack " + packId + " already finished");
        }
    }
}
