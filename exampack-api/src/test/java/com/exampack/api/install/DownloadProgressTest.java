package com.exampack.api.install;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DownloadProgressTest {

    @Test
    @DisplayName("百分比四舍五入")
    void percentageIsRounded() {
        assertEquals(33, DownloadProgress.downloading("net-basics", 1, 3).getPercentage());
        assertEquals(67, DownloadProgress.downloading("net-basics", 2, 3).getPercentage());
        assertEquals(100, DownloadProgress.downloading("net-basics", 3, 3).getPercentage());
    }

    @Test
    @DisplayName("总长度未知时百分比为 0")
    void unknownTotal() {
        assertEquals(0, DownloadProgress.downloading("net-basics", 500, -1).getPercentage());
    }

    @Test
    @DisplayName("错误快照携带错误信息")
    void errorSnapshot() {
        DownloadProgress progress = DownloadProgress.error("net-basics", "Pack verification failed");

        assertEquals(DownloadStatus.ERROR, progress.getStatus());
        assertEquals("Pack verification failed", progress.getError());
        assertEquals(0, progress.getPercentage());
    }

    @Test
    void nullListenerBecomesNoop() {
        assertSame(ProgressListener.NONE, ProgressListener.nullToNone(null));
        assertDoesNotThrow(() -> ProgressListener.nullToNone(null)
                .onProgress(DownloadProgress.stage("net-basics", DownloadStatus.VERIFYING, 0)));
    }
}
