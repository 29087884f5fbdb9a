package com.exampack.api.install;

/**
 * 进度回调，由调用方提供
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> {
    };

    void onProgress(DownloadProgress progress);

    static ProgressListener nullToNone(ProgressListener listener) {
        return listener != null ? listener : NONE;
    }
}
