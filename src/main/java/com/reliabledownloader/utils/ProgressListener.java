package com.reliabledownloader.utils;

import com.reliabledownloader.models.TransferProgress;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(TransferProgress progress);
}
