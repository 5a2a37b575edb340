package com.example.reportmerge.application.service;

/**
 * Receives progress updates of a merge run.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message) -> { };

    /**
     * @param percent completion between 0 and 100
     * @param message human readable description of the current step
     */
    void onProgress(int percent, String message);
}
