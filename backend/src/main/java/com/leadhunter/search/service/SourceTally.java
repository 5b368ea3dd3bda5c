package com.leadhunter.search.service;

import com.leadhunter.search.model.SourceRunStats;

final class SourceTally {
    private final String sourceName;
    private int acquisitions;
    private int attempts;
    private int hits;
    private int failedAcquisitions;
    private String lastError;

    SourceTally(String sourceName) {
        this.sourceName = sourceName;
    }

    synchronized void startAcquisition() {
        acquisitions++;
    }

    synchronized void attempt() {
        attempts++;
    }

    synchronized void succeeded(int hitCount) {
        hits += hitCount;
    }

    synchronized void error(String message) {
        lastError = message;
    }

    synchronized void failed() {
        failedAcquisitions++;
    }

    synchronized boolean allFailed() {
        return acquisitions > 0 && failedAcquisitions >= acquisitions;
    }

    synchronized SourceRunStats snapshot() {
        return new SourceRunStats(sourceName, acquisitions, attempts, hits, failedAcquisitions, lastError);
    }
}
