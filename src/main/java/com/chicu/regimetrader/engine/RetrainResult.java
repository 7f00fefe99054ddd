package com.chicu.regimetrader.engine;

import java.time.Instant;

public record RetrainResult(
        Status status,
        String message,
        int symbolsRefit,
        int foldsTrained,
        Instant at
) {

    public enum Status { STARTED, ALREADY_RUNNING, COMPLETED }

    public static RetrainResult started(Instant at) {
        return new RetrainResult(Status.STARTED, "retrain started", 0, 0, at);
    }

    public static RetrainResult alreadyRunning(Instant at) {
        return new RetrainResult(Status.ALREADY_RUNNING, "retrain already running", 0, 0, at);
    }

    public static RetrainResult completed(int symbolsRefit, int foldsTrained, Instant at) {
        return new RetrainResult(Status.COMPLETED, "retrain completed", symbolsRefit, foldsTrained, at);
    }
}
