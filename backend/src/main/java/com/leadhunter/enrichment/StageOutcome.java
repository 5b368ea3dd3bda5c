package com.leadhunter.enrichment;

public record StageOutcome(String stage, Status status, String detail) {
    public enum Status {
        APPLIED,
        SKIPPED,
        FAILED
    }

    public static StageOutcome applied(String stage, String detail) {
        return new StageOutcome(stage, Status.APPLIED, detail);
    }

    public static StageOutcome skipped(String stage, String reason) {
        return new StageOutcome(stage, Status.SKIPPED, reason);
    }

    public static StageOutcome failed(String stage, String reason) {
        return new StageOutcome(stage, Status.FAILED, reason);
    }
}
