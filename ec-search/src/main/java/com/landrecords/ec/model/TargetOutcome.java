package com.landrecords.ec.model;

/**
 * What happened to one target in a batch run.
 */
public record TargetOutcome(SearchTarget target, Status status, int rowsFound, String error) {

    public enum Status {
        SUCCESS, FAILED, SESSION_EXPIRED, NOT_ATTEMPTED
    }

    public static TargetOutcome success(SearchTarget target, int rows) {
        return new TargetOutcome(target, Status.SUCCESS, rows, null);
    }

    public static TargetOutcome failed(SearchTarget target, String error) {
        return new TargetOutcome(target, Status.FAILED, 0, error);
    }

    public static TargetOutcome sessionExpired(SearchTarget target, String error) {
        return new TargetOutcome(target, Status.SESSION_EXPIRED, 0, error);
    }

    public static TargetOutcome notAttempted(SearchTarget target) {
        return new TargetOutcome(target, Status.NOT_ATTEMPTED, 0, null);
    }

    public boolean attempted() {
        return status != Status.NOT_ATTEMPTED;
    }

    public boolean isError() {
        return status == Status.FAILED || status == Status.SESSION_EXPIRED;
    }
}
