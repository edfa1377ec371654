package com.opsdesk.runner.query;

/**
 * Result of one query evaluation.
 *
 * @param success        the evaluation completed
 * @param value          the result on success: a scalar, a record map, a list, or null
 * @param elapsedSeconds wall-clock time up to completion or failure
 * @param errorMessage   failure explanation; null on success
 */
public record ExecutionOutcome(boolean success, Object value, double elapsedSeconds, String errorMessage) {

    public static ExecutionOutcome success(Object value, double elapsedSeconds) {
        return new ExecutionOutcome(true, value, elapsedSeconds, null);
    }

    public static ExecutionOutcome failure(String errorMessage, double elapsedSeconds) {
        return new ExecutionOutcome(false, null, elapsedSeconds, errorMessage);
    }

    public int exitCode() {
        return success ? 0 : 1;
    }
}
