package com.redarm.shared.model;

/**
 * Job status values as stored and returned to clients. A job normally goes
 * queued, running, then completed or failed; a redelivered message moves it
 * back to running.
 */
public final class JobStatus {

    public static final String QUEUED = "queued";
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    private JobStatus() {
    }

    public static boolean isTerminal(String status) {
        return COMPLETED.equals(status) || FAILED.equals(status);
    }
}
