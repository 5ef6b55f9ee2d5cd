package com.redarm.shared.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Partial update of a {@link Job}. Only the fields a worker may change are
 * representable; a field is written only if it was set on this update.
 * Instances come from the transition factories below.
 */
public final class JobUpdate {

    private final String status;
    private final Instant updatedAt;
    private final Integer attempt;
    private final boolean resultUriSet;
    private final String resultUri;
    private final boolean errorSet;
    private final String error;

    private JobUpdate(String status, Instant updatedAt, Integer attempt,
                      boolean resultUriSet, String resultUri,
                      boolean errorSet, String error) {
        this.status = status;
        this.updatedAt = updatedAt;
        this.attempt = attempt;
        this.resultUriSet = resultUriSet;
        this.resultUri = resultUri;
        this.errorSet = errorSet;
        this.error = error;
    }

    public static JobUpdate running(int attempt, Instant now) {
        return new JobUpdate(JobStatus.RUNNING, now, attempt, false, null, false, null);
    }

    /**
     * Terminal success. Clears any error left by an earlier delivery.
     */
    public static JobUpdate completed(String resultUri, Instant now) {
        Objects.requireNonNull(resultUri, "resultUri is required for a completed job");
        return new JobUpdate(JobStatus.COMPLETED, now, null, true, resultUri, true, null);
    }

    /**
     * Terminal failure. The result URI is left as it is.
     */
    public static JobUpdate failed(String error, Instant now) {
        Objects.requireNonNull(error, "error is required for a failed job");
        return new JobUpdate(JobStatus.FAILED, now, null, false, null, true, error);
    }

    /**
     * Merges this update into the given job.
     */
    public void applyTo(Job job) {
        if (status != null) {
            job.setStatus(status);
        }
        if (updatedAt != null) {
            job.setUpdatedAt(updatedAt);
        }
        if (attempt != null) {
            job.setAttempt(attempt);
        }
        if (resultUriSet) {
            job.setResultUri(resultUri);
        }
        if (errorSet) {
            job.setError(error);
        }
    }

    public String getStatus() {
        return status;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Integer getAttempt() {
        return attempt;
    }

    public boolean isResultUriSet() {
        return resultUriSet;
    }

    public String getResultUri() {
        return resultUri;
    }

    public boolean isErrorSet() {
        return errorSet;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "JobUpdate{status=" + status + ", attempt=" + attempt
                + ", resultUriSet=" + resultUriSet + ", errorSet=" + errorSet + "}";
    }
}
