package com.redarm.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Canonical projection of a job for status polling.
 * Null fields are always serialized so clients see a stable shape.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"jobId", "status", "type", "resultUri", "error", "updatedAt"})
public class JobStatusResponse {

    private String jobId;
    private String status;
    private String type;
    private String resultUri;
    private String error;
    private String updatedAt;

    public JobStatusResponse() {
    }

    public JobStatusResponse(String jobId, String status, String type,
                             String resultUri, String error, String updatedAt) {
        this.jobId = jobId;
        this.status = status;
        this.type = type;
        this.resultUri = resultUri;
        this.error = error;
        this.updatedAt = updatedAt;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getResultUri() {
        return resultUri;
    }

    public void setResultUri(String resultUri) {
        this.resultUri = resultUri;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }
}
