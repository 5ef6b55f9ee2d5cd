package com.redarm.shared.model;

import com.redarm.util.Emails;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * A unit of asynchronous work bound to one document and one owner.
 * Maps to the jobs table.
 */
@Entity
@Table(name = "jobs", indexes = {
    @Index(name = "idx_jobs_owner", columnList = "owner_email"),
    @Index(name = "idx_jobs_doc", columnList = "doc_id")
})
public class Job {

    @Id
    @Column(name = "job_id", length = 36, nullable = false, updatable = false)
    @NotNull
    private String jobId;

    @Column(name = "doc_id", length = 64)
    @Size(max = 64)
    private String docId;

    @Column(name = "owner_email", length = 320, updatable = false)
    @Size(max = 320)
    private String ownerEmail;

    @Column(name = "type", length = 20)
    @Size(max = 20)
    private String type;

    @Column(name = "status", length = 20)
    @Size(max = 20)
    private String status;

    @Column(name = "attempt")
    private Integer attempt;

    @Column(name = "result_uri", columnDefinition = "TEXT")
    private String resultUri;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "requested_format", length = 20)
    @Size(max = 20)
    private String requestedFormat;

    @Column(name = "pages", length = 255)
    @Size(max = 255)
    private String pages;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected Job() {
    }

    public Job(String jobId) {
        this.jobId = jobId;
    }

    /**
     * Builds a freshly queued job: attempt 0, both timestamps set to {@code now}.
     */
    public static Job queued(String jobId, String type, String docId, String ownerEmail, Instant now) {
        Job job = new Job(jobId);
        job.setType(type);
        job.setDocId(docId);
        job.setOwnerEmail(ownerEmail);
        job.setStatus(JobStatus.QUEUED);
        job.setAttempt(0);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return job;
    }

    public String getJobId() {
        return jobId;
    }

    public String getDocId() {
        return docId;
    }

    public void setDocId(String docId) {
        this.docId = docId;
    }

    public String getOwnerEmail() {
        return ownerEmail;
    }

    public void setOwnerEmail(String ownerEmail) {
        this.ownerEmail = ownerEmail != null ? Emails.normalize(ownerEmail) : null;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getAttempt() {
        return attempt;
    }

    public void setAttempt(Integer attempt) {
        this.attempt = attempt;
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

    public String getRequestedFormat() {
        return requestedFormat;
    }

    public void setRequestedFormat(String requestedFormat) {
        this.requestedFormat = requestedFormat;
    }

    public String getPages() {
        return pages;
    }

    public void setPages(String pages) {
        this.pages = pages;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
