package com.redarm.api.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Task envelope handed from a start request to a worker. Export tasks carry
 * {@code requestedFormat}, OCR tasks carry {@code pages}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobTaskMessage {

    private String jobId;
    private String docId;
    private String ownerEmail;
    private String createdAt;
    private Integer attempt;
    private String requestedFormat;
    private String pages;

    public JobTaskMessage() {
    }

    public static JobTaskMessage export(String jobId, String docId, String ownerEmail,
                                        String createdAt, String requestedFormat) {
        JobTaskMessage message = base(jobId, docId, ownerEmail, createdAt);
        message.setRequestedFormat(requestedFormat);
        return message;
    }

    public static JobTaskMessage ocr(String jobId, String docId, String ownerEmail,
                                     String createdAt, String pages) {
        JobTaskMessage message = base(jobId, docId, ownerEmail, createdAt);
        message.setPages(pages);
        return message;
    }

    private static JobTaskMessage base(String jobId, String docId, String ownerEmail, String createdAt) {
        JobTaskMessage message = new JobTaskMessage();
        message.setJobId(jobId);
        message.setDocId(docId);
        message.setOwnerEmail(ownerEmail);
        message.setCreatedAt(createdAt);
        message.setAttempt(0);
        return message;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
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
        this.ownerEmail = ownerEmail;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public Integer getAttempt() {
        return attempt;
    }

    public void setAttempt(Integer attempt) {
        this.attempt = attempt;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobTaskMessage)) {
            return false;
        }
        JobTaskMessage that = (JobTaskMessage) o;
        return Objects.equals(jobId, that.jobId)
                && Objects.equals(docId, that.docId)
                && Objects.equals(ownerEmail, that.ownerEmail)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(attempt, that.attempt)
                && Objects.equals(requestedFormat, that.requestedFormat)
                && Objects.equals(pages, that.pages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, docId, ownerEmail, createdAt, attempt, requestedFormat, pages);
    }

    @Override
    public String toString() {
        return "JobTaskMessage{jobId=" + jobId + ", docId=" + docId + ", attempt=" + attempt + "}";
    }
}
