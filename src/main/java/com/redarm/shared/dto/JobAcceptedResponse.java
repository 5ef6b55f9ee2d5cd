package com.redarm.shared.dto;

/**
 * Body of a 202 response to a job start request.
 */
public class JobAcceptedResponse {

    private String jobId;

    public JobAcceptedResponse() {
    }

    public JobAcceptedResponse(String jobId) {
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }
}
