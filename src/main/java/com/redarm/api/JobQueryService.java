package com.redarm.api;

import com.redarm.security.Identity;
import com.redarm.shared.dto.JobStatusResponse;
import com.redarm.shared.error.AuthException;
import com.redarm.shared.error.NotFoundException;
import com.redarm.shared.model.Job;
import com.redarm.shared.store.JobStore;
import com.redarm.util.Strings;
import org.springframework.stereotype.Service;

/**
 * Read-only projection of a job for its owner.
 */
@Service
public class JobQueryService {

    private final JobStore jobStore;

    public JobQueryService(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    public JobStatusResponse getJob(Identity identity, String jobId) {
        Job job = jobStore.getJob(jobId).orElseThrow(() -> new NotFoundException("Job not found"));
        if (!identity.owns(job.getOwnerEmail())) {
            throw AuthException.forbidden("You do not own this job");
        }
        return toResponse(job);
    }

    // Partially written rows project to defaults instead of failing.
    static JobStatusResponse toResponse(Job job) {
        return new JobStatusResponse(
                job.getJobId(),
                Strings.safe(job.getStatus(), "unknown"),
                job.getType() == null ? "" : job.getType(),
                Strings.blankToNull(job.getResultUri()),
                Strings.blankToNull(job.getError()),
                job.getUpdatedAt() != null ? job.getUpdatedAt().toString() : null);
    }
}
