package com.redarm.shared.store;

import com.redarm.shared.model.Job;
import com.redarm.shared.model.JobUpdate;

import java.util.Optional;

/**
 * Persistence contract for jobs. Must give read-after-write consistency so a
 * job can be polled right after it is created.
 */
public interface JobStore {

    void createJob(Job job);

    Optional<Job> getJob(String jobId);

    /**
     * Merges the update into the stored job. Only fields set on the update
     * are overwritten; the last write wins.
     */
    void updateJob(String jobId, JobUpdate update);
}
