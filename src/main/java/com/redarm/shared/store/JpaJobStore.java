package com.redarm.shared.store;

import com.redarm.shared.model.Job;
import com.redarm.shared.model.JobStatus;
import com.redarm.shared.model.JobUpdate;
import com.redarm.shared.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * JobStore backed by the jobs table.
 */
@Service
public class JpaJobStore implements JobStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaJobStore.class);

    private final JobRepository jobRepository;

    public JpaJobStore(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    @Override
    @Transactional
    public void createJob(Job job) {
        if (jobRepository.existsById(job.getJobId())) {
            throw new IllegalStateException("Job already exists: " + job.getJobId());
        }
        jobRepository.saveAndFlush(job);
        logger.info("Job record created: jobId={}, type={}, docId={}", job.getJobId(), job.getType(), job.getDocId());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> getJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional
    public void updateJob(String jobId, JobUpdate update) {
        Optional<Job> existing = jobRepository.findById(jobId);
        if (existing.isEmpty()) {
            logger.warn("Ignoring update for unknown job: jobId={}, update={}", jobId, update);
            return;
        }

        Job job = existing.get();
        if (JobStatus.isTerminal(job.getStatus()) && JobStatus.RUNNING.equals(update.getStatus())) {
            // Redelivered message: the worker re-runs and writes a terminal state again.
            logger.info("Job {} re-entering running from terminal state {}", jobId, job.getStatus());
        }

        update.applyTo(job);
        jobRepository.save(job);
        logger.debug("Job updated: jobId={}, status={}", jobId, job.getStatus());
    }
}
