package com.redarm.shared.repository;

import com.redarm.shared.model.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for Job entities, keyed by job id.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, String> {
}
