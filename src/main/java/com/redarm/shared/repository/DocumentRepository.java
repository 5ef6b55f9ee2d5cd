package com.redarm.shared.repository;

import com.redarm.shared.model.Document;
import org.springframework.data.repository.Repository;

import java.util.Optional;

/**
 * Read-only repository for Document entities.
 */
public interface DocumentRepository extends Repository<Document, String> {

    Optional<Document> findById(String docId);
}
