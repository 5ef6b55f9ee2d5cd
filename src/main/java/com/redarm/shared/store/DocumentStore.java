package com.redarm.shared.store;

import com.redarm.shared.model.Document;

import java.util.Optional;

/**
 * Read-only lookup of document metadata.
 */
public interface DocumentStore {

    Optional<Document> getDocument(String docId);
}
