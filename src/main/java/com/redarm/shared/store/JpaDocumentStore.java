package com.redarm.shared.store;

import com.redarm.shared.model.Document;
import com.redarm.shared.repository.DocumentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
public class JpaDocumentStore implements DocumentStore {

    private final DocumentRepository documentRepository;

    public JpaDocumentStore(DocumentRepository documentRepository) {
        this.documentRepository = documentRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Document> getDocument(String docId) {
        if (docId == null || docId.isBlank()) {
            return Optional.empty();
        }
        return documentRepository.findById(docId);
    }
}
