package com.redarm.shared.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

/**
 * Uploaded source document. Owned by the document service; read-only here.
 * Maps only the columns used to authorize requests and locate source bytes.
 */
@Entity
@Immutable
@Table(name = "documents")
public class Document {

    @Id
    @Column(name = "doc_id", length = 64, nullable = false, updatable = false)
    private String docId;

    @Column(name = "owner_email", length = 320)
    private String ownerEmail;

    @Column(name = "source_blob_name", length = 1024)
    private String sourceBlobName;

    protected Document() {
    }

    public Document(String docId, String ownerEmail, String sourceBlobName) {
        this.docId = docId;
        this.ownerEmail = ownerEmail;
        this.sourceBlobName = sourceBlobName;
    }

    public String getDocId() {
        return docId;
    }

    public String getOwnerEmail() {
        return ownerEmail;
    }

    public String getSourceBlobName() {
        return sourceBlobName;
    }
}
