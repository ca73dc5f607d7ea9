package com.incidents.adapter.model;

import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Base class for all stored documents.
 * The id is always a natural key (feed identifier, normalized query, setting name).
 */
public abstract class BaseDocument {

    @Id
    private String id;

    /**
     * When this document was first written
     */
    private Instant createdAt;

    /**
     * When this document was last written
     */
    private Instant updatedAt;

    protected BaseDocument() {
    }

    protected BaseDocument(BaseDocument other) {
        this.id = other.id;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
