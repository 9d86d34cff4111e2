package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A node in the project tree. Root projects (no parent) act as organisations.
 *
 * @param metadata free-form JSON document
 */
public record Project(UUID id, UUID parentId, String name, String metadata, Instant createdAt) {

    public boolean isRoot() {
        return parentId == null;
    }
}
