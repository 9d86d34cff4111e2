package com.warden.controlplane.domain.ruletype;

/** A schema change that would invalidate documents accepted by the previous schema. */
public class SchemaUpdateException extends RuntimeException {

    private final String path;

    public SchemaUpdateException(String path, String problem) {
        super(path + ": " + problem);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
