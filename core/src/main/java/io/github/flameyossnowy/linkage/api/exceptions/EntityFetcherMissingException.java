package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

/**
 * Raised when the registry has no fetcher for an entity, which means it was configured incompletely.
 */
public class EntityFetcherMissingException extends LinkageException {
    private final String entity;

    public EntityFetcherMissingException(String entity) {
        super("No entity fetcher registered for '" + entity + "'");
        this.entity = entity;
    }

    public String getEntity() {
        return entity;
    }

    @Override
    public @NotNull String userMessage() {
        return "Configuration error";
    }
}
