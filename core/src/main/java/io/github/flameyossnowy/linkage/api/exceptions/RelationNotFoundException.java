package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

/**
 * Raised when a relation name is not part of an entity's descriptor table.
 */
public class RelationNotFoundException extends LinkageException {
    private final String entity;
    private final String relation;

    public RelationNotFoundException(String entity, String relation) {
        super("Relation '" + relation + "' not found on entity '" + entity + "'");
        this.entity = entity;
        this.relation = relation;
    }

    public String getEntity() {
        return entity;
    }

    public String getRelation() {
        return relation;
    }

    @Override
    public @NotNull String userMessage() {
        return "Invalid relation: " + relation;
    }
}
