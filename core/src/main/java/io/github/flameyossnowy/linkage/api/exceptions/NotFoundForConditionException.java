package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

/**
 * Raised when a deferred foreign-key lookup finds no row for its unique condition.
 */
public class NotFoundForConditionException extends LinkageException {
    private final String entity;
    private final String condition;

    public NotFoundForConditionException(String entity, String condition) {
        super("No " + entity + " found for condition: " + condition);
        this.entity = entity;
        this.condition = condition;
    }

    public String getEntity() {
        return entity;
    }

    public String getCondition() {
        return condition;
    }

    @Override
    public @NotNull String userMessage() {
        return entity + " not found";
    }
}
