package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class RelationNotFetchedException extends LinkageException {
    public RelationNotFetchedException(String message) {
        super(message);
    }

    public RelationNotFetchedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public @NotNull String userMessage() {
        return "Related data was not loaded";
    }
}
