package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class FieldNotFetchedException extends LinkageException {
    public FieldNotFetchedException(String message) {
        super(message);
    }

    public FieldNotFetchedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public @NotNull String userMessage() {
        return "Requested field was not selected";
    }
}
