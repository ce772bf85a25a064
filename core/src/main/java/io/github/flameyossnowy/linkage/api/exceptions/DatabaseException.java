package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class DatabaseException extends LinkageException {
    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }

    @Override
    public @NotNull String userMessage() {
        return "Database error";
    }
}
