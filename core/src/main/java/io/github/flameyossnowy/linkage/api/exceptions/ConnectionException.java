package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class ConnectionException extends LinkageException {
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }

    @Override
    public @NotNull String userMessage() {
        return "Database connection error";
    }
}
