package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class BatchException extends LinkageException {
    public BatchException(String message) {
        super(message);
    }

    public BatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public @NotNull String userMessage() {
        return "Batch operation failed";
    }
}
