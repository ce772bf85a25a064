package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

/**
 * Base type of every error raised by Linkage.
 * <p>
 * Errors propagate to the caller unchanged; nothing is retried internally.
 * {@link #isRecoverable()} tells callers whether a retry of the whole operation could succeed.
 */
public class LinkageException extends RuntimeException {
    public LinkageException(String message) {
        super(message);
    }

    public LinkageException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRecoverable() {
        return false;
    }

    /**
     * A short message suitable for showing to end users.
     */
    public @NotNull String userMessage() {
        return "An unexpected error occurred";
    }
}
