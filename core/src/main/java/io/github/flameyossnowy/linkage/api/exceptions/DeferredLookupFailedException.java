package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class DeferredLookupFailedException extends LinkageException {
    public DeferredLookupFailedException(String message) {
        super(message);
    }

    public DeferredLookupFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public @NotNull String userMessage() {
        return "Related record lookup failed";
    }
}
