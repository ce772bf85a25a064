package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class InvalidConfigurationException extends LinkageException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public @NotNull String userMessage() {
        return "Configuration error";
    }
}
