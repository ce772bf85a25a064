package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class InvalidFieldTypeException extends LinkageException {
    public InvalidFieldTypeException(String message) {
        super(message);
    }

    public InvalidFieldTypeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public @NotNull String userMessage() {
        return "Invalid data type";
    }
}
