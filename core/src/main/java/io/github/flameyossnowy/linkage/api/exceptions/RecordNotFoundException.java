package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class RecordNotFoundException extends LinkageException {
    public RecordNotFoundException(String message) {
        super(message);
    }

    @Override
    public @NotNull String userMessage() {
        return "Record not found";
    }
}
