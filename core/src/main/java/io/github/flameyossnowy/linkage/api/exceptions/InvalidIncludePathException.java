package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class InvalidIncludePathException extends LinkageException {
    private final String path;

    public InvalidIncludePathException(String path, String reason) {
        super("Invalid include path '" + path + "': " + reason);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    @Override
    public @NotNull String userMessage() {
        return "Invalid include path: " + path;
    }
}
