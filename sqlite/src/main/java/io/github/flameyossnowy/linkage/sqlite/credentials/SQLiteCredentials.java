package io.github.flameyossnowy.linkage.sqlite.credentials;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Location of an SQLite database file. Every operation opens its own connection, so in-memory
 * databases are not supported.
 */
public record SQLiteCredentials(@NotNull String path) {
    public SQLiteCredentials {
        Objects.requireNonNull(path, "path");
        if (path.isBlank() || path.startsWith(":memory:")) {
            throw new IllegalArgumentException("SQLite credentials need a database file, got '" + path + "'");
        }
    }

    public @NotNull String url() {
        return "jdbc:sqlite:" + path;
    }
}
