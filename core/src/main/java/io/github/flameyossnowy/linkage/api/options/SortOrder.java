package io.github.flameyossnowy.linkage.api.options;

public enum SortOrder {
    ASC,
    DESC;

    public SortOrder reverse() {
        return this == ASC ? DESC : ASC;
    }
}
