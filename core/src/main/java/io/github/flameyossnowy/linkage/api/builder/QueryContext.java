package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.fetch.QueryResolver;
import io.github.flameyossnowy.linkage.api.handler.IncludePathValidator;
import io.github.flameyossnowy.linkage.api.handler.NestedIncludeEngine;
import io.github.flameyossnowy.linkage.api.write.WriteExecutor;
import org.jetbrains.annotations.NotNull;

/**
 * The collaborators every builder of one client shares.
 */
public final class QueryContext {
    private final EntityRegistry registry;
    private final QueryResolver resolver;
    private final NestedIncludeEngine includeEngine;
    private final IncludePathValidator includeValidator;
    private final WriteExecutor writer;

    public QueryContext(@NotNull EntityRegistry registry) {
        this.registry = registry;
        this.resolver = new QueryResolver(registry);
        this.includeEngine = new NestedIncludeEngine(registry);
        this.includeValidator = new IncludePathValidator(registry);
        this.writer = new WriteExecutor(registry);
    }

    public @NotNull EntityRegistry registry() {
        return registry;
    }

    public @NotNull QueryResolver resolver() {
        return resolver;
    }

    public @NotNull NestedIncludeEngine includeEngine() {
        return includeEngine;
    }

    public @NotNull IncludePathValidator includeValidator() {
        return includeValidator;
    }

    public @NotNull WriteExecutor writer() {
        return writer;
    }
}
