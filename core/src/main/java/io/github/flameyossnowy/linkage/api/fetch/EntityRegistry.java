package io.github.flameyossnowy.linkage.api.fetch;

import io.github.flameyossnowy.linkage.api.exceptions.EntityFetcherMissingException;
import io.github.flameyossnowy.linkage.api.exceptions.InvalidConfigurationException;
import io.github.flameyossnowy.linkage.api.exceptions.MissingConfigurationException;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Entity models and their fetchers, by entity name.
 * <p>
 * Built once at startup and handed to every client and builder. Lookups accept the exact name, a
 * namespaced name ({@code blog::user} or {@code blog.user}), or a name in different case
 * ({@code User}).
 */
public final class EntityRegistry {
    private final Map<String, EntityModel<?>> models = new LinkedHashMap<>();
    private final Map<String, EntityFetcher> fetchers = new LinkedHashMap<>();
    private final Map<Class<?>, EntityModel<?>> byClass = new LinkedHashMap<>();

    private EntityRegistry() {}

    public static Builder builder() {
        return new Builder();
    }

    public @NotNull Optional<EntityFetcher> getFetcher(@NotNull String entityName) {
        String resolved = resolveName(entityName);
        return resolved == null ? Optional.empty() : Optional.ofNullable(fetchers.get(resolved));
    }

    public @NotNull EntityFetcher requireFetcher(@NotNull String entityName) {
        return getFetcher(entityName).orElseThrow(() -> new EntityFetcherMissingException(entityName));
    }

    public @NotNull Optional<EntityModel<?>> getModel(@NotNull String entityName) {
        String resolved = resolveName(entityName);
        return resolved == null ? Optional.empty() : Optional.ofNullable(models.get(resolved));
    }

    public @NotNull EntityModel<?> requireModel(@NotNull String entityName) {
        return getModel(entityName).orElseThrow(() -> new MissingConfigurationException("No entity model registered for '" + entityName + "'"));
    }

    @SuppressWarnings("unchecked")
    public <T> @NotNull EntityModel<T> requireModel(@NotNull Class<T> entityClass) {
        EntityModel<?> model = byClass.get(entityClass);
        if (model == null) {
            throw new MissingConfigurationException("No entity model registered for " + entityClass.getName());
        }
        return (EntityModel<T>) model;
    }

    public @NotNull Collection<EntityModel<?>> models() {
        return Collections.unmodifiableCollection(models.values());
    }

    /**
     * The registered name matching {@code name}, trying the exact name, then without namespace, then ignoring case.
     */
    public @Nullable String resolveName(@NotNull String name) {
        if (models.containsKey(name)) return name;

        String stripped = stripNamespace(name);
        if (models.containsKey(stripped)) return stripped;

        for (String registered : models.keySet()) {
            if (registered.equalsIgnoreCase(stripped)) return registered;
            if (normalize(registered).equals(normalize(stripped))) return registered;
        }
        return null;
    }

    private static String stripNamespace(String name) {
        int index = Math.max(name.lastIndexOf("::"), name.lastIndexOf('.'));
        if (index < 0) return name;
        return name.substring(index + (name.startsWith("::", index) ? 2 : 1));
    }

    private static String normalize(String name) {
        return name.replace("_", "").toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, EntityModel<?>> models = new LinkedHashMap<>();
        private final Map<String, Function<EntityRegistry, EntityFetcher>> fetchers = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a model served by a {@link DefaultEntityFetcher}.
         */
        public Builder register(@NotNull EntityModel<?> model) {
            return register(model, registry -> DefaultEntityFetcher.of(model, registry));
        }

        /**
         * Registers a model with a custom fetcher. The factory receives the finished registry.
         */
        public Builder register(@NotNull EntityModel<?> model, @NotNull Function<EntityRegistry, EntityFetcher> fetcherFactory) {
            if (models.putIfAbsent(model.entityName(), model) != null) {
                throw new InvalidConfigurationException("Entity '" + model.entityName() + "' is already registered");
            }
            fetchers.put(model.entityName(), fetcherFactory);
            return this;
        }

        /**
         * Registers a model without a fetcher. Including relations of such an entity fails with
         * {@link EntityFetcherMissingException}.
         */
        public Builder registerModelOnly(@NotNull EntityModel<?> model) {
            if (models.putIfAbsent(model.entityName(), model) != null) {
                throw new InvalidConfigurationException("Entity '" + model.entityName() + "' is already registered");
            }
            return this;
        }

        public EntityRegistry build() {
            EntityRegistry registry = new EntityRegistry();
            registry.models.putAll(models);
            for (EntityModel<?> model : models.values()) {
                registry.byClass.put(model.entityClass(), model);
            }
            for (Map.Entry<String, Function<EntityRegistry, EntityFetcher>> entry : fetchers.entrySet()) {
                registry.fetchers.put(entry.getKey(), entry.getValue().apply(registry));
            }
            return registry;
        }
    }
}
