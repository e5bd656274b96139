package com.odmesh.core;

import com.odmesh.core.property.NavigationProperty;
import com.odmesh.core.property.ValueProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Root of every modeled record type. An entity keeps no fields of its own: values, dirty
 * marks and resolved relations live in its {@link EntityState}, reached through the
 * property descriptors declared on its {@link EntityType}.
 *
 * <p>Two entities are equal when both carry a non-null primary key and the key values are
 * equal. An entity without a key equals only itself.
 */
public abstract class Entity {
    private final EntityState state;

    protected Entity(EntityType<?> type) {
        this(type, null);
    }

    protected Entity(EntityType<?> type, Map<String, Object> rawData) {
        if (type == null) {
            throw new EntityDefinitionException(getClass().getSimpleName() + " was constructed without an entity type");
        }
        if (!type.entityClass().isInstance(this)) {
            throw new EntityDefinitionException(getClass().getSimpleName() + " was constructed with " + type);
        }
        this.state = new EntityState(this, type);

        if (rawData == null) {
            for (ValueProperty<?> property : type.valueProperties()) {
                state.load(property.name(), null);
            }
            return;
        }

        Map<String, Object> remaining = new LinkedHashMap<>(rawData);
        for (NavigationProperty<?> navigation : type.navigationProperties()) {
            if (remaining.containsKey(navigation.name())) {
                Object expanded = remaining.remove(navigation.name());
                state.cacheNavigation(navigation, navigation.hydrate(expanded));
            }
        }
        for (ValueProperty<?> property : type.valueProperties()) {
            state.load(property.name(), remaining.get(property.name()));
        }
    }

    public final EntityState state() {
        return state;
    }

    public final EntityType<?> entityType() {
        return state.entityType();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Entity)) {
            return false;
        }
        Object id = state.id();
        return id != null && id.equals(((Entity) other).state.id());
    }

    @Override
    public int hashCode() {
        Object id = state.id();
        return id != null ? id.hashCode() : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        String className = getClass().getSimpleName();
        Optional<ValueProperty<?>> key = state.primaryKeyProperty();
        Object id = state.id();
        if (key.isPresent() && id != null) {
            return "Entity(" + className + ":" + key.get().escapeRaw(id) + ")";
        }
        return "Entity(" + className + ")";
    }
}
