package com.odmesh.core;

import com.odmesh.core.property.NavigationProperty;
import com.odmesh.core.property.ValueProperty;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-instance storage behind an {@link Entity}: field values keyed by wire name, the set of
 * locally modified fields, and the cache of resolved navigation properties.
 *
 * <p>Not thread safe. Callers sharing an entity across threads serialize their own access.
 */
public class EntityState {
    private static final Logger logger = LoggerFactory.getLogger(EntityState.class);

    private final EntityType<?> type;
    private final WeakReference<Entity> owner;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> dirty = new HashSet<>();
    private final Set<String> dirtyNavigations = new LinkedHashSet<>();
    private final Map<String, NavigationValue> navCache = new LinkedHashMap<>();
    private RelationFetcher fetcher;

    EntityState(Entity owner, EntityType<?> type) {
        this.owner = new WeakReference<>(owner);
        this.type = type;
    }

    public EntityType<?> entityType() {
        return type;
    }

    public Entity owner() {
        return owner.get();
    }

    public Object get(String name) {
        requireValueProperty(name);
        return values.get(name);
    }

    public void set(String name, Object value) {
        requireValueProperty(name);
        values.put(name, value);
        dirty.add(name);
        logger.trace("{} marked dirty on {}", name, type.entityClass().getSimpleName());
    }

    public void load(String name, Object value) {
        requireValueProperty(name);
        values.put(name, value);
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    public List<String> dirtyFields() {
        List<String> result = new ArrayList<>();
        for (ValueProperty<?> property : type.valueProperties()) {
            if (dirty.contains(property.name())) {
                result.add(property.name());
            }
        }
        return result;
    }

    public boolean isDirty() {
        return !dirty.isEmpty() || !dirtyNavigations.isEmpty();
    }

    public Stash dirtyValues() {
        Stash changes = new Stash();
        for (String name : dirtyFields()) {
            changes.put(name, values.get(name));
        }
        return changes;
    }

    public Set<String> dirtyNavigations() {
        return Collections.unmodifiableSet(dirtyNavigations);
    }

    public void markClean() {
        dirty.clear();
        dirtyNavigations.clear();
    }

    public List<ValueProperty<?>> properties() {
        return type.valueProperties();
    }

    public List<NavigationProperty<?>> navigationProperties() {
        return type.navigationProperties();
    }

    public Optional<ValueProperty<?>> primaryKeyProperty() {
        return type.primaryKeyProperty();
    }

    public Object id() {
        return type.primaryKeyProperty()
                .map(key -> key.normalize(values.get(key.name())))
                .orElse(null);
    }

    public Optional<String> instanceUrl() {
        Object id = id();
        if (id == null) {
            return Optional.empty();
        }
        ValueProperty<?> key = type.primaryKeyProperty().orElseThrow();
        return Optional.of(type.url() + "(" + key.escapeRaw(id) + ")");
    }

    public Map<String, NavigationValue> navCache() {
        return Collections.unmodifiableMap(navCache);
    }

    public Optional<NavigationValue> navigation(String name) {
        return Optional.ofNullable(navCache.get(name));
    }

    public void cacheNavigation(NavigationProperty<?> property, NavigationValue value) {
        requireNavigationProperty(property);
        if (value.isCollection() != property.isCollection()) {
            throw new IllegalArgumentException("Cardinality of " + value.cardinality() + " does not match " + property.name());
        }
        navCache.put(property.name(), value);
    }

    public void assignNavigation(NavigationProperty<?> property, Entity related) {
        cacheNavigation(property, NavigationValue.single(related));
        dirtyNavigations.add(property.name());
    }

    public void invalidate(String name) {
        navCache.remove(name);
    }

    public void invalidateAll() {
        navCache.clear();
    }

    public void attach(RelationFetcher fetcher) {
        this.fetcher = fetcher;
    }

    public NavigationValue resolve(NavigationProperty<?> property) {
        requireNavigationProperty(property);
        NavigationValue cached = navCache.get(property.name());
        if (cached != null) {
            return cached;
        }
        if (fetcher == null) {
            throw new UnresolvedNavigationException(
                    property.name() + " on " + type.entityClass().getSimpleName() + " is not loaded and no fetcher is attached");
        }
        Entity parent = owner();
        logger.debug("Fetching {} for {}", property.name(), parent);
        Object raw = property.isCollection()
                ? fetcher.fetchCollection(parent, property)
                : fetcher.fetchSingle(parent, property);
        NavigationValue value = property.hydrate(raw);
        navCache.put(property.name(), value);
        return value;
    }

    private void requireValueProperty(String name) {
        for (ValueProperty<?> property : type.valueProperties()) {
            if (property.name().equals(name)) {
                return;
            }
        }
        throw new IllegalArgumentException(name + " is not a value property of " + type.entityClass().getSimpleName());
    }

    private void requireNavigationProperty(NavigationProperty<?> property) {
        if (!type.navigationProperties().contains(property)) {
            throw new IllegalArgumentException(property.name() + " is not a navigation property of " + type.entityClass().getSimpleName());
        }
    }
}
