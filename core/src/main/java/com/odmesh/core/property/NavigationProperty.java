package com.odmesh.core.property;

import com.odmesh.core.Entity;
import com.odmesh.core.EntityType;
import com.odmesh.core.HydrationException;
import com.odmesh.core.NavigationValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A property referencing one related entity or a collection of them. The target type is
 * looked up lazily so that an entity may reference itself, or a type declared later.
 */
public class NavigationProperty<E extends Entity> extends Property {
    private final Supplier<EntityType<E>> target;
    private final boolean collection;

    private NavigationProperty(String name, Supplier<EntityType<E>> target, boolean collection) {
        super(name, false);
        if (target == null) {
            throw new IllegalArgumentException("Navigation property " + name + " needs a target type");
        }
        this.target = target;
        this.collection = collection;
    }

    public static <E extends Entity> NavigationProperty<E> single(String name, Supplier<EntityType<E>> target) {
        return new NavigationProperty<>(name, target, false);
    }

    public static <E extends Entity> NavigationProperty<E> collection(String name, Supplier<EntityType<E>> target) {
        return new NavigationProperty<>(name, target, true);
    }

    @Override
    public final boolean isNavigation() {
        return true;
    }

    public boolean isCollection() {
        return collection;
    }

    public EntityType<E> targetType() {
        return target.get();
    }

    public Object instancesFromData(Object raw) {
        return collection ? collectionFromData(raw) : singleFromData(raw);
    }

    public NavigationValue hydrate(Object raw) {
        return collection
                ? NavigationValue.collection(collectionFromData(raw))
                : NavigationValue.single(singleFromData(raw));
    }

    public E get(Entity entity) {
        if (collection) {
            throw new IllegalStateException(name() + " is a collection; use getAll");
        }
        return targetType().entityClass().cast(entity.state().resolve(this).single());
    }

    public List<E> getAll(Entity entity) {
        if (!collection) {
            throw new IllegalStateException(name() + " is a single relation; use get");
        }
        EntityType<E> type = targetType();
        List<E> result = new ArrayList<>();
        for (Entity related : entity.state().resolve(this).collection()) {
            result.add(type.entityClass().cast(related));
        }
        return result;
    }

    public void set(Entity entity, E value) {
        if (collection) {
            throw new IllegalStateException("Cannot assign a single entity to collection " + name());
        }
        entity.state().assignNavigation(this, value);
    }

    private E singleFromData(Object raw) {
        if (raw == null) {
            return null;
        }
        return targetType().fromData(asMapping(raw));
    }

    private List<E> collectionFromData(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List)) {
            throw new HydrationException("Expected a list for collection " + name() + " but got " + raw.getClass().getSimpleName());
        }
        EntityType<E> type = targetType();
        List<E> result = new ArrayList<>();
        for (Object element : (List<?>) raw) {
            if (element == null) {
                throw new HydrationException("Collection " + name() + " contains a null element");
            }
            result.add(type.fromData(asMapping(element)));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMapping(Object raw) {
        if (!(raw instanceof Map)) {
            throw new HydrationException("Expected a mapping for " + name() + " but got " + raw.getClass().getSimpleName());
        }
        return (Map<String, Object>) raw;
    }
}
