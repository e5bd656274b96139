package com.odmesh.core;

import java.util.List;

/**
 * A resolved navigation payload tagged by cardinality. A single relation may resolve to
 * no entity; a collection resolves to a possibly empty list in payload order.
 */
public record NavigationValue(
        Cardinality cardinality,
        Entity single,
        List<Entity> collection
) {
    public enum Cardinality {
        SINGLE,
        COLLECTION
    }

    public static NavigationValue single(Entity entity) {
        return new NavigationValue(Cardinality.SINGLE, entity, null);
    }

    public static NavigationValue collection(List<? extends Entity> entities) {
        return new NavigationValue(Cardinality.COLLECTION, null, List.copyOf(entities));
    }

    public boolean isCollection() {
        return cardinality == Cardinality.COLLECTION;
    }

    @Override
    public Entity single() {
        if (isCollection()) {
            throw new IllegalStateException("Navigation value holds a collection");
        }
        return single;
    }

    @Override
    public List<Entity> collection() {
        if (!isCollection()) {
            throw new IllegalStateException("Navigation value holds a single entity");
        }
        return collection;
    }
}
