package com.odmesh.core.property;

/**
 * Class-level descriptor of one declared field. Descriptors hold no per-instance data;
 * the same descriptor may be shared by every entity type built from a common base.
 */
public abstract class Property {
    private final String name;
    private final boolean primaryKey;

    protected Property(String name, boolean primaryKey) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Property wire name must not be empty");
        }
        this.name = name;
        this.primaryKey = primaryKey;
    }

    public String name() {
        return name;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    public abstract boolean isNavigation();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
