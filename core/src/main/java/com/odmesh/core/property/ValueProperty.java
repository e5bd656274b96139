package com.odmesh.core.property;

import com.odmesh.core.Entity;
import com.odmesh.core.HydrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A property mapped to a single scalar wire value. Reads and writes go through the
 * owning entity's {@link com.odmesh.core.EntityState}, so every write made here is
 * recorded as a local change. Raw values are coerced on read; {@link #normalize} and
 * {@link #escapeRaw} fall back to the raw value when it cannot be coerced.
 */
public abstract class ValueProperty<T> extends Property {
    private static final Logger logger = LoggerFactory.getLogger(ValueProperty.class);

    protected ValueProperty(String name, boolean primaryKey) {
        super(name, primaryKey);
    }

    @Override
    public final boolean isNavigation() {
        return false;
    }

    public T get(Entity entity) {
        return fromRaw(entity.state().get(name()));
    }

    public void set(Entity entity, T value) {
        entity.state().set(name(), toRaw(value));
    }

    public Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return fromRaw(raw);
        } catch (HydrationException e) {
            logger.debug("Keeping unreadable value of {} as received: {}", name(), e.getMessage());
            return raw;
        }
    }

    public String escapeRaw(Object raw) {
        if (raw == null) {
            return "null";
        }
        try {
            return escapeValue(fromRaw(raw));
        } catch (HydrationException e) {
            logger.debug("Rendering unreadable value of {} as received: {}", name(), e.getMessage());
            return String.valueOf(raw);
        }
    }

    public abstract String escapeValue(T value);

    protected abstract T fromRaw(Object raw);

    protected Object toRaw(T value) {
        return value;
    }
}
