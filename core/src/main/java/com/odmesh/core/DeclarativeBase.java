package com.odmesh.core;

import com.odmesh.core.property.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared root for a family of entity types talking to one service. Properties declared here
 * (an id, created and modified stamps) come first on every type built through {@link #entity},
 * and {@link #bind} points every registered type at the service root once it is known.
 */
public class DeclarativeBase {
    private static final Logger logger = LoggerFactory.getLogger(DeclarativeBase.class);

    private final Map<String, Property> baseProperties = new LinkedHashMap<>();
    private final List<EntityType<?>> types = new CopyOnWriteArrayList<>();
    private volatile String serviceUrl = "";

    public DeclarativeBase property(String attributeName, Property property) {
        if (baseProperties.containsKey(attributeName)) {
            throw new EntityDefinitionException("Base attribute " + attributeName + " declared twice");
        }
        baseProperties.put(attributeName, property);
        return this;
    }

    public Map<String, Property> properties() {
        return Collections.unmodifiableMap(baseProperties);
    }

    public <E extends Entity> EntityType.Builder<E> entity(Class<E> entityClass) {
        return EntityType.builder(entityClass)
                .properties(baseProperties)
                .onBuild(this::register);
    }

    private void register(EntityType<?> type) {
        if (!serviceUrl.isEmpty()) {
            type.setUrlBase(serviceUrl);
        }
        types.add(type);
    }

    public void bind(String serviceUrl) {
        this.serviceUrl = serviceUrl == null ? "" : serviceUrl;
        logger.debug("Binding {} entity types to {}", types.size(), this.serviceUrl);
        for (EntityType<?> type : types) {
            type.setUrlBase(this.serviceUrl);
        }
    }

    public String serviceUrl() {
        return serviceUrl;
    }

    public List<EntityType<?>> types() {
        return List.copyOf(types);
    }
}
