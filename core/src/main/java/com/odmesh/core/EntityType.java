package com.odmesh.core;

import com.odmesh.core.config.EntityTypeConfig;
import com.odmesh.core.property.NavigationProperty;
import com.odmesh.core.property.Property;
import com.odmesh.core.property.ValueProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.tailoredshapes.underbar.ocho.UnderBar.map;

/**
 * Class-level metadata of an entity: protocol names, URL root and the declared property table.
 * Built once, usually from a static initializer of the entity class, and shared by all of its instances.
 *
 * <pre>
 * public class Product extends Entity {
 *     public static final IntegerProperty ID = new IntegerProperty("ProductID", true);
 *     public static final StringProperty NAME = new StringProperty("ProductName");
 *
 *     public static final EntityType&lt;Product&gt; TYPE = EntityType.builder(Product.class)
 *             .typeName("ProductDataService.Objects.Product")
 *             .collectionName("Products")
 *             .property("id", ID)
 *             .property("name", NAME)
 *             .constructors(Product::new, Product::new)
 *             .build();
 *
 *     public Product() { super(TYPE); }
 *     public Product(Map&lt;String, Object&gt; data) { super(TYPE, data); }
 * }
 * </pre>
 */
public final class EntityType<E extends Entity> {
    private static final Logger logger = LoggerFactory.getLogger(EntityType.class);

    private final Class<E> entityClass;
    private final String typeName;
    private final String collectionName;
    private volatile String urlBase;
    private final Map<String, Property> properties;
    private final List<ValueProperty<?>> valueProperties;
    private final List<NavigationProperty<?>> navigationProperties;
    private final ValueProperty<?> primaryKey;
    private final Supplier<E> constructor;
    private final Function<Map<String, Object>, E> dataConstructor;

    private EntityType(Builder<E> builder) {
        this.entityClass = builder.entityClass;
        this.typeName = builder.config.typeName();
        this.collectionName = builder.config.collectionName();
        this.urlBase = builder.config.urlBase();
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.constructor = builder.constructor;
        this.dataConstructor = builder.dataConstructor;

        List<ValueProperty<?>> values = new ArrayList<>();
        List<NavigationProperty<?>> navigations = new ArrayList<>();
        ValueProperty<?> key = null;
        for (Property property : properties.values()) {
            if (property instanceof NavigationProperty) {
                navigations.add((NavigationProperty<?>) property);
            } else if (property instanceof ValueProperty) {
                ValueProperty<?> value = (ValueProperty<?>) property;
                values.add(value);
                if (value.isPrimaryKey()) {
                    key = value;
                }
            }
        }
        this.valueProperties = List.copyOf(values);
        this.navigationProperties = List.copyOf(navigations);
        this.primaryKey = key;
    }

    public static <E extends Entity> Builder<E> builder(Class<E> entityClass) {
        return new Builder<>(entityClass);
    }

    public Class<E> entityClass() {
        return entityClass;
    }

    public String typeName() {
        return typeName;
    }

    public String collectionName() {
        return collectionName;
    }

    public String urlBase() {
        return urlBase;
    }

    public void setUrlBase(String urlBase) {
        logger.debug("URL base of {} set to {}", entityClass.getSimpleName(), urlBase);
        this.urlBase = urlBase == null ? "" : urlBase;
    }

    public String url() {
        return UrlJoin.join(urlBase, collectionName);
    }

    public Map<String, Property> properties() {
        return properties;
    }

    public List<ValueProperty<?>> valueProperties() {
        return valueProperties;
    }

    public List<NavigationProperty<?>> navigationProperties() {
        return navigationProperties;
    }

    public Optional<ValueProperty<?>> primaryKeyProperty() {
        return Optional.ofNullable(primaryKey);
    }

    public Optional<String> attributeName(Property property) {
        for (Map.Entry<String, Property> entry : properties.entrySet()) {
            if (entry.getValue() == property) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public E newInstance() {
        return constructor.get();
    }

    public E fromData(Map<String, Object> rawData) {
        return dataConstructor.apply(rawData);
    }

    public List<E> fromData(List<? extends Map<String, Object>> rows) {
        return map(rows, dataConstructor::apply);
    }

    @Override
    public String toString() {
        return "EntityType(" + entityClass.getSimpleName() + ", " + typeName + ", " + collectionName + ")";
    }

    public static class Builder<E extends Entity> {
        private final Class<E> entityClass;
        private final EntityTypeConfig.Builder configBuilder = EntityTypeConfig.builder();
        private EntityTypeConfig config;
        private final Map<String, Property> properties = new LinkedHashMap<>();
        private Supplier<E> constructor;
        private Function<Map<String, Object>, E> dataConstructor;
        private final List<Consumer<EntityType<E>>> listeners = new ArrayList<>();

        private Builder(Class<E> entityClass) {
            if (entityClass == null) {
                throw new EntityDefinitionException("Entity class must not be null");
            }
            this.entityClass = entityClass;
        }

        public Builder<E> config(EntityTypeConfig config) {
            configBuilder.typeName(config.typeName())
                    .collectionName(config.collectionName())
                    .urlBase(config.urlBase());
            return this;
        }

        public Builder<E> typeName(String typeName) {
            configBuilder.typeName(typeName);
            return this;
        }

        public Builder<E> collectionName(String collectionName) {
            configBuilder.collectionName(collectionName);
            return this;
        }

        public Builder<E> urlBase(String urlBase) {
            configBuilder.urlBase(urlBase);
            return this;
        }

        public Builder<E> property(String attributeName, Property property) {
            if (attributeName == null || attributeName.isEmpty()) {
                throw new EntityDefinitionException("Attribute name must not be empty on " + entityClass.getSimpleName());
            }
            if (properties.containsKey(attributeName)) {
                throw new EntityDefinitionException("Attribute " + attributeName + " declared twice on " + entityClass.getSimpleName());
            }
            properties.put(attributeName, property);
            return this;
        }

        public Builder<E> properties(Map<String, ? extends Property> declared) {
            declared.forEach(this::property);
            return this;
        }

        public Builder<E> constructors(Supplier<E> constructor, Function<Map<String, Object>, E> dataConstructor) {
            this.constructor = constructor;
            this.dataConstructor = dataConstructor;
            return this;
        }

        Builder<E> onBuild(Consumer<EntityType<E>> listener) {
            listeners.add(listener);
            return this;
        }

        public EntityType<E> build() {
            validate();
            config = configBuilder.build();
            EntityType<E> type = new EntityType<>(this);
            logger.debug("Defined {} with {} value and {} navigation properties",
                    type, type.valueProperties.size(), type.navigationProperties.size());
            listeners.forEach(listener -> listener.accept(type));
            return type;
        }

        private void validate() {
            String owner = entityClass.getSimpleName();
            if (constructor == null || dataConstructor == null) {
                throw new EntityDefinitionException("No constructors registered for " + owner);
            }
            Set<String> wireNames = new HashSet<>();
            String keyAttribute = null;
            for (Map.Entry<String, Property> entry : properties.entrySet()) {
                Property property = entry.getValue();
                if (property == null) {
                    throw new EntityDefinitionException("Attribute " + entry.getKey() + " on " + owner + " has no descriptor");
                }
                if (!wireNames.add(property.name())) {
                    throw new EntityDefinitionException("Wire name " + property.name() + " declared twice on " + owner);
                }
                if (property.isPrimaryKey()) {
                    if (property.isNavigation()) {
                        throw new EntityDefinitionException("Navigation property " + entry.getKey() + " on " + owner + " cannot be a primary key");
                    }
                    if (keyAttribute != null) {
                        throw new EntityDefinitionException(owner + " declares primary keys " + keyAttribute + " and " + entry.getKey());
                    }
                    keyAttribute = entry.getKey();
                }
            }
        }
    }
}
