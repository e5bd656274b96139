package com.odmesh.core;

import com.odmesh.core.property.DatetimeProperty;
import com.odmesh.core.property.IntegerProperty;
import com.odmesh.core.property.StringProperty;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.tailoredshapes.stash.Stash.stash;
import static org.junit.jupiter.api.Assertions.*;

class DeclarativeBaseTest {
    private static final IntegerProperty ID = new IntegerProperty("Id", true);
    private static final DatetimeProperty CREATED = new DatetimeProperty("Created");
    private static final DatetimeProperty MODIFIED = new DatetimeProperty("Modified");

    private static DeclarativeBase base() {
        return new DeclarativeBase()
                .property("id", ID)
                .property("createdDate", CREATED)
                .property("modifiedDate", MODIFIED);
    }

    static class Widget extends Entity {
        static final StringProperty NAME = new StringProperty("WidgetName");

        Widget(EntityType<Widget> type) {
            super(type);
        }

        Widget(EntityType<Widget> type, Map<String, Object> data) {
            super(type, data);
        }

        boolean didSomebodyTouchThis() {
            Instant created = CREATED.get(this);
            Instant modified = MODIFIED.get(this);
            return created != null && !created.equals(modified);
        }
    }

    static class Gadget extends Entity {
        Gadget(EntityType<Gadget> type, Map<String, Object> data) {
            super(type, data);
        }
    }

    private static EntityType<Widget> widgets(DeclarativeBase base) {
        AtomicReference<EntityType<Widget>> type = new AtomicReference<>();
        type.set(base.entity(Widget.class)
                .collectionName("Widgets")
                .property("name", Widget.NAME)
                .constructors(() -> new Widget(type.get()), data -> new Widget(type.get(), data))
                .build());
        return type.get();
    }

    private static EntityType<Gadget> gadgets(DeclarativeBase base) {
        AtomicReference<EntityType<Gadget>> type = new AtomicReference<>();
        type.set(base.entity(Gadget.class)
                .collectionName("Gadgets")
                .constructors(() -> new Gadget(type.get(), null), data -> new Gadget(type.get(), data))
                .build());
        return type.get();
    }

    @Test
    void testBasePropertiesComeFirst() {
        EntityType<Widget> type = widgets(base());

        assertEquals(List.of("id", "createdDate", "modifiedDate", "name"), List.copyOf(type.properties().keySet()));
        assertSame(ID, type.primaryKeyProperty().orElseThrow());
    }

    @Test
    void testBasePropertiesHydrate() {
        EntityType<Widget> type = widgets(base());

        Widget widget = type.fromData(stash(
                "Id", 4,
                "WidgetName", "sprocket",
                "Created", "2024-01-01T00:00:00Z",
                "Modified", "2024-02-01T00:00:00Z"));

        assertEquals("Entity(Widget:4)", widget.toString());
        assertEquals("sprocket", Widget.NAME.get(widget));
        assertTrue(widget.didSomebodyTouchThis());
        assertFalse(type.newInstance().didSomebodyTouchThis());
    }

    @Test
    void testBindSetsUrlOnRegisteredTypes() {
        DeclarativeBase base = base();
        EntityType<Widget> widgetType = widgets(base);
        EntityType<Gadget> gadgetType = gadgets(base);

        assertEquals(List.of(widgetType, gadgetType), base.types());
        assertEquals("Widgets", widgetType.url());

        base.bind("https://svc/odata/");

        assertEquals("https://svc/odata/Widgets", widgetType.url());
        assertEquals("https://svc/odata/Gadgets", gadgetType.url());
    }

    @Test
    void testTypesDefinedAfterBindInheritUrl() {
        DeclarativeBase base = base();
        base.bind("https://svc/");

        EntityType<Gadget> gadgetType = gadgets(base);

        assertEquals("https://svc/Gadgets", gadgetType.url());
        assertEquals("https://svc/", base.serviceUrl());
    }

    @Test
    void testBindBeforeBuildAppliesToPendingType() {
        DeclarativeBase base = base();
        AtomicReference<EntityType<Gadget>> type = new AtomicReference<>();
        EntityType.Builder<Gadget> builder = base.entity(Gadget.class)
                .collectionName("Gadgets")
                .constructors(() -> new Gadget(type.get(), null), data -> new Gadget(type.get(), data));

        base.bind("https://svc/late/");
        type.set(builder.build());

        assertEquals("https://svc/late/Gadgets", type.get().url());
        assertEquals(List.of(type.get()), base.types());
    }

    @Test
    void testKeyEqualityIgnoresOtherFields() {
        DeclarativeBase base = base();
        EntityType<Widget> widgetType = widgets(base);

        assertEquals(widgetType.fromData(stash("Id", 1)), widgetType.fromData(stash("Id", 1, "WidgetName", "cog")));
    }

    @Test
    void testDuplicateBaseAttributeIsRejected() {
        assertThrows(EntityDefinitionException.class, () -> base().property("id", new IntegerProperty("Other")));
    }
}
