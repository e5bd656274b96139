package com.odmesh.core.property;

import com.odmesh.core.HydrationException;
import com.odmesh.core.TestModel.LogEntry;
import com.odmesh.core.TestModel.Product;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.tailoredshapes.stash.Stash.stash;
import static org.junit.jupiter.api.Assertions.*;

class ValuePropertyTest {

    @Test
    void testStringEscapingDoublesQuotes() {
        StringProperty property = new StringProperty("Name");

        assertEquals("'Kettle'", property.escapeValue("Kettle"));
        assertEquals("'O''Brien'", property.escapeValue("O'Brien"));
        assertEquals("null", property.escapeRaw(null));
    }

    @Test
    void testIntegerAcceptsAnyNumber() {
        Product product = new Product(stash("ProductID", 7L, "QuantityInStorage", "12"));

        assertEquals(7, product.getId());
        assertEquals(12, product.getQuantityInStorage());
        assertEquals("7", Product.ID.escapeRaw(7L));
    }

    @Test
    void testIntegerRejectsText() {
        Product product = new Product(stash("QuantityInStorage", "plenty"));

        assertThrows(HydrationException.class, product::getQuantityInStorage);
    }

    @Test
    void testIntegerRejectsOverflowAndFractions() {
        assertThrows(HydrationException.class, () -> new Product(stash("ProductID", 4294967301L)).getId());
        assertThrows(HydrationException.class, () -> new Product(stash("ProductID", 2.9)).getId());
        assertThrows(HydrationException.class, () -> new Product(stash("QuantityInStorage", 4294967301L)).getQuantityInStorage());
        assertThrows(HydrationException.class, () -> new Product(stash("QuantityInStorage", 2.9)).getQuantityInStorage());
        assertThrows(HydrationException.class, () -> Product.ID.fromRaw(Double.NaN));
        assertEquals(2, new Product(stash("ProductID", 2.0)).getId());
        assertEquals(Integer.MAX_VALUE, Product.ID.fromRaw((long) Integer.MAX_VALUE));
    }

    @Test
    void testOutOfRangeKeyDoesNotCollideWithInRangeKey() {
        Product wide = new Product(stash("ProductID", 4294967301L));
        Product narrow = new Product(stash("ProductID", 5));

        assertNotEquals(wide, narrow);
        assertEquals("Entity(Product:4294967301)", wide.toString());
    }

    @Test
    void testBooleanCoercion() {
        BooleanProperty property = new BooleanProperty("Discontinued");

        assertEquals(Boolean.TRUE, property.fromRaw("TRUE"));
        assertEquals(Boolean.FALSE, property.fromRaw(false));
        assertNull(property.fromRaw(null));
        assertEquals("true", property.escapeValue(true));
        assertThrows(HydrationException.class, () -> property.fromRaw("maybe"));
    }

    @Test
    void testDatetimeParsesIsoText() {
        LogEntry entry = new LogEntry(stash("Message", "started", "Logged", "2024-03-01T10:15:30Z"));

        assertEquals(Instant.parse("2024-03-01T10:15:30Z"), entry.getLogged());
        assertEquals("2024-03-01T10:15:30Z", LogEntry.LOGGED.escapeValue(entry.getLogged()));
    }

    @Test
    void testDatetimeRejectsGarbage() {
        LogEntry entry = new LogEntry(stash("Logged", "yesterday"));

        assertThrows(HydrationException.class, entry::getLogged);
    }

    @Test
    void testDatetimeWriteKeepsInstant() {
        LogEntry entry = new LogEntry();
        Instant now = Instant.parse("2024-03-01T10:15:30Z");

        LogEntry.LOGGED.set(entry, now);

        assertSame(now, entry.state().get("Logged"));
        assertEquals(List.of("Logged"), entry.state().dirtyFields());
    }

    @Test
    void testEmptyWireNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StringProperty(""));
    }
}
