package com.odmesh.core.property;

import com.odmesh.core.HydrationException;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Timestamps travel as ISO-8601 strings; the raw value is left as received until it is read.
 */
public class DatetimeProperty extends ValueProperty<Instant> {

    public DatetimeProperty(String name) {
        super(name, false);
    }

    @Override
    public String escapeValue(Instant value) {
        return DateTimeFormatter.ISO_INSTANT.format(value);
    }

    @Override
    protected Instant fromRaw(Object raw) {
        if (raw == null || raw instanceof Instant) {
            return (Instant) raw;
        }
        try {
            return Instant.parse(raw.toString());
        } catch (DateTimeParseException e) {
            throw new HydrationException("Value of " + name() + " is not an ISO-8601 instant: " + raw, e);
        }
    }
}
