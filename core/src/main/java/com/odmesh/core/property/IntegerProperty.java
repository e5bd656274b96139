package com.odmesh.core.property;

import com.odmesh.core.HydrationException;

import java.math.BigDecimal;

public class IntegerProperty extends ValueProperty<Integer> {

    public IntegerProperty(String name) {
        this(name, false);
    }

    public IntegerProperty(String name, boolean primaryKey) {
        super(name, primaryKey);
    }

    @Override
    public String escapeValue(Integer value) {
        return value.toString();
    }

    @Override
    protected Integer fromRaw(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Integer) {
            return (Integer) raw;
        }
        if (raw instanceof Number) {
            try {
                return new BigDecimal(raw.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new HydrationException("Value of " + name() + " does not fit an integer: " + raw, e);
            }
        }
        try {
            return Integer.valueOf(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new HydrationException("Value of " + name() + " is not an integer: " + raw, e);
        }
    }
}
