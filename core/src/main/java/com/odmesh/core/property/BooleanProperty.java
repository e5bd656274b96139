package com.odmesh.core.property;

import com.odmesh.core.HydrationException;

public class BooleanProperty extends ValueProperty<Boolean> {

    public BooleanProperty(String name) {
        super(name, false);
    }

    @Override
    public String escapeValue(Boolean value) {
        return value ? "true" : "false";
    }

    @Override
    protected Boolean fromRaw(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return (Boolean) raw;
        }
        String text = raw.toString().trim();
        if (text.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (text.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        throw new HydrationException("Value of " + name() + " is not a boolean: " + raw);
    }
}
