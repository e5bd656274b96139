package com.odmesh.core.property;

public class StringProperty extends ValueProperty<String> {

    public StringProperty(String name) {
        this(name, false);
    }

    public StringProperty(String name, boolean primaryKey) {
        super(name, primaryKey);
    }

    @Override
    public String escapeValue(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    protected String fromRaw(Object raw) {
        return raw == null ? null : raw.toString();
    }
}
