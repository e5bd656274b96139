package com.odmesh.core;

public class EntityDefinitionException extends RuntimeException {
    public EntityDefinitionException(String message) {
        super(message);
    }

    public EntityDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
