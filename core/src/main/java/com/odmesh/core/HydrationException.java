package com.odmesh.core;

public class HydrationException extends RuntimeException {
    public HydrationException(String message) {
        super(message);
    }

    public HydrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
