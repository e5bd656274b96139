package com.odmesh.core;

public class UnresolvedNavigationException extends RuntimeException {
    public UnresolvedNavigationException(String message) {
        super(message);
    }

    public UnresolvedNavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
