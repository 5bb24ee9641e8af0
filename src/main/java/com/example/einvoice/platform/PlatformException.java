package com.example.einvoice.platform;

/**
 * Base class of failures reported by a filing platform.
 */
public class PlatformException extends RuntimeException {

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
