package com.example.einvoice.platform;

/**
 * Transport failure: timeout, DNS, TLS.
 */
public class PlatformConnectionException extends PlatformException {

    public PlatformConnectionException(String message) {
        super(message);
    }

    public PlatformConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
