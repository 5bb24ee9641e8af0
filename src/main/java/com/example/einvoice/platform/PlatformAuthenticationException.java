package com.example.einvoice.platform;

/**
 * Invalid credentials, expired token or insufficient rights.
 */
public class PlatformAuthenticationException extends PlatformException {

    public PlatformAuthenticationException(String message) {
        super(message);
    }

    public PlatformAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
