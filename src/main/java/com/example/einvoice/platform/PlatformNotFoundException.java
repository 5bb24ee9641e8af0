package com.example.einvoice.platform;

public class PlatformNotFoundException extends PlatformException {

    public PlatformNotFoundException(String message) {
        super(message);
    }
}
