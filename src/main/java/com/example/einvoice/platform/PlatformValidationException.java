package com.example.einvoice.platform;

import java.util.ArrayList;
import java.util.List;

/**
 * The platform rejected the request content.
 */
public class PlatformValidationException extends PlatformException {

    private final List<String> reasons = new ArrayList<>();

    public PlatformValidationException(String message) {
        super(message);
    }

    public PlatformValidationException(String message, List<String> reasons) {
        super(message);
        this.reasons.addAll(reasons);
    }

    public PlatformValidationException(String message, Throwable cause) {
        super(message, cause);
        this.reasons.add(cause.getMessage());
    }

    public List<String> getReasons() {
        return new ArrayList<>(reasons);
    }
}
