package com.example.einvoice.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when transaction, payment or aggregate data fails the e-reporting rules.
 * Carries every error found, not only the first.
 */
public class EReportingValidationException extends EReportingException {

    private final List<String> errors = new ArrayList<>();

    public EReportingValidationException(String message) {
        super(message);
    }

    public EReportingValidationException(List<String> errors) {
        super(buildMessage(errors));
        this.errors.addAll(errors);
    }

    public List<String> getErrors() {
        return new ArrayList<>(errors);
    }

    private static String buildMessage(List<String> errors) {
        if (errors.isEmpty()) {
            return "E-reporting validation failed";
        }
        StringBuilder message = new StringBuilder("E-reporting validation failed with ")
            .append(errors.size())
            .append(" error(s):\n");
        for (String error : errors) {
            message.append("- ").append(error).append("\n");
        }
        return message.toString();
    }
}
