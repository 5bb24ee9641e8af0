package com.example.einvoice.platform;

/**
 * Whether an invoice was sent or received through the platform.
 */
public enum Direction {
    SENT,
    RECEIVED
}
