package com.example.einvoice.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point wiring the codec, validator and filing-platform beans.
 */
@SpringBootApplication(scanBasePackages = "com.example.einvoice")
public class EInvoiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EInvoiceApplication.class, args);
    }
}
