package com.example.einvoice.service;

import com.example.einvoice.TestInvoices;
import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.InvoiceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InvoiceValidationService.
 * Schema errors must short-circuit the business rules stage.
 */
@ExtendWith(MockitoExtension.class)
class InvoiceValidationServiceTest {

    private static final byte[] XML = "<Invoice/>".getBytes(StandardCharsets.UTF_8);

    @Mock
    private SchemaValidationService schemaValidation;

    @Mock
    private BusinessRuleValidationService businessRules;

    @InjectMocks
    private InvoiceValidationService service;

    @Test
    void validateXml_schemaErrors_skipBusinessRules() {
        when(schemaValidation.validate(XML)).thenReturn(List.of("Line 3: cvc-enumeration-valid"));

        List<String> errors = service.validateXml(XML);

        assertEquals(List.of("Line 3: cvc-enumeration-valid"), errors);
        verify(businessRules, never()).validate(any(byte[].class));
    }

    @Test
    void validateXml_schemaValid_returnsBusinessRuleErrors() {
        when(schemaValidation.validate(XML)).thenReturn(List.of());
        when(businessRules.validate(XML)).thenReturn(List.of("[BR-CO-15] total mismatch (location: /)"));

        List<String> errors = service.validateXml(XML);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("[BR-CO-15]"));
    }

    @Test
    void validateXml_explicitProfile_passesItToSchemaStage() {
        when(schemaValidation.validate(XML, InvoiceFormat.CII, FacturXProfile.EN16931)).thenReturn(List.of());
        when(businessRules.validate(XML)).thenReturn(List.of());

        assertTrue(service.validateXml(XML, InvoiceFormat.CII, FacturXProfile.EN16931).isEmpty());
        verify(schemaValidation, never()).validate(XML);
    }

    @Test
    void validateXml_generatedInvoice_passesBothStages() {
        InvoiceValidationService real = new InvoiceValidationService(
            new SchemaValidationService("classpath:test-schemas"),
            new BusinessRuleValidationService("classpath:test-rules"));
        byte[] xml = new CiiInvoiceGenerator(new TaxCalculationService())
            .generateXml(TestInvoices.standard(), FacturXProfile.EN16931);

        assertTrue(real.validateXml(xml).isEmpty());
    }
}
