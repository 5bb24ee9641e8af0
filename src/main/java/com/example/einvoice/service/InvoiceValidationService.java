package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.InvoiceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Two-stage invoice validation: XSD first, then the EN16931 business rules.
 * Business rules only run on a structurally valid document.
 */
@Service
public class InvoiceValidationService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceValidationService.class);

    private final SchemaValidationService schemaValidationService;
    private final BusinessRuleValidationService businessRuleValidationService;

    public InvoiceValidationService(SchemaValidationService schemaValidationService,
                                    BusinessRuleValidationService businessRuleValidationService) {
        this.schemaValidationService = schemaValidationService;
        this.businessRuleValidationService = businessRuleValidationService;
    }

    /**
     * Validates a document, detecting its syntax and profile.
     *
     * @return All findings; empty means the document is compliant
     */
    public List<String> validateXml(byte[] xml) {
        List<String> errors = schemaValidationService.validate(xml);
        return afterSchema(xml, errors);
    }

    public List<String> validateXml(byte[] xml, InvoiceFormat format, FacturXProfile profile) {
        List<String> errors = schemaValidationService.validate(xml, format, profile);
        return afterSchema(xml, errors);
    }

    private List<String> afterSchema(byte[] xml, List<String> schemaErrors) {
        if (!schemaErrors.isEmpty()) {
            log.warn("Schema validation failed with {} error(s); business rules skipped", schemaErrors.size());
            return schemaErrors;
        }
        List<String> ruleErrors = businessRuleValidationService.validate(xml);
        if (!ruleErrors.isEmpty()) {
            log.warn("Business rule validation failed with {} error(s)", ruleErrors.size());
        }
        return ruleErrors;
    }
}
