package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.InvoiceFormat;
import com.example.einvoice.service.InvoiceDocumentDetector.DetectedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Structural validation of invoice XML against the official XSD.
 *
 * Schemas are loaded from {@code einvoice.validation.schema-location}:
 * - CII: {@code facturx/Factur-X_1.08_<PROFILE>.xsd}
 * - UBL: {@code ubl/maindoc/UBL-Invoice-2.1.xsd} and {@code UBL-CreditNote-2.1.xsd}
 *
 * Every violation is reported as {@code Line N: message}; malformed XML gives a
 * single {@code XML syntax error: ...} entry. Compiled schemas are cached.
 */
@Service
public class SchemaValidationService {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidationService.class);

    private static final String FACTURX_SCHEMA = "facturx/Factur-X_1.08_%s.xsd";
    private static final String UBL_INVOICE_SCHEMA = "ubl/maindoc/UBL-Invoice-2.1.xsd";
    private static final String UBL_CREDIT_NOTE_SCHEMA = "ubl/maindoc/UBL-CreditNote-2.1.xsd";

    private final ResourceLoader resourceLoader;
    private final String schemaLocation;
    private final Map<String, Schema> schemaCache = new ConcurrentHashMap<>();

    @Autowired
    public SchemaValidationService(ResourceLoader resourceLoader,
                                   @Value("${einvoice.validation.schema-location:classpath:schemas}") String schemaLocation) {
        this.resourceLoader = resourceLoader;
        this.schemaLocation = schemaLocation.endsWith("/") ? schemaLocation : schemaLocation + "/";
    }

    public SchemaValidationService(String schemaLocation) {
        this(new DefaultResourceLoader(), schemaLocation);
    }

    /**
     * Validates a document whose format and profile are detected from its content.
     *
     * @param xml Document bytes
     * @return Errors, empty when the document is valid
     * @throws IllegalArgumentException if the root namespace or the profile is unknown
     * @throws IllegalStateException if the schema asset is missing
     */
    public List<String> validate(byte[] xml) {
        Document document;
        try {
            document = XmlSupport.parse(xml);
        } catch (SAXException e) {
            return List.of("XML syntax error: " + e.getMessage());
        } catch (IOException e) {
            throw new DocumentProcessingException("Failed to read XML: " + e.getMessage(), e);
        }
        DetectedDocument detected = InvoiceDocumentDetector.detect(document);
        String schemaPath = schemaPath(detected.format(), detected.profile(), InvoiceDocumentDetector.isCreditNote(document));
        return validateAgainst(xml, schemaPath);
    }

    /**
     * Validates a document against the schema of an explicit format and profile.
     *
     * @param profile ignored for UBL
     */
    public List<String> validate(byte[] xml, InvoiceFormat format, FacturXProfile profile) {
        if (format == InvoiceFormat.CII && profile == null) {
            throw new IllegalArgumentException("A Factur-X profile is required to validate CII");
        }
        boolean creditNote = false;
        if (format == InvoiceFormat.UBL) {
            try {
                creditNote = InvoiceDocumentDetector.isCreditNote(XmlSupport.parse(xml));
            } catch (SAXException e) {
                return List.of("XML syntax error: " + e.getMessage());
            } catch (IOException e) {
                throw new DocumentProcessingException("Failed to read XML: " + e.getMessage(), e);
            }
        }
        return validateAgainst(xml, schemaPath(format, profile, creditNote));
    }

    /**
     * Validates a document against an explicit schema, for instance the full CII D16B
     * schema that every Factur-X profile restricts. Imports are resolved relative to the
     * resource URL.
     *
     * @throws IllegalStateException if the schema does not exist or does not compile
     */
    public List<String> validate(byte[] xml, Resource schema) {
        String key;
        try {
            key = schema.getURL().toExternalForm();
        } catch (IOException e) {
            throw new IllegalStateException("Schema not found: " + schema.getDescription(), e);
        }
        return validateAgainst(xml, key, schemaCache.computeIfAbsent(key, k -> compile(schema, k)));
    }

    private String schemaPath(InvoiceFormat format, FacturXProfile profile, boolean creditNote) {
        return switch (format) {
            case CII -> String.format(FACTURX_SCHEMA, profile.getSchemaName());
            case UBL -> creditNote ? UBL_CREDIT_NOTE_SCHEMA : UBL_INVOICE_SCHEMA;
        };
    }

    private List<String> validateAgainst(byte[] xml, String schemaPath) {
        return validateAgainst(xml, schemaPath, schemaCache.computeIfAbsent(schemaPath, this::loadSchema));
    }

    private List<String> validateAgainst(byte[] xml, String schemaPath, Schema schema) {
        List<String> errors = new ArrayList<>();
        try {
            Validator validator = schema.newValidator();
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            validator.setErrorHandler(new CollectingErrorHandler(errors));
            validator.validate(new StreamSource(new ByteArrayInputStream(xml)));
        } catch (SAXParseException e) {
            // fatal errors are already collected by the handler
            if (errors.isEmpty()) {
                errors.add("XML syntax error: " + e.getMessage());
            }
        } catch (SAXException e) {
            errors.add("XML syntax error: " + e.getMessage());
        } catch (IOException e) {
            throw new DocumentProcessingException("Failed to read XML: " + e.getMessage(), e);
        }
        log.debug("Schema validation against {}: {} error(s)", schemaPath, errors.size());
        return errors;
    }

    private Schema loadSchema(String schemaPath) {
        Resource resource = resourceLoader.getResource(schemaLocation + schemaPath);
        if (!resource.exists()) {
            throw new IllegalStateException("Schema not found: " + schemaLocation + schemaPath);
        }
        return compile(resource, schemaPath);
    }

    private Schema compile(Resource resource, String schemaPath) {
        if (!resource.exists()) {
            throw new IllegalStateException("Schema not found: " + resource.getDescription());
        }
        try {
            SchemaFactory factory = SchemaFactory.newDefaultInstance();
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "file,jar:file");
            Schema schema = factory.newSchema(new StreamSource(resource.getInputStream(), resource.getURL().toExternalForm()));
            log.info("Loaded schema {}", resource.getDescription());
            return schema;
        } catch (SAXException | IOException e) {
            log.error("Failed to load schema {}", schemaPath, e);
            throw new IllegalStateException("Failed to load schema " + schemaPath + ": " + e.getMessage(), e);
        }
    }

    private static final class CollectingErrorHandler implements ErrorHandler {
        private final List<String> errors;

        private CollectingErrorHandler(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public void warning(SAXParseException exception) {
            log.debug("Schema warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) {
            errors.add("Line " + exception.getLineNumber() + ": " + exception.getMessage());
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXParseException {
            errors.add("Line " + exception.getLineNumber() + ": " + exception.getMessage());
            throw exception;
        }
    }
}
