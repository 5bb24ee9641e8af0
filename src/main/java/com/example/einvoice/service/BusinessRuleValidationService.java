package com.example.einvoice.service;

import com.example.einvoice.domain.InvoiceFormat;
import net.sf.saxon.s9api.Processor;
import net.sf.saxon.s9api.QName;
import net.sf.saxon.s9api.SaxonApiException;
import net.sf.saxon.s9api.XPathCompiler;
import net.sf.saxon.s9api.XPathSelector;
import net.sf.saxon.s9api.XdmDestination;
import net.sf.saxon.s9api.XdmItem;
import net.sf.saxon.s9api.XdmNode;
import net.sf.saxon.s9api.XsltCompiler;
import net.sf.saxon.s9api.XsltExecutable;
import net.sf.saxon.s9api.XsltTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamSource;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * EN16931 business-rule validation through the CEN schematron compiled to XSLT 2.0.
 *
 * Handles:
 * - Choosing the CII or UBL rule set from the document's root namespace
 * - Running the transformation with Saxon-HE
 * - Reading the SVRL report into {@code [RULE-ID] text (location: xpath)} entries
 */
@Service
public class BusinessRuleValidationService {

    private static final Logger log = LoggerFactory.getLogger(BusinessRuleValidationService.class);

    public static final String SVRL_NS = "http://purl.oclc.org/dsdl/svrl";

    private static final String CII_RULES = "EN16931-CII-validation.xslt";
    private static final String UBL_RULES = "EN16931-UBL-validation.xslt";

    private static final QName ID = new QName("id");
    private static final QName LOCATION = new QName("location");

    private final ResourceLoader resourceLoader;
    private final String rulesLocation;
    private final Processor processor = new Processor(false);
    private final Map<InvoiceFormat, XsltExecutable> executables = new ConcurrentHashMap<>();

    @Autowired
    public BusinessRuleValidationService(ResourceLoader resourceLoader,
                                         @Value("${einvoice.validation.rules-location:classpath:schematron}") String rulesLocation) {
        this.resourceLoader = resourceLoader;
        this.rulesLocation = rulesLocation.endsWith("/") ? rulesLocation : rulesLocation + "/";
    }

    public BusinessRuleValidationService(String rulesLocation) {
        this(new DefaultResourceLoader(), rulesLocation);
    }

    /**
     * Runs the business rules matching the document's syntax.
     *
     * @return One entry per failed assertion, empty when every rule holds
     * @throws IllegalArgumentException if the root namespace is unknown
     * @throws IllegalStateException if the rule set cannot be loaded
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
        InvoiceFormat format = InvoiceDocumentDetector.detect(document).format();
        return validate(document, format);
    }

    List<String> validate(Document document, InvoiceFormat format) {
        XsltExecutable executable = executables.computeIfAbsent(format, this::compile);
        try {
            XdmNode source = processor.newDocumentBuilder().build(new DOMSource(document));
            XsltTransformer transformer = executable.load();
            transformer.setInitialContextNode(source);
            XdmDestination destination = new XdmDestination();
            transformer.setDestination(destination);
            transformer.transform();

            List<String> errors = readFailedAssertions(destination.getXdmNode());
            log.debug("Business rules ({}): {} failed assertion(s)", format, errors.size());
            return errors;
        } catch (SaxonApiException e) {
            log.error("Business rule validation failed to run", e);
            throw new DocumentProcessingException("Business rule validation failed: " + e.getMessage(), e);
        }
    }

    private List<String> readFailedAssertions(XdmNode report) throws SaxonApiException {
        XPathCompiler xpath = processor.newXPathCompiler();
        xpath.declareNamespace("svrl", SVRL_NS);
        XPathSelector selector = xpath.compile("//svrl:failed-assert").load();
        selector.setContextItem(report);

        List<String> errors = new ArrayList<>();
        for (XdmItem item : selector) {
            XdmNode assertion = (XdmNode) item;
            String id = assertion.getAttributeValue(ID);
            String location = assertion.getAttributeValue(LOCATION);
            String text = xpath.evaluateSingle("normalize-space(svrl:text)", assertion).getStringValue();
            errors.add("[" + (id != null ? id : "UNKNOWN") + "] " + text + " (location: " + location + ")");
        }
        return errors;
    }

    private XsltExecutable compile(InvoiceFormat format) {
        String file = format == InvoiceFormat.CII ? CII_RULES : UBL_RULES;
        Resource resource = resourceLoader.getResource(rulesLocation + file);
        if (!resource.exists()) {
            throw new IllegalStateException("Business rules not found: " + rulesLocation + file);
        }
        try (InputStream in = resource.getInputStream()) {
            XsltCompiler compiler = processor.newXsltCompiler();
            XsltExecutable executable = compiler.compile(new StreamSource(in, resource.getURL().toExternalForm()));
            log.info("Compiled business rules {}", resource.getDescription());
            return executable;
        } catch (SaxonApiException | IOException e) {
            log.error("Failed to compile business rules {}", file, e);
            throw new IllegalStateException("Failed to compile business rules " + file + ": " + e.getMessage(), e);
        }
    }
}
