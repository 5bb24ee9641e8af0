package com.example.einvoice.platform;

import com.example.einvoice.domain.EReportingSubmission;
import com.example.einvoice.domain.Invoice;
import com.example.einvoice.domain.InvoiceStatus;
import com.example.einvoice.domain.LifecycleEvent;
import com.example.einvoice.lifecycle.InvalidTransitionException;
import com.example.einvoice.lifecycle.LifecycleManager;
import com.example.einvoice.service.EReportingPayloadMapper;
import com.example.einvoice.service.TaxCalculationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filing platform kept in memory, for tests and development.
 *
 * Handles:
 * - Sequential invoice ids ({@code MEM-000001}, ...)
 * - One lifecycle state machine per invoice, starting at DEPOSITED
 * - Paginated search over sent and received invoices
 * - A simulated central directory
 * - E-reporting submissions kept as JSON payloads
 *
 * All public methods are synchronized on the instance.
 */
@Service
public class InMemoryFilingPlatform implements FilingPlatform {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFilingPlatform.class);

    private static final byte[] PLACEHOLDER_XML = "<placeholder/>".getBytes(StandardCharsets.UTF_8);

    private final TaxCalculationService taxCalculationService;
    private final EReportingPayloadMapper payloadMapper;
    private final Clock clock;

    private final Map<String, StoredInvoice> invoices = new LinkedHashMap<>();
    private final Map<String, DirectoryEntry> directory = new HashMap<>();
    private final Map<String, StoredSubmission> submissions = new HashMap<>();
    private int counter;

    private record StoredInvoice(String invoiceId, Invoice invoice, byte[] xml, LifecycleManager lifecycle,
                                 LifecycleEvent initialEvent, BigDecimal totalInclTax, Direction direction) {
    }

    private record StoredSubmission(EReportingSubmissionResponse response, String payload) {
    }

    @Autowired
    public InMemoryFilingPlatform(TaxCalculationService taxCalculationService, EReportingPayloadMapper payloadMapper) {
        this(taxCalculationService, payloadMapper, Clock.systemUTC());
    }

    public InMemoryFilingPlatform(TaxCalculationService taxCalculationService, EReportingPayloadMapper payloadMapper,
                                  Clock clock) {
        this.taxCalculationService = taxCalculationService;
        this.payloadMapper = payloadMapper;
        this.clock = clock;
    }

    // ==================== Invoices ====================

    @Override
    public synchronized SubmissionResponse submit(Invoice invoice, byte[] xml, byte[] pdf) {
        StoredInvoice stored = store(invoice, xml != null ? xml : PLACEHOLDER_XML, Direction.SENT);
        log.info("Deposited invoice {} as {}", invoice.getNumber(), stored.invoiceId());
        return new SubmissionResponse(stored.invoiceId(), InvoiceStatus.DEPOSITED, stored.initialEvent().timestamp());
    }

    /**
     * Simulates an incoming invoice.
     *
     * @return The id given to the received invoice
     */
    public synchronized String addReceivedInvoice(Invoice invoice, byte[] xml) {
        StoredInvoice stored = store(invoice, xml, Direction.RECEIVED);
        log.info("Received invoice {} as {}", invoice.getNumber(), stored.invoiceId());
        return stored.invoiceId();
    }

    private StoredInvoice store(Invoice invoice, byte[] xml, Direction direction) {
        String invoiceId = nextId();
        Instant now = Instant.now(clock);
        StoredInvoice stored = new StoredInvoice(
            invoiceId,
            invoice,
            xml,
            new LifecycleManager(invoice.getNumber(), InvoiceStatus.DEPOSITED, clock),
            LifecycleEvent.of(InvoiceStatus.DEPOSITED, now),
            taxCalculationService.compute(invoice).grossTotal(),
            direction
        );
        invoices.put(invoiceId, stored);
        return stored;
    }

    @Override
    public synchronized InvoiceStatus getStatus(String invoiceId) {
        return find(invoiceId).lifecycle().getStatus();
    }

    @Override
    public synchronized LifecycleResponse getLifecycle(String invoiceId) {
        StoredInvoice stored = find(invoiceId);
        List<LifecycleEvent> events = new ArrayList<>();
        events.add(stored.initialEvent());
        events.addAll(stored.lifecycle().getHistory());
        return new LifecycleResponse(invoiceId, stored.lifecycle().getStatus(), events);
    }

    @Override
    public synchronized byte[] getInvoice(String invoiceId) {
        return find(invoiceId).xml().clone();
    }

    @Override
    public synchronized InvoiceSearchResponse searchInvoices(InvoiceSearchFilters filters) {
        InvoiceSearchFilters criteria = filters != null ? filters : InvoiceSearchFilters.all();

        List<InvoiceSearchResult> matches = new ArrayList<>();
        for (StoredInvoice stored : invoices.values()) {
            if (matches(stored, criteria)) {
                Invoice invoice = stored.invoice();
                matches.add(new InvoiceSearchResult(
                    stored.invoiceId(),
                    invoice.getNumber(),
                    invoice.getIssueDate(),
                    invoice.getSeller().getName(),
                    invoice.getBuyer().getName(),
                    stored.totalInclTax(),
                    invoice.getCurrency(),
                    stored.lifecycle().getStatus(),
                    stored.direction()
                ));
            }
        }

        int from = Math.min((criteria.page() - 1) * criteria.pageSize(), matches.size());
        int to = Math.min(from + criteria.pageSize(), matches.size());
        return new InvoiceSearchResponse(matches.subList(from, to), matches.size(), criteria.page(), criteria.pageSize());
    }

    private static boolean matches(StoredInvoice stored, InvoiceSearchFilters criteria) {
        Invoice invoice = stored.invoice();
        if (criteria.status() != null && stored.lifecycle().getStatus() != criteria.status()) {
            return false;
        }
        if (criteria.dateFrom() != null && invoice.getIssueDate().isBefore(criteria.dateFrom())) {
            return false;
        }
        if (criteria.dateTo() != null && invoice.getIssueDate().isAfter(criteria.dateTo())) {
            return false;
        }
        if (criteria.sellerSiren() != null && !criteria.sellerSiren().equals(invoice.getSeller().getSiren())) {
            return false;
        }
        if (criteria.buyerSiren() != null && !criteria.buyerSiren().equals(invoice.getBuyer().getSiren())) {
            return false;
        }
        return criteria.direction() == null || criteria.direction() == stored.direction();
    }

    @Override
    public synchronized StatusUpdateResponse updateStatus(String invoiceId, InvoiceStatus status,
                                                          String reason, String reasonCode, BigDecimal amount) {
        StoredInvoice stored = find(invoiceId);
        try {
            LifecycleEvent event = stored.lifecycle().transition(status, reason, reasonCode, null, amount);
            return new StatusUpdateResponse(invoiceId, status, event.timestamp());
        } catch (InvalidTransitionException e) {
            log.warn("Status update rejected for {}: {}", invoiceId, e.getMessage());
            throw new PlatformValidationException("Status update rejected for " + invoiceId, e);
        }
    }

    // ==================== Directory ====================

    @Override
    public synchronized DirectoryEntry lookupDirectory(String siren) {
        DirectoryEntry entry = directory.get(siren);
        if (entry == null) {
            throw new PlatformNotFoundException("SIREN not found in directory: " + siren);
        }
        return entry;
    }

    public synchronized void addDirectoryEntry(DirectoryEntry entry) {
        directory.put(entry.siren(), entry);
    }

    // ==================== E-reporting ====================

    @Override
    public synchronized EReportingSubmissionResponse submitEReportingTransaction(EReportingSubmission submission) {
        if (submission.transactions().isEmpty() && submission.aggregatedData() == null) {
            throw new PlatformValidationException("Transaction submission " + submission.submissionId()
                + " carries neither transactions nor aggregated data");
        }
        return accept(submission);
    }

    @Override
    public synchronized EReportingSubmissionResponse submitEReportingPayment(EReportingSubmission submission) {
        if (!submission.isPaymentSubmission()) {
            throw new PlatformValidationException("Payment submission " + submission.submissionId()
                + " carries no payment data");
        }
        return accept(submission);
    }

    @Override
    public synchronized EReportingSubmissionResponse getEReportingStatus(String submissionId) {
        StoredSubmission stored = submissions.get(submissionId);
        if (stored == null) {
            throw new PlatformNotFoundException("E-reporting submission not found: " + submissionId);
        }
        return stored.response();
    }

    /**
     * @return The JSON payload recorded for a submission
     */
    public synchronized String getEReportingPayload(String submissionId) {
        StoredSubmission stored = submissions.get(submissionId);
        if (stored == null) {
            throw new PlatformNotFoundException("E-reporting submission not found: " + submissionId);
        }
        return stored.payload();
    }

    private EReportingSubmissionResponse accept(EReportingSubmission submission) {
        String payload = payloadMapper.toJson(submission);
        EReportingSubmissionResponse response = new EReportingSubmissionResponse(
            submission.submissionId(), EReportingSubmissionStatus.ACCEPTED, Instant.now(clock), List.of());
        submissions.put(submission.submissionId(), new StoredSubmission(response, payload));
        log.info("Accepted e-reporting submission {} ({} bytes)", submission.submissionId(), payload.length());
        return response;
    }

    // ==================== Helpers ====================

    private String nextId() {
        counter++;
        return String.format("MEM-%06d", counter);
    }

    private StoredInvoice find(String invoiceId) {
        StoredInvoice stored = invoices.get(invoiceId);
        if (stored == null) {
            throw new PlatformNotFoundException("Invoice not found: " + invoiceId);
        }
        return stored;
    }
}
