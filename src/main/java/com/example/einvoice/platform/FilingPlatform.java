package com.example.einvoice.platform;

import com.example.einvoice.domain.EReportingSubmission;
import com.example.einvoice.domain.Invoice;
import com.example.einvoice.domain.InvoiceStatus;

import java.math.BigDecimal;

/**
 * Exchange contract with a certified filing platform (AFNOR XP Z12-013).
 *
 * Implementations report failures with the {@link PlatformException} hierarchy
 * and never retry on their own. Remote implementations add
 * {@link PlatformAuthenticationException} for rejected credentials and
 * {@link PlatformConnectionException} for transport failures.
 */
public interface FilingPlatform {

    /**
     * Deposits an invoice.
     *
     * @param xml Pre-generated XML, may be null when the platform generates it
     * @param pdf The readable PDF, may be null
     * @throws PlatformValidationException if the invoice is not compliant
     */
    SubmissionResponse submit(Invoice invoice, byte[] xml, byte[] pdf);

    /**
     * @throws PlatformNotFoundException for an unknown invoice
     */
    InvoiceStatus getStatus(String invoiceId);

    LifecycleResponse getLifecycle(String invoiceId);

    /**
     * @return The invoice XML
     */
    byte[] getInvoice(String invoiceId);

    InvoiceSearchResponse searchInvoices(InvoiceSearchFilters filters);

    /**
     * Moves an invoice along its lifecycle.
     *
     * @param reason Mandatory for a refusal
     * @param amount Cashed amount for a partial collection
     * @throws PlatformValidationException if the transition is not allowed
     */
    StatusUpdateResponse updateStatus(String invoiceId, InvoiceStatus status,
                                      String reason, String reasonCode, BigDecimal amount);

    /**
     * @throws PlatformNotFoundException if the SIREN is not in the directory
     */
    DirectoryEntry lookupDirectory(String siren);

    EReportingSubmissionResponse submitEReportingTransaction(EReportingSubmission submission);

    EReportingSubmissionResponse submitEReportingPayment(EReportingSubmission submission);

    EReportingSubmissionResponse getEReportingStatus(String submissionId);
}
