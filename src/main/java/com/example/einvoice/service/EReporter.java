package com.example.einvoice.service;

import com.example.einvoice.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Prepares e-reporting data for one seller: B2C and international transactions,
 * aggregated declarations, and payment data for services taxed on receipts.
 *
 * Handles:
 * - Extracting transaction data from an invoice
 * - Validating transactions, payments and aggregates
 * - Building submissions for the filing platform
 * - The transmission calendar of the seller's VAT regime
 */
public class EReporter {

    private static final Logger log = LoggerFactory.getLogger(EReporter.class);

    public static final String FREQUENCY_TEN_DAYS = "every 10 days";
    public static final String FREQUENCY_MONTHLY = "monthly";

    /**
     * @param paymentFrequency null when the regime has no payment reporting
     */
    public record TransmissionSchedule(String transactionFrequency, String paymentFrequency) {
    }

    private final String sellerSiren;
    private final VatRegime vatRegime;
    private final TaxCalculationService taxCalculationService;
    private final Clock clock;

    public EReporter(String sellerSiren, VatRegime vatRegime) {
        this(sellerSiren, vatRegime, new TaxCalculationService(), Clock.systemUTC());
    }

    public EReporter(String sellerSiren, VatRegime vatRegime,
                     TaxCalculationService taxCalculationService, Clock clock) {
        if (!Party.isValidSiren(sellerSiren)) {
            throw new IllegalArgumentException("Invalid SIREN: " + sellerSiren + " (9 digits expected)");
        }
        if (vatRegime == null) {
            throw new IllegalArgumentException("VAT regime is required");
        }
        this.sellerSiren = sellerSiren;
        this.vatRegime = vatRegime;
        this.taxCalculationService = taxCalculationService;
        this.clock = clock;
    }

    // ==================== Invoice extraction ====================

    public EReportingTransaction transactionFromInvoice(Invoice invoice, EReportingTransactionType type) {
        return transactionFromInvoice(invoice, type, null);
    }

    /**
     * Builds transaction data from an invoice. The dominant VAT rate is the one
     * carrying the largest taxable base.
     */
    public EReportingTransaction transactionFromInvoice(Invoice invoice, EReportingTransactionType type,
                                                        String countryCode) {
        InvoiceTotals totals = taxCalculationService.compute(invoice);
        BigDecimal rate = totals.dominantRate();
        boolean exempt = totals.taxSummaries().stream()
            .allMatch(s -> s.category() == VatCategory.EXEMPT || s.category() == VatCategory.OUTSIDE_SCOPE);

        return EReportingTransaction.builder()
            .sellerSiren(invoice.getSeller().getSiren())
            .transactionType(type)
            .invoiceDate(invoice.getIssueDate())
            .invoiceNumber(invoice.getNumber())
            .period(invoice.getBillingPeriodStart(), invoice.getBillingPeriodEnd())
            .operationCategory(invoice.getOperationCategory())
            .totalExclTax(totals.netTotal())
            .vatAmount(totals.taxTotal())
            .vatRate(exempt ? null : rate)
            .vatExemption(exempt)
            .vatOnDebits(invoice.isVatOnDebits())
            .countryCode(countryCode)
            .currency(invoice.getCurrency())
            .build();
    }

    // ==================== Validation ====================

    /**
     * @return Human-readable errors, empty when the transaction is reportable
     */
    public List<String> validateTransaction(EReportingTransaction transaction) {
        List<String> errors = new ArrayList<>();
        checkSiren(transaction.getSellerSiren(), errors);

        if (transaction.getInvoiceDate() == null
                && (transaction.getPeriodStart() == null || transaction.getPeriodEnd() == null)) {
            errors.add("Invoice date or a complete period (start and end) is required");
        }
        checkPeriod(transaction.getPeriodStart(), transaction.getPeriodEnd(), errors);

        if (transaction.getVatRate() == null && !transaction.isVatExemption()) {
            errors.add("VAT rate is required unless the operation is VAT exempt");
        }

        if (transaction.getTransactionType().isInternational()) {
            String country = transaction.getCountryCode();
            if (country == null || country.isBlank()) {
                errors.add("Country code is required for international transactions");
            } else if ("FR".equalsIgnoreCase(country)) {
                errors.add("Country code cannot be FR for an international transaction");
            }
        }
        return errors;
    }

    public List<String> validatePayment(EReportingPayment payment) {
        List<String> errors = new ArrayList<>();
        checkSiren(payment.sellerSiren(), errors);
        if (payment.cashingDate() == null) {
            errors.add("Cashing date is required");
        }
        if (payment.cashedAmount() == null) {
            errors.add("Cashed amount is required");
        } else if (payment.cashedAmount().signum() <= 0) {
            errors.add("Cashed amount must be positive");
        }
        if (payment.invoiceReference() == null || payment.invoiceReference().isBlank()) {
            errors.add("Invoice reference is required");
        }
        return errors;
    }

    /**
     * @throws EReportingEmptyDeclarationException if every amount of the aggregate is zero
     */
    public List<String> validateAggregated(EReportingAggregate aggregate) {
        List<String> errors = new ArrayList<>();
        checkSiren(aggregate.sellerSiren(), errors);
        if (aggregate.periodStart() == null || aggregate.periodEnd() == null) {
            errors.add("Aggregation period start and end are required");
        }
        checkPeriod(aggregate.periodStart(), aggregate.periodEnd(), errors);

        boolean allZero = aggregate.taxBreakdowns().stream()
            .allMatch(b -> b.taxableAmount().signum() == 0 && b.vatAmount().signum() == 0);
        if (allZero) {
            throw new EReportingEmptyDeclarationException(
                "Empty declaration for " + aggregate.periodStart() + " to " + aggregate.periodEnd()
                    + ": no operations, nothing to transmit");
        }
        return errors;
    }

    private void checkSiren(String siren, List<String> errors) {
        if (!sellerSiren.equals(siren)) {
            errors.add("Seller SIREN " + siren + " does not match the reporting SIREN " + sellerSiren);
        }
    }

    private static void checkPeriod(LocalDate start, LocalDate end, List<String> errors) {
        if (start != null && end != null && start.isAfter(end)) {
            errors.add("Period start " + start + " is after period end " + end);
        }
    }

    // ==================== Submissions ====================

    public EReportingSubmission prepareTransaction(EReportingTransaction transaction) {
        return prepareTransactions(List.of(transaction));
    }

    /**
     * Builds an individual submission whose period covers every transaction.
     *
     * @throws EReportingValidationException with the errors of all transactions
     */
    public EReportingSubmission prepareTransactions(List<EReportingTransaction> transactions) {
        if (transactions.isEmpty()) {
            throw new EReportingEmptyDeclarationException("No transactions to report");
        }
        List<String> errors = new ArrayList<>();
        for (EReportingTransaction transaction : transactions) {
            for (String error : validateTransaction(transaction)) {
                errors.add(label(transaction) + ": " + error);
            }
        }
        if (!errors.isEmpty()) {
            throw new EReportingValidationException(errors);
        }

        LocalDate start = transactions.stream().map(EReporter::startOf).filter(Objects::nonNull)
            .min(Comparator.naturalOrder()).orElse(null);
        LocalDate end = transactions.stream().map(EReporter::endOf).filter(Objects::nonNull)
            .max(Comparator.naturalOrder()).orElse(null);

        EReportingSubmission submission = new EReportingSubmission(
            UUID.randomUUID().toString(), EReportingTransmissionMode.INDIVIDUAL, sellerSiren, vatRegime,
            start, end, transactions, null, null, Instant.now(clock));
        log.info("Prepared e-reporting submission {} with {} transaction(s) for SIREN {}",
            submission.submissionId(), transactions.size(), sellerSiren);
        return submission;
    }

    public EReportingSubmission prepareAggregated(EReportingAggregate aggregate) {
        List<String> errors = validateAggregated(aggregate);
        if (!errors.isEmpty()) {
            throw new EReportingValidationException(errors);
        }
        EReportingSubmission submission = new EReportingSubmission(
            UUID.randomUUID().toString(), EReportingTransmissionMode.AGGREGATED, sellerSiren, vatRegime,
            aggregate.periodStart(), aggregate.periodEnd(), List.of(), aggregate, null, Instant.now(clock));
        log.info("Prepared aggregated e-reporting submission {} for SIREN {} ({} to {})",
            submission.submissionId(), sellerSiren, aggregate.periodStart(), aggregate.periodEnd());
        return submission;
    }

    public EReportingSubmission preparePayment(EReportingPayment payment) {
        List<String> errors = validatePayment(payment);
        if (!errors.isEmpty()) {
            throw new EReportingValidationException(errors);
        }
        EReportingSubmission submission = new EReportingSubmission(
            UUID.randomUUID().toString(), EReportingTransmissionMode.INDIVIDUAL, sellerSiren, vatRegime,
            payment.cashingDate(), payment.cashingDate(), List.of(), null, payment, Instant.now(clock));
        log.info("Prepared payment e-reporting submission {} for invoice {}",
            submission.submissionId(), payment.invoiceReference());
        return submission;
    }

    // ==================== Aggregation ====================

    /**
     * Sums transactions per (VAT rate, exemption) pair.
     *
     * @throws EReportingEmptyDeclarationException if the list is empty
     * @throws EReportingValidationException if the transactions belong to several sellers
     */
    public EReportingAggregate aggregateTransactions(List<EReportingTransaction> transactions,
                                                     LocalDate periodStart, LocalDate periodEnd) {
        if (transactions.isEmpty()) {
            throw new EReportingEmptyDeclarationException(
                "No transactions between " + periodStart + " and " + periodEnd + ": nothing to transmit");
        }
        long sirens = transactions.stream().map(EReportingTransaction::getSellerSiren).distinct().count();
        if (sirens > 1) {
            throw new EReportingValidationException(List.of("All transactions must have the same SIREN"));
        }

        Map<BreakdownKey, BigDecimal[]> sums = new LinkedHashMap<>();
        for (EReportingTransaction transaction : transactions) {
            BigDecimal rate = transaction.getVatRate() != null ? transaction.getVatRate().stripTrailingZeros() : null;
            BigDecimal[] sum = sums.computeIfAbsent(new BreakdownKey(rate, transaction.isVatExemption()),
                k -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            sum[0] = sum[0].add(transaction.getTotalExclTax());
            sum[1] = sum[1].add(transaction.getVatAmount());
        }

        List<TaxBreakdown> breakdowns = new ArrayList<>();
        sums.forEach((key, sum) -> breakdowns.add(new TaxBreakdown(key.rate(), key.exempt(), sum[0], sum[1])));

        EReportingTransaction first = transactions.get(0);
        boolean vatOnDebits = transactions.stream().anyMatch(EReportingTransaction::isVatOnDebits);
        return new EReportingAggregate(first.getSellerSiren(), periodStart, periodEnd,
            first.getOperationCategory(), breakdowns, vatOnDebits);
    }

    private record BreakdownKey(BigDecimal rate, boolean exempt) {
    }

    // ==================== Calendar ====================

    public TransmissionSchedule getTransmissionSchedule() {
        return switch (vatRegime) {
            case REAL_NORMAL_MONTHLY, REAL_NORMAL_QUARTERLY -> new TransmissionSchedule(FREQUENCY_TEN_DAYS, FREQUENCY_MONTHLY);
            case SIMPLIFIED_REAL -> new TransmissionSchedule(FREQUENCY_MONTHLY, FREQUENCY_MONTHLY);
            case FRANCHISE -> new TransmissionSchedule(FREQUENCY_MONTHLY, null);
        };
    }

    /**
     * Next transaction deadline strictly after {@code date}: the 10th, the 20th or
     * the last day of the month for ten-day reporting, the end of next month otherwise.
     */
    public LocalDate nextTransactionDeadline(LocalDate date) {
        if (FREQUENCY_TEN_DAYS.equals(getTransmissionSchedule().transactionFrequency())) {
            LocalDate monthEnd = YearMonth.from(date).atEndOfMonth();
            if (date.getDayOfMonth() < 10) {
                return date.withDayOfMonth(10);
            }
            if (date.getDayOfMonth() < 20) {
                return date.withDayOfMonth(20);
            }
            if (date.isBefore(monthEnd)) {
                return monthEnd;
            }
            return date.plusMonths(1).withDayOfMonth(10);
        }
        return YearMonth.from(date).plusMonths(1).atEndOfMonth();
    }

    /**
     * @return End of next month, or empty when the regime has no payment reporting
     */
    public Optional<LocalDate> nextPaymentDeadline(LocalDate date) {
        if (getTransmissionSchedule().paymentFrequency() == null) {
            return Optional.empty();
        }
        return Optional.of(YearMonth.from(date).plusMonths(1).atEndOfMonth());
    }

    public String getSellerSiren() {
        return sellerSiren;
    }

    public VatRegime getVatRegime() {
        return vatRegime;
    }

    private static String label(EReportingTransaction transaction) {
        return transaction.getInvoiceNumber() != null ? transaction.getInvoiceNumber() : transaction.getTransactionId();
    }

    private static LocalDate startOf(EReportingTransaction transaction) {
        return transaction.getPeriodStart() != null ? transaction.getPeriodStart() : transaction.getInvoiceDate();
    }

    private static LocalDate endOf(EReportingTransaction transaction) {
        return transaction.getPeriodEnd() != null ? transaction.getPeriodEnd() : transaction.getInvoiceDate();
    }
}
