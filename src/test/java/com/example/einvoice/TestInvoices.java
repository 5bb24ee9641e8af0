package com.example.einvoice;

import com.example.einvoice.domain.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Invoices shared by the service tests.
 */
public final class TestInvoices {

    public static final String SELLER_SIREN = "123456789";
    public static final String BUYER_SIREN = "987654321";

    private TestInvoices() {
    }

    public static Party seller() {
        return Party.builder()
            .name("OptiPaulo SARL")
            .siren(SELLER_SIREN)
            .siret("12345678900012")
            .vatNumber("FR12345678901")
            .email("factures@optipaulo.fr")
            .address(new Address("12 rue des Opticiens", "Créteil", "94000"))
            .build();
    }

    public static Party buyer() {
        return Party.builder()
            .name("LunettesPlus SA")
            .siren(BUYER_SIREN)
            .vatNumber("FR98765432101")
            .address(new Address("5 avenue de la Vision", "Paris", "75011"))
            .build();
    }

    public static InvoiceLine line(String description, String quantity, String unitPrice, String rate) {
        return InvoiceLine.builder()
            .description(description)
            .quantity(quantity)
            .unitPrice(unitPrice)
            .vatRate(rate)
            .build();
    }

    /**
     * Base builder: two lines at 5.5% and 20%, due date set.
     */
    public static Invoice.Builder standardBuilder() {
        return Invoice.builder()
            .number("FA-2026-001")
            .issueDate(LocalDate.of(2026, 9, 15))
            .dueDate(LocalDate.of(2026, 10, 15))
            .operationCategory(OperationCategory.DELIVERY)
            .seller(seller())
            .buyer(buyer())
            .buyerReference("SERVICE-ACHATS")
            .purchaseOrderReference("PO-2026-17")
            .paymentTerms(new PaymentTerms("Paiement à 30 jours"))
            .paymentMeans(new PaymentMeans(PaymentMeansCode.SEPA_CREDIT_TRANSFER,
                new BankAccount("FR76 3000 6000 0112 3456 7890 189", "AGRIFRPP"), "FA-2026-001"))
            .addLine(line("Monture acétate", "100", "2.00", "5.5"))
            .addLine(line("Verres progressifs", "50", "3.00", "20.0"));
    }

    public static Invoice standard() {
        return standardBuilder().build();
    }

    /**
     * Single 20% line of 1200.00.
     */
    public static Invoice singleRate() {
        return standardBuilder()
            .number("FA-2026-042")
            .lines(List.of(line("Lunettes de soleil", "10", "120.00", "20.0")))
            .build();
    }

    public static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }
}
