package com.example.einvoice.platform;

import com.example.einvoice.domain.InvoiceStatus;

import java.time.LocalDate;

/**
 * Invoice search criteria. Every criterion is optional; pages start at 1.
 *
 * @param pageSize between 1 and 500
 */
public record InvoiceSearchFilters(
    InvoiceStatus status,
    LocalDate dateFrom,
    LocalDate dateTo,
    String sellerSiren,
    String buyerSiren,
    Direction direction,
    int page,
    int pageSize
) {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;

    public InvoiceSearchFilters {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be at least 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
    }

    /** No criteria, first page. */
    public static InvoiceSearchFilters all() {
        return new InvoiceSearchFilters(null, null, null, null, null, null, 1, DEFAULT_PAGE_SIZE);
    }

    public InvoiceSearchFilters withStatus(InvoiceStatus status) {
        return new InvoiceSearchFilters(status, dateFrom, dateTo, sellerSiren, buyerSiren, direction, page, pageSize);
    }

    public InvoiceSearchFilters withDates(LocalDate from, LocalDate to) {
        return new InvoiceSearchFilters(status, from, to, sellerSiren, buyerSiren, direction, page, pageSize);
    }

    public InvoiceSearchFilters withSellerSiren(String siren) {
        return new InvoiceSearchFilters(status, dateFrom, dateTo, siren, buyerSiren, direction, page, pageSize);
    }

    public InvoiceSearchFilters withBuyerSiren(String siren) {
        return new InvoiceSearchFilters(status, dateFrom, dateTo, sellerSiren, siren, direction, page, pageSize);
    }

    public InvoiceSearchFilters withDirection(Direction direction) {
        return new InvoiceSearchFilters(status, dateFrom, dateTo, sellerSiren, buyerSiren, direction, page, pageSize);
    }

    public InvoiceSearchFilters withPage(int page, int pageSize) {
        return new InvoiceSearchFilters(status, dateFrom, dateTo, sellerSiren, buyerSiren, direction, page, pageSize);
    }
}
