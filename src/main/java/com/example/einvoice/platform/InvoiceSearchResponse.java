package com.example.einvoice.platform;

import java.util.List;

/**
 * One page of search results.
 *
 * @param totalCount number of matches over all pages
 */
public record InvoiceSearchResponse(List<InvoiceSearchResult> results, int totalCount, int page, int pageSize) {

    public InvoiceSearchResponse {
        results = List.copyOf(results);
    }
}
