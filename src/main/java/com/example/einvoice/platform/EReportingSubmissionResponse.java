package com.example.einvoice.platform;

import java.time.Instant;
import java.util.List;

public record EReportingSubmissionResponse(
    String submissionId,
    EReportingSubmissionStatus status,
    Instant submittedAt,
    List<String> errors
) {

    public EReportingSubmissionResponse {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
