package com.example.einvoice.platform;

public enum EReportingSubmissionStatus {
    ACCEPTED,
    REJECTED,
    PENDING
}
