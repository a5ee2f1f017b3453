package com.example.docstandards.validation.model.response;

import com.example.docstandards.validation.service.ComplianceReportService.DocumentReport;

/**
 * Current validation status of a document. {@code report} is the latest report, if any,
 * and can be older than {@code latestJob} while a revalidation is pending.
 */
public record DocumentReportResponse(
        String documentId,
        String status,
        JobResponse latestJob,
        ReportResponse report
) {
    public static DocumentReportResponse from(DocumentReport view) {
        return new DocumentReportResponse(
                view.documentId(),
                view.status().name(),
                view.latestJob() != null ? JobResponse.from(view.latestJob()) : null,
                view.report() != null ? ReportResponse.from(view.report()) : null);
    }
}
