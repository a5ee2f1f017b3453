package com.example.docstandards.validation.model.response;

import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.validation.document.ComplianceReportDoc;

import java.time.Instant;
import java.util.List;

public record ReportResponse(
        String reportId,
        String jobId,
        String documentId,
        String standardId,
        int standardVersion,
        String contentKey,
        String verdict,
        List<Finding> findings,
        Instant generatedAt
) {
    public static ReportResponse from(ComplianceReportDoc report) {
        return new ReportResponse(
                report.getId(),
                report.getJobId(),
                report.getDocumentId(),
                report.getStandardId(),
                report.getStandardVersion(),
                report.getContentKey(),
                report.getVerdict() != null ? report.getVerdict().name() : null,
                report.getFindings() != null ? report.getFindings() : List.of(),
                report.getGeneratedAt());
    }
}
