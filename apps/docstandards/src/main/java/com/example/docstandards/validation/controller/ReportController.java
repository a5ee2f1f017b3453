package com.example.docstandards.validation.controller;

import com.example.docstandards.validation.model.response.DocumentReportResponse;
import com.example.docstandards.validation.model.response.ReportResponse;
import com.example.docstandards.validation.service.ComplianceReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
public class ReportController {

    private final ComplianceReportService reportService;

    @GetMapping("/{documentId}/report")
    public Mono<DocumentReportResponse> getLatestReport(@PathVariable String documentId) {
        log.debug("GET /documents/{}/report", documentId);
        return reportService.latest(documentId).map(DocumentReportResponse::from);
    }

    @GetMapping("/{documentId}/reports")
    public Mono<List<ReportResponse>> getReportHistory(@PathVariable String documentId) {
        log.debug("GET /documents/{}/reports", documentId);
        return reportService.history(documentId)
                .map(ReportResponse::from)
                .collectList();
    }
}
