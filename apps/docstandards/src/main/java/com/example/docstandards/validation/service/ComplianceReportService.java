package com.example.docstandards.validation.service;

import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.validation.document.ComplianceReportDoc;
import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.ReportStatus;
import com.example.docstandards.validation.repository.ComplianceReportRepository;
import com.example.docstandards.validation.store.ValidationJobStore;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Read side of validation results.
 */
@Service
public class ComplianceReportService {

    private final ComplianceReportRepository reportRepository;
    private final ValidationJobStore jobStore;
    private final DocumentRepository documentRepository;

    public ComplianceReportService(ComplianceReportRepository reportRepository,
                                   ValidationJobStore jobStore,
                                   DocumentRepository documentRepository) {
        this.reportRepository = reportRepository;
        this.jobStore = jobStore;
        this.documentRepository = documentRepository;
    }

    /**
     * Status from the latest job plus the latest report, which may predate that job.
     *
     * @throws NotFoundException unknown document
     */
    @NonNull
    public Mono<DocumentReport> latest(@NonNull String documentId) {
        return requireDocument(documentId)
                .then(Mono.zip(
                        jobStore.findLatestByDocument(documentId).map(Optional::of).defaultIfEmpty(Optional.empty()),
                        reportRepository.findFirstByDocumentIdOrderByGeneratedAtDesc(documentId)
                                .map(Optional::of).defaultIfEmpty(Optional.empty())))
                .map(tuple -> {
                    ValidationJobDoc job = tuple.getT1().orElse(null);
                    return new DocumentReport(
                            documentId,
                            ReportStatus.of(job != null ? job.getState() : null),
                            job,
                            tuple.getT2().orElse(null));
                });
    }

    /**
     * Every report of a document, newest first.
     *
     * @throws NotFoundException unknown document
     */
    @NonNull
    public Flux<ComplianceReportDoc> history(@NonNull String documentId) {
        return requireDocument(documentId)
                .thenMany(reportRepository.findByDocumentIdOrderByGeneratedAtDesc(documentId));
    }

    private Mono<Void> requireDocument(String documentId) {
        return documentRepository.existsById(documentId)
                .flatMap(exists -> exists
                        ? Mono.<Void>empty()
                        : Mono.error(new NotFoundException("Document", documentId)));
    }

    public record DocumentReport(
            String documentId,
            ReportStatus status,
            ValidationJobDoc latestJob,
            ComplianceReportDoc report
    ) {}
}
