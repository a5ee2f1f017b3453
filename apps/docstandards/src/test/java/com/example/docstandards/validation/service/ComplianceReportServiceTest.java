package com.example.docstandards.validation.service;

import com.example.docstandards.compliance.model.Verdict;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.validation.document.ComplianceReportDoc;
import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.JobState;
import com.example.docstandards.validation.model.ReportStatus;
import com.example.docstandards.validation.repository.ComplianceReportRepository;
import com.example.docstandards.validation.store.ValidationJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ComplianceReportService")
class ComplianceReportServiceTest {

    @Mock
    private ComplianceReportRepository reportRepository;

    @Mock
    private ValidationJobStore jobStore;

    @Mock
    private DocumentRepository documentRepository;

    private ComplianceReportService service;

    @BeforeEach
    void setUp() {
        service = new ComplianceReportService(reportRepository, jobStore, documentRepository);
    }

    private static ComplianceReportDoc report(String jobId, Instant generatedAt) {
        return ComplianceReportDoc.builder()
                .id(ComplianceReportDoc.idForJob(jobId))
                .jobId(jobId)
                .documentId("doc-1")
                .standardId("std-1")
                .standardVersion(1)
                .contentKey("sha256/abc")
                .findings(List.of())
                .verdict(Verdict.COMPLIANT)
                .generatedAt(generatedAt)
                .build();
    }

    @Nested
    @DisplayName("latest")
    class Latest {

        @Test
        @DisplayName("should report NOT_YET_VALIDATED for a document without jobs")
        void shouldReportNotYetValidated() {
            when(documentRepository.existsById("doc-1")).thenReturn(Mono.just(true));
            when(jobStore.findLatestByDocument("doc-1")).thenReturn(Mono.empty());
            when(reportRepository.findFirstByDocumentIdOrderByGeneratedAtDesc("doc-1")).thenReturn(Mono.empty());

            StepVerifier.create(service.latest("doc-1"))
                    .assertNext(view -> {
                        assertThat(view.status()).isEqualTo(ReportStatus.NOT_YET_VALIDATED);
                        assertThat(view.latestJob()).isNull();
                        assertThat(view.report()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report PENDING with the previous report while a newer job runs")
        void shouldReportPendingWithPreviousReport() {
            ComplianceReportDoc previous = report("job-1", Instant.parse("2024-05-01T10:00:00Z"));
            ValidationJobDoc running = ValidationJobDoc.builder()
                    .id("job-2").documentId("doc-1").state(JobState.RUNNING).build();
            when(documentRepository.existsById("doc-1")).thenReturn(Mono.just(true));
            when(jobStore.findLatestByDocument("doc-1")).thenReturn(Mono.just(running));
            when(reportRepository.findFirstByDocumentIdOrderByGeneratedAtDesc("doc-1"))
                    .thenReturn(Mono.just(previous));

            StepVerifier.create(service.latest("doc-1"))
                    .assertNext(view -> {
                        assertThat(view.status()).isEqualTo(ReportStatus.PENDING);
                        assertThat(view.latestJob().getId()).isEqualTo("job-2");
                        assertThat(view.report().getJobId()).isEqualTo("job-1");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject unknown documents")
        void shouldRejectUnknownDocument() {
            when(documentRepository.existsById("missing")).thenReturn(Mono.just(false));

            StepVerifier.create(service.latest("missing"))
                    .expectError(NotFoundException.class)
                    .verify();

            verify(jobStore, never()).findLatestByDocument("missing");
        }
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "QUEUED, PENDING",
            "RUNNING, PENDING",
            "SUCCEEDED, COMPLETED",
            "SKIPPED, SKIPPED",
            "FAILED, FAILED"
    })
    @DisplayName("should derive the report status from the latest job state")
    void shouldMapJobState(JobState state, ReportStatus expected) {
        assertThat(ReportStatus.of(state)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should list history newest first")
    void shouldListHistory() {
        ComplianceReportDoc newer = report("job-2", Instant.parse("2024-05-02T10:00:00Z"));
        ComplianceReportDoc older = report("job-1", Instant.parse("2024-05-01T10:00:00Z"));
        when(documentRepository.existsById("doc-1")).thenReturn(Mono.just(true));
        when(reportRepository.findByDocumentIdOrderByGeneratedAtDesc("doc-1")).thenReturn(Flux.just(newer, older));

        StepVerifier.create(service.history("doc-1"))
                .expectNext(newer, older)
                .verifyComplete();
    }
}
