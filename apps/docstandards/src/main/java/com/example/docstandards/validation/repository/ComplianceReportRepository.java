package com.example.docstandards.validation.repository;

import com.example.docstandards.validation.document.ComplianceReportDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ComplianceReportRepository extends ReactiveMongoRepository<ComplianceReportDoc, String> {

    Mono<ComplianceReportDoc> findFirstByDocumentIdOrderByGeneratedAtDesc(String documentId);

    Flux<ComplianceReportDoc> findByDocumentIdOrderByGeneratedAtDesc(String documentId);
}
