package com.example.docstandards.standard.repository;

import com.example.docstandards.standard.document.StandardDoc;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface StandardRepository extends ReactiveMongoRepository<StandardDoc, String> {

    Flux<StandardDoc> findByLineageIdOrderByVersionAsc(String lineageId);

    /**
     * Current head of a lineage.
     */
    Mono<StandardDoc> findFirstByLineageIdOrderByVersionDesc(String lineageId);

    Flux<StandardDoc> findAllBy(Pageable pageable);
}
