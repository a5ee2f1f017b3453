package com.example.docstandards.folder.repository;

import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.model.DocumentLifecycle;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface DocumentRepository extends ReactiveMongoRepository<DocumentDoc, String> {

    Flux<DocumentDoc> findByFolderIdAndLifecycle(String folderId, DocumentLifecycle lifecycle);

    Flux<DocumentDoc> findByFolderId(String folderId);
}
