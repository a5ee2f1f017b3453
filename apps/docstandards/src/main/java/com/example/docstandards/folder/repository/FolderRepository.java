package com.example.docstandards.folder.repository;

import com.example.docstandards.folder.document.FolderDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface FolderRepository extends ReactiveMongoRepository<FolderDoc, String> {

    Flux<FolderDoc> findByParentId(String parentId);

    /**
     * The root. More than one result means the tree is corrupt.
     */
    Flux<FolderDoc> findByParentIdIsNull();
}
