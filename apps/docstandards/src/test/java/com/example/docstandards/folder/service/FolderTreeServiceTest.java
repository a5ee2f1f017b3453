package com.example.docstandards.folder.service;

import com.example.docstandards.audit.document.AuditEventDoc;
import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.common.concurrent.KeyedMutex;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.ConflictException;
import com.example.docstandards.exception.CycleRejectedException;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.exception.TransientStorageException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.model.DocumentLifecycle;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.folder.repository.FolderRepository;
import com.example.docstandards.standard.document.StandardDoc;
import com.example.docstandards.standard.service.StandardRegistry;
import com.example.docstandards.util.FolderTreeStubs;
import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.EnqueueResult;
import com.example.docstandards.validation.model.JobTrigger;
import com.example.docstandards.validation.service.ValidationJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FolderTreeService")
class FolderTreeServiceTest {

    private static final String ACTOR = "editor-1";

    @Mock
    private FolderRepository folderRepository;

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private StandardRegistry standardRegistry;

    @Mock
    private ValidationJobService jobService;

    @Mock
    private AuditLedger auditLedger;

    private FolderTreeStubs tree;
    private FolderTreeService service;

    @BeforeEach
    void setUp() {
        tree = new FolderTreeStubs(folderRepository, documentRepository);
        StandardResolver resolver = new StandardResolver(folderRepository, documentRepository);
        service = new FolderTreeService(folderRepository, documentRepository, resolver, standardRegistry,
                jobService, new KeyedMutex(new AppProperties()), auditLedger);

        lenient().when(auditLedger.append(any(), anyString(), any(), any()))
                .thenReturn(Mono.just(AuditEventDoc.builder().id(1L).build()));
        lenient().when(jobService.enqueue(any(DocumentDoc.class), any(JobTrigger.class), anyString()))
                .thenAnswer(inv -> {
                    DocumentDoc document = inv.getArgument(0);
                    return Mono.just(EnqueueResult.created(ValidationJobDoc.builder()
                            .id("job-" + document.getId())
                            .documentId(document.getId())
                            .build()));
                });
    }

    private void seedTree() {
        // root -> finance -> reports ; root -> hr
        tree.folder("root", null);
        tree.folder("finance", "root");
        tree.folder("reports", "finance");
        tree.folder("hr", "root");
    }

    @Nested
    @DisplayName("createFolder")
    class CreateFolder {

        @Test
        @DisplayName("should create the root when none exists")
        void shouldCreateRoot() {
            StepVerifier.create(service.createFolder(" Company ", null, ACTOR))
                    .assertNext(folder -> {
                        assertThat(folder.isRoot()).isTrue();
                        assertThat(folder.getName()).isEqualTo("Company");
                        assertThat(folder.getCreatedBy()).isEqualTo(ACTOR);
                    })
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.FOLDER_CREATE), eq(ACTOR), any(EntityRef.class), any());
        }

        @Test
        @DisplayName("should refuse a second root")
        void shouldRefuseSecondRoot() {
            seedTree();

            StepVerifier.create(service.createFolder("Another root", null, ACTOR))
                    .expectErrorSatisfies(error -> assertThat(((ConflictException) error).getReason())
                            .isEqualTo(ConflictException.ROOT_EXISTS))
                    .verify();

            assertThat(tree.folderCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should create a child under an existing parent")
        void shouldCreateChild() {
            seedTree();

            StepVerifier.create(service.createFolder("Payroll", "hr", ACTOR))
                    .assertNext(folder -> assertThat(folder.getParentId()).isEqualTo("hr"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail for an unknown parent")
        void shouldFailForUnknownParent() {
            seedTree();

            StepVerifier.create(service.createFolder("Orphan", "missing", ACTOR))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("moveFolder")
    class MoveFolder {

        @BeforeEach
        void seed() {
            seedTree();
        }

        @Test
        @DisplayName("should reject moving a folder under its own descendant")
        void shouldRejectDescendantTarget() {
            StepVerifier.create(service.moveFolder("finance", "reports", ACTOR))
                    .expectError(CycleRejectedException.class)
                    .verify();

            assertThat(tree.getFolder("finance").getParentId()).isEqualTo("root");
            verify(auditLedger, never()).append(any(), anyString(), any(), any());
        }

        @Test
        @DisplayName("should reject moving a folder under itself")
        void shouldRejectSelfTarget() {
            StepVerifier.create(service.moveFolder("hr", "hr", ACTOR))
                    .expectError(CycleRejectedException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse to move the root")
        void shouldRefuseRootMove() {
            StepVerifier.create(service.moveFolder("root", "hr", ACTOR))
                    .expectError(ConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should treat a move to the current parent as a no-op")
        void shouldIgnoreSameParent() {
            StepVerifier.create(service.moveFolder("reports", "finance", ACTOR))
                    .assertNext(folder -> assertThat(folder.getParentId()).isEqualTo("finance"))
                    .verifyComplete();

            verify(auditLedger, never()).append(any(), anyString(), any(), any());
            verify(jobService, never()).enqueue(any(DocumentDoc.class), any(), anyString());
        }

        @Test
        @DisplayName("should re-parent and revalidate documents whose inheritance changed")
        void shouldMoveAndRevalidate() {
            tree.getFolder("hr").setAssignedStandardId("std-hr");
            tree.document("doc-1", "reports");

            StepVerifier.create(service.moveFolder("reports", "hr", ACTOR))
                    .assertNext(folder -> assertThat(folder.getParentId()).isEqualTo("hr"))
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.FOLDER_MOVE), eq(ACTOR), eq(EntityRef.folder("reports")),
                    eq(Map.of("fromParentId", "finance", "toParentId", "hr")));
            verify(jobService).enqueue(argThat((DocumentDoc d) -> "doc-1".equals(d.getId())),
                    eq(JobTrigger.MOVE), eq(ACTOR));
        }

        @Test
        @DisplayName("should not revalidate when the moved folder has its own assignment")
        void shouldNotRevalidateShadowedMove() {
            tree.getFolder("reports").setAssignedStandardId("std-reports");
            tree.document("doc-1", "reports");

            StepVerifier.create(service.moveFolder("reports", "hr", ACTOR))
                    .expectNextCount(1)
                    .verifyComplete();

            verify(jobService, never()).enqueue(any(DocumentDoc.class), any(), anyString());
        }
    }

    @Nested
    @DisplayName("assignStandard")
    class AssignStandard {

        @BeforeEach
        void seed() {
            seedTree();
            lenient().when(standardRegistry.get(anyString()))
                    .thenAnswer(inv -> Mono.just(StandardDoc.builder().id(inv.getArgument(0)).version(1).build()));
        }

        @Test
        @DisplayName("should assign and enqueue every inheriting active document")
        void shouldAssignAndRevalidate() {
            tree.document("doc-finance", "finance");
            tree.document("doc-reports", "reports");
            tree.document("doc-archived", "reports").setLifecycle(DocumentLifecycle.ARCHIVED);
            tree.document("doc-override", "reports").setOverrideStandardId("std-own");
            tree.document("doc-hr", "hr");

            StepVerifier.create(service.assignStandard("finance", "std-1", ACTOR))
                    .assertNext(result -> {
                        assertThat(result.changed()).isTrue();
                        assertThat(result.previousStandardId()).isNull();
                        assertThat(result.revalidatedDocuments()).isEqualTo(2);
                        assertThat(result.folder().getAssignedStandardId()).isEqualTo("std-1");
                    })
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.ASSIGN), eq(ACTOR), eq(EntityRef.folder("finance")),
                    eq(Map.of("standardId", "std-1")));
        }

        @Test
        @DisplayName("should skip subtrees that have their own assignment")
        void shouldSkipShadowedSubtrees() {
            tree.getFolder("reports").setAssignedStandardId("std-reports");
            tree.document("doc-finance", "finance");
            tree.document("doc-reports", "reports");

            StepVerifier.create(service.assignStandard("finance", "std-1", ACTOR))
                    .assertNext(result -> assertThat(result.revalidatedDocuments()).isEqualTo(1))
                    .verifyComplete();

            verify(jobService, never()).enqueue(argThat((DocumentDoc d) -> "doc-reports".equals(d.getId())),
                    any(), anyString());
        }

        @Test
        @DisplayName("should be a no-op when the assignment is unchanged")
        void shouldIgnoreUnchangedAssignment() {
            tree.getFolder("finance").setAssignedStandardId("std-1");
            tree.document("doc-finance", "finance");

            StepVerifier.create(service.assignStandard("finance", "std-1", ACTOR))
                    .assertNext(result -> {
                        assertThat(result.changed()).isFalse();
                        assertThat(result.revalidatedDocuments()).isZero();
                    })
                    .verifyComplete();

            verify(auditLedger, never()).append(any(), anyString(), any(), any());
            verify(jobService, never()).enqueue(any(DocumentDoc.class), any(), anyString());
        }

        @Test
        @DisplayName("should record a reassignment with the previous Standard")
        void shouldRecordReassignment() {
            tree.getFolder("finance").setAssignedStandardId("std-1");

            StepVerifier.create(service.assignStandard("finance", "std-2", ACTOR))
                    .assertNext(result -> assertThat(result.previousStandardId()).isEqualTo("std-1"))
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.REASSIGN), eq(ACTOR), eq(EntityRef.folder("finance")),
                    eq(Map.of("standardId", "std-2", "previousStandardId", "std-1")));
        }

        @Test
        @DisplayName("should clear an assignment and revalidate")
        void shouldClearAssignment() {
            tree.getFolder("finance").setAssignedStandardId("std-1");
            tree.document("doc-finance", "finance");

            StepVerifier.create(service.assignStandard("finance", null, ACTOR))
                    .assertNext(result -> {
                        assertThat(result.folder().getAssignedStandardId()).isNull();
                        assertThat(result.revalidatedDocuments()).isEqualTo(1);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail for an unknown Standard without touching the folder")
        void shouldFailForUnknownStandard() {
            when(standardRegistry.get("missing")).thenReturn(Mono.error(new NotFoundException("Standard", "missing")));

            StepVerifier.create(service.assignStandard("finance", "missing", ACTOR))
                    .expectError(NotFoundException.class)
                    .verify();

            assertThat(tree.getFolder("finance").getAssignedStandardId()).isNull();
        }

        @Test
        @DisplayName("should keep going when one document cannot be enqueued")
        void shouldSkipFailedEnqueue() {
            tree.document("doc-a", "finance");
            tree.document("doc-b", "finance");
            when(jobService.enqueue(argThat((DocumentDoc d) -> d != null && "doc-a".equals(d.getId())),
                    any(JobTrigger.class), anyString()))
                    .thenReturn(Mono.error(new TransientStorageException("store down")));

            StepVerifier.create(service.assignStandard("finance", "std-1", ACTOR))
                    .assertNext(result -> assertThat(result.revalidatedDocuments()).isEqualTo(1))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("subtreeLockKeys")
    class SubtreeLockKeys {

        @BeforeEach
        void seed() {
            seedTree();
        }

        @Test
        @DisplayName("should lock the top-level subtree of a nested folder")
        void shouldLockTopLevelSubtree() {
            StepVerifier.create(service.subtreeLockKeys("reports"))
                    .assertNext(keys -> assertThat(keys).containsExactly("tree:finance"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should lock the whole tree for the root")
        void shouldLockWholeTreeForRoot() {
            StepVerifier.create(service.subtreeLockKeys("root"))
                    .assertNext(keys -> assertThat(keys)
                            .containsExactlyInAnyOrder(FolderTreeService.ROOT_LOCK, "tree:finance", "tree:hr"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("renameFolder")
    class RenameFolder {

        @Test
        @DisplayName("should rename and audit without re-enqueueing")
        void shouldRename() {
            seedTree();
            tree.document("doc-1", "finance");

            StepVerifier.create(service.renameFolder("finance", "  Finance & Accounting ", ACTOR))
                    .assertNext(folder -> assertThat(folder.getName()).isEqualTo("Finance & Accounting"))
                    .verifyComplete();

            assertThat(tree.getFolder("finance").getName()).isEqualTo("Finance & Accounting");
            verify(auditLedger).append(eq(AuditEventKind.FOLDER_RENAME), eq(ACTOR), eq(EntityRef.folder("finance")),
                    eq(Map.of("previousName", "finance", "name", "Finance & Accounting")));
            verify(jobService, never()).enqueue(any(DocumentDoc.class), any(JobTrigger.class), anyString());
        }

        @Test
        @DisplayName("should rename the root")
        void shouldRenameRoot() {
            seedTree();

            StepVerifier.create(service.renameFolder("root", "Company", ACTOR))
                    .assertNext(folder -> assertThat(folder.getName()).isEqualTo("Company"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be a no-op for the current name")
        void shouldSkipSameName() {
            seedTree();

            StepVerifier.create(service.renameFolder("hr", "hr", ACTOR))
                    .assertNext(folder -> assertThat(folder.getName()).isEqualTo("hr"))
                    .verifyComplete();

            verify(auditLedger, never()).append(any(), anyString(), any(), any());
        }

        @Test
        @DisplayName("should reject a blank name and an unknown folder")
        void shouldRejectInvalid() {
            seedTree();

            StepVerifier.create(service.renameFolder("hr", "   ", ACTOR))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            StepVerifier.create(service.renameFolder("missing", "Missing", ACTOR))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }
}
