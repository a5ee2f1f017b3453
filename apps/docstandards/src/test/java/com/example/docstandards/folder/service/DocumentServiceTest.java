package com.example.docstandards.folder.service;

import com.example.docstandards.audit.document.AuditEventDoc;
import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.blob.InMemoryBlobStore;
import com.example.docstandards.common.concurrent.KeyedMutex;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.ConflictException;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.model.DocumentLifecycle;
import com.example.docstandards.folder.model.Resolution;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.folder.repository.FolderRepository;
import com.example.docstandards.observability.metrics.ValidationMetrics;
import com.example.docstandards.standard.document.StandardDoc;
import com.example.docstandards.standard.service.StandardRegistry;
import com.example.docstandards.util.FolderTreeStubs;
import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.EnqueueResult;
import com.example.docstandards.validation.model.JobTrigger;
import com.example.docstandards.validation.service.ValidationJobService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.example.docstandards.util.OdfTestDocuments.aGoldenDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentService")
class DocumentServiceTest {

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
    private InMemoryBlobStore blobStore;
    private AppProperties properties;
    private DocumentService service;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getDocuments().setMaxFileSizeMb(1);

        tree = new FolderTreeStubs(folderRepository, documentRepository);
        tree.folder("root", null);
        tree.folder("finance", "root", "std-finance");
        tree.folder("hr", "root");

        blobStore = new InMemoryBlobStore();
        KeyedMutex keyedMutex = new KeyedMutex(properties);
        StandardResolver resolver = new StandardResolver(folderRepository, documentRepository);
        FolderTreeService folderTreeService = new FolderTreeService(folderRepository, documentRepository, resolver,
                standardRegistry, jobService, keyedMutex, auditLedger);

        service = new DocumentService(documentRepository, folderTreeService, resolver, standardRegistry,
                jobService, blobStore, keyedMutex, auditLedger, new ValidationMetrics(new SimpleMeterRegistry()),
                properties);

        lenient().when(auditLedger.append(any(), anyString(), any(), any()))
                .thenReturn(Mono.just(AuditEventDoc.builder().id(1L).build()));
        lenient().when(jobService.enqueue(any(DocumentDoc.class), any(JobTrigger.class), anyString()))
                .thenAnswer(inv -> {
                    DocumentDoc document = inv.getArgument(0);
                    JobTrigger trigger = inv.getArgument(1);
                    return Mono.just(EnqueueResult.created(ValidationJobDoc.builder()
                            .id("job-" + document.getId())
                            .documentId(document.getId())
                            .contentKey(document.getContentKey())
                            .trigger(trigger)
                            .build()));
                });
    }

    @Nested
    @DisplayName("upload")
    class Upload {

        @Test
        @DisplayName("should store content, record revision 1 and enqueue validation")
        void shouldUploadAndEnqueue() {
            byte[] content = aGoldenDocument().build();

            StepVerifier.create(service.upload("finance", "report.odt", content, ACTOR))
                    .assertNext(change -> {
                        DocumentDoc document = change.document();
                        assertThat(document.getFolderId()).isEqualTo("finance");
                        assertThat(document.getRevision()).isEqualTo(1);
                        assertThat(document.getLifecycle()).isEqualTo(DocumentLifecycle.ACTIVE);
                        assertThat(document.getContentType()).isEqualTo("application/vnd.oasis.opendocument.text");
                        assertThat(document.getContentKey()).startsWith("sha256/");
                        assertThat(document.getSizeBytes()).isEqualTo(content.length);
                        assertThat(change.job()).isNotNull();
                        assertThat(change.job().getTrigger()).isEqualTo(JobTrigger.UPLOAD);
                    })
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.UPLOAD), eq(ACTOR), any(EntityRef.class), any());
        }

        @Test
        @DisplayName("should strip path segments from the filename")
        void shouldSanitizeFilename() {
            StepVerifier.create(service.upload("finance", "../../etc/report.odt", aGoldenDocument().build(), ACTOR))
                    .assertNext(change -> assertThat(change.document().getFilename()).isEqualTo("report.odt"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a non-ODF extension")
        void shouldRejectUnsupportedType() {
            byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

            StepVerifier.create(service.upload("finance", "notes.docx", content, ACTOR))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(IllegalArgumentException.class)
                            .hasMessageContaining("Unsupported file type: docx"))
                    .verify();

            verify(documentRepository, never()).save(any(DocumentDoc.class));
        }

        @Test
        @DisplayName("should reject empty content")
        void shouldRejectEmpty() {
            StepVerifier.create(service.upload("finance", "empty.odt", new byte[0], ACTOR))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject content over the size limit")
        void shouldRejectOversized() {
            byte[] content = new byte[1024 * 1024 + 1];

            StepVerifier.create(service.upload("finance", "huge.odt", content, ACTOR))
                    .expectErrorSatisfies(error -> assertThat(error).hasMessageContaining("1MB"))
                    .verify();
        }

        @Test
        @DisplayName("should fail for an unknown folder")
        void shouldFailForUnknownFolder() {
            StepVerifier.create(service.upload("missing", "report.odt", aGoldenDocument().build(), ACTOR))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("revise")
    class Revise {

        @Test
        @DisplayName("should bump the revision and enqueue REVISE for new content")
        void shouldReviseAndEnqueue() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.revise("doc-1", aGoldenDocument().build(), ACTOR))
                    .assertNext(change -> {
                        assertThat(change.document().getRevision()).isEqualTo(2);
                        assertThat(change.job().getTrigger()).isEqualTo(JobTrigger.REVISE);
                        assertThat(change.job().getContentKey()).isEqualTo(change.document().getContentKey());
                    })
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.DOCUMENT_REVISE), eq(ACTOR),
                    eq(EntityRef.document("doc-1")), any());
        }

        @Test
        @DisplayName("should be a no-op for identical content")
        void shouldIgnoreIdenticalContent() {
            byte[] content = aGoldenDocument().build();
            String key = blobStore.put(content, "application/vnd.oasis.opendocument.text").block().key();
            tree.document("doc-1", "finance").setContentKey(key);

            StepVerifier.create(service.revise("doc-1", content, ACTOR))
                    .assertNext(change -> {
                        assertThat(change.document().getRevision()).isEqualTo(1);
                        assertThat(change.job()).isNull();
                    })
                    .verifyComplete();

            verify(jobService, never()).enqueue(any(DocumentDoc.class), any(), anyString());
        }

        @Test
        @DisplayName("should refuse to revise an archived document")
        void shouldRefuseArchived() {
            tree.document("doc-1", "finance").setLifecycle(DocumentLifecycle.ARCHIVED);

            StepVerifier.create(service.revise("doc-1", aGoldenDocument().build(), ACTOR))
                    .expectError(ConflictException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("move")
    class Move {

        @Test
        @DisplayName("should move the document and enqueue MOVE")
        void shouldMoveAndEnqueue() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.move("doc-1", "hr", ACTOR))
                    .assertNext(change -> {
                        assertThat(change.document().getFolderId()).isEqualTo("hr");
                        assertThat(change.job().getTrigger()).isEqualTo(JobTrigger.MOVE);
                    })
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.DOCUMENT_MOVE), eq(ACTOR), eq(EntityRef.document("doc-1")),
                    eq(Map.of("fromFolderId", "finance", "toFolderId", "hr")));
        }

        @Test
        @DisplayName("should be a no-op within the same folder")
        void shouldIgnoreSameFolder() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.move("doc-1", "finance", ACTOR))
                    .assertNext(change -> assertThat(change.job()).isNull())
                    .verifyComplete();

            verify(auditLedger, never()).append(any(), anyString(), any(), any());
        }

        @Test
        @DisplayName("should fail for an unknown target folder")
        void shouldFailForUnknownTarget() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.move("doc-1", "missing", ACTOR))
                    .expectError(NotFoundException.class)
                    .verify();

            assertThat(tree.getDocument("doc-1").getFolderId()).isEqualTo("finance");
        }
    }

    @Nested
    @DisplayName("setOverride")
    class SetOverride {

        @BeforeEach
        void stubStandards() {
            lenient().when(standardRegistry.get(anyString()))
                    .thenAnswer(inv -> Mono.just(StandardDoc.builder().id(inv.getArgument(0)).version(1).build()));
        }

        @Test
        @DisplayName("should set an override and enqueue OVERRIDE")
        void shouldSetOverride() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.setOverride("doc-1", "std-special", ACTOR))
                    .assertNext(change -> {
                        assertThat(change.document().getOverrideStandardId()).isEqualTo("std-special");
                        assertThat(change.job().getTrigger()).isEqualTo(JobTrigger.OVERRIDE);
                    })
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.OVERRIDE_SET), eq(ACTOR), eq(EntityRef.document("doc-1")),
                    eq(Map.of("standardId", "std-special")));
        }

        @Test
        @DisplayName("should clear an override")
        void shouldClearOverride() {
            tree.document("doc-1", "finance").setOverrideStandardId("std-special");

            StepVerifier.create(service.setOverride("doc-1", null, ACTOR))
                    .assertNext(change -> assertThat(change.document().getOverrideStandardId()).isNull())
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.OVERRIDE_CLEAR), eq(ACTOR), eq(EntityRef.document("doc-1")),
                    eq(Map.of("previousStandardId", "std-special")));
        }

        @Test
        @DisplayName("should be a no-op when the override is unchanged")
        void shouldIgnoreUnchangedOverride() {
            tree.document("doc-1", "finance").setOverrideStandardId("std-special");

            StepVerifier.create(service.setOverride("doc-1", "std-special", ACTOR))
                    .assertNext(change -> assertThat(change.job()).isNull())
                    .verifyComplete();

            verify(jobService, never()).enqueue(any(DocumentDoc.class), any(), anyString());
        }
    }

    @Nested
    @DisplayName("archive")
    class Archive {

        @Test
        @DisplayName("should archive an active document once")
        void shouldArchiveOnce() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.archive("doc-1", ACTOR))
                    .assertNext(document -> assertThat(document.getLifecycle()).isEqualTo(DocumentLifecycle.ARCHIVED))
                    .verifyComplete();
            StepVerifier.create(service.archive("doc-1", ACTOR))
                    .expectNextCount(1)
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.DOCUMENT_ARCHIVE), eq(ACTOR),
                    eq(EntityRef.document("doc-1")), any());
        }
    }

    @Nested
    @DisplayName("getDocumentView")
    class GetDocumentView {

        @Test
        @DisplayName("should include the resolved Standard")
        void shouldIncludeResolvedStandard() {
            tree.document("doc-1", "finance");
            StandardDoc standard = StandardDoc.builder().id("std-finance").name("Finance").version(2).build();
            when(standardRegistry.findById("std-finance")).thenReturn(Mono.just(standard));

            StepVerifier.create(service.getDocumentView("doc-1"))
                    .assertNext(view -> {
                        assertThat(view.resolution().source()).isEqualTo(Resolution.Source.FOLDER);
                        assertThat(view.standard()).isSameAs(standard);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report an exempt document without a Standard")
        void shouldReportExemptDocument() {
            tree.document("doc-1", "hr");

            StepVerifier.create(service.getDocumentView("doc-1"))
                    .assertNext(view -> {
                        assertThat(view.resolution().isResolved()).isFalse();
                        assertThat(view.standard()).isNull();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("rename")
    class Rename {

        @Test
        @DisplayName("should rename and audit without re-enqueueing")
        void shouldRename() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.rename("doc-1", "Q3 Report.odt", ACTOR))
                    .assertNext(document -> assertThat(document.getFilename()).isEqualTo("Q3 Report.odt"))
                    .verifyComplete();

            verify(auditLedger).append(eq(AuditEventKind.DOCUMENT_RENAME), eq(ACTOR), eq(EntityRef.document("doc-1")),
                    eq(Map.of("previousName", "doc-1.odt", "name", "Q3 Report.odt")));
            verify(jobService, never()).enqueue(any(DocumentDoc.class), any(JobTrigger.class), anyString());
        }

        @Test
        @DisplayName("should strip path segments and keep a case-changed extension")
        void shouldSanitizeName() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.rename("doc-1", "../archive/Final.ODT", ACTOR))
                    .assertNext(document -> assertThat(document.getFilename()).isEqualTo("Final.ODT"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to change the file type")
        void shouldRejectExtensionChange() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.rename("doc-1", "doc-1.ods", ACTOR))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            assertThat(tree.getDocument("doc-1").getFilename()).isEqualTo("doc-1.odt");
        }

        @Test
        @DisplayName("should refuse to rename an archived document")
        void shouldRejectArchived() {
            tree.document("doc-1", "finance").setLifecycle(DocumentLifecycle.ARCHIVED);

            StepVerifier.create(service.rename("doc-1", "renamed.odt", ACTOR))
                    .expectError(ConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should be a no-op for the current name")
        void shouldSkipSameName() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.rename("doc-1", "doc-1.odt", ACTOR))
                    .expectNextCount(1)
                    .verifyComplete();
            verify(auditLedger, never()).append(any(), anyString(), any(), any());
        }
    }

    @Nested
    @DisplayName("documentsIn")
    class DocumentsIn {

        @Test
        @DisplayName("should list every document of the folder or only one lifecycle")
        void shouldListByLifecycle() {
            tree.document("doc-1", "finance");
            tree.document("doc-2", "finance").setLifecycle(DocumentLifecycle.ARCHIVED);
            tree.document("doc-3", "hr");

            StepVerifier.create(service.documentsIn("finance", null).map(DocumentDoc::getId))
                    .expectNext("doc-1", "doc-2")
                    .verifyComplete();
            StepVerifier.create(service.documentsIn("finance", DocumentLifecycle.ACTIVE).map(DocumentDoc::getId))
                    .expectNext("doc-1")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail for an unknown folder")
        void shouldFailForUnknownFolder() {
            StepVerifier.create(service.documentsIn("missing", null))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("getContent")
    class GetContent {

        @Test
        @DisplayName("should return the bytes of the current revision")
        void shouldReturnCurrentContent() {
            byte[] content = aGoldenDocument().build();
            DocumentDoc uploaded = service.upload("finance", "report.odt", content, ACTOR).block().document();

            StepVerifier.create(service.getContent(uploaded.getId()))
                    .assertNext(result -> {
                        assertThat(result.document().getId()).isEqualTo(uploaded.getId());
                        assertThat(result.content()).isEqualTo(content);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail when the blob is missing")
        void shouldFailForMissingBlob() {
            tree.document("doc-1", "finance");

            StepVerifier.create(service.getContent("doc-1"))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }
}
