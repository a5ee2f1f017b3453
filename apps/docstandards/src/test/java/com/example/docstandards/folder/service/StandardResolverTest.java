package com.example.docstandards.folder.service;

import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.document.FolderDoc;
import com.example.docstandards.folder.model.Resolution;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.folder.repository.FolderRepository;
import com.example.docstandards.util.FolderTreeStubs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
@DisplayName("StandardResolver")
class StandardResolverTest {

    @Mock
    private FolderRepository folderRepository;

    @Mock
    private DocumentRepository documentRepository;

    private FolderTreeStubs tree;
    private StandardResolver resolver;

    @BeforeEach
    void setUp() {
        tree = new FolderTreeStubs(folderRepository, documentRepository);
        resolver = new StandardResolver(folderRepository, documentRepository);

        // root -> finance (std-finance) -> reports -> q1
        tree.folder("root", null);
        tree.folder("finance", "root", "std-finance");
        tree.folder("reports", "finance");
        tree.folder("q1", "reports");
        tree.folder("hr", "root");
    }

    @Nested
    @DisplayName("resolveStandard")
    class ResolveStandard {

        @Test
        @DisplayName("should inherit the nearest ancestor assignment")
        void shouldInheritNearestAssignment() {
            tree.document("doc-1", "q1");

            StepVerifier.create(resolver.resolveStandard("doc-1"))
                    .assertNext(resolution -> {
                        assertThat(resolution.standardId()).isEqualTo("std-finance");
                        assertThat(resolution.source()).isEqualTo(Resolution.Source.FOLDER);
                        assertThat(resolution.sourceId()).isEqualTo("finance");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should prefer a closer assignment")
        void shouldPreferCloserAssignment() {
            tree.getFolder("reports").setAssignedStandardId("std-reports");
            tree.document("doc-1", "q1");

            StepVerifier.create(resolver.resolveStandard("doc-1"))
                    .assertNext(resolution -> assertThat(resolution.standardId()).isEqualTo("std-reports"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should let an override win over any folder assignment")
        void shouldPreferOverride() {
            DocumentDoc document = tree.document("doc-1", "q1");
            document.setOverrideStandardId("std-special");

            StepVerifier.create(resolver.resolveStandard("doc-1"))
                    .assertNext(resolution -> {
                        assertThat(resolution.standardId()).isEqualTo("std-special");
                        assertThat(resolution.source()).isEqualTo(Resolution.Source.OVERRIDE);
                        assertThat(resolution.sourceId()).isEqualTo("doc-1");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should resolve to none when no ancestor has an assignment")
        void shouldResolveToNone() {
            tree.document("doc-1", "hr");

            StepVerifier.create(resolver.resolveStandard("doc-1"))
                    .assertNext(resolution -> {
                        assertThat(resolution.isResolved()).isFalse();
                        assertThat(resolution.source()).isEqualTo(Resolution.Source.NONE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail for an unknown document")
        void shouldFailForUnknownDocument() {
            StepVerifier.create(resolver.resolveStandard("missing"))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("effectiveStandard")
    class EffectiveStandard {

        @Test
        @DisplayName("should report the folder's own assignment")
        void shouldReportOwnAssignment() {
            StepVerifier.create(resolver.effectiveStandard("finance"))
                    .assertNext(resolution -> assertThat(resolution.sourceId()).isEqualTo("finance"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail for an unknown folder")
        void shouldFailForUnknownFolder() {
            StepVerifier.create(resolver.effectiveStandard("missing"))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("ancestry")
    class Ancestry {

        @Test
        @DisplayName("should walk from the folder up to the root")
        void shouldWalkToRoot() {
            StepVerifier.create(resolver.ancestry(tree.getFolder("q1")).map(FolderDoc::getId))
                    .expectNext("q1", "reports", "finance", "root")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail on a broken parent chain")
        void shouldFailOnBrokenChain() {
            FolderDoc orphan = tree.folder("orphan", "deleted-parent");

            StepVerifier.create(resolver.ancestry(orphan))
                    .expectNextCount(1)
                    .expectError(IllegalStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("should stop walking a parent cycle")
        void shouldStopOnCycle() {
            tree.folder("loop-a", "loop-b");
            tree.folder("loop-b", "loop-a");

            StepVerifier.create(resolver.ancestry(tree.getFolder("loop-a")))
                    .expectNextCount(StandardResolver.MAX_DEPTH)
                    .expectError(IllegalStateException.class)
                    .verify();
        }
    }
}
