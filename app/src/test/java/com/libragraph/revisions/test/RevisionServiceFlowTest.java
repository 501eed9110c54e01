package com.libragraph.revisions.test;

import com.libragraph.revisions.core.dao.RevisionRecord;
import com.libragraph.revisions.core.diff.DiffResult;
import com.libragraph.revisions.core.error.ResourceConflictException;
import com.libragraph.revisions.core.reconcile.OrphanBlobSweeper;
import com.libragraph.revisions.core.revision.DocumentDetail;
import com.libragraph.revisions.core.revision.DocumentPage;
import com.libragraph.revisions.core.revision.RevisionService;
import com.libragraph.revisions.core.storage.ContentBlobStore;
import com.libragraph.revisions.types.DocumentContent;
import com.libragraph.revisions.types.Section;
import com.libragraph.revisions.types.VersionBump;
import com.libragraph.revisions.util.StorageKeys;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end revision flows against PostgreSQL and MinIO.
 */
@QuarkusTest
@QuarkusTestResource(MinioTestResource.class)
class RevisionServiceFlowTest {

    private static final DocumentContent V1 = DocumentContent.of("Intro",
            List.of(new Section("A", "a1", 1)));
    private static final DocumentContent V2 = DocumentContent.of("Intro",
            List.of(new Section("A", "a2", 1), new Section("B", "b1", 2)));

    @Inject
    RevisionService revisionService;

    @Inject
    ContentBlobStore blobStore;

    @Inject
    OrphanBlobSweeper sweeper;

    @Test
    void createDiffAndReadBack() {
        DocumentDetail created = revisionService.createDocument("Intro", "first doc", V1, "alice");
        String id = created.document().id();

        RevisionRecord v2 = revisionService.createRevision(id, V2, "add B", VersionBump.MINOR, "bob");
        DiffResult diff = revisionService.getDiff(id, "1.0.0", v2.version());

        assertThat(v2.version()).isEqualTo("1.1.0");
        assertThat(diff.sectionsAdded()).extracting(Section::title).containsExactly("B");
        assertThat(diff.sectionsModified()).hasSize(1);
        assertThat(diff.sectionsRemoved()).isEmpty();
        assertThat(revisionService.getContent(id, "1.0.0").content()).isEqualTo(V1);
        assertThat(revisionService.getContent(id, null).content()).isEqualTo(V2);
        assertThat(revisionService.getDocument(id).latestRevision().version()).isEqualTo("1.1.0");
    }

    @Test
    void blobIsStoredUnderDerivedKey() {
        String id = revisionService.createDocument("Keyed", null, V1, "alice").document().id();

        String key = StorageKeys.contentKey(id, "1.0.0");
        assertThat(blobStore.exists(key).await().indefinitely()).isTrue();
    }

    @Test
    void leftoverBlobForNextVersionConflicts() {
        String id = revisionService.createDocument("Leftover", null, V1, "alice").document().id();
        blobStore.put(StorageKeys.contentKey(id, "1.1.0"), "{}".getBytes(StandardCharsets.UTF_8), null)
                .await().indefinitely();

        assertThatThrownBy(() -> revisionService.createRevision(id, V2, null, VersionBump.MINOR, "bob"))
                .isInstanceOf(ResourceConflictException.class);
        assertThat(revisionService.listRevisions(id)).hasSize(1);
    }

    @Test
    void sweeperRemovesOrphansButKeepsRevisions() {
        String id = revisionService.createDocument("Sweep", null, V1, "alice").document().id();
        String orphan = StorageKeys.contentKey(id, "9.0.0");
        blobStore.put(orphan, "{}".getBytes(StandardCharsets.UTF_8), null).await().indefinitely();

        sweeper.sweepOlderThan(Duration.ZERO);

        assertThat(blobStore.exists(orphan).await().indefinitely()).isFalse();
        assertThat(blobStore.exists(StorageKeys.contentKey(id, "1.0.0")).await().indefinitely()).isTrue();
        assertThat(revisionService.getContent(id, "1.0.0").content()).isEqualTo(V1);
    }

    @Test
    void listDocumentsFiltersByTitle() {
        String marker = UUID.randomUUID().toString().substring(0, 8);
        revisionService.createDocument("Alpha " + marker, null, null, null);
        revisionService.createDocument("Beta " + marker, null, null, null);
        revisionService.createDocument("Alpha other", null, null, null);

        DocumentPage page = revisionService.listDocuments(1, 10, "alpha " + marker);

        assertThat(page.totalItems()).isEqualTo(1);
        assertThat(page.items()).extracting(d -> d.title()).containsExactly("Alpha " + marker);
        assertThat(page.totalPages()).isEqualTo(1);
    }
}
