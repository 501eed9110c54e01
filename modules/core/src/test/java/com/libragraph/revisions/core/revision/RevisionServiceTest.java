package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.RevisionRecord;
import com.libragraph.revisions.core.diff.DiffEngine;
import com.libragraph.revisions.core.diff.DiffResult;
import com.libragraph.revisions.core.diff.SectionChange;
import com.libragraph.revisions.core.error.ConsistencyException;
import com.libragraph.revisions.core.error.ResourceConflictException;
import com.libragraph.revisions.core.error.ResourceNotFoundException;
import com.libragraph.revisions.core.error.ValidationException;
import com.libragraph.revisions.core.storage.StorageException;
import com.libragraph.revisions.core.storage.StorageRetry;
import com.libragraph.revisions.core.testing.InMemoryContentBlobStore;
import com.libragraph.revisions.core.testing.InMemoryDocumentStore;
import com.libragraph.revisions.core.testing.InMemoryRevisionStore;
import com.libragraph.revisions.types.DocumentContent;
import com.libragraph.revisions.types.Section;
import com.libragraph.revisions.types.VersionBump;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevisionServiceTest {

    private static final DocumentContent V1 = DocumentContent.of("Intro",
            List.of(new Section("A", "a1", 1)));
    private static final DocumentContent V2 = DocumentContent.of("Intro",
            List.of(new Section("A", "a2", 1), new Section("B", "b1", 2)));

    InMemoryDocumentStore documents;
    InMemoryRevisionStore revisions;
    InMemoryContentBlobStore blobs;
    RevisionService service;

    @BeforeEach
    void setUp() {
        documents = new InMemoryDocumentStore();
        revisions = new InMemoryRevisionStore(documents);
        blobs = new InMemoryContentBlobStore();
        service = new RevisionService();
        service.documents = documents;
        service.revisions = revisions;
        service.blobs = blobs;
        service.codec = new ContentCodec();
        service.validator = new ContentValidator();
        service.diffEngine = new DiffEngine();
        service.retry = new StorageRetry(3, Duration.ofMillis(1), Duration.ofMillis(5));
    }

    private String newDocument() {
        return service.createDocument("Doc", null, null, "alice").document().id();
    }

    @Test
    void createDocumentWithInitialContentWritesFirstRevision() {
        DocumentDetail detail = service.createDocument("Intro", "desc", V1, "alice");

        String id = detail.document().id();
        assertThat(detail.latestRevision().version()).isEqualTo("1.0.0");
        assertThat(detail.latestRevision().changeSummary()).isEqualTo("Initial revision");
        assertThat(detail.latestRevision().createdBy()).isEqualTo("alice");
        assertThat(detail.latestRevision().storageKey())
                .isEqualTo("documents/" + id + "/1.0.0/content.json");
        assertThat(blobs.contains("documents/" + id + "/1.0.0/content.json")).isTrue();
    }

    @Test
    void createDocumentWithoutContentHasNoRevision() {
        DocumentDetail detail = service.createDocument("Empty", null, null, null);

        assertThat(detail.latestRevision()).isNull();
        assertThat(service.listRevisions(detail.document().id())).isEmpty();
        assertThatThrownBy(() -> service.getContent(detail.document().id(), null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void createDocumentRejectsBlankTitle() {
        assertThatThrownBy(() -> service.createDocument(" ", null, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void versionsFollowRequestedBump() {
        String id = newDocument();

        assertThat(service.createRevision(id, V1, "first", null, "a").version()).isEqualTo("1.0.0");
        assertThat(service.createRevision(id, V2, "minor", VersionBump.MINOR, "a").version()).isEqualTo("1.1.0");
        assertThat(service.createRevision(id, V1, "patch", VersionBump.PATCH, "a").version()).isEqualTo("1.1.1");
        assertThat(service.createRevision(id, V2, "major", VersionBump.MAJOR, "a").version()).isEqualTo("2.0.0");
    }

    @Test
    void diffBetweenTwoRevisions() {
        String id = service.createDocument("Intro", null, V1, "alice").document().id();
        String v2 = service.createRevision(id, V2, "add B", VersionBump.MINOR, "alice").version();

        DiffResult diff = service.getDiff(id, "1.0.0", v2);

        assertThat(diff.fromVersion()).isEqualTo("1.0.0");
        assertThat(diff.toVersion()).isEqualTo("1.1.0");
        assertThat(diff.sectionsAdded()).containsExactly(new Section("B", "b1", 2));
        assertThat(diff.sectionsRemoved()).isEmpty();
        assertThat(diff.sectionsModified()).containsExactly(
                new SectionChange(new Section("A", "a1", 1), new Section("A", "a2", 1)));
    }

    @Test
    void diffRequiresBothVersions() {
        String id = newDocument();

        assertThatThrownBy(() -> service.getDiff(id, null, " "))
                .isInstanceOfSatisfying(ValidationException.class, e ->
                        assertThat(e.violations()).hasSize(2));
    }

    @Test
    void latestContentIsLastCreated() {
        String id = newDocument();
        DocumentContent v3 = DocumentContent.of("Intro", List.of(new Section("C", "c", 1)));
        service.createRevision(id, V1, "v1", VersionBump.MINOR, "a");
        service.createRevision(id, V2, "v2", VersionBump.MINOR, "a");
        service.createRevision(id, v3, "v3", VersionBump.MINOR, "a");

        RevisionContent latest = service.getContent(id, null);

        assertThat(latest.revision().version()).isEqualTo("1.2.0");
        assertThat(latest.content()).isEqualTo(v3);
        assertThat(service.getDocument(id).latestRevision().version()).isEqualTo("1.2.0");
    }

    @Test
    void contentRoundTripsIncludingMetadata() {
        String id = newDocument();
        DocumentContent content = new DocumentContent("Guide",
                List.of(new Section("Setup", "Install it", 1), new Section("Use", "", 2)),
                Map.of("difficulty", "easy"));

        String version = service.createRevision(id, content, null, null, "a").version();

        assertThat(service.getContent(id, version).content()).isEqualTo(content);
    }

    @Test
    void malformedContentWritesNothing() {
        String id = newDocument();

        assertThatThrownBy(() -> service.createRevision(id,
                DocumentContent.of("Missing sections", null), null, null, "a"))
                .isInstanceOf(ValidationException.class);

        assertThat(blobs.putCalls()).isZero();
        assertThat(service.listRevisions(id)).isEmpty();
    }

    @Test
    void existingRevisionsNeverChange() {
        String id = newDocument();
        RevisionRecord first = service.createRevision(id, V1, "first", null, "a");
        service.createRevision(id, V2, "second", null, "a");
        service.createRevision(id, V1, "third", null, "a");

        List<RevisionRecord> history = service.listRevisions(id);

        assertThat(history).extracting(RevisionRecord::version).containsExactly("1.0.0", "1.1.0", "1.2.0");
        assertThat(history.get(0)).isEqualTo(first);
        assertThat(service.getContent(id, "1.0.0").content()).isEqualTo(V1);
    }

    @Test
    void unknownDocumentAndVersionAreNotFound() {
        String id = newDocument();
        service.createRevision(id, V1, null, null, "a");

        assertThatThrownBy(() -> service.createRevision("missing", V1, null, null, "a"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.getContent("missing", null))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.getContent(id, "9.9.9"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("9.9.9");
    }

    @Test
    void concurrentWritersOfSameVersionYieldOneConflict() throws Exception {
        String id = newDocument();
        service.createRevision(id, V1, "base", null, "a");

        // Both writers read the same latest version before either writes
        CyclicBarrier bothRead = new CyclicBarrier(2);
        revisions.beforeFindLatest(() -> {
            try {
                bothRead.await(5, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<RevisionRecord>> results = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                String summary = "writer-" + i;
                results.add(pool.submit(() -> service.createRevision(id, V2, summary, null, summary)));
            }
            int successes = 0;
            int conflicts = 0;
            for (Future<RevisionRecord> result : results) {
                try {
                    assertThat(result.get(10, TimeUnit.SECONDS).version()).isEqualTo("1.1.0");
                    successes++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ResourceConflictException.class);
                    conflicts++;
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(conflicts).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        revisions.beforeFindLatest(null);
        assertThat(service.listRevisions(id)).extracting(RevisionRecord::version)
                .containsExactly("1.0.0", "1.1.0");
    }

    @Test
    void insertConflictDiscardsBlob() {
        String id = newDocument();
        revisions.failNextInsert(new ResourceConflictException("raced"));

        assertThatThrownBy(() -> service.createRevision(id, V1, null, null, "a"))
                .isInstanceOf(ResourceConflictException.class);

        assertThat(blobs.contains("documents/" + id + "/1.0.0/content.json")).isFalse();
        // The version is free again once the loser has cleaned up
        assertThat(service.createRevision(id, V1, null, null, "a").version()).isEqualTo("1.0.0");
    }

    @Test
    void insertFailureAfterBlobWriteIsConsistencyError() {
        String id = newDocument();
        revisions.failNextInsert(new IllegalStateException("database went away"));

        assertThatThrownBy(() -> service.createRevision(id, V1, null, null, "a"))
                .isInstanceOfSatisfying(ConsistencyException.class, e -> {
                    assertThat(e.documentId()).isEqualTo(id);
                    assertThat(e.version()).isEqualTo("1.0.0");
                    assertThat(e.storageKey()).isEqualTo("documents/" + id + "/1.0.0/content.json");
                });
        assertThat(blobs.contains("documents/" + id + "/1.0.0/content.json")).isFalse();
    }

    @Test
    void failedDiscardLeavesOrphanButStillReportsError() {
        String id = newDocument();
        revisions.failNextInsert(new IllegalStateException("database went away"));
        blobs.failNextDeletes(10);

        assertThatThrownBy(() -> service.createRevision(id, V1, null, null, "a"))
                .isInstanceOf(ConsistencyException.class);
        assertThat(blobs.contains("documents/" + id + "/1.0.0/content.json")).isTrue();
    }

    @Test
    void transientBlobFailuresAreRetried() {
        String id = newDocument();
        blobs.failNextPuts(2);

        RevisionRecord created = service.createRevision(id, V1, null, null, "a");

        assertThat(created.version()).isEqualTo("1.0.0");
        assertThat(blobs.putCalls()).isEqualTo(3);
    }

    @Test
    void blobWriteWithLostAcknowledgementStillCreatesRevision() {
        String id = newDocument();
        blobs.loseNextPutAcks(1);

        RevisionRecord created = service.createRevision(id, V1, null, null, "a");

        assertThat(created.version()).isEqualTo("1.0.0");
        assertThat(blobs.putCalls()).isEqualTo(2);
        assertThat(service.getContent(id, null).content()).isEqualTo(V1);
        assertThat(service.createRevision(id, V2, null, null, "a").version()).isEqualTo("1.1.0");
    }

    @Test
    void differentPayloadUnderRevisionKeyIsConflict() {
        String id = newDocument();
        String key = "documents/" + id + "/1.0.0/content.json";
        byte[] foreign = "{\"title\":\"Other\",\"sections\":[]}".getBytes(StandardCharsets.UTF_8);
        blobs.plant(key, foreign, Instant.now());

        assertThatThrownBy(() -> service.createRevision(id, V1, null, null, "a"))
                .isInstanceOf(ResourceConflictException.class);
        assertThat(service.listRevisions(id)).isEmpty();
        assertThat(blobs.contains(key)).isTrue();
    }

    @Test
    void persistentBlobFailureSurfacesWithoutMetadata() {
        String id = newDocument();
        blobs.failNextPuts(5);

        assertThatThrownBy(() -> service.createRevision(id, V1, null, null, "a"))
                .isInstanceOf(StorageException.class);
        assertThat(blobs.putCalls()).isEqualTo(3);
        assertThat(service.listRevisions(id)).isEmpty();
    }

    @Test
    void tamperedPayloadIsDetected() {
        String id = newDocument();
        RevisionRecord rev = service.createRevision(id, V1, null, null, "a");
        blobs.plant(rev.storageKey(), "{\"title\":\"Forged\",\"sections\":[]}".getBytes(StandardCharsets.UTF_8),
                Instant.now());

        assertThatThrownBy(() -> service.getContent(id, rev.version()))
                .isInstanceOf(ConsistencyException.class);
    }

    @Test
    void listDocumentsValidatesPaging() {
        newDocument();

        assertThat(service.listDocuments(1, 10, null).totalItems()).isEqualTo(1);
        assertThatThrownBy(() -> service.listDocuments(0, 10, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.listDocuments(1, 1000, null))
                .isInstanceOf(ValidationException.class);
    }
}
