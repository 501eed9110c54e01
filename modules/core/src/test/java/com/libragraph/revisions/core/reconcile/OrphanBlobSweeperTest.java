package com.libragraph.revisions.core.reconcile;

import com.libragraph.revisions.core.revision.NewRevision;
import com.libragraph.revisions.core.testing.InMemoryContentBlobStore;
import com.libragraph.revisions.core.testing.InMemoryDocumentStore;
import com.libragraph.revisions.core.testing.InMemoryRevisionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class OrphanBlobSweeperTest {

    private static final byte[] PAYLOAD = "{}".getBytes();
    private static final Instant LONG_AGO = Instant.now().minus(Duration.ofHours(2));

    InMemoryDocumentStore documents;
    InMemoryRevisionStore revisions;
    InMemoryContentBlobStore blobs;
    OrphanBlobSweeper sweeper;

    @BeforeEach
    void setUp() {
        documents = new InMemoryDocumentStore();
        revisions = new InMemoryRevisionStore(documents);
        blobs = new InMemoryContentBlobStore();
        sweeper = new OrphanBlobSweeper();
        sweeper.blobs = blobs;
        sweeper.revisions = revisions;
        sweeper.orphanGrace = Duration.ofMinutes(15);
    }

    @Test
    void removesOnlyOldUnreferencedRevisionBlobs() {
        documents.insert("d1", "Doc", null);
        String referenced = "documents/d1/1.0.0/content.json";
        blobs.plant(referenced, PAYLOAD, LONG_AGO);
        revisions.insert(new NewRevision("d1", "1.0.0", referenced, "0".repeat(64), null, null));

        String oldOrphan = "documents/d1/1.1.0/content.json";
        String freshOrphan = "documents/d1/1.2.0/content.json";
        String foreign = "documents/readme.txt";
        blobs.plant(oldOrphan, PAYLOAD, LONG_AGO);
        blobs.plant(freshOrphan, PAYLOAD, Instant.now());
        blobs.plant(foreign, PAYLOAD, LONG_AGO);

        int removed = sweeper.sweepOlderThan(Duration.ofMinutes(15));

        assertThat(removed).isEqualTo(1);
        assertThat(blobs.keys()).containsExactlyInAnyOrder(referenced, freshOrphan, foreign);
    }

    @Test
    void scheduledSweepUsesConfiguredGrace() {
        blobs.plant("documents/gone/1.0.0/content.json", PAYLOAD, LONG_AGO);

        sweeper.sweep();

        assertThat(blobs.keys()).isEmpty();
    }
}
