package com.libragraph.revisions.core.reconcile;

import com.libragraph.revisions.core.revision.RevisionStore;
import com.libragraph.revisions.core.storage.BlobEntry;
import com.libragraph.revisions.core.storage.BlobNotFoundException;
import com.libragraph.revisions.core.storage.ContentBlobStore;
import com.libragraph.revisions.util.StorageKeys;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Deletes revision blobs that never got a metadata row.
 *
 * <p>Such blobs appear when a metadata insert fails and the in-line discard fails too.
 * Only blobs older than the grace period are considered, so a revision whose blob is
 * written but whose insert has not committed yet is left alone.
 */
@ApplicationScoped
public class OrphanBlobSweeper {

    private static final Logger log = Logger.getLogger(OrphanBlobSweeper.class);

    @Inject
    ContentBlobStore blobs;

    @Inject
    RevisionStore revisions;

    @ConfigProperty(name = "revisions.reconcile.orphan-grace", defaultValue = "15m")
    Duration orphanGrace;

    @Scheduled(every = "${revisions.reconcile.interval:10m}", concurrentExecution = SKIP)
    public void sweep() {
        int removed = sweepOlderThan(orphanGrace);
        if (removed > 0) {
            log.infof("Orphan sweep removed %d blob(s)", removed);
        }
    }

    /**
     * Removes unreferenced blobs last modified before {@code now - grace}.
     *
     * @return number of blobs deleted
     */
    public int sweepOlderThan(Duration grace) {
        Instant cutoff = Instant.now().minus(grace);
        List<BlobEntry> entries = blobs.list(StorageKeys.PREFIX).collect().asList().await().indefinitely();
        int removed = 0;
        for (BlobEntry entry : entries) {
            if (!entry.lastModified().isBefore(cutoff)) {
                continue;
            }
            Optional<StorageKeys.RevisionKey> key = StorageKeys.parse(entry.key());
            if (key.isEmpty()) {
                log.debugf("Skipping foreign key %s", entry.key());
                continue;
            }
            if (revisions.exists(key.get().documentId(), key.get().version())) {
                continue;
            }
            try {
                blobs.delete(entry.key()).await().indefinitely();
                removed++;
                log.warnf("Deleted orphan blob %s (document_id=%s version=%s)",
                        entry.key(), key.get().documentId(), key.get().version());
            } catch (BlobNotFoundException e) {
                log.debugf("Orphan %s vanished before delete", entry.key());
            }
        }
        return removed;
    }
}
