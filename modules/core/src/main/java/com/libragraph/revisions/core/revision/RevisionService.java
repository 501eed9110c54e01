package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.DocumentRecord;
import com.libragraph.revisions.core.dao.RevisionRecord;
import com.libragraph.revisions.core.diff.DiffEngine;
import com.libragraph.revisions.core.diff.DiffResult;
import com.libragraph.revisions.core.error.ConsistencyException;
import com.libragraph.revisions.core.error.ResourceConflictException;
import com.libragraph.revisions.core.error.ResourceNotFoundException;
import com.libragraph.revisions.core.error.ValidationException;
import com.libragraph.revisions.core.storage.BlobAlreadyExistsException;
import com.libragraph.revisions.core.storage.BlobNotFoundException;
import com.libragraph.revisions.core.storage.ContentBlobStore;
import com.libragraph.revisions.core.storage.StorageRetry;
import com.libragraph.revisions.types.DocumentContent;
import com.libragraph.revisions.types.VersionBump;
import com.libragraph.revisions.util.ContentHash;
import com.libragraph.revisions.util.SemanticVersion;
import com.libragraph.revisions.util.StorageKeys;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates and reads document revisions.
 *
 * <p>A revision is written blob-first: the payload goes to the {@link ContentBlobStore}
 * under its derived key, then the metadata row is inserted. The insert is the durability
 * boundary; until it commits the revision does not exist. A failed insert leaves a blob
 * that is discarded on the spot when possible and otherwise by the orphan sweeper.
 */
@ApplicationScoped
public class RevisionService {

    private static final Logger log = Logger.getLogger(RevisionService.class);

    static final String INITIAL_SUMMARY = "Initial revision";
    static final int MAX_PER_PAGE = 100;

    @Inject
    DocumentStore documents;

    @Inject
    RevisionStore revisions;

    @Inject
    ContentBlobStore blobs;

    @Inject
    ContentCodec codec;

    @Inject
    ContentValidator validator;

    @Inject
    DiffEngine diffEngine;

    @Inject
    StorageRetry retry;

    /**
     * Creates a document, and its first revision when {@code initialContent} is given.
     * Content is validated before anything is written.
     */
    public DocumentDetail createDocument(String title, String description,
                                         DocumentContent initialContent, String author) {
        validator.validateDocument(title);
        if (initialContent != null) {
            validator.validate(initialContent);
        }
        String id = UUID.randomUUID().toString();
        DocumentRecord document = documents.insert(id, title.strip(), description);
        log.infof("Created document %s (%s)", id, document.title());
        if (initialContent == null) {
            return new DocumentDetail(document, null);
        }
        RevisionRecord first = writeRevision(id, SemanticVersion.INITIAL.toString(),
                initialContent, INITIAL_SUMMARY, author);
        return new DocumentDetail(requireDocument(id), first);
    }

    public DocumentDetail getDocument(String documentId) {
        DocumentRecord document = requireDocument(documentId);
        RevisionRecord latest = retry.call(() -> revisions.findLatest(documentId),
                "latest revision of " + documentId).orElse(null);
        return new DocumentDetail(document, latest);
    }

    public DocumentPage listDocuments(int page, int perPage, String titleContains) {
        List<String> violations = new ArrayList<>();
        if (page < 1) {
            violations.add("page must be at least 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            violations.add("per_page must be between 1 and " + MAX_PER_PAGE);
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return retry.call(() -> documents.list(page, perPage, titleContains), "list documents");
    }

    /** Revision history in creation order. */
    public List<RevisionRecord> listRevisions(String documentId) {
        requireDocument(documentId);
        return retry.call(() -> revisions.listByDocument(documentId), "revisions of " + documentId);
    }

    /**
     * Appends a revision whose version is the latest one bumped by {@code bump}, or
     * {@code 1.0.0} for a document without revisions.
     *
     * @throws ValidationException if the content is malformed; no blob is written
     * @throws ResourceConflictException if a concurrent writer took the same version, or a
     *         different payload already sits under the revision's key
     * @throws ConsistencyException if the blob was written but the metadata insert failed
     */
    public RevisionRecord createRevision(String documentId, DocumentContent content,
                                         String changeSummary, VersionBump bump, String author) {
        validator.validate(content);
        requireDocument(documentId);
        VersionBump effective = bump != null ? bump : VersionBump.MINOR;
        String version = retry.call(() -> revisions.findLatest(documentId),
                        "latest revision of " + documentId)
                .map(latest -> SemanticVersion.parse(latest.version()).bump(effective))
                .orElse(SemanticVersion.INITIAL)
                .toString();
        return writeRevision(documentId, version, content, changeSummary, author);
    }

    private RevisionRecord writeRevision(String documentId, String version, DocumentContent content,
                                         String changeSummary, String author) {
        String key = StorageKeys.contentKey(documentId, version);
        byte[] payload = codec.encode(content);
        ContentHash contentHash = ContentHash.of(payload);
        String hash = contentHash.toHex();

        try {
            retry.await(blobs.put(key, payload, ContentCodec.MIME_TYPE), "write " + key);
        } catch (BlobAlreadyExistsException e) {
            // A retried put whose first attempt landed finds its own bytes; the insert decides
            if (!holdsPayload(key, contentHash)) {
                throw new ResourceConflictException("Revision " + version + " of document "
                        + documentId + " is already being written", e);
            }
            log.debugf("Blob %s already holds this payload", key);
        }

        try {
            RevisionRecord created = revisions.insert(
                    new NewRevision(documentId, version, key, hash, changeSummary, author));
            log.infof("Created revision %s of document %s", version, documentId);
            return created;
        } catch (ResourceConflictException | ResourceNotFoundException e) {
            log.infof("Revision %s of document %s rejected: %s", version, documentId, e.getMessage());
            discardBlob(documentId, version, key, hash);
            throw e;
        } catch (RuntimeException e) {
            // The insert may have committed before the failure reached us
            Optional<RevisionRecord> committed = findCommitted(documentId, version, hash);
            if (committed.isPresent()) {
                log.warnf(e, "Insert of revision %s of document %s reported failure but committed",
                        version, documentId);
                return committed.get();
            }
            discardBlob(documentId, version, key, hash);
            log.errorf(e, "Revision metadata insert failed after blob write: "
                    + "document_id=%s version=%s storage_key=%s", documentId, version, key);
            throw new ConsistencyException("Revision metadata insert failed after blob write",
                    documentId, version, key, e);
        }
    }

    private boolean holdsPayload(String key, ContentHash hash) {
        try {
            return hash.matches(retry.await(blobs.get(key), "read " + key));
        } catch (BlobNotFoundException e) {
            return false;
        }
    }

    private Optional<RevisionRecord> findCommitted(String documentId, String version, String hash) {
        try {
            return revisions.findByVersion(documentId, version)
                    .filter(r -> hash.equals(r.contentHash()));
        } catch (RuntimeException e) {
            log.debugf("Could not check for committed revision %s of %s: %s",
                    version, documentId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Best-effort removal of a blob that has no metadata row. Never throws; anything
     * left behind is reclaimed by the orphan sweeper.
     */
    private void discardBlob(String documentId, String version, String key, String hash) {
        try {
            if (findCommitted(documentId, version, hash).isPresent()) {
                log.debugf("Blob %s backs a committed revision, keeping it", key);
                return;
            }
            retry.await(blobs.delete(key), "discard " + key);
            log.debugf("Discarded blob %s", key);
        } catch (BlobNotFoundException e) {
            log.debugf("Blob %s already gone", key);
        } catch (RuntimeException e) {
            log.warnf(e, "Could not discard blob %s; orphan left for sweeper", key);
        }
    }

    /**
     * Reads revision content; the latest revision when {@code version} is null.
     * The payload is checked against the hash recorded at write time.
     */
    public RevisionContent getContent(String documentId, String version) {
        requireDocument(documentId);
        RevisionRecord revision;
        if (version == null) {
            revision = retry.call(() -> revisions.findLatest(documentId),
                            "latest revision of " + documentId)
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Document has no revisions: " + documentId));
        } else {
            revision = retry.call(() -> revisions.findByVersion(documentId, version),
                            "revision " + version + " of " + documentId)
                    .orElseThrow(() -> ResourceNotFoundException.revision(documentId, version));
        }

        String key = revision.storageKey();
        byte[] payload;
        try {
            payload = retry.await(blobs.get(key), "read " + key);
        } catch (BlobNotFoundException e) {
            log.errorf("Revision blob missing: document_id=%s version=%s storage_key=%s",
                    documentId, revision.version(), key);
            throw e;
        }
        if (!ContentHash.fromHex(revision.contentHash()).matches(payload)) {
            log.errorf("Revision blob hash mismatch: document_id=%s version=%s storage_key=%s",
                    documentId, revision.version(), key);
            throw new ConsistencyException("Stored payload does not match recorded hash",
                    documentId, revision.version(), key, null);
        }
        return new RevisionContent(revision, codec.decode(payload, key));
    }

    public DiffResult getDiff(String documentId, String fromVersion, String toVersion) {
        List<String> violations = new ArrayList<>();
        if (fromVersion == null || fromVersion.isBlank()) {
            violations.add("from_version is required");
        }
        if (toVersion == null || toVersion.isBlank()) {
            violations.add("to_version is required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        RevisionContent from = getContent(documentId, fromVersion);
        RevisionContent to = getContent(documentId, toVersion);
        return diffEngine.compute(from.content(), to.content())
                .annotate(from.revision().version(), to.revision().version());
    }

    private DocumentRecord requireDocument(String documentId) {
        return retry.call(() -> documents.findById(documentId), "document " + documentId)
                .orElseThrow(() -> ResourceNotFoundException.document(documentId));
    }
}
