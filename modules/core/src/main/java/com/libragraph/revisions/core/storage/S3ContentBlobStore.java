package com.libragraph.revisions.core.storage;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * S3/MinIO-backed ContentBlobStore for production use.
 *
 * <p>All revisions share one bucket; keys are the revision storage keys verbatim.
 * Write-once is enforced twice: a stat probe rejects keys that are already visible,
 * and the PUT carries {@code If-None-Match: *} so a server that supports conditional
 * writes rejects a racing writer that slipped in after the probe.
 */
@ApplicationScoped
@IfBuildProperty(name = "revisions.object-store.type", stringValue = "s3")
public class S3ContentBlobStore implements ContentBlobStore {

    private static final Logger log = Logger.getLogger(S3ContentBlobStore.class);

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "revisions.object-store.bucket", defaultValue = "revisions-documents")
    String bucket;

    private volatile boolean bucketReady;

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.infof("Created bucket %s", bucket);
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // Concurrent creation by another instance
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    @Override
    public Uni<Void> put(String key, byte[] payload, String contentType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ensureBucket();
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
                throw new BlobAlreadyExistsException(key);
            } catch (BlobAlreadyExistsException e) {
                throw e;
            } catch (ErrorResponseException e) {
                if (!isMissing(e)) {
                    throw new StorageException("Failed to check existence: " + key, e);
                }
                // Not there yet, proceed
            } catch (Exception e) {
                throw new StorageException("Failed to check existence: " + key, e);
            }
            try (InputStream is = new ByteArrayInputStream(payload)) {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .stream(is, payload.length, -1)
                        .contentType(contentType != null ? contentType : "application/octet-stream")
                        .extraHeaders(Map.of("If-None-Match", "*"))
                        .build());
            } catch (ErrorResponseException e) {
                if ("PreconditionFailed".equals(e.errorResponse().code())) {
                    throw new BlobAlreadyExistsException(key);
                }
                throw new StorageException("Failed to write blob: " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to write blob: " + key, e);
            }
        });
    }

    @Override
    public Uni<byte[]> get(String key) {
        return Uni.createFrom().item(() -> {
            try (InputStream is = minioClient.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(key).build())) {
                return is.readAllBytes();
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(key);
                }
                throw new StorageException("Failed to read blob: " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to read blob: " + key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
                return true;
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return false;
                }
                throw new StorageException("Failed to check existence: " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to check existence: " + key, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            // removeObject is silent on missing keys
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(key);
                }
                throw new StorageException("Failed to delete blob: " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to delete blob: " + key, e);
            }
            try {
                minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
            } catch (Exception e) {
                throw new StorageException("Failed to delete blob: " + key, e);
            }
        });
    }

    @Override
    public Multi<BlobEntry> list(String prefix) {
        return Multi.createFrom().items(() -> {
            try {
                List<BlobEntry> entries = new ArrayList<>();
                for (Result<Item> result : minioClient.listObjects(ListObjectsArgs.builder()
                        .bucket(bucket).prefix(prefix).recursive(true).build())) {
                    Item item = result.get();
                    entries.add(new BlobEntry(item.objectName(), item.lastModified().toInstant()));
                }
                return entries.stream();
            } catch (ErrorResponseException e) {
                if ("NoSuchBucket".equals(e.errorResponse().code())) {
                    return Stream.<BlobEntry>empty();
                }
                throw new StorageException("Failed to list blobs under: " + prefix, e);
            } catch (Exception e) {
                throw new StorageException("Failed to list blobs under: " + prefix, e);
            }
        });
    }
}
