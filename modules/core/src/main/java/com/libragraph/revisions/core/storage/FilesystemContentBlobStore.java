package com.libragraph.revisions.core.storage;

import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem-backed ContentBlobStore for development and testing.
 *
 * <p>Layout: {@code {root}/{key}}, so {@code documents/{id}/{version}/content.json}
 * maps onto nested directories. Payloads are stored as-is for easy debugging.
 */
@ApplicationScoped
@IfBuildProperty(name = "revisions.object-store.type", stringValue = "filesystem")
public class FilesystemContentBlobStore implements ContentBlobStore {

    private static final Logger log = Logger.getLogger(FilesystemContentBlobStore.class);

    @ConfigProperty(name = "revisions.object-store.filesystem.root")
    String root;

    private Path rootPath() {
        return Path.of(root).toAbsolutePath().normalize();
    }

    private Path resolvePath(String key) {
        Path base = rootPath();
        Path path = base.resolve(key).normalize();
        if (!path.startsWith(base) || path.equals(base)) {
            throw new StorageException("Key escapes store root: " + key);
        }
        return path;
    }

    @Override
    public Uni<Void> put(String key, byte[] payload, String contentType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(key);
            try {
                Files.createDirectories(path.getParent());
            } catch (IOException e) {
                throw new StorageException("Failed to write blob: " + key, e);
            }
            try (OutputStream out = Files.newOutputStream(path,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                out.write(payload);
            } catch (FileAlreadyExistsException e) {
                throw new BlobAlreadyExistsException(key);
            } catch (IOException e) {
                discardPartial(path);
                throw new StorageException("Failed to write blob: " + key, e);
            }
        });
    }

    private static void discardPartial(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warnf(e, "Failed to discard partial blob %s; orphan left for sweeper", path);
        }
    }

    @Override
    public Uni<byte[]> get(String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(key);
            } catch (IOException e) {
                throw new StorageException("Failed to read blob: " + key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> Files.isRegularFile(resolvePath(key)));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(key);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new BlobNotFoundException(key);
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete blob: " + key, e);
            }
        });
    }

    @Override
    public Multi<BlobEntry> list(String prefix) {
        return Multi.createFrom().items(() -> {
            Path base = rootPath();
            if (!Files.isDirectory(base)) {
                return Stream.<BlobEntry>empty();
            }
            try (Stream<Path> files = Files.walk(base)) {
                List<BlobEntry> entries = files
                        .filter(Files::isRegularFile)
                        .map(p -> toEntry(base, p))
                        .filter(e -> e.key().startsWith(prefix))
                        .collect(Collectors.toList());
                return entries.stream();
            } catch (IOException e) {
                throw new StorageException("Failed to list blobs under: " + prefix, e);
            }
        });
    }

    private static BlobEntry toEntry(Path base, Path file) {
        String key = base.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
        try {
            return new BlobEntry(key, Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            throw new StorageException("Failed to stat blob: " + key, e);
        }
    }
}
