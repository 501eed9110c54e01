package com.libragraph.revisions.test;

import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;
import org.testcontainers.containers.MinIOContainer;

import java.util.Map;

/**
 * Starts an ephemeral MinIO container for the test profile.
 *
 * <p>When the dev profile is active (Docker Compose MinIO), this resource
 * is a no-op and no config is overridden.
 */
public class MinioTestResource implements QuarkusTestResourceLifecycleManager {

    static {
        // Ryuk has connectivity issues on WSL2; container cleanup handled by stop()
        System.setProperty("testcontainers.ryuk.disabled", "true");
    }

    private MinIOContainer container;

    @Override
    public Map<String, String> start() {
        if ("dev".equals(System.getProperty("quarkus.test.profile"))) {
            return Map.of();
        }
        container = new MinIOContainer("minio/minio:RELEASE.2024-11-07T00-52-20Z");
        container.start();
        return Map.of(
                "revisions.minio.endpoint", container.getS3URL(),
                "revisions.minio.access-key", container.getUserName(),
                "revisions.minio.secret-key", container.getPassword()
        );
    }

    @Override
    public void stop() {
        if (container != null) {
            container.stop();
        }
    }
}
