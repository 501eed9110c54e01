package com.libragraph.revisions.core.health;

import com.libragraph.revisions.core.storage.ContentBlobStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;

/** Probes the configured blob store with an existence check on a key that is never written. */
@Readiness
@ApplicationScoped
public class ObjectStoreHealthCheck implements HealthCheck {

    static final String PROBE_KEY = "health/probe";

    @Inject
    ContentBlobStore blobs;

    @ConfigProperty(name = "revisions.object-store.type")
    String storeType;

    @Override
    public HealthCheckResponse call() {
        try {
            blobs.exists(PROBE_KEY).await().atMost(Duration.ofSeconds(5));
            return HealthCheckResponse.named("object-store")
                    .up()
                    .withData("type", storeType)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("object-store")
                    .down()
                    .withData("type", storeType)
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
