package com.libragraph.revisions.core.revision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.libragraph.revisions.core.error.ConsistencyException;
import com.libragraph.revisions.types.DocumentContent;
import com.libragraph.revisions.util.StorageKeys;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON codec for revision blobs. Uses its own mapper so the stored format does not
 * follow the REST layer's naming strategy.
 */
@ApplicationScoped
public class ContentCodec {

    public static final String MIME_TYPE = "application/json";

    private final JsonMapper mapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public byte[] encode(DocumentContent content) {
        try {
            return mapper.writeValueAsBytes(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document content is not serializable", e);
        }
    }

    /**
     * @throws ConsistencyException if a stored payload cannot be read back
     */
    public DocumentContent decode(byte[] payload, String storageKey) {
        try {
            return mapper.readValue(payload, DocumentContent.class);
        } catch (IOException e) {
            Optional<StorageKeys.RevisionKey> key = StorageKeys.parse(storageKey);
            throw new ConsistencyException("Stored revision payload is not valid content",
                    key.map(StorageKeys.RevisionKey::documentId).orElse(null),
                    key.map(StorageKeys.RevisionKey::version).orElse(null),
                    storageKey, e);
        }
    }
}
