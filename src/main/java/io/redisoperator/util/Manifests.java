package io.redisoperator.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.hash.Hashing;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Canonical JSON, deep copies and content hashes of manifests and status objects.
 */
public final class Manifests {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private static final KubernetesSerialization KUBERNETES_SERIALIZATION = new KubernetesSerialization();

    private Manifests() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return CANONICAL_MAPPER;
    }

    /**
     * Serializes with sorted properties and map keys, so equal content gives equal text.
     */
    public static String canonicalJson(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * SHA-256 of the canonical JSON of {@code value}, hex encoded.
     */
    public static String hash(Object value) {
        return Hashing.sha256().hashString(canonicalJson(value), StandardCharsets.UTF_8).toString();
    }

    /**
     * Deep copy. Resources go through the fabric8 serialization so they keep their concrete type.
     */
    @SuppressWarnings("unchecked")
    public static <T> T copy(T value) {
        if (value == null) {
            return null;
        }
        if (value instanceof HasMetadata) {
            return KUBERNETES_SERIALIZATION.clone(value);
        }
        try {
            byte[] bytes = CANONICAL_MAPPER.writeValueAsBytes(value);
            return (T) CANONICAL_MAPPER.readValue(bytes, value.getClass());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot copy " + value.getClass().getSimpleName(), e);
        }
    }

    public static String describe(HasMetadata resource) {
        return resource.getKind() + " " + resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName();
    }
}
