package fr.lapetina.orchestrator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Builds cache keys from request content. Map keys are sorted before hashing so
 * equal payloads give equal keys whatever their insertion order.
 */
public final class Fingerprinter {

    private final ObjectMapper canonicalMapper;

    public Fingerprinter(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * SHA-256 of the canonical JSON of {@code parts}, hex encoded.
     *
     * @throws IllegalArgumentException if a part cannot be serialized
     */
    public String fingerprint(Object... parts) {
        try {
            byte[] json = canonicalMapper.writeValueAsBytes(Arrays.asList(parts));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot fingerprint value: " + e.getOriginalMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
