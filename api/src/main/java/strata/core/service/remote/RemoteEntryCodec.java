package strata.core.service.remote;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import strata.core.model.CacheEntry;
import strata.core.model.CacheTier;
import strata.core.model.CachedValue;

/**
 * Encodes entries for transmission to the remote tier.
 *
 * <p>An entry travels as a JSON envelope carrying the payload (Base64), its type tag, creation
 * time, TTL and labels, so a value read back from the remote tier can be backfilled with its
 * remaining TTL and re-indexed. With compression enabled the envelope is gzipped.
 *
 * <p>Wire format: {@code j:<json>} or {@code z:<base64 gzip of json>}.
 */
public class RemoteEntryCodec {

    static final String PLAIN_MARKER = "j:";
    static final String GZIP_MARKER = "z:";

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final boolean compression;

    public RemoteEntryCodec(boolean compression) {
        this.compression = compression;
    }

    record Envelope(
            @JsonProperty("v") String payload,
            @JsonProperty("t") String typeTag,
            @JsonProperty("c") long createdAtMillis,
            @JsonProperty("ttl") long ttlSeconds,
            @JsonProperty("tags") Set<String> tags,
            @JsonProperty("deps") Set<String> dependencies) {}

    public String encode(CacheEntry entry) {
        var envelope = new Envelope(
                Base64.getEncoder().encodeToString(entry.value().payload()),
                entry.value().typeTag(),
                entry.createdAt().toEpochMilli(),
                entry.ttlSeconds(),
                entry.tags(),
                entry.dependencies());
        String json;
        try {
            json = OBJECT_MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize remote cache entry " + entry.key(), e);
        }
        if (!compression) {
            return PLAIN_MARKER + json;
        }
        return GZIP_MARKER + Base64.getEncoder().encodeToString(gzip(json.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Decode a stored value. Either wire format is accepted regardless of the compression setting,
     * so the flag can be flipped without flushing the remote tier.
     *
     * @throws IllegalArgumentException if the value is not a valid envelope
     */
    public CacheEntry decode(String key, String encoded) {
        String json;
        if (encoded.startsWith(GZIP_MARKER)) {
            json = new String(
                    gunzip(Base64.getDecoder().decode(encoded.substring(GZIP_MARKER.length()))),
                    StandardCharsets.UTF_8);
        } else if (encoded.startsWith(PLAIN_MARKER)) {
            json = encoded.substring(PLAIN_MARKER.length());
        } else {
            throw new IllegalArgumentException("Unrecognized remote cache encoding for key " + key);
        }

        Envelope envelope;
        try {
            envelope = OBJECT_MAPPER.readValue(json, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed remote cache entry for key " + key, e);
        }
        if (envelope.payload() == null) {
            throw new IllegalArgumentException("Remote cache entry for key " + key + " has no payload");
        }
        return new CacheEntry(
                key,
                new CachedValue(Base64.getDecoder().decode(envelope.payload()), envelope.typeTag()),
                Instant.ofEpochMilli(envelope.createdAtMillis()),
                envelope.ttlSeconds(),
                envelope.tags(),
                envelope.dependencies(),
                CacheTier.REMOTE);
    }

    private static byte[] gzip(byte[] raw) {
        var out = new ByteArrayOutputStream(raw.length / 2 + 16);
        try (var gzip = new GZIPOutputStream(out)) {
            gzip.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress remote cache entry", e);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] compressed) {
        try (var gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new IllegalArgumentException("Corrupt compressed remote cache entry", e);
        }
    }
}
