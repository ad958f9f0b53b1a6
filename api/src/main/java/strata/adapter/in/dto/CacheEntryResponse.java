package strata.adapter.in.dto;

import java.time.Instant;
import java.util.Set;

import strata.core.model.CacheEntry;

/**
 * DTO describing one cached entry without its payload.
 */
public record CacheEntryResponse(
        String key,
        String tier,
        String type,
        long sizeBytes,
        long ttlSeconds,
        Instant createdAt,
        Instant expiresAt,
        long accessCount,
        Set<String> tags,
        Set<String> dependencies) {

    public static CacheEntryResponse from(CacheEntry entry) {
        return new CacheEntryResponse(
                entry.key(),
                entry.tier().label(),
                entry.value().typeTag(),
                entry.sizeBytes(),
                entry.ttlSeconds(),
                entry.createdAt(),
                entry.expiresAt(),
                entry.accessCount(),
                entry.tags(),
                entry.dependencies());
    }
}
