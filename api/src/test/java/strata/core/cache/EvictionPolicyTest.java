package strata.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import strata.core.model.CacheEntry;
import strata.core.model.CacheTier;
import strata.core.model.CachedValue;
import strata.core.model.EvictionReason;

@DisplayName("EvictionPolicy")
class EvictionPolicyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static CacheEntry entry(String key, long createdOffsetSeconds, long ttlSeconds) {
        return new CacheEntry(
                key,
                CachedValue.bytes(new byte[10]),
                T0.plusSeconds(createdOffsetSeconds),
                ttlSeconds,
                Set.of(),
                Set.of(),
                CacheTier.MEMORY);
    }

    private static List<String> keys(List<CacheEntry> entries) {
        return entries.stream().map(CacheEntry::key).toList();
    }

    @Nested
    @DisplayName("named()")
    class Named {

        @Test
        @DisplayName("should resolve configured names case-insensitively")
        void shouldResolveNames() {
            assertInstanceOf(LruEvictionPolicy.class, EvictionPolicy.named("LRU"));
            assertInstanceOf(LfuEvictionPolicy.class, EvictionPolicy.named("lfu"));
            assertInstanceOf(TtlEvictionPolicy.class, EvictionPolicy.named(" ttl "));
        }

        @Test
        @DisplayName("should reject unknown names")
        void shouldRejectUnknownNames() {
            assertThrows(IllegalArgumentException.class, () -> EvictionPolicy.named("fifo"));
        }
    }

    @Nested
    @DisplayName("LRU")
    class Lru {

        @Test
        @DisplayName("should evict the least recently accessed entry first")
        void shouldEvictLeastRecentlyAccessed() {
            var a = entry("a", 0, 60);
            var b = entry("b", 0, 60);
            var c = entry("c", 0, 60);
            a.recordAccess(T0, 3);
            b.recordAccess(T0, 1);
            c.recordAccess(T0, 2);

            var victims = new LruEvictionPolicy().selectVictims(List.of(a, b, c), 1, 0, T0);

            assertEquals(List.of("b"), keys(victims));
            assertEquals(EvictionReason.LRU, new LruEvictionPolicy().reason());
        }
    }

    @Nested
    @DisplayName("LFU")
    class Lfu {

        @Test
        @DisplayName("should evict the least frequently accessed entry first")
        void shouldEvictLeastFrequentlyAccessed() {
            var hot = entry("hot", 0, 60);
            var cold = entry("cold", 0, 60);
            for (int i = 1; i <= 5; i++) {
                hot.recordAccess(T0.plusSeconds(i), i);
            }
            cold.recordAccess(T0.plusSeconds(10), 10);

            var victims = new LfuEvictionPolicy().selectVictims(List.of(hot, cold), 1, 0, T0);

            assertEquals(List.of("cold"), keys(victims));
        }

        @Test
        @DisplayName("should break frequency ties by recency")
        void shouldBreakTiesByRecency() {
            var older = entry("older", 0, 60);
            var newer = entry("newer", 0, 60);
            older.recordAccess(T0.plusSeconds(1), 1);
            newer.recordAccess(T0.plusSeconds(2), 2);

            var victims = new LfuEvictionPolicy().selectVictims(List.of(newer, older), 1, 0, T0);

            assertEquals(List.of("older"), keys(victims));
        }
    }

    @Nested
    @DisplayName("TTL")
    class Ttl {

        @Test
        @DisplayName("should evict entries closest to expiry first and never-expiring entries last")
        void shouldEvictClosestToExpiry() {
            var forever = entry("forever", 0, 0);
            var soon = entry("soon", 0, 30);
            var later = entry("later", 0, 300);

            var victims = new TtlEvictionPolicy().selectVictims(List.of(forever, later, soon), 1_000_000, 3, T0);

            assertEquals(List.of("soon", "later", "forever"), keys(victims));
        }
    }

    @Nested
    @DisplayName("selectVictims()")
    class SelectVictims {

        @Test
        @DisplayName("should take victims until both byte and entry targets are met")
        void shouldMeetBothTargets() {
            var a = entry("a", 0, 60);
            var b = entry("b", 0, 60);
            var c = entry("c", 0, 60);
            a.recordAccess(T0, 1);
            b.recordAccess(T0, 2);
            c.recordAccess(T0, 3);

            var victims = new LruEvictionPolicy().selectVictims(List.of(a, b, c), 1, 2, T0);

            assertEquals(List.of("a", "b"), keys(victims));
        }

        @Test
        @DisplayName("should select nothing when nothing needs freeing")
        void shouldSelectNothingWhenNotNeeded() {
            var victims = new LruEvictionPolicy().selectVictims(List.of(entry("a", 0, 60)), 0, 0, T0);

            assertEquals(List.of(), victims);
        }
    }
}
