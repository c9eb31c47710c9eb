package com.face.attendance.roster;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RosterProvider")
class RosterProviderTest {

    @Nested
    @DisplayName("InMemoryRosterProvider")
    class InMemory {

        @Test
        @DisplayName("Rosters and memberships reflect enrollments")
        void enrollments() {
            InMemoryRosterProvider roster = new InMemoryRosterProvider()
                    .enrollAll("bio-101", List.of("alice", "bob"))
                    .enroll("chem-2", "alice");

            assertEquals(Set.of("alice", "bob"), roster.rosterFor("bio-101"));
            assertEquals(Set.of("bio-101", "chem-2"), roster.classesOf("alice"));
            assertTrue(roster.unenroll("bio-101", "bob"));
            assertFalse(roster.unenroll("bio-101", "bob"));
            assertEquals(Set.of("alice"), roster.rosterFor("bio-101"));
        }

        @Test
        @DisplayName("An unknown class has an empty roster")
        void unknownClass() {
            assertTrue(new InMemoryRosterProvider().rosterFor("nope").isEmpty());
        }

        @Test
        @DisplayName("Returned rosters are snapshots")
        void snapshot() {
            InMemoryRosterProvider roster = new InMemoryRosterProvider().enroll("bio-101", "alice");
            Set<String> before = roster.rosterFor("bio-101");

            roster.enroll("bio-101", "bob");

            assertEquals(Set.of("alice"), before);
        }
    }

    @Nested
    @DisplayName("CachingRosterProvider")
    class Caching {

        private final AtomicLong nanos = new AtomicLong();
        private final Ticker ticker = nanos::get;
        private final AtomicInteger lookups = new AtomicInteger();
        private final InMemoryRosterProvider backing = new InMemoryRosterProvider().enroll("bio-101", "alice");
        private final RosterProvider counting = classId -> {
            lookups.incrementAndGet();
            return backing.rosterFor(classId);
        };

        @Test
        @DisplayName("Repeated lookups hit the cache until the TTL expires")
        void ttl() {
            CachingRosterProvider cache = new CachingRosterProvider(counting, new RosterCacheConfig(10, 30), ticker);

            cache.rosterFor("bio-101");
            cache.rosterFor("bio-101");
            assertEquals(1, lookups.get());

            backing.enroll("bio-101", "bob");
            assertEquals(Set.of("alice"), cache.rosterFor("bio-101"));

            nanos.addAndGet(TimeUnit.SECONDS.toNanos(31));
            assertEquals(Set.of("alice", "bob"), cache.rosterFor("bio-101"));
            assertEquals(2, lookups.get());
        }

        @Test
        @DisplayName("Invalidation forces a fresh lookup")
        void invalidate() {
            CachingRosterProvider cache = new CachingRosterProvider(counting, new RosterCacheConfig(10, 30), ticker);
            cache.rosterFor("bio-101");

            backing.enroll("bio-101", "carol");
            cache.invalidate("bio-101");

            assertTrue(cache.rosterFor("bio-101").contains("carol"));
            assertEquals(2, lookups.get());
            assertEquals(2, cache.stats().missCount());
        }

        @Test
        @DisplayName("Cache settings are validated")
        void config() {
            assertThrows(IllegalArgumentException.class, () -> new RosterCacheConfig(0, 10));
            assertThrows(IllegalArgumentException.class, () -> new RosterCacheConfig(10, 0));
            assertEquals(new RosterCacheConfig(1_000, 60), RosterCacheConfig.defaults());
        }
    }
}
