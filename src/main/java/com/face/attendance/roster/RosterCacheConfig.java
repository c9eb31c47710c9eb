package com.face.attendance.roster;

/**
 * Settings for {@link CachingRosterProvider}.
 *
 * @param maxSize    maximum number of cached class rosters
 * @param ttlSeconds how long a roster is trusted before it is fetched again
 */
public record RosterCacheConfig(int maxSize, int ttlSeconds) {

    public RosterCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 rosters for 60 seconds.
     */
    public static RosterCacheConfig defaults() {
        return new RosterCacheConfig(1_000, 60);
    }
}
