package com.architecture.memory.inevitability.service.cache;

/**
 * Key of a derived analysis artifact. Every entry belongs to exactly one SCM version.
 */
public record CacheKey(String scmVersion, String kind, String goalId, String queryHash) {

    public static CacheKey of(String scmVersion, String kind, String goalId, String queryHash) {
        return new CacheKey(scmVersion == null ? "" : scmVersion, kind, goalId == null ? "" : goalId, queryHash);
    }
}
