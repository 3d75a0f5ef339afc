package io.b2mash.remodel.engine;

/**
 * Memoization counters of one engine.
 *
 * @param hitRate percentage with two decimals, e.g. "66.67%"
 * @param size number of results currently held
 */
public record CacheStats(long hits, long misses, String hitRate, long size) {}
