package com.badmintongroup.discovery.cache;

/** hitRate は hits + misses が 0 のとき null (未定義)。 */
public record CacheStats(long hits, long misses, long evictions, int entries, Double hitRate) {

  public static CacheStats of(long hits, long misses, long evictions, int entries) {
    final long total = hits + misses;
    return new CacheStats(
        hits, misses, evictions, entries, total == 0 ? null : (double) hits / total);
  }
}
