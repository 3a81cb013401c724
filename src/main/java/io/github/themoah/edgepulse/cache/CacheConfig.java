package io.github.themoah.edgepulse.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the investigation cache.
 *
 * @param ttlMs age after which an entry is ignored (default 1 hour)
 * @param maxEntries entries retained by cleanup, most recent first (default 10)
 * @param storeQuota entry quota of the in-memory store, 0 for unlimited (default 200)
 */
public record CacheConfig(
  long ttlMs,
  int maxEntries,
  int storeQuota
) {

  private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

  private static final long DEFAULT_TTL_MS = 60 * 60 * 1000L;
  private static final int DEFAULT_MAX_ENTRIES = 10;
  private static final int DEFAULT_STORE_QUOTA = 200;

  public static CacheConfig defaults() {
    return new CacheConfig(DEFAULT_TTL_MS, DEFAULT_MAX_ENTRIES, DEFAULT_STORE_QUOTA);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>INVESTIGATION_CACHE_TTL_MS - Entry lifetime (default: 3600000)</li>
   *   <li>INVESTIGATION_CACHE_MAX_ENTRIES - Entries kept by cleanup (default: 10)</li>
   *   <li>INVESTIGATION_CACHE_QUOTA - Store entry quota, 0 = unlimited (default: 200)</li>
   * </ul>
   */
  public static CacheConfig fromEnvironment() {
    long ttlMs = parseLong("INVESTIGATION_CACHE_TTL_MS", DEFAULT_TTL_MS);
    int maxEntries = parseInt("INVESTIGATION_CACHE_MAX_ENTRIES", DEFAULT_MAX_ENTRIES);
    int quota = parseInt("INVESTIGATION_CACHE_QUOTA", DEFAULT_STORE_QUOTA);

    CacheConfig config = new CacheConfig(ttlMs, maxEntries, quota);
    log.info("Investigation cache config: ttlMs={}, maxEntries={}, storeQuota={}", ttlMs, maxEntries, quota);
    return config;
  }

  private static int parseInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
