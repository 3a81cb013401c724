package io.github.themoah.edgepulse.cache;

import io.github.themoah.edgepulse.filter.FilterCompiler;
import io.github.themoah.edgepulse.identity.AnomalyIdGenerator;
import io.github.themoah.edgepulse.model.AnomalyInvestigation;
import io.github.themoah.edgepulse.model.Contributor;
import io.github.themoah.edgepulse.model.QueryContext;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists investigation results per time and host scope.
 *
 * <p>The storage key covers only the time filter and the host filter. Facet filters are
 * checked at read time instead: a result computed under filters F can serve any request
 * whose filters include all of F, so drilling in within the same scope still hits the
 * cache while drilling out does not.
 *
 * <p>Store failures never reach the caller. Reads that fail are misses and writes that
 * fail are dropped, both logged at WARN.
 */
public class InvestigationCache {

  private static final Logger log = LoggerFactory.getLogger(InvestigationCache.class);

  public static final String KEY_PREFIX = "anomaly_investigation_";

  /** Bump when the stored format or the detection algorithm changes. */
  public static final int CACHE_VERSION = 3;

  /** Contributors stored per investigation. */
  public static final int CACHE_TOP_N = 30;

  /** Contributors a cached result must cover to be served without a fresh run. */
  public static final int HIGHLIGHT_TOP_N = 3;

  private final KeyValueStore store;
  private final FilterCompiler filterCompiler;
  private final CacheConfig config;
  private final Clock clock;

  public InvestigationCache(KeyValueStore store, FilterCompiler filterCompiler, CacheConfig config) {
    this(store, filterCompiler, config, Clock.systemUTC());
  }

  public InvestigationCache(KeyValueStore store, FilterCompiler filterCompiler, CacheConfig config, Clock clock) {
    this.store = store;
    this.filterCompiler = filterCompiler;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Storage key for a scope. Facet filters are deliberately not part of it.
   */
  public static String cacheKey(QueryContext context) {
    return KEY_PREFIX + AnomalyIdGenerator.cacheKey(context.timeFilter(), context.hostFilter());
  }

  /**
   * Decides whether a result computed under {@code cached} may serve {@code current}.
   *
   * <p>Time and host filters must match exactly and the current facet filters must be a
   * superset of the cached ones. Serving a drill-in from a broader aggregate is an
   * accepted approximation.
   */
  public boolean isCacheEligible(QueryContext current, QueryContext cached) {
    if (!current.timeFilter().equals(cached.timeFilter())) {
      log.debug("Cache ineligible: time filter changed");
      return false;
    }
    if (!current.hostFilter().equals(cached.hostFilter())) {
      log.debug("Cache ineligible: host filter changed");
      return false;
    }
    if (!filterCompiler.isSuperset(current.filterMap(), cached.filterMap())) {
      log.debug("Cache ineligible: filters changed or removed");
      return false;
    }

    if (current.filterCount() > cached.filterCount()) {
      log.debug("Cache eligible: drilled in ({} -> {} filters)", cached.filterCount(), current.filterCount());
    } else {
      log.debug("Cache eligible: same context");
    }
    return true;
  }

  /**
   * Loads the entry for the current scope if it is present, current and eligible.
   *
   * @param current the scope of the request
   * @return the entry, or empty on a miss
   */
  public Optional<InvestigationCacheEntry> load(QueryContext current) {
    String key = cacheKey(current);
    InvestigationCacheEntry entry;
    try {
      String encoded = store.get(key);
      if (encoded == null) {
        log.debug("No cached investigation for key {}", key);
        return Optional.empty();
      }
      entry = InvestigationCacheEntry.fromJson(encoded);
    } catch (RuntimeException e) {
      // Unreadable or malformed entries count as a miss
      log.warn("Failed to load cached investigation {}: {}", key, e.toString());
      return Optional.empty();
    }

    if (entry.version() != CACHE_VERSION) {
      log.info("Cache version mismatch for {}: {} vs {}", key, entry.version(), CACHE_VERSION);
      return Optional.empty();
    }

    long age = clock.millis() - entry.timestamp();
    if (age >= config.ttlMs()) {
      log.info("Cached investigation {} expired ({}ms old)", key, age);
      return Optional.empty();
    }

    if (entry.isLegacy()) {
      log.info("Cache eligible: entry {} has no recorded context", key);
      return Optional.of(entry);
    }
    if (!isCacheEligible(current, entry.context())) {
      return Optional.empty();
    }

    log.info("Cache loaded for {}: {} contributors", key, entry.topContributors().size());
    return Optional.of(entry);
  }

  /**
   * Stores an investigation under the scope of {@code context}, stamped with the current
   * version and time.
   *
   * @return true if the store accepted the write
   */
  public boolean save(QueryContext context, List<AnomalyInvestigation> investigations, List<Contributor> topContributors) {
    String key = cacheKey(context);
    InvestigationCacheEntry entry = new InvestigationCacheEntry(
      investigations, topContributors, context, CACHE_VERSION, clock.millis());
    try {
      store.set(key, entry.toJson().encode());
      log.debug("Cached investigation {} ({} contributors)", key, topContributors.size());
      return true;
    } catch (KeyValueStoreException e) {
      log.warn("Failed to cache investigation {}: {}", key, e.getMessage());
      return false;
    }
  }

  /**
   * Removes all but the most recent entries of the namespace.
   *
   * @return number of entries removed
   */
  public int cleanupOldEntries() {
    List<TimestampedKey> entries = new ArrayList<>();
    try {
      for (String key : store.keys()) {
        if (key.startsWith(KEY_PREFIX)) {
          entries.add(new TimestampedKey(key, readTimestamp(key)));
        }
      }

      entries.sort(Comparator.comparingLong(TimestampedKey::timestamp).reversed());
      int removed = 0;
      for (TimestampedKey entry : entries.subList(Math.min(config.maxEntries(), entries.size()), entries.size())) {
        store.remove(entry.key());
        removed++;
      }
      if (removed > 0) {
        log.info("Removed {} old cached investigations, kept {}", removed, entries.size() - removed);
      }
      return removed;
    } catch (KeyValueStoreException e) {
      log.warn("Cache cleanup failed: {}", e.getMessage());
      return 0;
    }
  }

  /**
   * Removes every entry in the namespace, whatever its version or age.
   *
   * @return number of entries removed
   */
  public int clearAll() {
    int removed = 0;
    try {
      for (String key : store.keys()) {
        if (key.startsWith(KEY_PREFIX)) {
          store.remove(key);
          removed++;
        }
      }
    } catch (KeyValueStoreException e) {
      log.warn("Failed to clear cached investigations: {}", e.getMessage());
    }
    log.info("Cleared {} cached investigations", removed);
    return removed;
  }

  // Unreadable entries sort as oldest so cleanup removes them first
  private long readTimestamp(String key) {
    String encoded = store.get(key);
    if (encoded == null) {
      return 0L;
    }
    try {
      Long timestamp = new JsonObject(encoded).getLong("timestamp");
      return timestamp == null ? 0L : timestamp;
    } catch (DecodeException | ClassCastException e) {
      log.debug("Unreadable cache entry {}: {}", key, e.getMessage());
      return 0L;
    }
  }

  private record TimestampedKey(String key, long timestamp) {
  }
}
