package io.github.themoah.edgepulse.cache;

import java.util.Set;

/**
 * Synchronous string key-value store backing the investigation cache.
 *
 * <p>Any operation may throw {@link KeyValueStoreException}, for example when a quota is
 * exceeded.
 */
public interface KeyValueStore {

  /**
   * @return the stored value, or null if absent
   */
  String get(String key);

  void set(String key, String value);

  void remove(String key);

  /**
   * @return snapshot of all keys currently stored
   */
  Set<String> keys();
}
