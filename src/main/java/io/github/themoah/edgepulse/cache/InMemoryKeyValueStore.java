package io.github.themoah.edgepulse.cache;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store with an optional entry quota.
 *
 * <p>When the quota is reached, writes of new keys fail with {@link KeyValueStoreException};
 * overwriting an existing key always succeeds.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  /** No quota. */
  public static final int UNLIMITED = 0;

  private final ConcurrentHashMap<String, String> entries = new ConcurrentHashMap<>();
  private final int quota;

  public InMemoryKeyValueStore() {
    this(UNLIMITED);
  }

  public InMemoryKeyValueStore(int quota) {
    this.quota = quota;
  }

  @Override
  public String get(String key) {
    return entries.get(key);
  }

  @Override
  public synchronized void set(String key, String value) {
    if (quota > 0 && !entries.containsKey(key) && entries.size() >= quota) {
      throw new KeyValueStoreException(
        String.format("Quota exceeded: %d entries stored, cannot add '%s'", entries.size(), key));
    }
    entries.put(key, value);
  }

  @Override
  public void remove(String key) {
    entries.remove(key);
  }

  @Override
  public Set<String> keys() {
    return Set.copyOf(entries.keySet());
  }

  public int size() {
    return entries.size();
  }
}
