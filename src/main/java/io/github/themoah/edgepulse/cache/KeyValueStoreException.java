package io.github.themoah.edgepulse.cache;

/**
 * Raised by a {@link KeyValueStore} that cannot complete an operation.
 */
public class KeyValueStoreException extends RuntimeException {

  public KeyValueStoreException(String message) {
    super(message);
  }

  public KeyValueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
