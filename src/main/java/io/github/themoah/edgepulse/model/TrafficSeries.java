package io.github.themoah.edgepulse.model;

import java.util.Arrays;
import java.util.List;

/**
 * Per-bucket request counts for one chart window. Any of the three categories may be
 * absent (null), but at least one must be given and all given ones must be the same length.
 *
 * @param ok 2xx/3xx counts per bucket, or null
 * @param client 4xx counts per bucket, or null
 * @param server 5xx counts per bucket, or null
 */
public record TrafficSeries(
  List<Long> ok,
  List<Long> client,
  List<Long> server
) {

  public TrafficSeries {
    if (ok == null && client == null && server == null) {
      throw new IllegalArgumentException("At least one of ok, client or server is required");
    }
    ok = ok == null ? null : List.copyOf(ok);
    client = client == null ? null : List.copyOf(client);
    server = server == null ? null : List.copyOf(server);
    int len = -1;
    for (List<Long> values : Arrays.asList(ok, client, server)) {
      if (values == null) {
        continue;
      }
      if (len >= 0 && values.size() != len) {
        throw new IllegalArgumentException(String.format(
          "Series lengths differ: ok=%s, client=%s, server=%s", sizeOf(ok), sizeOf(client), sizeOf(server)));
      }
      len = values.size();
    }
    requireNonNegative("ok", ok);
    requireNonNegative("client", client);
    requireNonNegative("server", server);
  }

  public int length() {
    for (List<Long> values : Arrays.asList(ok, client, server)) {
      if (values != null) {
        return values.size();
      }
    }
    return 0;
  }

  /**
   * Whether counts were given for a status category.
   *
   * @param category RED, YELLOW or GREEN (SUCCESS is the same series as GREEN)
   */
  public boolean has(TrafficCategory category) {
    return listFor(category) != null;
  }

  /**
   * Returns the counts for one of the three status categories. An absent category
   * reads as all zeros.
   *
   * @param category RED, YELLOW or GREEN
   * @return counts as doubles
   */
  public double[] valuesFor(TrafficCategory category) {
    List<Long> values = listFor(category);
    return values == null ? new double[length()] : toArray(values);
  }

  private List<Long> listFor(TrafficCategory category) {
    return switch (category) {
      case RED -> server;
      case YELLOW -> client;
      case GREEN, SUCCESS -> ok;
      default -> throw new IllegalArgumentException("No series for category: " + category);
    };
  }

  private static String sizeOf(List<Long> values) {
    return values == null ? "absent" : String.valueOf(values.size());
  }

  private static double[] toArray(List<Long> values) {
    double[] result = new double[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i);
    }
    return result;
  }

  private static void requireNonNegative(String name, List<Long> values) {
    if (values == null) {
      return;
    }
    for (Long value : values) {
      if (value < 0) {
        throw new IllegalArgumentException("Negative count in " + name + " series: " + value);
      }
    }
  }
}
