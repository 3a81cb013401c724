package io.github.themoah.edgepulse.health;

import io.vertx.core.json.JsonObject;

/**
 * Body of the health endpoints.
 *
 * @param status overall status
 * @param clickhouse ClickHouse reachability, null for the liveness probe
 */
public record HealthCheckResponse(
  HealthStatus status,
  String clickhouse
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * @param reachable whether the last ClickHouse ping succeeded
   */
  public static HealthCheckResponse readiness(boolean reachable) {
    return new HealthCheckResponse(HealthStatus.of(reachable), reachable ? "reachable" : "unreachable");
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (clickhouse != null) {
      json.put("clickhouse", clickhouse);
    }
    return json;
  }
}
