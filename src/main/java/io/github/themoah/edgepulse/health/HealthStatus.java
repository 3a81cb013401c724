package io.github.themoah.edgepulse.health;

/**
 * Health of a component, with the HTTP status a probe answers for it.
 */
public enum HealthStatus {
  UP("UP", 200),
  DOWN("DOWN", 503);

  private final String value;
  private final int httpStatus;

  HealthStatus(String value, int httpStatus) {
    this.value = value;
    this.httpStatus = httpStatus;
  }

  public static HealthStatus of(boolean up) {
    return up ? UP : DOWN;
  }

  public String getValue() {
    return value;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public boolean isUp() {
    return this == UP;
  }
}
