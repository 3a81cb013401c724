package io.github.themoah.edgepulse.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x and deployment options. The event-loop pool size can be set with
 * VERTX_EVENT_LOOP_POOL_SIZE.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_EVENT_LOOP_POOL_SIZE = "VERTX_EVENT_LOOP_POOL_SIZE";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    Integer poolSize = positiveInt(ENV_EVENT_LOOP_POOL_SIZE);
    if (poolSize != null) {
      log.info("Event loop pool size: {}", poolSize);
      options.setEventLoopPoolSize(poolSize);
    }
    return options;
  }

  /**
   * A single instance by default: investigation sessions live in the verticle.
   */
  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions().setInstances(1);
  }

  private static Integer positiveInt(String name) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed > 0) {
        return parsed;
      }
      log.warn("Non-positive value for {}: {}, using Vert.x default", name, value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: {}, using Vert.x default", name, value);
    }
    return null;
  }
}
