package io.github.themoah.edgepulse;

import io.github.themoah.edgepulse.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates Vert.x, deploys {@link MainVerticle} and closes Vert.x on JVM
 * shutdown so in-flight investigations are cancelled and the ClickHouse client is released.
 */
public class EdgePulseLauncher {

  private static final Logger log = LoggerFactory.getLogger(EdgePulseLauncher.class);

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);
    log.info("Starting edgepulse on Java {} (native transport: {})",
      System.getProperty("java.version"), vertx.isNativeTransportEnabled());

    Runtime.getRuntime().addShutdownHook(new Thread(() -> close(vertx), "edgepulse-shutdown"));

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();
    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        System.exit(1);
      });
  }

  private static void close(Vertx vertx) {
    log.info("Shutdown requested, stopping edgepulse");
    CountDownLatch closed = new CountDownLatch(1);
    vertx.close().onComplete(ar -> {
      if (ar.failed()) {
        log.error("Error closing Vert.x", ar.cause());
      }
      closed.countDown();
    });
    try {
      if (!closed.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Vert.x did not close within {}s", SHUTDOWN_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for Vert.x to close");
    }
  }
}
