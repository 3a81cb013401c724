package io.github.themoah.edgepulse.query;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryExecutor} for the ClickHouse HTTP interface.
 *
 * <p>Queries are POSTed as {@code <sql> FORMAT JSON} with basic authentication. Whitespace
 * is collapsed first so that equivalent queries share server-side query cache entries.
 */
public class ClickHouseQueryExecutor implements QueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseQueryExecutor.class);

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int FORCE_REFRESH_CACHE_TTL_SECONDS = 1;

  private final WebClient webClient;
  private final ClickHouseConfig config;

  /**
   * Creates a new ClickHouseQueryExecutor.
   *
   * @param vertx  the Vert.x instance
   * @param config the ClickHouse connection configuration
   */
  public ClickHouseQueryExecutor(Vertx vertx, ClickHouseConfig config) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    Objects.requireNonNull(config, "config cannot be null");
    log.info("Creating ClickHouse client for {}", config.getUrl());
    this.webClient = WebClient.create(vertx);
    this.config = config;
  }

  /**
   * Creates a new ClickHouseQueryExecutor with an existing web client (for testing).
   */
  ClickHouseQueryExecutor(WebClient webClient, ClickHouseConfig config) {
    this.webClient = Objects.requireNonNull(webClient, "webClient cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  @Override
  public Future<List<JsonObject>> runAggregation(String sql, QueryOptions options) {
    if (options.cancellation().isCancelled()) {
      return Future.failedFuture(new QueryCancelledException());
    }

    int cacheTtl = options.forceRefresh() ? FORCE_REFRESH_CACHE_TTL_SECONDS : config.getQueryCacheTtlSeconds();
    HttpRequest<Buffer> request = newRequest()
      .addQueryParam("use_query_cache", "1")
      .addQueryParam("query_cache_ttl", String.valueOf(cacheTtl))
      .addQueryParam("query_cache_nondeterministic_function_handling", "save");

    String body = normalize(sql) + " FORMAT JSON";
    long startNanos = System.nanoTime();

    return request.sendBuffer(Buffer.buffer(body))
      .recover(err -> Future.failedFuture(new QueryException("ClickHouse request failed: " + err.getMessage(), err)))
      .map(response -> {
        options.cancellation().throwIfCancelled();
        List<JsonObject> rows = parseRows(response);
        log.debug("Query returned {} rows in {}ms", rows.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return rows;
      });
  }

  @Override
  public Future<Void> ping() {
    return newRequest()
      .sendBuffer(Buffer.buffer("SELECT 1 FORMAT JSON"))
      .map(response -> {
        checkStatus(response);
        return (Void) null;
      });
  }

  @Override
  public Future<Void> close() {
    webClient.close();
    return Future.succeededFuture();
  }

  /**
   * Collapses runs of whitespace to a single space and trims.
   */
  static String normalize(String sql) {
    return WHITESPACE.matcher(sql).replaceAll(" ").trim();
  }

  private HttpRequest<Buffer> newRequest() {
    return webClient.postAbs(config.getUrl())
      .basicAuthentication(config.getUser(), config.getPassword())
      .timeout(config.getRequestTimeoutMs());
  }

  static List<JsonObject> parseRows(HttpResponse<Buffer> response) {
    checkStatus(response);
    JsonObject json = response.bodyAsJsonObject();
    JsonArray data = json == null ? null : json.getJsonArray("data");
    if (data == null) {
      throw new QueryException("ClickHouse response has no data array");
    }
    List<JsonObject> rows = new ArrayList<>(data.size());
    for (int i = 0; i < data.size(); i++) {
      rows.add(data.getJsonObject(i));
    }
    return rows;
  }

  private static void checkStatus(HttpResponse<Buffer> response) {
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String text = response.bodyAsString();
      if (status == 401 || (text != null && (text.contains("Authentication failed") || text.contains("REQUIRED_PASSWORD")))) {
        log.warn("ClickHouse authentication failed (HTTP {})", status);
      }
      throw new QueryException(text == null ? "HTTP " + status : text.trim(), status);
    }
  }
}
