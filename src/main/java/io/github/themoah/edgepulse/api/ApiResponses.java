package io.github.themoah.edgepulse.api;

import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON response and request-parsing helpers shared by the API handlers.
 */
final class ApiResponses {

  private static final Logger log = LoggerFactory.getLogger(ApiResponses.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private ApiResponses() {
  }

  static void ok(RoutingContext ctx, String json) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(json);
  }

  static void error(RoutingContext ctx, int statusCode, String message) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(new JsonObject().put("error", message).encode());
  }

  /**
   * Maps a request failure to a response: malformed input is a 400, anything else a 500.
   */
  static void fail(RoutingContext ctx, Throwable err) {
    if (isBadRequest(err)) {
      log.debug("Rejected request to {}: {}", ctx.request().path(), err.getMessage());
      error(ctx, 400, err.getMessage() == null ? "Bad request" : err.getMessage());
    } else {
      log.error("Request to {} failed", ctx.request().path(), err);
      error(ctx, 500, "Internal error");
    }
  }

  static boolean isBadRequest(Throwable err) {
    return err instanceof IllegalArgumentException
      || err instanceof DecodeException
      || err instanceof DateTimeParseException
      || err instanceof ClassCastException
      || err instanceof NullPointerException;
  }

  static JsonObject body(RoutingContext ctx) {
    JsonObject body = ctx.body().asJsonObject();
    if (body == null) {
      throw new IllegalArgumentException("Request body must be a JSON object");
    }
    return body;
  }

  static String requireString(JsonObject json, String field) {
    String value = json.getString(field);
    if (value == null) {
      throw new IllegalArgumentException("Missing field: " + field);
    }
    return value;
  }

  static Instant requireInstant(JsonObject json, String field) {
    return Instant.parse(requireString(json, field));
  }

  /**
   * Reads an array of counts.
   *
   * @return the counts, or null if the field is absent
   */
  static List<Long> longs(JsonObject json, String field) {
    JsonArray array = json.getJsonArray(field);
    if (array == null) {
      return null;
    }
    List<Long> values = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      Number n = (Number) array.getValue(i);
      if (n == null) {
        throw new IllegalArgumentException(field + "[" + i + "] is null");
      }
      values.add(n.longValue());
    }
    return values;
  }
}
