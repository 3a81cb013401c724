package io.github.themoah.edgepulse.query;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL templates loaded from {@code sql/<name>.sql} on the classpath.
 *
 * <p>Templates use {@code {{name}}} placeholders. Every placeholder must be supplied;
 * values are inserted verbatim and must already be valid SQL fragments.
 */
public class SqlTemplates {

  private static final String BASE_PATH = "sql/";
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

  private final Map<String, String> templates = new ConcurrentHashMap<>();

  /**
   * Loads (once) and interpolates a template.
   *
   * @param name template name without the .sql extension
   * @param params placeholder values
   * @return the interpolated SQL
   * @throws IllegalArgumentException if a placeholder has no value
   * @throws UncheckedIOException if the template cannot be read
   */
  public String render(String name, Map<String, String> params) {
    return interpolate(templates.computeIfAbsent(name, SqlTemplates::load), params);
  }

  static String interpolate(String template, Map<String, String> params) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder sql = new StringBuilder();
    while (matcher.find()) {
      String key = matcher.group(1);
      String value = params.get(key);
      if (value == null) {
        throw new IllegalArgumentException("Missing SQL template parameter: " + key);
      }
      matcher.appendReplacement(sql, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(sql);
    return sql.toString();
  }

  private static String load(String name) {
    String resource = BASE_PATH + name + ".sql";
    try (InputStream is = SqlTemplates.class.getClassLoader().getResourceAsStream(resource)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resource);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load SQL template: " + name, e);
    }
  }
}
