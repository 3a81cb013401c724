package io.github.themoah.edgepulse.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for ClickHouseConfig.
 */
public class ClickHouseConfigTest {

  @Test
  void builder_defaults() {
    ClickHouseConfig config = ClickHouseConfig.builder().build();

    assertEquals("http://localhost:8123/", config.getUrl());
    assertEquals("default", config.getUser());
    assertEquals("helix_logs_production.cdn_requests_v2", config.qualifiedTable());
    assertEquals(30000, config.getRequestTimeoutMs());
    assertEquals(60, config.getQueryCacheTtlSeconds());
  }

  @Test
  void fromClasspath_readsAllProperties() throws IOException {
    ClickHouseConfig config = ClickHouseConfig.fromClasspath("clickhouse-test.properties");

    assertEquals("http://clickhouse.test:8123/", config.getUrl());
    assertEquals("analyst", config.getUser());
    assertEquals("secret", config.getPassword());
    assertEquals("logs_test", config.getDatabase());
    assertEquals("requests", config.getTable());
    assertEquals(5000, config.getRequestTimeoutMs());
    assertEquals(30, config.getQueryCacheTtlSeconds());
  }

  @Test
  void fromClasspath_missingResource() {
    assertThrows(IOException.class, () -> ClickHouseConfig.fromClasspath("missing.properties"));
  }

  @Test
  void fromFile_readsProperties(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("clickhouse.properties");
    Files.writeString(file, "clickhouse.url=https://ch.internal:8443/\nclickhouse.query.cache.ttl.seconds=120\n");

    ClickHouseConfig config = ClickHouseConfig.fromFile(file);

    assertEquals("https://ch.internal:8443/", config.getUrl());
    assertEquals(120, config.getQueryCacheTtlSeconds());
    assertEquals("default", config.getUser());
  }

  @Test
  void fromProperties_blankValuesKeepDefaults() {
    Properties props = new Properties();
    props.setProperty("clickhouse.url", "  ");
    props.setProperty("clickhouse.table", "events");

    ClickHouseConfig config = ClickHouseConfig.fromProperties(props);

    assertEquals("http://localhost:8123/", config.getUrl());
    assertEquals("helix_logs_production.events", config.qualifiedTable());
  }

  @Test
  void normalize_collapsesWhitespace() {
    assertEquals("SELECT a FROM t WHERE x = 1",
      ClickHouseQueryExecutor.normalize("\n  SELECT a\n\tFROM t   WHERE x = 1\n"));
  }
}
