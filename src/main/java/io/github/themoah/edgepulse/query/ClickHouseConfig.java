package io.github.themoah.edgepulse.query;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings for the ClickHouse HTTP interface.
 */
public class ClickHouseConfig {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_URL = "clickhouse.url";
  private static final String PROP_USER = "clickhouse.user";
  private static final String PROP_PASSWORD = "clickhouse.password";
  private static final String PROP_DATABASE = "clickhouse.database";
  private static final String PROP_TABLE = "clickhouse.table";
  private static final String PROP_REQUEST_TIMEOUT_MS = "clickhouse.request.timeout.ms";
  private static final String PROP_QUERY_CACHE_TTL = "clickhouse.query.cache.ttl.seconds";

  private static final String DEFAULT_URL = "http://localhost:8123/";
  private static final String DEFAULT_USER = "default";
  private static final String DEFAULT_DATABASE = "helix_logs_production";
  private static final String DEFAULT_TABLE = "cdn_requests_v2";
  private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000;
  private static final int DEFAULT_QUERY_CACHE_TTL_SECONDS = 60;

  private final String url;
  private final String user;
  private final String password;
  private final String database;
  private final String table;
  private final int requestTimeoutMs;
  private final int queryCacheTtlSeconds;

  private ClickHouseConfig(Builder builder) {
    this.url = builder.url;
    this.user = builder.user;
    this.password = builder.password;
    this.database = builder.database;
    this.table = builder.table;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.queryCacheTtlSeconds = builder.queryCacheTtlSeconds;
  }

  public String getUrl() {
    return url;
  }

  public String getUser() {
    return user;
  }

  public String getPassword() {
    return password;
  }

  public String getDatabase() {
    return database;
  }

  public String getTable() {
    return table;
  }

  /**
   * @return {@code database.table} of the request log table
   */
  public String qualifiedTable() {
    return database + "." + table;
  }

  public int getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public int getQueryCacheTtlSeconds() {
    return queryCacheTtlSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ClickHouseConfig fromEnvironment() {
    return builder()
      .url(System.getenv().getOrDefault("CLICKHOUSE_URL", DEFAULT_URL))
      .user(System.getenv().getOrDefault("CLICKHOUSE_USER", DEFAULT_USER))
      .password(System.getenv().getOrDefault("CLICKHOUSE_PASSWORD", ""))
      .database(System.getenv().getOrDefault("CLICKHOUSE_DATABASE", DEFAULT_DATABASE))
      .table(System.getenv().getOrDefault("CLICKHOUSE_TABLE", DEFAULT_TABLE))
      .requestTimeoutMs(
        Integer.parseInt(
          System.getenv().getOrDefault("CLICKHOUSE_REQUEST_TIMEOUT_MS",
            String.valueOf(DEFAULT_REQUEST_TIMEOUT_MS))
        )
      )
      .build();
  }

  /**
   * Loads configuration from the default application.properties file on the classpath.
   *
   * @return ClickHouseConfig loaded from classpath
   * @throws IOException if the config file cannot be read
   */
  public static ClickHouseConfig fromClasspath() throws IOException {
    return fromClasspath(DEFAULT_CONFIG_FILE);
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @return ClickHouseConfig loaded from the resource
   * @throws IOException if the config file cannot be read
   */
  public static ClickHouseConfig fromClasspath(String resourceName) throws IOException {
    log.info("Loading configuration from classpath: {}", resourceName);
    try (InputStream is = ClickHouseConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Loads configuration from a properties file at the given path.
   *
   * @param path the path to the properties file
   * @return ClickHouseConfig loaded from the file
   * @throws IOException if the file cannot be read
   */
  public static ClickHouseConfig fromFile(Path path) throws IOException {
    log.info("Loading configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from a Properties object. Missing or blank properties keep
   * their defaults.
   *
   * @param props the properties containing clickhouse.* configuration
   * @return ClickHouseConfig built from the properties
   */
  public static ClickHouseConfig fromProperties(Properties props) {
    Builder builder = builder();

    String url = props.getProperty(PROP_URL);
    if (url != null && !url.isBlank()) {
      builder.url(url.trim());
    }
    String user = props.getProperty(PROP_USER);
    if (user != null && !user.isBlank()) {
      builder.user(user.trim());
    }
    String password = props.getProperty(PROP_PASSWORD);
    if (password != null) {
      builder.password(password);
    }
    String database = props.getProperty(PROP_DATABASE);
    if (database != null && !database.isBlank()) {
      builder.database(database.trim());
    }
    String table = props.getProperty(PROP_TABLE);
    if (table != null && !table.isBlank()) {
      builder.table(table.trim());
    }
    String requestTimeout = props.getProperty(PROP_REQUEST_TIMEOUT_MS);
    if (requestTimeout != null && !requestTimeout.isBlank()) {
      builder.requestTimeoutMs(Integer.parseInt(requestTimeout.trim()));
    }
    String cacheTtl = props.getProperty(PROP_QUERY_CACHE_TTL);
    if (cacheTtl != null && !cacheTtl.isBlank()) {
      builder.queryCacheTtlSeconds(Integer.parseInt(cacheTtl.trim()));
    }

    log.info("Configuration loaded: url={}, table={}.{}", builder.url, builder.database, builder.table);
    return builder.build();
  }

  public static class Builder {

    private String url = DEFAULT_URL;
    private String user = DEFAULT_USER;
    private String password = "";
    private String database = DEFAULT_DATABASE;
    private String table = DEFAULT_TABLE;
    private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private int queryCacheTtlSeconds = DEFAULT_QUERY_CACHE_TTL_SECONDS;

    public Builder url(String url) {
      this.url = Objects.requireNonNull(url, "url cannot be null");
      return this;
    }

    public Builder user(String user) {
      this.user = Objects.requireNonNull(user, "user cannot be null");
      return this;
    }

    public Builder password(String password) {
      this.password = Objects.requireNonNull(password, "password cannot be null");
      return this;
    }

    public Builder database(String database) {
      this.database = Objects.requireNonNull(database, "database cannot be null");
      return this;
    }

    public Builder table(String table) {
      this.table = Objects.requireNonNull(table, "table cannot be null");
      return this;
    }

    public Builder requestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    public Builder queryCacheTtlSeconds(int queryCacheTtlSeconds) {
      this.queryCacheTtlSeconds = queryCacheTtlSeconds;
      return this;
    }

    public ClickHouseConfig build() {
      return new ClickHouseConfig(this);
    }
  }
}
