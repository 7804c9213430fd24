package se.alipsa.dbext.local;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of the {@link LocalPivotExecutor}.
 *
 * @param workers
 *          size of the worker pool, at least one
 * @param reuseDescribeSnapshot
 *          whether Start restores the key map captured at Describe instead of re-running the
 *          catalog query
 * @param caseSensitive
 *          whether column names in a {@link PivotInvocation} are matched case sensitively
 */
public record LocalExecutorConfig(int workers, boolean reuseDescribeSnapshot, boolean caseSensitive) {

  public static final String WORKERS = "workers";
  public static final String REUSE_DESCRIBE_SNAPSHOT = "reuseDescribeSnapshot";
  public static final String CASE_SENSITIVE = "caseSensitive";

  /**
   * Validates the record components.
   */
  public LocalExecutorConfig {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be at least 1 but was " + workers);
    }
  }

  /**
   * The default settings: one worker per available processor, catalog query re-run at Start, case
   * insensitive column lookup.
   *
   * @return the default configuration
   */
  public static LocalExecutorConfig defaults() {
    return fromProperties(new Properties());
  }

  /**
   * Read the settings from properties; absent keys fall back to their defaults.
   *
   * @param props
   *          the properties, may be {@code null}
   * @return the configuration
   */
  public static LocalExecutorConfig fromProperties(Properties props) {
    Properties p = props == null ? new Properties() : props;
    int workers = Runtime.getRuntime().availableProcessors();
    String w = p.getProperty(WORKERS);
    if (w != null && !w.isBlank()) {
      try {
        workers = Integer.parseInt(w.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid value for " + WORKERS + ": " + w, e);
      }
    }
    boolean reuse = Boolean.parseBoolean(p.getProperty(REUSE_DESCRIBE_SNAPSHOT, "false").trim());
    boolean caseSensitive = Boolean.parseBoolean(p.getProperty(CASE_SENSITIVE, "false").trim());
    return new LocalExecutorConfig(workers, reuse, caseSensitive);
  }

  /**
   * Parse a URL query style string such as {@code workers=4&reuseDescribeSnapshot=true}. A leading
   * {@code ?} is ignored and keys and values are URL decoded.
   *
   * @param query
   *          the query string, may be {@code null} or empty
   * @return the configuration
   */
  public static LocalExecutorConfig parse(String query) {
    Properties p = new Properties();
    if (query == null || query.isEmpty()) {
      return fromProperties(p);
    }
    String s = query.charAt(0) == '?' ? query.substring(1) : query;
    for (String pair : s.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      String[] kv = pair.split("=", 2);
      String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8).trim();
      String value = kv.length == 2 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
      if (!key.isEmpty()) {
        p.setProperty(canonicalKey(key), value);
      }
    }
    return fromProperties(p);
  }

  private static String canonicalKey(String key) {
    return switch (key.toLowerCase(Locale.ROOT)) {
      case "workers" -> WORKERS;
      case "reusedescribesnapshot" -> REUSE_DESCRIBE_SNAPSHOT;
      case "casesensitive" -> CASE_SENSITIVE;
      default -> key;
    };
  }
}
