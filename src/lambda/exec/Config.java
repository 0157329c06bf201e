package lambda.exec;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Provides access to the framework settings collected in {@code lambda.cfg},
 * which lives next to this class. A JVM system property named
 * {@code lambda.<key>} takes precedence over the entry in the file.
 */
public class Config {
  /** Prefix of system properties that override {@code lambda.cfg}. */
  public static final String PROPERTY_PREFIX = "lambda.";

  private static Config config = null;
  private final Properties properties = new Properties();

  private Config() {
    final InputStream cfg = Config.class.getResourceAsStream("lambda.cfg");
    if (cfg == null)
      throw new IllegalStateException("could not find config file");
    try (InputStream in = cfg) {
      properties.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("failure reading config file: " + e);
    }
  }

  Config(Properties properties) {
    this.properties.putAll(properties);
  }

  /** Get the configuration singleton. */
  public static synchronized Config getConfig() {
    if (config != null)
      return config;
    return config = new Config();
  }

  /**
   * Get the value of a setting.
   *
   * @param name
   *          the setting's name, without the {@code lambda.} prefix
   * @return the system property override if present, otherwise the value in
   *         {@code lambda.cfg}, or null if neither defines it
   */
  public String getProperty(String name) {
    final String override = System.getProperty(PROPERTY_PREFIX + name);
    if (override != null)
      return override.trim();
    final String value = properties.getProperty(name);
    return value == null ? null : value.trim();
  }

  /**
   * Get an integer setting.
   *
   * @return the parsed value, or {@code defaultValue} if the setting is
   *         missing or not a number
   */
  public int getInt(String name, int defaultValue) {
    final String value = getProperty(name);
    if (value == null || value.isEmpty())
      return defaultValue;
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      System.err.println("[WARNING] config property " + name
                         + " is not an integer: " + value);
      return defaultValue;
    }
  }

  /** Get a boolean setting; anything other than "true" is false. */
  public boolean getBoolean(String name, boolean defaultValue) {
    final String value = getProperty(name);
    if (value == null || value.isEmpty())
      return defaultValue;
    return Boolean.parseBoolean(value);
  }

  /** Status output level used by {@link lambda.hir.PrintTools}. */
  public int getVerbosity() {
    return getInt("verbosity", 0);
  }

  /** Whether {@link lambda.hir.DepthFirstIterator} traces its walk. */
  public boolean isTraversalTraced() {
    return getBoolean("trace-traversal", false);
  }
}
