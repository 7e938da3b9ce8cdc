package io.tagstream;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings shared by every publisher a {@link TagReadJournal} creates.
 *
 * <p>Recognised properties:
 * <ul>
 *   <li>{@code tagstream.refresh-interval-ms} - poll check period, default {@code 3000}</li>
 *   <li>{@code tagstream.max-buffer-size} - envelopes buffered per publisher, default {@code 500}</li>
 * </ul>
 */
public final class ReadJournalConfig {
  public static final String REFRESH_INTERVAL_MS = "tagstream.refresh-interval-ms";
  public static final String MAX_BUFFER_SIZE = "tagstream.max-buffer-size";

  private Duration refreshInterval = Duration.ofSeconds(3);
  private int maxBufferSize = 500;

  /**
   * Reads settings from {@code properties}; missing keys keep their defaults.
   *
   * @throws IllegalArgumentException if a value is not a positive integer
   */
  public static ReadJournalConfig fromProperties(Properties properties) {
    Objects.requireNonNull(properties, "properties");
    ReadJournalConfig config = new ReadJournalConfig();
    String interval = properties.getProperty(REFRESH_INTERVAL_MS);
    if (interval != null) {
      config.setRefreshInterval(Duration.ofMillis(parsePositive(REFRESH_INTERVAL_MS, interval)));
    }
    String bufferSize = properties.getProperty(MAX_BUFFER_SIZE);
    if (bufferSize != null) {
      long parsed = parsePositive(MAX_BUFFER_SIZE, bufferSize);
      if (parsed > Integer.MAX_VALUE) {
        throw new IllegalArgumentException(MAX_BUFFER_SIZE + " is too large: " + bufferSize);
      }
      config.setMaxBufferSize((int) parsed);
    }
    return config;
  }

  /**
   * Loads settings from a properties file on the classpath.
   *
   * @param resource classpath resource name, e.g. {@code "tagstream.properties"}
   * @throws IllegalArgumentException if the resource does not exist
   * @throws UncheckedIOException     if it cannot be read
   */
  public static ReadJournalConfig load(String resource) {
    Objects.requireNonNull(resource, "resource");
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = ReadJournalConfig.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("Configuration resource not found: " + resource);
      }
      Properties properties = new Properties();
      properties.load(in);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read configuration resource " + resource, e);
    }
  }

  public Duration getRefreshInterval() {
    return refreshInterval;
  }

  public ReadJournalConfig setRefreshInterval(Duration refreshInterval) {
    Objects.requireNonNull(refreshInterval, "refreshInterval");
    if (refreshInterval.isNegative() || refreshInterval.isZero()) {
      throw new IllegalArgumentException("refreshInterval must be > 0");
    }
    this.refreshInterval = refreshInterval;
    return this;
  }

  public int getMaxBufferSize() {
    return maxBufferSize;
  }

  public ReadJournalConfig setMaxBufferSize(int maxBufferSize) {
    if (maxBufferSize <= 0) {
      throw new IllegalArgumentException("maxBufferSize must be > 0");
    }
    this.maxBufferSize = maxBufferSize;
    return this;
  }

  private static long parsePositive(String key, String value) {
    long parsed;
    try {
      parsed = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer, was '" + value + "'", e);
    }
    if (parsed <= 0) {
      throw new IllegalArgumentException(key + " must be > 0, was " + parsed);
    }
    return parsed;
  }
}
