package org.integratedmodelling.ogc.configuration;

import com.google.common.base.Strings;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import java.util.Map;
import java.util.function.Function;

/**
 * Settings consumed by the capabilities pipeline. Built programmatically or from an
 * environment-style map such as {@link System#getenv()}; unset keys keep their defaults.
 */
public final class ExplorerConfiguration {

  public static final String CONNECT_TIMEOUT_MS = "OGC_CONNECT_TIMEOUT_MS";
  public static final String READ_TIMEOUT_MS = "OGC_READ_TIMEOUT_MS";
  public static final String RETRY_COUNT = "OGC_RETRY_COUNT";
  public static final String RETRY_BACKOFF_FACTOR = "OGC_RETRY_BACKOFF_FACTOR";
  public static final String MAX_RESPONSE_BYTES = "OGC_MAX_RESPONSE_BYTES";
  public static final String MAX_URL_LENGTH = "OGC_MAX_URL_LENGTH";
  public static final String CACHE_TTL_SECONDS = "OGC_CACHE_TTL_SECONDS";
  public static final String CACHE_CAPACITY = "OGC_CACHE_CAPACITY";
  public static final String USER_AGENT = "USER_AGENT";

  public static final String DEFAULT_USER_AGENT = "klab OGC capabilities explorer";

  private final int connectTimeoutMs;
  private final int readTimeoutMs;
  private final int retryCount;
  private final double retryBackoffFactor;
  private final long maxResponseBytes;
  private final int maxUrlLength;
  private final long cacheTtlSeconds;
  private final long cacheCapacity;
  private final String userAgent;

  private ExplorerConfiguration(Builder builder) {
    this.connectTimeoutMs = positive(CONNECT_TIMEOUT_MS, builder.connectTimeoutMs);
    this.readTimeoutMs = positive(READ_TIMEOUT_MS, builder.readTimeoutMs);
    this.retryCount = (int) notNegative(RETRY_COUNT, builder.retryCount);
    if (!(builder.retryBackoffFactor >= 0)) {
      throw new IllegalArgumentException(
          RETRY_BACKOFF_FACTOR + " must be a non-negative number: " + builder.retryBackoffFactor);
    }
    this.retryBackoffFactor = builder.retryBackoffFactor;
    this.maxResponseBytes = positive(MAX_RESPONSE_BYTES, builder.maxResponseBytes);
    this.maxUrlLength = positive(MAX_URL_LENGTH, builder.maxUrlLength);
    this.cacheTtlSeconds = positive(CACHE_TTL_SECONDS, builder.cacheTtlSeconds);
    this.cacheCapacity = positive(CACHE_CAPACITY, builder.cacheCapacity);
    if (Strings.isNullOrEmpty(builder.userAgent) || builder.userAgent.isBlank()) {
      throw new IllegalArgumentException(USER_AGENT + " must not be blank");
    }
    this.userAgent = builder.userAgent.trim();
  }

  public static ExplorerConfiguration defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Read the configuration from environment-style variables. Blank values are treated as unset.
   *
   * @param environment variable name to value, e.g. {@code System.getenv()}
   * @throws IllegalArgumentException if a value cannot be parsed or is out of range
   */
  public static ExplorerConfiguration fromEnvironment(Map<String, String> environment) {
    Builder builder = builder();
    Function<String, String> get =
        key -> {
          String value = environment.get(key);
          return value == null || value.isBlank() ? null : value.trim();
        };
    if (get.apply(CONNECT_TIMEOUT_MS) != null) {
      builder.connectTimeoutMs((int) parseLong(CONNECT_TIMEOUT_MS, get.apply(CONNECT_TIMEOUT_MS)));
    }
    if (get.apply(READ_TIMEOUT_MS) != null) {
      builder.readTimeoutMs((int) parseLong(READ_TIMEOUT_MS, get.apply(READ_TIMEOUT_MS)));
    }
    if (get.apply(RETRY_COUNT) != null) {
      builder.retryCount((int) parseLong(RETRY_COUNT, get.apply(RETRY_COUNT)));
    }
    if (get.apply(RETRY_BACKOFF_FACTOR) != null) {
      Double factor = Doubles.tryParse(get.apply(RETRY_BACKOFF_FACTOR));
      if (factor == null) {
        throw new IllegalArgumentException(
            RETRY_BACKOFF_FACTOR + " is not a number: " + get.apply(RETRY_BACKOFF_FACTOR));
      }
      builder.retryBackoffFactor(factor);
    }
    if (get.apply(MAX_RESPONSE_BYTES) != null) {
      builder.maxResponseBytes(parseLong(MAX_RESPONSE_BYTES, get.apply(MAX_RESPONSE_BYTES)));
    }
    if (get.apply(MAX_URL_LENGTH) != null) {
      builder.maxUrlLength((int) parseLong(MAX_URL_LENGTH, get.apply(MAX_URL_LENGTH)));
    }
    if (get.apply(CACHE_TTL_SECONDS) != null) {
      builder.cacheTtlSeconds(parseLong(CACHE_TTL_SECONDS, get.apply(CACHE_TTL_SECONDS)));
    }
    if (get.apply(CACHE_CAPACITY) != null) {
      builder.cacheCapacity(parseLong(CACHE_CAPACITY, get.apply(CACHE_CAPACITY)));
    }
    if (get.apply(USER_AGENT) != null) {
      builder.userAgent(get.apply(USER_AGENT));
    }
    return builder.build();
  }

  private static long parseLong(String key, String value) {
    Long ret = Longs.tryParse(value);
    if (ret == null || ret > Integer.MAX_VALUE && !key.equals(MAX_RESPONSE_BYTES)) {
      throw new IllegalArgumentException(key + " is not a valid integer: " + value);
    }
    return ret;
  }

  private static int positive(String key, int value) {
    return (int) positive(key, (long) value);
  }

  private static long positive(String key, long value) {
    if (value <= 0) {
      throw new IllegalArgumentException(key + " must be positive: " + value);
    }
    return value;
  }

  private static long notNegative(String key, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(key + " must not be negative: " + value);
    }
    return value;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public int getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public double getRetryBackoffFactor() {
    return retryBackoffFactor;
  }

  public long getMaxResponseBytes() {
    return maxResponseBytes;
  }

  public int getMaxUrlLength() {
    return maxUrlLength;
  }

  public long getCacheTtlSeconds() {
    return cacheTtlSeconds;
  }

  public long getCacheCapacity() {
    return cacheCapacity;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public static class Builder {

    private int connectTimeoutMs = 3050;
    private int readTimeoutMs = 18000;
    private int retryCount = 2;
    private double retryBackoffFactor = 0.5;
    private long maxResponseBytes = 25L * 1024 * 1024;
    private int maxUrlLength = 400;
    private long cacheTtlSeconds = 900;
    private long cacheCapacity = 64;
    private String userAgent = DEFAULT_USER_AGENT;

    public Builder connectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    public Builder readTimeoutMs(int readTimeoutMs) {
      this.readTimeoutMs = readTimeoutMs;
      return this;
    }

    public Builder retryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    public Builder retryBackoffFactor(double retryBackoffFactor) {
      this.retryBackoffFactor = retryBackoffFactor;
      return this;
    }

    public Builder maxResponseBytes(long maxResponseBytes) {
      this.maxResponseBytes = maxResponseBytes;
      return this;
    }

    public Builder maxUrlLength(int maxUrlLength) {
      this.maxUrlLength = maxUrlLength;
      return this;
    }

    public Builder cacheTtlSeconds(long cacheTtlSeconds) {
      this.cacheTtlSeconds = cacheTtlSeconds;
      return this;
    }

    public Builder cacheCapacity(long cacheCapacity) {
      this.cacheCapacity = cacheCapacity;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public ExplorerConfiguration build() {
      return new ExplorerConfiguration(this);
    }
  }
}
