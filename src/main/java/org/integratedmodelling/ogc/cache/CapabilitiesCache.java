package org.integratedmodelling.ogc.cache;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-bucketed memoization in front of the capabilities pipeline. Entries are keyed by service
 * key and {@code floor(epochSeconds / ttl)}, so they stop being hit when the bucket rolls over
 * without any per-entry timer. Only successful results are stored: a failure is handed back to the
 * caller and the next request goes to the network again. Capacity is bounded with LRU eviction.
 *
 * <p>Concurrent misses on the same key are coalesced by the underlying Guava loader, so a cold key
 * is fetched once however many callers ask for it at the same time.
 *
 * @param <T> the cached result type
 */
public class CapabilitiesCache<T> {

  private static final Logger logger = LoggerFactory.getLogger(CapabilitiesCache.class);

  private final Function<String, T> pipeline;
  private final long ttlSeconds;
  private final Clock clock;
  private final Cache<BucketKey, T> cache;

  /**
   * @param pipeline computes the result for a service key, throwing on failure
   * @param ttlSeconds width of a time bucket
   * @param capacity maximum number of stored results
   * @param clock source of the current time for bucketing
   */
  public CapabilitiesCache(
      Function<String, T> pipeline, long ttlSeconds, long capacity, Clock clock) {
    if (ttlSeconds <= 0 || capacity <= 0) {
      throw new IllegalArgumentException("cache TTL and capacity must be positive");
    }
    this.pipeline = pipeline;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
    this.cache =
        CacheBuilder.newBuilder()
            .maximumSize(capacity)
            // a single segment makes eviction strictly least-recently-used
            .concurrencyLevel(1)
            // an entry can't outlive its bucket, this only frees memory early
            .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
            .build();
  }

  /**
   * @param serviceKey the service to look up
   * @param bypass if true, run the pipeline and return its outcome without storing it
   * @return the cached or freshly computed result
   */
  public T get(String serviceKey, boolean bypass) {

    if (bypass) {
      logger.debug("Bypassing cache for {}", serviceKey);
      return pipeline.apply(serviceKey);
    }

    BucketKey key = new BucketKey(serviceKey, bucket());
    T cached = cache.getIfPresent(key);
    if (cached != null) {
      logger.debug("Cache hit for {} in bucket {}", serviceKey, key.bucket);
      return cached;
    }

    try {
      return cache.get(key, () -> pipeline.apply(serviceKey));
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException(e.getCause());
    } catch (UncheckedExecutionException | ExecutionError e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
  }

  /** The current time bucket. */
  public long bucket() {
    return Math.floorDiv(clock.instant().getEpochSecond(), ttlSeconds);
  }

  public long size() {
    return cache.size();
  }

  private static final class BucketKey {

    private final String serviceKey;
    private final long bucket;

    BucketKey(String serviceKey, long bucket) {
      this.serviceKey = serviceKey;
      this.bucket = bucket;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof BucketKey)) {
        return false;
      }
      BucketKey other = (BucketKey) o;
      return bucket == other.bucket && serviceKey.equals(other.serviceKey);
    }

    @Override
    public int hashCode() {
      return Objects.hash(serviceKey, bucket);
    }
  }
}
