package org.integratedmodelling.ogc.http;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Set;
import kong.unirest.HttpResponse;
import kong.unirest.RawResponse;
import kong.unirest.Unirest;
import kong.unirest.UnirestException;
import kong.unirest.UnirestInstance;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.integratedmodelling.ogc.configuration.ExplorerConfiguration;
import org.integratedmodelling.ogc.exceptions.HttpStatusException;
import org.integratedmodelling.ogc.exceptions.PayloadTooLargeException;
import org.integratedmodelling.ogc.exceptions.TransportException;
import org.integratedmodelling.ogc.exceptions.TransportTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport over a dedicated Unirest instance. Requests are plain GETs, so transient failures
 * (throttling, gateway errors, timeouts, refused connections) are retried with exponential
 * backoff. The body is streamed through a bound one byte above the configured ceiling, so an
 * oversized response is detected without reading it all.
 */
public class UnirestCapabilitiesTransport implements CapabilitiesTransport, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(UnirestCapabilitiesTransport.class);

  public static final String ACCEPT = "application/xml,text/xml,*/*;q=0.9";

  private static final Set<Integer> RETRY_STATUS = ImmutableSet.of(429, 500, 502, 503, 504);

  private final UnirestInstance unirest;
  private final int retryCount;
  private final double retryBackoffFactor;
  private final long maxResponseBytes;

  public UnirestCapabilitiesTransport(ExplorerConfiguration configuration) {
    this.retryCount = configuration.getRetryCount();
    this.retryBackoffFactor = configuration.getRetryBackoffFactor();
    this.maxResponseBytes = configuration.getMaxResponseBytes();
    this.unirest = Unirest.spawnInstance();
    this.unirest
        .config()
        .connectTimeout(configuration.getConnectTimeoutMs())
        .socketTimeout(configuration.getReadTimeoutMs())
        .automaticRetries(false)
        .setDefaultHeader("User-Agent", configuration.getUserAgent())
        .setDefaultHeader("Accept", ACCEPT);
  }

  @Override
  public byte[] get(String url) {

    TransportException failure = null;

    for (int attempt = 0; attempt <= retryCount; attempt++) {
      if (attempt > 0) {
        backoff(url, attempt);
      }
      try {
        return fetch(url);
      } catch (PayloadTooLargeException e) {
        throw e;
      } catch (HttpStatusException e) {
        if (!RETRY_STATUS.contains(e.getStatus())) {
          throw e;
        }
        failure = e;
      } catch (TransportException e) {
        failure = e;
      }
      logger.warn(
          "Attempt {} of {} for {} failed: {}",
          attempt + 1,
          retryCount + 1,
          url,
          failure.getMessage());
    }

    throw failure;
  }

  private byte[] fetch(String url) {

    HttpResponse<Body> response;
    try {
      response = unirest.get(url).asObject(this::read);
    } catch (UnirestException e) {
      throw classify(url, e);
    }

    Body body = response.getBody();
    if (body == null) {
      throw new TransportException(url, "No response received from " + url);
    }
    if (body.error != null) {
      throw classify(url, body.error);
    }
    if (body.status < 200 || body.status >= 300) {
      throw new HttpStatusException(url, body.status, body.statusText);
    }
    if (body.content == null) {
      throw new PayloadTooLargeException(url, maxResponseBytes);
    }
    return body.content;
  }

  /*
   * Runs inside Unirest, which turns exceptions thrown here into parsing errors, so failures are
   * returned in the Body. The stream is not closed here: closing a partially read entity would
   * drain the rest of an oversized body, while Unirest releases the connection on return.
   */
  private Body read(RawResponse response) {
    int status = response.getStatus();
    if (status < 200 || status >= 300) {
      return new Body(status, response.getStatusText(), null, null);
    }
    try {
      byte[] content =
          IOUtils.toByteArray(new BoundedInputStream(response.getContent(), maxResponseBytes + 1));
      boolean tooLarge = content.length > maxResponseBytes;
      return new Body(status, response.getStatusText(), tooLarge ? null : content, null);
    } catch (IOException e) {
      return new Body(status, response.getStatusText(), null, e);
    }
  }

  private static TransportException classify(String url, Throwable error) {
    boolean timeout =
        Throwables.getCausalChain(error).stream()
            .anyMatch(t -> t instanceof InterruptedIOException);
    if (timeout) {
      return new TransportTimeoutException(url, error);
    }
    Throwable root = Throwables.getRootCause(error);
    return new TransportException(
        url,
        "Cannot connect to "
            + url
            + ": "
            + (root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage()),
        error);
  }

  private void backoff(String url, int attempt) {
    long millis = (long) (retryBackoffFactor * 1000 * Math.pow(2, attempt - 1));
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(url, "Interrupted while waiting to retry " + url, e);
    }
  }

  @Override
  public void close() {
    unirest.shutDown();
  }

  private static final class Body {

    final int status;
    final String statusText;
    // null when the ceiling was exceeded or reading failed
    final byte[] content;
    final IOException error;

    Body(int status, String statusText, byte[] content, IOException error) {
      this.status = status;
      this.statusText = statusText;
      this.content = content;
      this.error = error;
    }
  }
}
