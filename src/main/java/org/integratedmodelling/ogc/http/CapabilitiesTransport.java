package org.integratedmodelling.ogc.http;

/**
 * Retrieves the raw bytes behind a fully built request URL. Implementations apply their own
 * bounded retry policy and surface a single typed failure once it is exhausted.
 */
@FunctionalInterface
public interface CapabilitiesTransport {

  /**
   * @param url the request URL
   * @return the response body of a successful (2xx) response
   * @throws org.integratedmodelling.ogc.exceptions.TransportException or one of its subtypes
   */
  byte[] get(String url);
}
