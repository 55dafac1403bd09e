package org.integratedmodelling.ogc.exceptions;

/** The streamed response body exceeded the configured byte ceiling. */
public class PayloadTooLargeException extends TransportException {

  private static final long serialVersionUID = 1L;

  private final long limit;

  public PayloadTooLargeException(String url, long limit) {
    super(url, "Response from " + url + " exceeds the limit of " + limit + " bytes");
    this.limit = limit;
  }

  public long getLimit() {
    return limit;
  }
}
