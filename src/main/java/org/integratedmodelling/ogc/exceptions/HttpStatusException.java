package org.integratedmodelling.ogc.exceptions;

/** The remote service answered with a non-2xx status after all retries. */
public class HttpStatusException extends TransportException {

  private static final long serialVersionUID = 1L;

  private final int status;

  public HttpStatusException(String url, int status, String statusText) {
    super(
        url,
        "Cannot access content at "
            + url
            + ": "
            + status
            + (statusText == null || statusText.isBlank() ? "" : " " + statusText));
    this.status = status;
  }

  public int getStatus() {
    return status;
  }
}
