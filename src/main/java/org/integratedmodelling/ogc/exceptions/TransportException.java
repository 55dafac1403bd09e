package org.integratedmodelling.ogc.exceptions;

/** Connection-level failure while talking to a remote service. */
public class TransportException extends OgcException {

  private static final long serialVersionUID = 1L;

  private final String url;

  public TransportException(String url, String message) {
    super(message);
    this.url = url;
  }

  public TransportException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
