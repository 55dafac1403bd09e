package org.integratedmodelling.ogc.exceptions;

/** Either the connect or the read timeout expired. */
public class TransportTimeoutException extends TransportException {

  private static final long serialVersionUID = 1L;

  public TransportTimeoutException(String url, Throwable cause) {
    super(url, "Timeout while retrieving " + url, cause);
  }
}
