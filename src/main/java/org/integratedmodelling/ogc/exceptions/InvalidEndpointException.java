package org.integratedmodelling.ogc.exceptions;

/** The base URL of a service is empty, too long, not https or not a valid URI. */
public class InvalidEndpointException extends OgcException {

  private static final long serialVersionUID = 1L;

  public InvalidEndpointException(String message) {
    super(message);
  }

  public InvalidEndpointException(String message, Throwable cause) {
    super(message, cause);
  }
}
