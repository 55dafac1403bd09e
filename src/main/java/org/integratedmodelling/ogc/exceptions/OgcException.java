package org.integratedmodelling.ogc.exceptions;

/**
 * Root of all failures raised while acquiring capabilities. Unchecked, like the rest of the
 * runtime exceptions in this component: callers map the concrete subtype to their own surface.
 */
public class OgcException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public OgcException(String message) {
    super(message);
  }

  public OgcException(String message, Throwable cause) {
    super(message, cause);
  }
}
