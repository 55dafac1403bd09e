package org.integratedmodelling.ogc.exceptions;

/**
 * Every candidate version failed. The message carries a truncated description of the last
 * failure, which is also available as the cause.
 */
public class CapabilitiesUnavailableException extends OgcException {

  private static final long serialVersionUID = 1L;

  public CapabilitiesUnavailableException(String message, Throwable lastError) {
    super(message, lastError);
  }
}
