package org.integratedmodelling.ogc.exceptions;

/**
 * A capabilities response could not be read as a capabilities document: broken XML, or an OGC
 * exception report returned in its place.
 */
public class MalformedDocumentException extends OgcException {

  private static final long serialVersionUID = 1L;

  public MalformedDocumentException(String message) {
    super(message);
  }

  public MalformedDocumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
