package org.integratedmodelling.ogc.exceptions;

/** The service key is blank or not known to the registry. */
public class UnknownServiceException extends OgcException {

  private static final long serialVersionUID = 1L;

  private final String serviceKey;

  public UnknownServiceException(String serviceKey) {
    super(
        serviceKey == null || serviceKey.isBlank()
            ? "No service key given"
            : "Unknown service: " + serviceKey);
    this.serviceKey = serviceKey;
  }

  public String getServiceKey() {
    return serviceKey;
  }
}
