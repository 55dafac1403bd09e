package org.integratedmodelling.ogc;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;

/**
 * The OGC service protocols this component can read, each with the versions tried against a
 * server, most modern first. The trailing empty version means "do not send a version": some
 * servers reject an explicit version they don't support but answer an unqualified request.
 */
public enum ServiceKind {
  WMS("1.3.0", "1.1.1", ServiceKind.UNSPECIFIED_VERSION),
  WFS("2.0.0", "1.1.0", "1.0.0", ServiceKind.UNSPECIFIED_VERSION),
  WCS("2.0.1", "2.0.0", "1.0.0", ServiceKind.UNSPECIFIED_VERSION);

  public static final String UNSPECIFIED_VERSION = "";

  private final List<String> candidateVersions;

  ServiceKind(String... candidateVersions) {
    this.candidateVersions = ImmutableList.copyOf(candidateVersions);
  }

  public List<String> getCandidateVersions() {
    return candidateVersions;
  }

  /** The value of the {@code service} request parameter. */
  public String getServiceParameter() {
    return name();
  }

  /** Only WMS layers carry styles. */
  public boolean hasStyles() {
    return this == WMS;
  }

  /**
   * @param kind case-insensitive protocol name, e.g. "wms"
   * @throws IllegalArgumentException if the kind is not one of the supported protocols
   */
  public static ServiceKind fromString(String kind) {
    if (kind == null) {
      throw new IllegalArgumentException("service kind is missing");
    }
    try {
      return valueOf(kind.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unsupported service kind: " + kind, e);
    }
  }
}
