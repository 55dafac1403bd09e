package org.integratedmodelling.ogc;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/** The service block of a result: which service was read, through which URL and version. */
public final class ServiceInfo {

  private final String key;
  private final String label;
  private final ServiceKind kind;
  private final String url;
  private final String capabilitiesUrl;
  private final String version;
  private final List<String> outputFormats;

  public ServiceInfo(
      ServiceDescriptor descriptor,
      String capabilitiesUrl,
      String version,
      List<String> outputFormats) {
    this.key = descriptor.getKey();
    this.label = descriptor.getLabel();
    this.kind = descriptor.getKind();
    this.url = descriptor.getBaseUrl();
    this.capabilitiesUrl = capabilitiesUrl;
    this.version = version;
    this.outputFormats = outputFormats == null ? null : ImmutableList.copyOf(outputFormats);
  }

  public String getKey() {
    return key;
  }

  public String getLabel() {
    return label;
  }

  public ServiceKind getKind() {
    return kind;
  }

  /** The base URL from the registry. */
  public String getUrl() {
    return url;
  }

  /** The GetCapabilities request that succeeded. */
  public String getCapabilitiesUrl() {
    return capabilitiesUrl;
  }

  /** The negotiated version; null if neither the document nor the request named one. */
  public String getVersion() {
    return version;
  }

  /** Output formats declared by WFS and WCS services; empty for WMS. */
  public Optional<List<String>> getOutputFormats() {
    return Optional.ofNullable(outputFormats);
  }
}
