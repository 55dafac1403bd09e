package org.integratedmodelling.ogc;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A known OGC endpoint as supplied by the registry. The group is only used for display and is
 * passed through untouched. The base URL is validated when a request is built from it.
 */
public final class ServiceDescriptor {

  private final String key;
  private final String label;
  private final ServiceKind kind;
  private final String baseUrl;
  private final String group;

  public ServiceDescriptor(
      String key, String label, ServiceKind kind, String baseUrl, String group) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(key), "service key is empty");
    this.key = key;
    this.label = Strings.isNullOrEmpty(label) ? key : label;
    this.kind = Preconditions.checkNotNull(kind, "kind");
    this.baseUrl = Strings.nullToEmpty(baseUrl);
    this.group = Strings.nullToEmpty(group);
  }

  public ServiceDescriptor(String key, String label, ServiceKind kind, String baseUrl) {
    this(key, label, kind, baseUrl, "");
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

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getGroup() {
    return group;
  }

  @Override
  public String toString() {
    return key + " (" + kind + " " + baseUrl + ")";
  }
}
