package org.integratedmodelling.ogc.registry;

import com.github.underscore.U;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.io.IOUtils;
import org.integratedmodelling.ogc.ServiceDescriptor;
import org.integratedmodelling.ogc.ServiceKind;

/**
 * Immutable registry of service descriptors, either assembled in code or read from a JSON document
 * of the form {@code {"services": [{"key", "label", "kind", "url", "group"}, ...]}}.
 */
public class StaticServiceRegistry implements ServiceRegistry {

  public static final String DEFAULT_RESOURCE = "/ogc-services.json";

  private final Map<String, ServiceDescriptor> services;

  public StaticServiceRegistry(Collection<ServiceDescriptor> services) {
    ImmutableMap.Builder<String, ServiceDescriptor> builder = ImmutableMap.builder();
    for (ServiceDescriptor service : services) {
      builder.put(service.getKey(), service);
    }
    // fails on duplicate keys
    this.services = builder.buildOrThrow();
  }

  /** The services bundled with the component. */
  public static StaticServiceRegistry loadDefaults() {
    try {
      return fromJson(IOUtils.resourceToString(DEFAULT_RESOURCE, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  /**
   * @throws IllegalArgumentException if the document is not a valid service list
   */
  public static StaticServiceRegistry fromJson(String json) {
    Map<String, Object> document = U.fromJsonMap(json);
    if (!(document.get("services") instanceof List)) {
      throw new IllegalArgumentException("service registry has no 'services' list");
    }
    ImmutableMap.Builder<String, ServiceDescriptor> ret = ImmutableMap.builder();
    for (Object o : (List<?>) document.get("services")) {
      if (!(o instanceof Map)) {
        throw new IllegalArgumentException("service registry entry is not an object: " + o);
      }
      Map<?, ?> entry = (Map<?, ?>) o;
      ServiceDescriptor service =
          new ServiceDescriptor(
              string(entry, "key"),
              string(entry, "label"),
              ServiceKind.fromString(string(entry, "kind")),
              string(entry, "url"),
              string(entry, "group"));
      ret.put(service.getKey(), service);
    }
    return new StaticServiceRegistry(ret.buildOrThrow().values());
  }

  private static String string(Map<?, ?> entry, String field) {
    Object ret = entry.get(field);
    return ret == null ? null : ret.toString();
  }

  @Override
  public Optional<ServiceDescriptor> get(String serviceKey) {
    return serviceKey == null ? Optional.empty() : Optional.ofNullable(services.get(serviceKey));
  }

  @Override
  public Collection<ServiceDescriptor> getServices() {
    return services.values();
  }
}
