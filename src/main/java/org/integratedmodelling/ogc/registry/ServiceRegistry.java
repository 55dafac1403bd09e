package org.integratedmodelling.ogc.registry;

import java.util.Collection;
import java.util.Optional;
import org.integratedmodelling.ogc.ServiceDescriptor;

/** Source of the known service endpoints. */
public interface ServiceRegistry {

  Optional<ServiceDescriptor> get(String serviceKey);

  /** All descriptors, in registration order. */
  Collection<ServiceDescriptor> getServices();
}
