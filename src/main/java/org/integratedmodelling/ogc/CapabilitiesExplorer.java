package org.integratedmodelling.ogc;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import org.integratedmodelling.ogc.cache.CapabilitiesCache;
import org.integratedmodelling.ogc.catalog.CatalogItem;
import org.integratedmodelling.ogc.catalog.CatalogNormalizer;
import org.integratedmodelling.ogc.configuration.ExplorerConfiguration;
import org.integratedmodelling.ogc.exceptions.OgcException;
import org.integratedmodelling.ogc.exceptions.UnknownServiceException;
import org.integratedmodelling.ogc.http.CapabilitiesTransport;
import org.integratedmodelling.ogc.http.EndpointBuilder;
import org.integratedmodelling.ogc.http.UnirestCapabilitiesTransport;
import org.integratedmodelling.ogc.negotiation.AttemptOutcome;
import org.integratedmodelling.ogc.negotiation.VersionNegotiator;
import org.integratedmodelling.ogc.registry.ServiceRegistry;
import org.integratedmodelling.ogc.registry.StaticServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the capabilities pipeline. {@link #fetch(String, boolean)} resolves a service key
 * against the registry and returns its normalized catalog, from the cache unless asked to bypass
 * it. On a miss the supported versions are negotiated with the remote service and the first
 * readable capabilities document becomes the result.
 *
 * <p>Instances are thread-safe. Calls for different services run independently; the only shared
 * state is the cache.
 */
public class CapabilitiesExplorer implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(CapabilitiesExplorer.class);

  private final ServiceRegistry registry;
  private final CapabilitiesTransport transport;
  private final VersionNegotiator negotiator;
  private final CapabilitiesCache<ServiceResult> cache;

  public CapabilitiesExplorer(
      ServiceRegistry registry,
      CapabilitiesTransport transport,
      ExplorerConfiguration configuration,
      Clock clock) {
    this.registry = registry;
    this.transport = transport;
    this.negotiator =
        new VersionNegotiator(
            new EndpointBuilder(configuration.getMaxUrlLength()), transport, clock);
    this.cache =
        new CapabilitiesCache<>(
            this::retrieve,
            configuration.getCacheTtlSeconds(),
            configuration.getCacheCapacity(),
            clock);
  }

  /** An explorer over HTTP, with the system clock. */
  public static CapabilitiesExplorer create(
      ExplorerConfiguration configuration, ServiceRegistry registry) {
    return new CapabilitiesExplorer(
        registry,
        new UnirestCapabilitiesTransport(configuration),
        configuration,
        Clock.systemUTC());
  }

  /**
   * @param serviceKey a key known to the registry
   * @param bypassCache if true, always go to the network and leave the cache untouched
   * @return the normalized catalog of the service
   * @throws UnknownServiceException if the key is blank or not registered
   * @throws org.integratedmodelling.ogc.exceptions.CapabilitiesUnavailableException if no
   *     supported version could be read
   * @throws org.integratedmodelling.ogc.exceptions.InvalidEndpointException if the registered URL
   *     is not usable
   */
  public ServiceResult fetch(String serviceKey, boolean bypassCache) {
    String key = serviceKey == null ? null : serviceKey.trim();
    if (key == null || key.isEmpty() || registry.get(key).isEmpty()) {
      throw new UnknownServiceException(serviceKey);
    }
    return cache.get(key, bypassCache);
  }

  public Collection<ServiceDescriptor> services() {
    return registry.getServices();
  }

  private ServiceResult retrieve(String serviceKey) {

    ServiceDescriptor service =
        registry.get(serviceKey).orElseThrow(() -> new UnknownServiceException(serviceKey));

    logger.info(
        "Retrieving {} capabilities for {} from {}",
        service.getKind(),
        serviceKey,
        service.getBaseUrl());

    AttemptOutcome.Success success = negotiator.negotiate(service);
    List<CatalogItem> items = CatalogNormalizer.sort(success.getCapabilities().getItems());
    ServiceResult ret =
        new ServiceResult(
            new ServiceInfo(
                service,
                success.getCapabilitiesUrl(),
                success.getNegotiatedVersion(),
                service.getKind() == ServiceKind.WMS
                    ? null
                    : success.getCapabilities().getOutputFormats().orElse(List.of())),
            CatalogNormalizer.count(items, service.getKind().hasStyles()),
            items,
            success.getFetchedAt(),
            success.getDurationMs());

    logger.info(
        "Read {} items from {} (version {}) in {} ms",
        items.size(),
        serviceKey,
        ret.getService().getVersion(),
        ret.getFetchDurationMs());

    return ret;
  }

  @Override
  public void close() {
    if (transport instanceof UnirestCapabilitiesTransport unirest) {
      unirest.close();
    }
  }

  /**
   * Fetch the services named on the command line, bypassing the cache, and print their catalogs
   * as JSON. Without arguments, list the registered services.
   *
   * @param args service keys
   */
  public static void main(String[] args) {

    ExplorerConfiguration configuration = ExplorerConfiguration.fromEnvironment(System.getenv());

    try (CapabilitiesExplorer explorer =
        create(configuration, StaticServiceRegistry.loadDefaults())) {

      if (args.length == 0) {
        for (ServiceDescriptor service : explorer.services()) {
          System.out.println(
              service.getKey() + "\t" + service.getKind() + "\t" + service.getLabel());
        }
        return;
      }

      for (String key : args) {
        try {
          System.out.println(explorer.fetch(key, true).toJson());
        } catch (OgcException e) {
          logger.error("Cannot read capabilities for {}: {}", key, e.getMessage(), e);
        }
      }
    }
  }
}
