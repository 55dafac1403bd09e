package org.integratedmodelling.ogc.negotiation;

import com.google.common.base.Ascii;
import com.google.common.base.Stopwatch;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.integratedmodelling.ogc.ServiceDescriptor;
import org.integratedmodelling.ogc.ServiceKind;
import org.integratedmodelling.ogc.capabilities.CapabilitiesParser;
import org.integratedmodelling.ogc.capabilities.ParsedCapabilities;
import org.integratedmodelling.ogc.exceptions.CapabilitiesUnavailableException;
import org.integratedmodelling.ogc.exceptions.OgcException;
import org.integratedmodelling.ogc.http.CapabilitiesTransport;
import org.integratedmodelling.ogc.http.EndpointBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries the candidate versions of a service kind in order and returns the first one that can be
 * both fetched and parsed. Failures of earlier candidates are expected while probing and only the
 * last one is reported when all fail. Attempts are strictly sequential.
 */
public class VersionNegotiator {

  private static final Logger logger = LoggerFactory.getLogger(VersionNegotiator.class);

  public static final int MAX_ERROR_LENGTH = 220;

  private final EndpointBuilder endpointBuilder;
  private final CapabilitiesTransport transport;
  private final Clock clock;

  public VersionNegotiator(
      EndpointBuilder endpointBuilder, CapabilitiesTransport transport, Clock clock) {
    this.endpointBuilder = endpointBuilder;
    this.transport = transport;
    this.clock = clock;
  }

  /**
   * @param service the service to query
   * @return the successful attempt
   * @throws CapabilitiesUnavailableException if no candidate version succeeds
   * @throws org.integratedmodelling.ogc.exceptions.InvalidEndpointException if the base URL is
   *     unusable, which no version can fix
   */
  public AttemptOutcome.Success negotiate(ServiceDescriptor service) {

    ServiceKind kind = service.getKind();
    CapabilitiesParser parser = CapabilitiesParser.forKind(kind);
    OgcException lastError = null;

    for (String version : kind.getCandidateVersions()) {
      AttemptOutcome outcome = attempt(service, parser, version);
      if (outcome instanceof AttemptOutcome.Success success) {
        logger.debug(
            "{}: version '{}' answered in {} ms",
            service.getKey(),
            version,
            success.getDurationMs());
        return success;
      }
      lastError = ((AttemptOutcome.Failure) outcome).getError();
      logger.debug(
          "{}: version '{}' failed at {}: {}",
          service.getKey(),
          version,
          outcome.getCapabilitiesUrl(),
          lastError.getMessage());
    }

    String message =
        kind
            + " capabilities could not be loaded: "
            + Ascii.truncate(describe(lastError), MAX_ERROR_LENGTH, "...");
    logger.warn("{}: {}", service.getKey(), message);
    throw new CapabilitiesUnavailableException(message, lastError);
  }

  AttemptOutcome attempt(ServiceDescriptor service, CapabilitiesParser parser, String version) {

    Map<String, String> parameters = new LinkedHashMap<>();
    parameters.put("service", service.getKind().getServiceParameter());
    parameters.put("request", "GetCapabilities");
    if (!version.isEmpty()) {
      parameters.put("version", version);
    }
    String url = endpointBuilder.build(service.getBaseUrl(), parameters);

    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      byte[] content = transport.get(url);
      ParsedCapabilities capabilities = parser.parse(content);
      return AttemptOutcome.success(
          version, url, capabilities, clock.instant(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
    } catch (OgcException e) {
      return AttemptOutcome.failure(version, url, e);
    }
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "no candidate version";
    }
    return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
  }
}
