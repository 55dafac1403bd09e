package org.integratedmodelling.ogc.negotiation;

import java.time.Instant;
import org.integratedmodelling.ogc.capabilities.ParsedCapabilities;
import org.integratedmodelling.ogc.exceptions.OgcException;

/**
 * Result of requesting and parsing capabilities for one candidate version: either the parsed
 * document or the typed failure that ended the attempt.
 */
public abstract class AttemptOutcome {

  private final String requestedVersion;
  private final String capabilitiesUrl;

  private AttemptOutcome(String requestedVersion, String capabilitiesUrl) {
    this.requestedVersion = requestedVersion;
    this.capabilitiesUrl = capabilitiesUrl;
  }

  public static Success success(
      String requestedVersion,
      String capabilitiesUrl,
      ParsedCapabilities capabilities,
      Instant fetchedAt,
      long durationMs) {
    return new Success(requestedVersion, capabilitiesUrl, capabilities, fetchedAt, durationMs);
  }

  public static Failure failure(
      String requestedVersion, String capabilitiesUrl, OgcException error) {
    return new Failure(requestedVersion, capabilitiesUrl, error);
  }

  public abstract boolean isSuccess();

  /** The candidate version sent, or the empty string when the version was omitted. */
  public String getRequestedVersion() {
    return requestedVersion;
  }

  public String getCapabilitiesUrl() {
    return capabilitiesUrl;
  }

  public static final class Success extends AttemptOutcome {

    private final ParsedCapabilities capabilities;
    private final Instant fetchedAt;
    private final long durationMs;

    private Success(
        String requestedVersion,
        String capabilitiesUrl,
        ParsedCapabilities capabilities,
        Instant fetchedAt,
        long durationMs) {
      super(requestedVersion, capabilitiesUrl);
      this.capabilities = capabilities;
      this.fetchedAt = fetchedAt;
      this.durationMs = durationMs;
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    public ParsedCapabilities getCapabilities() {
      return capabilities;
    }

    public Instant getFetchedAt() {
      return fetchedAt;
    }

    public long getDurationMs() {
      return durationMs;
    }

    /** The version declared by the document, else the one requested, else null. */
    public String getNegotiatedVersion() {
      return capabilities
          .getVersion()
          .orElse(getRequestedVersion().isEmpty() ? null : getRequestedVersion());
    }
  }

  public static final class Failure extends AttemptOutcome {

    private final OgcException error;

    private Failure(String requestedVersion, String capabilitiesUrl, OgcException error) {
      super(requestedVersion, capabilitiesUrl);
      this.error = error;
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    public OgcException getError() {
      return error;
    }
  }
}
