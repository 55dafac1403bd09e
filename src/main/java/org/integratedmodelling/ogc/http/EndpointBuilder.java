package org.integratedmodelling.ogc.http;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.integratedmodelling.ogc.exceptions.InvalidEndpointException;

/**
 * Builds request URLs from a service base URL and a set of parameter overrides. Parameter keys are
 * case-insensitive in OGC requests, so all keys are folded to lowercase and an override replaces
 * any existing parameter with the same logical name. Existing parameters keep their position, new
 * ones follow in key order, so equal inputs always produce the same URL.
 */
public class EndpointBuilder {

  private static final Splitter PARAMETERS = Splitter.on('&').omitEmptyStrings();
  private static final Splitter KEY_VALUE = Splitter.on('=').limit(2);

  private final int maxUrlLength;

  public EndpointBuilder(int maxUrlLength) {
    this.maxUrlLength = maxUrlLength;
  }

  /**
   * @param baseUrl an https URL, possibly with a query string
   * @param overrides parameters to set, taking precedence over those in the base URL
   * @return the request URL
   * @throws InvalidEndpointException if the base URL is empty, too long, not https or not a URI
   */
  public String build(String baseUrl, Map<String, String> overrides) {

    if (baseUrl == null || baseUrl.isBlank()) {
      throw new InvalidEndpointException("Service URL is empty");
    }
    if (baseUrl.length() > maxUrlLength) {
      throw new InvalidEndpointException(
          "Service URL exceeds the maximum length of " + maxUrlLength + " characters");
    }

    URI uri;
    try {
      uri = new URI(baseUrl.trim());
    } catch (URISyntaxException e) {
      throw new InvalidEndpointException("Service URL is not valid: " + e.getMessage(), e);
    }

    if (uri.getScheme() == null || !uri.getScheme().toLowerCase(Locale.ROOT).equals("https")) {
      throw new InvalidEndpointException("Only https:// service URLs are allowed: " + baseUrl);
    }
    if (uri.getRawAuthority() == null || host(uri.getRawAuthority()).isEmpty()) {
      throw new InvalidEndpointException("Service URL has no host: " + baseUrl);
    }

    Map<String, String> query = parseQuery(uri.getRawQuery());
    Map<String, String> added = new TreeMap<>();
    for (Map.Entry<String, String> override : overrides.entrySet()) {
      String key = override.getKey().toLowerCase(Locale.ROOT);
      String value = override.getValue() == null ? "" : override.getValue();
      if (query.containsKey(key)) {
        query.put(key, value);
      } else {
        added.put(key, value);
      }
    }
    query.putAll(added);

    StringBuilder ret = new StringBuilder("https://").append(uri.getRawAuthority());
    if (uri.getRawPath() != null) {
      ret.append(uri.getRawPath());
    }
    if (!query.isEmpty()) {
      ret.append('?').append(encodeQuery(query));
    }
    if (uri.getRawFragment() != null) {
      ret.append('#').append(uri.getRawFragment());
    }
    return ret.toString();
  }

  /** Lowercase keys, decoded values, blank values kept. Later duplicates win. */
  static Map<String, String> parseQuery(String rawQuery) {
    Map<String, String> ret = new LinkedHashMap<>();
    if (rawQuery == null) {
      return ret;
    }
    for (String parameter : PARAMETERS.split(rawQuery)) {
      List<String> keyValue = KEY_VALUE.splitToList(parameter);
      String key = decode(keyValue.get(0)).toLowerCase(Locale.ROOT);
      if (key.isEmpty()) {
        continue;
      }
      ret.put(key, keyValue.size() > 1 ? decode(keyValue.get(1)) : "");
    }
    return ret;
  }

  /**
   * The host of a raw authority, without user info or port. {@link URI#getHost()} is null for
   * registry-based authorities, which include host names with an underscore.
   */
  static String host(String rawAuthority) {
    String ret = rawAuthority.substring(rawAuthority.lastIndexOf('@') + 1);
    if (ret.startsWith("[")) {
      int end = ret.indexOf(']');
      return end < 0 ? "" : ret.substring(0, end + 1);
    }
    int port = ret.lastIndexOf(':');
    return port < 0 ? ret : ret.substring(0, port);
  }

  private static String encodeQuery(Map<String, String> query) {
    Map<String, String> encoded = new LinkedHashMap<>();
    query.forEach((key, value) -> encoded.put(encode(key), encode(value)));
    return Joiner.on('&').withKeyValueSeparator('=').join(encoded);
  }

  private static String decode(String s) {
    try {
      return URLDecoder.decode(s, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new InvalidEndpointException("Service URL has a malformed query: " + s, e);
    }
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }
}
