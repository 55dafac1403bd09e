package org.integratedmodelling.ogc.capabilities;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import org.integratedmodelling.ogc.catalog.CatalogItem;

/** What a parser extracted from one capabilities document. */
public final class ParsedCapabilities {

  private final List<CatalogItem> items;
  private final String version;
  private final List<String> outputFormats;

  public ParsedCapabilities(List<CatalogItem> items, String version, List<String> outputFormats) {
    this.items = ImmutableList.copyOf(items);
    this.version = version;
    this.outputFormats = outputFormats == null ? null : ImmutableList.copyOf(outputFormats);
  }

  public List<CatalogItem> getItems() {
    return items;
  }

  /** The version declared by the document root, if any. */
  public Optional<String> getVersion() {
    return Optional.ofNullable(version);
  }

  /** Declared output formats; empty for protocols that do not advertise them (WMS). */
  public Optional<List<String>> getOutputFormats() {
    return Optional.ofNullable(outputFormats);
  }
}
