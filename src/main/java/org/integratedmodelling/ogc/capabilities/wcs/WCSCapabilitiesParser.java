package org.integratedmodelling.ogc.capabilities.wcs;

import static org.integratedmodelling.ogc.capabilities.CapabilitiesXml.childText;
import static org.integratedmodelling.ogc.capabilities.CapabilitiesXml.children;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.integratedmodelling.ogc.capabilities.CapabilitiesParser;
import org.integratedmodelling.ogc.capabilities.CapabilitiesXml;
import org.integratedmodelling.ogc.capabilities.ParsedCapabilities;
import org.integratedmodelling.ogc.catalog.BoundingBox;
import org.integratedmodelling.ogc.catalog.CatalogItem;
import org.integratedmodelling.ogc.catalog.CatalogItemType;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Reads WCS capabilities into coverages. WCS 2.x and 1.1 list {@code CoverageSummary} elements
 * identified by {@code CoverageId} or {@code Identifier}; WCS 1.0.0 lists {@code
 * CoverageOfferingBrief} elements with a {@code name}, {@code label} and a {@code lonLatEnvelope}.
 */
public class WCSCapabilitiesParser implements CapabilitiesParser {

  public static final String COVERAGE_ID = "CoverageId";
  public static final String IDENTIFIER = "Identifier";
  public static final String GET_COVERAGE = "GetCoverage";

  @Override
  public ParsedCapabilities parse(byte[] content) {

    Document document = CapabilitiesXml.parse(content);
    Element root = document.getDocumentElement();
    List<CatalogItem> items = new ArrayList<>();

    for (Element summary : CapabilitiesXml.descendants(root, "CoverageSummary")) {
      String name = childText(summary, COVERAGE_ID, IDENTIFIER);
      if (name == null) {
        continue;
      }
      Set<String> crs = new LinkedHashSet<>(CapabilitiesXml.childTexts(summary, "SupportedCRS"));
      for (Element box : children(summary, "BoundingBox")) {
        String code = box.getAttribute("crs");
        if (!code.isBlank()) {
          crs.add(code.trim());
        }
      }
      items.add(
          CatalogItem.builder(CatalogItemType.WCS_COVERAGE, name)
              .title(childText(summary, "Title"))
              .abstractText(childText(summary, "Abstract"))
              .crs(crs)
              .boundingBox(wgs84BoundingBox(summary).orElse(null))
              .build());
    }

    for (Element brief : CapabilitiesXml.descendants(root, "CoverageOfferingBrief")) {
      String name = childText(brief, "name");
      if (name == null) {
        continue;
      }
      items.add(
          CatalogItem.builder(CatalogItemType.WCS_COVERAGE, name)
              .title(childText(brief, "label"))
              .abstractText(childText(brief, "description"))
              .boundingBox(lonLatEnvelope(brief).orElse(null))
              .build());
    }

    return new ParsedCapabilities(
        items, CapabilitiesXml.version(document).orElse(null), outputFormats(root));
  }

  private static Optional<BoundingBox> wgs84BoundingBox(Element summary) {
    for (Element box : children(summary, "WGS84BoundingBox")) {
      Optional<BoundingBox> ret = CapabilitiesXml.cornerPair(box, "LowerCorner", "UpperCorner");
      if (ret.isPresent()) {
        return ret;
      }
    }
    return Optional.empty();
  }

  /** WCS 1.0.0: two {@code gml:pos} children, lower corner first, in lon/lat order. */
  private static Optional<BoundingBox> lonLatEnvelope(Element brief) {
    for (Element envelope : children(brief, "lonLatEnvelope")) {
      List<String> positions = CapabilitiesXml.childTexts(envelope, "pos");
      if (positions.size() < 2) {
        continue;
      }
      double[] lower = CapabilitiesXml.coordinates(positions.get(0));
      double[] upper = CapabilitiesXml.coordinates(positions.get(1));
      if (lower != null && upper != null) {
        return Optional.of(BoundingBox.wgs84(lower[0], lower[1], upper[0], upper[1]));
      }
    }
    return Optional.empty();
  }

  /**
   * Formats from {@code ServiceMetadata/formatSupported} (2.x) and from the allowed values of the
   * GetCoverage {@code format} parameter (1.1).
   */
  static List<String> outputFormats(Element root) {

    Set<String> ret = new LinkedHashSet<>();

    for (Element metadata : CapabilitiesXml.descendants(root, "ServiceMetadata")) {
      ret.addAll(CapabilitiesXml.childTexts(metadata, "formatSupported"));
    }

    for (Element metadata : CapabilitiesXml.descendants(root, "OperationsMetadata")) {
      for (Element operation : children(metadata, "Operation")) {
        if (!GET_COVERAGE.equals(operation.getAttribute("name"))) {
          continue;
        }
        for (Element parameter : children(operation, "Parameter")) {
          if ("format".equalsIgnoreCase(parameter.getAttribute("name"))) {
            for (Element value : CapabilitiesXml.descendants(parameter, "Value")) {
              String format = CapabilitiesXml.text(value);
              if (!format.isEmpty()) {
                ret.add(format);
              }
            }
          }
        }
      }
    }

    return new ArrayList<>(ret);
  }
}
