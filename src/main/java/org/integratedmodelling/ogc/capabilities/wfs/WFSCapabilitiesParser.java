package org.integratedmodelling.ogc.capabilities.wfs;

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
 * Reads WFS 1.0.0, 1.1.0 and 2.0.0 capabilities into feature types, and collects the output
 * formats the service declares for GetFeature.
 */
public class WFSCapabilitiesParser implements CapabilitiesParser {

  public static final String GET_FEATURE = "GetFeature";
  public static final String OUTPUT_FORMAT = "outputFormat";

  @Override
  public ParsedCapabilities parse(byte[] content) {

    Document document = CapabilitiesXml.parse(content);
    Element root = document.getDocumentElement();

    Optional<Element> featureTypeList = CapabilitiesXml.first(root, "FeatureTypeList");
    List<Element> featureTypes =
        featureTypeList.isPresent()
            ? children(featureTypeList.get(), "FeatureType")
            : CapabilitiesXml.descendants(root, "FeatureType");

    List<CatalogItem> items = new ArrayList<>();
    for (Element featureType : featureTypes) {
      String name = childText(featureType, "Name");
      if (name == null) {
        continue;
      }
      String defaultCrs = childText(featureType, "DefaultCRS", "DefaultSRS");
      Set<String> crs = new LinkedHashSet<>();
      if (defaultCrs != null) {
        crs.add(defaultCrs);
      }
      crs.addAll(CapabilitiesXml.childTexts(featureType, "OtherCRS"));
      crs.addAll(CapabilitiesXml.childTexts(featureType, "OtherSRS"));
      // WFS 1.0.0 declares a single SRS element
      crs.addAll(CapabilitiesXml.childTexts(featureType, "SRS"));

      items.add(
          CatalogItem.builder(CatalogItemType.WFS_FEATURE_TYPE, name)
              .title(childText(featureType, "Title"))
              .abstractText(childText(featureType, "Abstract"))
              .defaultCrs(defaultCrs)
              .crs(crs)
              .boundingBox(boundingBox(featureType).orElse(null))
              .build());
    }

    return new ParsedCapabilities(
        items, CapabilitiesXml.version(document).orElse(null), outputFormats(root));
  }

  private static Optional<BoundingBox> boundingBox(Element featureType) {
    for (Element box : children(featureType, "WGS84BoundingBox")) {
      Optional<BoundingBox> ret = CapabilitiesXml.cornerPair(box, "LowerCorner", "UpperCorner");
      if (ret.isPresent()) {
        return ret;
      }
    }
    return Optional.empty();
  }

  /**
   * OWS-style {@code OperationsMetadata} (1.1.0, 2.0.0) lists allowed values of the GetFeature
   * {@code outputFormat} parameter; 1.0.0 names the formats as children of {@code ResultFormat}.
   */
  static List<String> outputFormats(Element root) {

    Set<String> ret = new LinkedHashSet<>();

    for (Element metadata : CapabilitiesXml.descendants(root, "OperationsMetadata")) {
      for (Element operation : children(metadata, "Operation")) {
        if (!GET_FEATURE.equals(operation.getAttribute("name"))) {
          continue;
        }
        for (Element parameter : children(operation, "Parameter")) {
          if (OUTPUT_FORMAT.equalsIgnoreCase(parameter.getAttribute("name"))) {
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

    for (Element request : CapabilitiesXml.descendants(root, "Request")) {
      for (Element getFeature : children(request, GET_FEATURE)) {
        for (Element resultFormat : children(getFeature, "ResultFormat")) {
          for (Element format : children(resultFormat)) {
            ret.add(CapabilitiesXml.localName(format));
          }
        }
      }
    }

    return new ArrayList<>(ret);
  }
}
