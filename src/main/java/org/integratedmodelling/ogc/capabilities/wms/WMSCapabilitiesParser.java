package org.integratedmodelling.ogc.capabilities.wms;

import static org.integratedmodelling.ogc.capabilities.CapabilitiesXml.childText;
import static org.integratedmodelling.ogc.capabilities.CapabilitiesXml.children;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
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
import org.integratedmodelling.ogc.catalog.StyleInfo;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Reads WMS 1.1.1 and 1.3.0 capabilities. The layer tree is walked depth-first, pre-order, from
 * the first {@code Layer} under {@code Capability}. Title and CRS are inherited from the nearest
 * ancestor that declares them; a layer's own CRS list replaces the inherited one. Layers without a
 * name only group their children and are not emitted.
 */
public class WMSCapabilitiesParser implements CapabilitiesParser {

  @Override
  public ParsedCapabilities parse(byte[] content) {

    Document document = CapabilitiesXml.parse(content);
    Element root = document.getDocumentElement();
    Element capability = CapabilitiesXml.first(root, "Capability").orElse(root);

    List<CatalogItem> items = new ArrayList<>();
    CapabilitiesXml.first(capability, "Layer")
        .ifPresent(top -> walk(top, null, ImmutableList.of(), items));

    return new ParsedCapabilities(items, CapabilitiesXml.version(document).orElse(null), null);
  }

  private void walk(
      Element layer, String inheritedTitle, List<String> inheritedCrs, List<CatalogItem> items) {

    String name = childText(layer, "Name");
    String title = childText(layer, "Title");
    if (title == null) {
      title = inheritedTitle;
    }
    List<String> declared = declaredCrs(layer);
    List<String> crs = declared.isEmpty() ? inheritedCrs : declared;

    if (name != null) {
      items.add(
          CatalogItem.builder(CatalogItemType.WMS_LAYER, name)
              .title(title)
              .abstractText(childText(layer, "Abstract"))
              .queryable(layer.getAttribute("queryable"))
              .crs(crs)
              .boundingBox(boundingBox(layer).orElse(null))
              .styles(styles(layer))
              .build());
    }

    for (Element child : children(layer, "Layer")) {
      walk(child, title, crs, items);
    }
  }

  /** CRS (1.3.0) and SRS (1.1.1) codes, some servers packing several into one element. */
  static List<String> declaredCrs(Element layer) {
    Set<String> ret = new LinkedHashSet<>();
    for (String element : new String[] {"CRS", "SRS"}) {
      for (String text : CapabilitiesXml.childTexts(layer, element)) {
        ret.addAll(CapabilitiesXml.tokens(text));
      }
    }
    return ImmutableList.copyOf(ret);
  }

  static Optional<BoundingBox> boundingBox(Element layer) {

    for (Element box : children(layer, "EX_GeographicBoundingBox")) {
      Double west = CapabilitiesXml.number(childText(box, "westBoundLongitude"));
      Double east = CapabilitiesXml.number(childText(box, "eastBoundLongitude"));
      Double south = CapabilitiesXml.number(childText(box, "southBoundLatitude"));
      Double north = CapabilitiesXml.number(childText(box, "northBoundLatitude"));
      if (west != null && east != null && south != null && north != null) {
        return Optional.of(BoundingBox.wgs84(west, south, east, north));
      }
    }

    for (Element box : children(layer, "WGS84BoundingBox")) {
      Optional<BoundingBox> ret = CapabilitiesXml.cornerPair(box, "LowerCorner", "UpperCorner");
      if (ret.isPresent()) {
        return ret;
      }
    }

    for (Element box : children(layer, "LatLonBoundingBox")) {
      Double minx = CapabilitiesXml.number(box.getAttribute("minx"));
      Double miny = CapabilitiesXml.number(box.getAttribute("miny"));
      Double maxx = CapabilitiesXml.number(box.getAttribute("maxx"));
      Double maxy = CapabilitiesXml.number(box.getAttribute("maxy"));
      if (minx != null && miny != null && maxx != null && maxy != null) {
        return Optional.of(BoundingBox.wgs84(minx, miny, maxx, maxy));
      }
    }

    return Optional.empty();
  }

  private static List<StyleInfo> styles(Element layer) {
    List<StyleInfo> ret = new ArrayList<>();
    for (Element style : children(layer, "Style")) {
      String name = Strings.nullToEmpty(childText(style, "Name"));
      String title = Strings.nullToEmpty(childText(style, "Title"));
      if (!name.isEmpty() || !title.isEmpty()) {
        ret.add(new StyleInfo(name, title));
      }
    }
    return ret;
  }
}
