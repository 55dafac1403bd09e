package org.integratedmodelling.ogc.catalog;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;

/**
 * Imposes the deterministic output order on a catalog and computes its counts. Parsers already
 * emit one item per named element, so no de-duplication happens here.
 */
public final class CatalogNormalizer {

  /** Ascending on prefix, then local name, then full name. Case-sensitive. */
  public static final Comparator<CatalogItem> ORDER =
      Comparator.comparing(CatalogItem::getPrefix)
          .thenComparing(CatalogItem::getLocalName)
          .thenComparing(CatalogItem::getName);

  private CatalogNormalizer() {}

  public static List<CatalogItem> sort(List<CatalogItem> items) {
    return ImmutableList.sortedCopyOf(ORDER, items);
  }

  /**
   * @param items the catalog
   * @param countStyles true for WMS catalogs, whose styles are summed over all layers
   */
  public static ItemCounts count(List<CatalogItem> items, boolean countStyles) {
    Integer styles = null;
    if (countStyles) {
      styles = items.stream().mapToInt(item -> item.getStyles().size()).sum();
    }
    return new ItemCounts(items.size(), styles);
  }
}
