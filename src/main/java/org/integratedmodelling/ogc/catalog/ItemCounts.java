package org.integratedmodelling.ogc.catalog;

/** Aggregate counts for a catalog. The style count is only meaningful for WMS. */
public final class ItemCounts {

  private final int items;
  private final Integer styles;

  public ItemCounts(int items, Integer styles) {
    this.items = items;
    this.styles = styles;
  }

  public int getItems() {
    return items;
  }

  /**
   * @return the total number of styles over all layers, or null when the catalog is not a WMS one
   */
  public Integer getStyles() {
    return styles;
  }
}
