package org.integratedmodelling.ogc.catalog;

/** What a catalog item stands for in its source service. */
public enum CatalogItemType {
  WMS_LAYER("wms_layer"),
  WFS_FEATURE_TYPE("wfs_feature_type"),
  WCS_COVERAGE("wcs_coverage");

  public final String field;

  CatalogItemType(String field) {
    this.field = field;
  }
}
