package org.integratedmodelling.ogc;

import com.github.underscore.U;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.integratedmodelling.ogc.catalog.BoundingBox;
import org.integratedmodelling.ogc.catalog.CatalogItem;
import org.integratedmodelling.ogc.catalog.CatalogItemType;
import org.integratedmodelling.ogc.catalog.ItemCounts;
import org.integratedmodelling.ogc.catalog.StyleInfo;

/**
 * The normalized catalog of one service, built fresh by each successful pipeline run and never
 * modified afterwards. Items are sorted by prefix, local name and name.
 */
public final class ServiceResult {

  private final ServiceInfo service;
  private final ItemCounts counts;
  private final List<CatalogItem> items;
  private final Instant fetchedAt;
  private final long fetchDurationMs;

  public ServiceResult(
      ServiceInfo service,
      ItemCounts counts,
      List<CatalogItem> items,
      Instant fetchedAt,
      long fetchDurationMs) {
    this.service = service;
    this.counts = counts;
    this.items = ImmutableList.copyOf(items);
    this.fetchedAt = fetchedAt;
    this.fetchDurationMs = fetchDurationMs;
  }

  public ServiceInfo getService() {
    return service;
  }

  public ItemCounts getCounts() {
    return counts;
  }

  public List<CatalogItem> getItems() {
    return items;
  }

  public Instant getFetchedAt() {
    return fetchedAt;
  }

  /** Wall-clock duration of the successful attempt only. */
  public long getFetchDurationMs() {
    return fetchDurationMs;
  }

  /**
   * The result as nested maps and lists with snake_case keys, in the shape served by the JSON
   * API. Optional fields that do not apply to the service kind are left out.
   */
  public Map<String, Object> asMap() {

    Map<String, Object> serviceMap = new LinkedHashMap<>();
    serviceMap.put("key", service.getKey());
    serviceMap.put("label", service.getLabel());
    serviceMap.put("kind", service.getKind().name().toLowerCase(Locale.ROOT));
    serviceMap.put("url", service.getUrl());
    serviceMap.put("capabilities_url", service.getCapabilitiesUrl());
    serviceMap.put("version", service.getVersion());
    service
        .getOutputFormats()
        .ifPresent(formats -> serviceMap.put("output_formats", new ArrayList<>(formats)));

    Map<String, Object> countMap = new LinkedHashMap<>();
    countMap.put("items", counts.getItems());
    if (counts.getStyles() != null) {
      countMap.put("styles", counts.getStyles());
    }

    List<Object> itemList = new ArrayList<>();
    for (CatalogItem item : items) {
      itemList.add(asMap(item));
    }

    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("ok", true);
    ret.put("service", serviceMap);
    ret.put("counts", countMap);
    ret.put("items", itemList);
    ret.put("fetched_at", fetchedAt.getEpochSecond());
    ret.put("fetch_duration_ms", fetchDurationMs);
    return ret;
  }

  public String toJson() {
    return U.toJson(asMap());
  }

  private static Map<String, Object> asMap(CatalogItem item) {
    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("type", item.getType().field);
    ret.put("name", item.getName());
    ret.put("prefix", item.getPrefix());
    ret.put("local_name", item.getLocalName());
    ret.put("title", item.getTitle());
    ret.put("abstract", item.getAbstract());
    if (item.getType() == CatalogItemType.WMS_LAYER) {
      ret.put("queryable", item.getQueryable());
    }
    ret.put("crs", new ArrayList<>(item.getCrs()));
    if (item.getType() == CatalogItemType.WFS_FEATURE_TYPE) {
      ret.put("default_crs", item.getDefaultCrs());
    }
    if (item.getBoundingBoxWgs84().isPresent()) {
      BoundingBox box = item.getBoundingBoxWgs84().get();
      Map<String, Object> boxMap = new LinkedHashMap<>();
      boxMap.put("minx", box.getMinx());
      boxMap.put("miny", box.getMiny());
      boxMap.put("maxx", box.getMaxx());
      boxMap.put("maxy", box.getMaxy());
      boxMap.put("crs", box.getCrs());
      ret.put("bbox_wgs84", boxMap);
    }
    if (item.getType() == CatalogItemType.WMS_LAYER) {
      List<Object> styles = new ArrayList<>();
      for (StyleInfo style : item.getStyles()) {
        Map<String, Object> styleMap = new LinkedHashMap<>();
        styleMap.put("name", style.getName());
        styleMap.put("title", style.getTitle());
        styles.add(styleMap);
      }
      ret.put("styles", styles);
    }
    return ret;
  }
}
