package org.integratedmodelling.ogc.catalog;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * One layer, feature type or coverage as advertised in a capabilities document. The name is the
 * qualified identifier found in the document and is never empty; prefix and local name are the
 * name split on its first colon. Optional text fields are empty strings when the document has no
 * value for them.
 */
public final class CatalogItem {

  private final CatalogItemType type;
  private final String name;
  private final String prefix;
  private final String localName;
  private final String title;
  private final String abstractText;
  private final String queryable;
  private final List<String> crs;
  private final String defaultCrs;
  private final BoundingBox boundingBoxWgs84;
  private final List<StyleInfo> styles;

  private CatalogItem(Builder builder) {
    this.type = builder.type;
    this.name = builder.name;
    int separator = name.indexOf(':');
    this.prefix = separator < 0 ? "" : name.substring(0, separator);
    this.localName = separator < 0 ? name : name.substring(separator + 1);
    this.title = Strings.nullToEmpty(builder.title);
    this.abstractText = Strings.nullToEmpty(builder.abstractText);
    this.queryable = Strings.nullToEmpty(builder.queryable);
    this.crs = builder.crs.build();
    this.defaultCrs = Strings.nullToEmpty(builder.defaultCrs);
    this.boundingBoxWgs84 = builder.boundingBoxWgs84;
    this.styles = builder.styles.build();
  }

  public static Builder builder(CatalogItemType type, String name) {
    return new Builder(type, name);
  }

  public CatalogItemType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getLocalName() {
    return localName;
  }

  public String getTitle() {
    return title;
  }

  public String getAbstract() {
    return abstractText;
  }

  public String getQueryable() {
    return queryable;
  }

  public List<String> getCrs() {
    return crs;
  }

  public String getDefaultCrs() {
    return defaultCrs;
  }

  public Optional<BoundingBox> getBoundingBoxWgs84() {
    return Optional.ofNullable(boundingBoxWgs84);
  }

  public List<StyleInfo> getStyles() {
    return styles;
  }

  @Override
  public String toString() {
    return type.field + " " + name + (title.isEmpty() ? "" : " \"" + title + "\"");
  }

  public static class Builder {

    private final CatalogItemType type;
    private final String name;
    private String title;
    private String abstractText;
    private String queryable;
    private String defaultCrs;
    private BoundingBox boundingBoxWgs84;
    private final ImmutableList.Builder<String> crs = ImmutableList.builder();
    private final ImmutableList.Builder<StyleInfo> styles = ImmutableList.builder();

    private Builder(CatalogItemType type, String name) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(name), "a catalog item must have a non-empty name");
      this.type = Preconditions.checkNotNull(type, "type");
      this.name = name;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder abstractText(String abstractText) {
      this.abstractText = abstractText;
      return this;
    }

    public Builder queryable(String queryable) {
      this.queryable = queryable;
      return this;
    }

    public Builder defaultCrs(String defaultCrs) {
      this.defaultCrs = defaultCrs;
      return this;
    }

    public Builder crs(Collection<String> codes) {
      this.crs.addAll(codes);
      return this;
    }

    public Builder boundingBox(BoundingBox boundingBox) {
      this.boundingBoxWgs84 = boundingBox;
      return this;
    }

    public Builder styles(Collection<StyleInfo> styles) {
      this.styles.addAll(styles);
      return this;
    }

    public CatalogItem build() {
      return new CatalogItem(this);
    }
  }
}
