package org.integratedmodelling.ogc.catalog;

import java.util.Objects;

/** A WMS style advertised by a layer. Either field may be empty, not both. */
public final class StyleInfo {

  private final String name;
  private final String title;

  public StyleInfo(String name, String title) {
    this.name = name == null ? "" : name;
    this.title = title == null ? "" : title;
  }

  public String getName() {
    return name;
  }

  public String getTitle() {
    return title;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StyleInfo)) {
      return false;
    }
    StyleInfo other = (StyleInfo) o;
    return name.equals(other.name) && title.equals(other.title);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, title);
  }

  @Override
  public String toString() {
    return name + (title.isEmpty() ? "" : " (" + title + ")");
  }
}
