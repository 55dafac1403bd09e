package org.integratedmodelling.ogc.catalog;

import java.util.Objects;

/** A geographic extent. Every box produced by the parsers is expressed in EPSG:4326. */
public final class BoundingBox {

  public static final String WGS84 = "EPSG:4326";

  private final double minx;
  private final double miny;
  private final double maxx;
  private final double maxy;
  private final String crs;

  private BoundingBox(double minx, double miny, double maxx, double maxy, String crs) {
    this.minx = minx;
    this.miny = miny;
    this.maxx = maxx;
    this.maxy = maxy;
    this.crs = crs;
  }

  public static BoundingBox wgs84(double minx, double miny, double maxx, double maxy) {
    return new BoundingBox(minx, miny, maxx, maxy, WGS84);
  }

  public double getMinx() {
    return minx;
  }

  public double getMiny() {
    return miny;
  }

  public double getMaxx() {
    return maxx;
  }

  public double getMaxy() {
    return maxy;
  }

  public String getCrs() {
    return crs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BoundingBox)) {
      return false;
    }
    BoundingBox other = (BoundingBox) o;
    return Double.compare(minx, other.minx) == 0
        && Double.compare(miny, other.miny) == 0
        && Double.compare(maxx, other.maxx) == 0
        && Double.compare(maxy, other.maxy) == 0
        && crs.equals(other.crs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(minx, miny, maxx, maxy, crs);
  }

  @Override
  public String toString() {
    return "[" + minx + " " + miny + ", " + maxx + " " + maxy + "] " + crs;
  }
}
