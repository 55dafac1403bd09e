package org.integratedmodelling.ogc.capabilities.wcs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.commons.io.IOUtils;
import org.integratedmodelling.ogc.capabilities.ParsedCapabilities;
import org.integratedmodelling.ogc.catalog.BoundingBox;
import org.integratedmodelling.ogc.catalog.CatalogItem;
import org.integratedmodelling.ogc.catalog.CatalogItemType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WCSCapabilitiesParserTest {

    private static ParsedCapabilities parse(String resource) throws IOException {
        return new WCSCapabilitiesParser()
                .parse(IOUtils.resourceToByteArray("/capabilities/" + resource));
    }

    @Test
    public void readsCoverageSummaries() throws IOException {
        ParsedCapabilities parsed = parse("wcs-2.0.1.xml");

        Assertions.assertEquals("2.0.1", parsed.getVersion().orElse(null));
        Assertions.assertEquals(List.of("image/tiff", "image/png"), parsed.getOutputFormats().get());

        List<CatalogItem> items = parsed.getItems();
        Assertions.assertEquals(2, items.size());
        CatalogItem mean = items.get(0);
        Assertions.assertEquals(CatalogItemType.WCS_COVERAGE, mean.getType());
        Assertions.assertEquals("emodnet__mean", mean.getName());
        Assertions.assertEquals("", mean.getPrefix());
        Assertions.assertEquals("Mean depth", mean.getTitle());
        Assertions.assertEquals(
                BoundingBox.wgs84(-36.0, 15.0, 43.0, 90.0), mean.getBoundingBoxWgs84().get());

        CatalogItem contours = items.get(1);
        Assertions.assertEquals("", contours.getTitle());
        Assertions.assertTrue(contours.getBoundingBoxWgs84().isEmpty());
    }

    @Test
    public void readsVersion100OfferingBriefs() throws IOException {
        ParsedCapabilities parsed = parse("wcs-1.0.0.xml");

        Assertions.assertEquals("1.0.0", parsed.getVersion().orElse(null));
        CatalogItem elevation = parsed.getItems().get(0);
        Assertions.assertEquals("elevation-global-90m", elevation.getName());
        Assertions.assertEquals("Elevation", elevation.getTitle());
        Assertions.assertEquals("Global elevation at 90m", elevation.getAbstract());
        Assertions.assertEquals(
                BoundingBox.wgs84(-180.0, -56.0, 180.0, 60.0), elevation.getBoundingBoxWgs84().get());
    }

    @Test
    public void readsIdentifierAndSupportedCrs() {
        String xml =
                "<Capabilities version=\"1.1.1\"><Contents><CoverageSummary>"
                        + "<Identifier>dem</Identifier>"
                        + "<SupportedCRS>urn:ogc:def:crs:EPSG::4326</SupportedCRS>"
                        + "<BoundingBox crs=\"urn:ogc:def:crs:EPSG::3035\"/>"
                        + "</CoverageSummary></Contents><OperationsMetadata>"
                        + "<Operation name=\"GetCoverage\"><Parameter name=\"Format\">"
                        + "<AllowedValues><Value>image/tiff</Value></AllowedValues>"
                        + "</Parameter></Operation></OperationsMetadata></Capabilities>";

        ParsedCapabilities parsed =
                new WCSCapabilitiesParser().parse(xml.getBytes(StandardCharsets.UTF_8));

        CatalogItem dem = parsed.getItems().get(0);
        Assertions.assertEquals("dem", dem.getName());
        Assertions.assertEquals(
                List.of("urn:ogc:def:crs:EPSG::4326", "urn:ogc:def:crs:EPSG::3035"), dem.getCrs());
        Assertions.assertEquals(List.of("image/tiff"), parsed.getOutputFormats().get());
    }
}
