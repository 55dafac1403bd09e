package org.integratedmodelling.ogc;

import com.github.underscore.U;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.io.IOUtils;
import org.integratedmodelling.ogc.catalog.CatalogItem;
import org.integratedmodelling.ogc.configuration.ExplorerConfiguration;
import org.integratedmodelling.ogc.exceptions.CapabilitiesUnavailableException;
import org.integratedmodelling.ogc.exceptions.HttpStatusException;
import org.integratedmodelling.ogc.exceptions.UnknownServiceException;
import org.integratedmodelling.ogc.http.CapabilitiesTransport;
import org.integratedmodelling.ogc.registry.StaticServiceRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CapabilitiesExplorerTest {

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_100L));
    private final AtomicInteger requests = new AtomicInteger();

    private final StaticServiceRegistry registry =
            new StaticServiceRegistry(
                    List.of(
                            new ServiceDescriptor(
                                    "weather_wms", "Weather", ServiceKind.WMS, "https://wms.example.org/ows"),
                            new ServiceDescriptor(
                                    "weather_wfs", "Weather", ServiceKind.WFS, "https://wfs.example.org/ows"),
                            new ServiceDescriptor(
                                    "depth_wcs", "Depth", ServiceKind.WCS, "https://wcs.example.org/ows"),
                            new ServiceDescriptor(
                                    "down_wms", "Down", ServiceKind.WMS, "https://down.example.org/ows")));

    private static byte[] fixture(String name) {
        try {
            return IOUtils.resourceToByteArray("/capabilities/" + name);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private final CapabilitiesTransport transport =
            url -> {
                requests.incrementAndGet();
                if (url.startsWith("https://wms.example.org")) {
                    return fixture("wms-1.3.0.xml");
                }
                if (url.startsWith("https://wfs.example.org")) {
                    return fixture("wfs-2.0.0.xml");
                }
                if (url.startsWith("https://wcs.example.org")) {
                    return fixture("wcs-2.0.1.xml");
                }
                throw new HttpStatusException(url, 503, "Service Unavailable");
            };

    private CapabilitiesExplorer explorer() {
        return new CapabilitiesExplorer(registry, transport, ExplorerConfiguration.defaults(), clock);
    }

    @Test
    public void returnsSortedCatalogWithServiceInfo() {
        ServiceResult result = explorer().fetch("weather_wms", false);

        Assertions.assertEquals(
                List.of("Basemap", "dwd:RX-Produkt", "dwd:Warnungen_Gemeinden"),
                result.getItems().stream().map(CatalogItem::getName).toList());
        Assertions.assertEquals(3, result.getCounts().getItems());
        Assertions.assertEquals(3, result.getCounts().getStyles());

        ServiceInfo service = result.getService();
        Assertions.assertEquals("weather_wms", service.getKey());
        Assertions.assertEquals(ServiceKind.WMS, service.getKind());
        Assertions.assertEquals("1.3.0", service.getVersion());
        Assertions.assertEquals(
                "https://wms.example.org/ows?request=GetCapabilities&service=WMS&version=1.3.0",
                service.getCapabilitiesUrl());
        Assertions.assertTrue(service.getOutputFormats().isEmpty());
        Assertions.assertEquals(clock.instant(), result.getFetchedAt());
    }

    @Test
    public void servesTheSameResultWithinABucket() {
        CapabilitiesExplorer explorer = explorer();
        ServiceResult first = explorer.fetch("weather_wfs", false);
        clock.advance(Duration.ofSeconds(30));
        ServiceResult second = explorer.fetch(" weather_wfs ", false);

        Assertions.assertSame(first, second);
        Assertions.assertEquals(first.getFetchedAt(), second.getFetchedAt());
        Assertions.assertEquals(1, requests.get());

        ServiceResult fresh = explorer.fetch("weather_wfs", true);
        Assertions.assertNotSame(first, fresh);
        Assertions.assertEquals(2, requests.get());
        Assertions.assertSame(first, explorer.fetch("weather_wfs", false));
    }

    @Test
    public void refetchesInTheNextBucket() {
        CapabilitiesExplorer explorer = explorer();
        ServiceResult first = explorer.fetch("depth_wcs", false);
        clock.advance(Duration.ofSeconds(900));
        ServiceResult second = explorer.fetch("depth_wcs", false);

        Assertions.assertNotSame(first, second);
        Assertions.assertEquals(2, requests.get());
        Assertions.assertEquals(
                List.of("image/tiff", "image/png"), second.getService().getOutputFormats().get());
    }

    @Test
    public void unknownAndBlankKeysAreRejected() {
        CapabilitiesExplorer explorer = explorer();
        UnknownServiceException unknown =
                Assertions.assertThrows(
                        UnknownServiceException.class, () -> explorer.fetch("nope", false));
        Assertions.assertEquals("Unknown service: nope", unknown.getMessage());

        UnknownServiceException blank =
                Assertions.assertThrows(UnknownServiceException.class, () -> explorer.fetch("  ", false));
        Assertions.assertEquals("No service key given", blank.getMessage());
        Assertions.assertThrows(UnknownServiceException.class, () -> explorer.fetch(null, true));
        Assertions.assertEquals(0, requests.get());
    }

    @Test
    public void failuresAreReportedAndRetriedOnTheNextCall() {
        CapabilitiesExplorer explorer = explorer();
        CapabilitiesUnavailableException exception =
                Assertions.assertThrows(
                        CapabilitiesUnavailableException.class, () -> explorer.fetch("down_wms", false));
        Assertions.assertTrue(
                exception.getMessage().startsWith("WMS capabilities could not be loaded"));
        Assertions.assertEquals(3, requests.get());

        Assertions.assertThrows(
                CapabilitiesUnavailableException.class, () -> explorer.fetch("down_wms", false));
        Assertions.assertEquals(6, requests.get());
    }

    @Test
    public void serializesToJson() {
        ServiceResult result = explorer().fetch("weather_wfs", false);
        Map<String, Object> json = U.fromJsonMap(result.toJson());

        Assertions.assertEquals(true, json.get("ok"));
        Map<?, ?> service = (Map<?, ?>) json.get("service");
        Assertions.assertEquals("wfs", service.get("kind"));
        Assertions.assertEquals("2.0.0", service.get("version"));
        Assertions.assertEquals(3, ((List<?>) service.get("output_formats")).size());

        Map<?, ?> counts = (Map<?, ?>) json.get("counts");
        Assertions.assertFalse(counts.containsKey("styles"));

        List<?> items = (List<?>) json.get("items");
        Assertions.assertEquals(2, items.size());
        Map<?, ?> stations = (Map<?, ?>) items.get(0);
        Assertions.assertEquals("cdc:Stations", stations.get("name"));
        Assertions.assertEquals("wfs_feature_type", stations.get("type"));
        Assertions.assertEquals("urn:ogc:def:crs:EPSG::25832", stations.get("default_crs"));
        Assertions.assertFalse(stations.containsKey("styles"));
        Assertions.assertFalse(stations.containsKey("queryable"));
        Assertions.assertFalse(stations.containsKey("bbox_wgs84"));

        Map<?, ?> warnings = (Map<?, ?>) items.get(1);
        Map<?, ?> box = (Map<?, ?>) warnings.get("bbox_wgs84");
        Assertions.assertEquals("EPSG:4326", box.get("crs"));
        Assertions.assertEquals(
                result.getFetchedAt().getEpochSecond(),
                ((Number) json.get("fetched_at")).longValue());
    }

    @Test
    public void bundledRegistryWorksWithTheExplorer() {
        CapabilitiesExplorer explorer =
                new CapabilitiesExplorer(
                        StaticServiceRegistry.loadDefaults(),
                        transport,
                        ExplorerConfiguration.defaults(),
                        clock);
        Assertions.assertFalse(explorer.services().isEmpty());
        Assertions.assertThrows(
                CapabilitiesUnavailableException.class, () -> explorer.fetch("dwd_wms", true));
    }
}
