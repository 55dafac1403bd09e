package org.integratedmodelling.ogc.registry;

import java.util.Set;
import java.util.stream.Collectors;
import org.integratedmodelling.ogc.ServiceDescriptor;
import org.integratedmodelling.ogc.ServiceKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class StaticServiceRegistryTest {

    @Test
    public void loadsTheBundledServices() {
        StaticServiceRegistry registry = StaticServiceRegistry.loadDefaults();

        Assertions.assertEquals(10, registry.getServices().size());
        ServiceDescriptor dwd = registry.get("dwd_wms").orElseThrow();
        Assertions.assertEquals(ServiceKind.WMS, dwd.getKind());
        Assertions.assertTrue(dwd.getBaseUrl().startsWith("https://"));
        Assertions.assertEquals("DWD", dwd.getGroup());

        Set<ServiceKind> kinds =
                registry.getServices().stream()
                        .map(ServiceDescriptor::getKind)
                        .collect(Collectors.toSet());
        Assertions.assertEquals(Set.of(ServiceKind.values()), kinds);
    }

    @Test
    public void unknownKeysAreAbsent() {
        StaticServiceRegistry registry = StaticServiceRegistry.loadDefaults();
        Assertions.assertTrue(registry.get("nope").isEmpty());
    }

    @Test
    public void labelDefaultsToKey() {
        StaticServiceRegistry registry =
                StaticServiceRegistry.fromJson(
                        "{\"services\":[{\"key\":\"k\",\"kind\":\"WCS\",\"url\":\"https://example.org\"}]}");
        ServiceDescriptor service = registry.get("k").orElseThrow();
        Assertions.assertEquals("k", service.getLabel());
        Assertions.assertEquals(ServiceKind.WCS, service.getKind());
        Assertions.assertEquals("", service.getGroup());
    }

    @Test
    public void rejectsBadDocuments() {
        Assertions.assertThrows(
                IllegalArgumentException.class, () -> StaticServiceRegistry.fromJson("{\"x\":[]}"));
        Assertions.assertThrows(
                IllegalArgumentException.class,
                () ->
                        StaticServiceRegistry.fromJson(
                                "{\"services\":[{\"key\":\"k\",\"kind\":\"wps\",\"url\":\"https://a.org\"}]}"));
        Assertions.assertThrows(
                IllegalArgumentException.class,
                () ->
                        StaticServiceRegistry.fromJson(
                                "{\"services\":["
                                        + "{\"key\":\"k\",\"kind\":\"wms\",\"url\":\"https://a.org\"},"
                                        + "{\"key\":\"k\",\"kind\":\"wfs\",\"url\":\"https://b.org\"}]}"));
    }
}
