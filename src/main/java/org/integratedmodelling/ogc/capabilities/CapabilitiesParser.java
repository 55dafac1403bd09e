package org.integratedmodelling.ogc.capabilities;

import org.integratedmodelling.ogc.ServiceKind;
import org.integratedmodelling.ogc.capabilities.wcs.WCSCapabilitiesParser;
import org.integratedmodelling.ogc.capabilities.wfs.WFSCapabilitiesParser;
import org.integratedmodelling.ogc.capabilities.wms.WMSCapabilitiesParser;

/** Turns one protocol's capabilities document into catalog items. */
public interface CapabilitiesParser {

  /**
   * @param content the raw capabilities response
   * @return the items in document order, with the declared version and output formats
   * @throws org.integratedmodelling.ogc.exceptions.MalformedDocumentException if the content is
   *     not a readable capabilities document
   */
  ParsedCapabilities parse(byte[] content);

  static CapabilitiesParser forKind(ServiceKind kind) {
    return switch (kind) {
      case WMS -> new WMSCapabilitiesParser();
      case WFS -> new WFSCapabilitiesParser();
      case WCS -> new WCSCapabilitiesParser();
    };
  }
}
