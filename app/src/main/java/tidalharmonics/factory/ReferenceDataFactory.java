package tidalharmonics.factory;

import lombok.extern.slf4j.Slf4j;
import tidalharmonics.domain.constituent.ConstituentCatalog;
import tidalharmonics.domain.constituent.ConstituentDefinition;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.io.CatalogDocument;
import tidalharmonics.io.JsonFileHandler;
import tidalharmonics.io.StationDocument;

import java.io.IOException;
import java.util.List;

/**
 * Fábrica centralizada de los datos de referencia de solo lectura: catálogo de
 * constituyentes y estaciones.
 * <p>
 * Al construir un catálogo comprueba que la velocidad declarada de cada constituyente
 * coincide con la implicada por sus números de Doodson.
 */
@Slf4j
public final class ReferenceDataFactory {

    public static final String DEFAULT_CATALOG_RESOURCE = "constituents.json";

    /**
     * Diferencia máxima admitida entre la velocidad declarada y la de Doodson (grados/hora).
     */
    static final double SPEED_TOLERANCE = 1e-3;

    private static final JsonFileHandler jsonHandler = new JsonFileHandler();

    /**
     * Prohibido construir esta clase utilidad
     */
    private ReferenceDataFactory() {
    }

    /**
     * Catálogo estándar incluido en el classpath.
     */
    public static ConstituentCatalog loadDefaultCatalog() throws IOException {
        return toCatalog(jsonHandler.readFromClasspath(DEFAULT_CATALOG_RESOURCE, CatalogDocument.class), DEFAULT_CATALOG_RESOURCE);
    }

    public static ConstituentCatalog loadCatalog(String filePath) throws IOException {
        return toCatalog(jsonHandler.readFromFile(filePath, CatalogDocument.class), filePath);
    }

    public static List<TideStation> loadStations(String filePath) throws IOException {
        return jsonHandler.readFromFile(filePath, StationDocument.class).stations();
    }

    public static List<TideStation> loadStationsFromClasspath(String resourceName) throws IOException {
        return jsonHandler.readFromClasspath(resourceName, StationDocument.class).stations();
    }

    /**
     * Construye el catálogo validando cada definición.
     *
     * @throws IllegalStateException Si el documento está vacío, o hay símbolos duplicados.
     */
    public static ConstituentCatalog toCatalog(CatalogDocument document, String origin) {
        if (document.constituents().isEmpty()) {
            throw new IllegalStateException("El catálogo " + origin + " no contiene constituyentes.");
        }
        for (ConstituentDefinition definition : document.constituents()) {
            double doodsonSpeed = definition.doodson().angularSpeed();
            if (Math.abs(doodsonSpeed - definition.speed()) > SPEED_TOLERANCE) {
                log.warn("Constituyente {}: velocidad declarada {}°/h difiere de la de Doodson {}°/h.",
                        definition.symbol(), definition.speed(), doodsonSpeed);
            }
        }
        ConstituentCatalog catalog = ConstituentCatalog.of(document.constituents());
        log.info("Catálogo de constituyentes cargado desde {}: {} definiciones.", origin, catalog.size());
        return catalog;
    }
}
