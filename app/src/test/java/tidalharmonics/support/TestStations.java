package tidalharmonics.support;

import tidalharmonics.config.PredictionConfig;
import tidalharmonics.domain.constituent.ConstituentCatalog;
import tidalharmonics.domain.station.StationConstituent;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.factory.ReferenceDataFactory;
import tidalharmonics.physics.astronomy.AstronomicalEphemeris;
import tidalharmonics.physics.astronomy.NodalCorrectionModel;
import tidalharmonics.physics.solver.TideSynthesizer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Datos compartidos por los tests del motor: catálogo estándar, estaciones de
 * classpath y estaciones sintéticas.
 */
public final class TestStations {

    public static final String STATIONS_RESOURCE = "stations.json";
    public static final String SAN_FRANCISCO = "9414290";
    public static final String BOSTON = "8443970";
    public static final String UNKNOWN_SYMBOLS = "TEST-UNKNOWN";

    private static ConstituentCatalog catalog;
    private static List<TideStation> stations;

    /**
     * Prohibido construir esta clase utilidad
     */
    private TestStations() {
    }

    public static synchronized ConstituentCatalog catalog() {
        if (catalog == null) {
            try {
                catalog = ReferenceDataFactory.loadDefaultCatalog();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return catalog;
    }

    public static synchronized TideStation byId(String id) {
        if (stations == null) {
            try {
                stations = ReferenceDataFactory.loadStationsFromClasspath(STATIONS_RESOURCE);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return stations.stream()
                .filter(s -> s.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Estación de test inexistente: " + id));
    }

    /**
     * Estación sintética con Z0 = 0.
     */
    public static TideStation synthetic(String id, StationConstituent... constituents) {
        return TideStation.builder()
                .id(id)
                .name("Sintética " + id)
                .country("Test")
                .datum("MSL")
                .constituents(List.of(constituents))
                .build();
    }

    /**
     * Sintetizador sin corrección nodal (f = 1, u = 0).
     */
    public static TideSynthesizer identitySynthesizer() {
        PredictionConfig config = PredictionConfig.builder().nodalCorrectionsEnabled(false).build();
        return new TideSynthesizer(catalog(), new AstronomicalEphemeris(), NodalCorrectionModel.identity(), config);
    }

    public static TideSynthesizer defaultSynthesizer() {
        return new TideSynthesizer(catalog(), PredictionConfig.defaults());
    }
}
