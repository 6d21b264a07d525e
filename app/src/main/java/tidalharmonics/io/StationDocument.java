package tidalharmonics.io;

import tidalharmonics.domain.station.TideStation;

import java.util.List;

/**
 * Estructura del fichero JSON de estaciones.
 */
public record StationDocument(List<TideStation> stations) {
    public StationDocument {
        stations = stations == null ? List.of() : List.copyOf(stations);
    }
}
