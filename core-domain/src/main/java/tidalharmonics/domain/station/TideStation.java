package tidalharmonics.domain.station;

import lombok.Builder;
import lombok.With;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Registro inmutable de una estación mareográfica con sus constantes armónicas.
 * <p>
 * Las alturas predichas se expresan respecto al datum de la estación. El nivel medio
 * {@code meanLevelOffset} (Z0) vale 0 salvo que el registro lo indique explícitamente.
 *
 * @param id              Identificador de la estación (ej: "9414290").
 * @param name            Nombre legible.
 * @param state           Estado/provincia, opcional.
 * @param country         País.
 * @param lat             Latitud en grados.
 * @param lon             Longitud en grados.
 * @param timezone        Zona horaria IANA, solo informativa.
 * @param datum           Datum vertical (ej: "MLLW", "MSL").
 * @param harmonicEpoch   Época de ajuste de las constantes (ej: "1983-2001").
 * @param meanLevelOffset Z0 en metros.
 * @param constituents    Constantes armónicas de la estación.
 */
@Builder
@With
public record TideStation(
        String id,
        String name,
        String state,
        String country,
        double lat,
        double lon,
        String timezone,
        String datum,
        String harmonicEpoch,
        double meanLevelOffset,
        List<StationConstituent> constituents
) {
    public TideStation {
        Objects.requireNonNull(id, "El identificador de la estación no puede ser nulo.");
        constituents = constituents == null ? List.of() : List.copyOf(constituents);
        if (!Double.isFinite(meanLevelOffset)) {
            throw new IllegalArgumentException("Z0 no finito en la estación " + id);
        }
    }

    public Optional<StationConstituent> findConstituent(String symbol) {
        return constituents.stream()
                .filter(c -> c.symbol().equals(symbol))
                .findFirst();
    }

    /**
     * Amplitud del constituyente o 0 si la estación no lo incluye.
     */
    public double amplitudeOf(String symbol) {
        return findConstituent(symbol).map(StationConstituent::amplitude).orElse(0.0);
    }

    /**
     * Los {@code count} constituyentes de mayor amplitud, en orden descendente.
     */
    public List<StationConstituent> dominantConstituents(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("El número de constituyentes no puede ser negativo: " + count);
        }
        return constituents.stream()
                .sorted(Comparator.comparingDouble(StationConstituent::amplitude).reversed())
                .limit(count)
                .toList();
    }
}
