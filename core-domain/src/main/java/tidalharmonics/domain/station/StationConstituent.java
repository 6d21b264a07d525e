package tidalharmonics.domain.station;

import lombok.Builder;
import lombok.With;
import tidalharmonics.physics.astronomy.AngleMath;

import java.util.Objects;

/**
 * Constantes armónicas de un constituyente en una estación concreta.
 *
 * @param symbol    Símbolo del constituyente en el catálogo global.
 * @param amplitude Amplitud en metros (≥ 0). Una amplitud 0 es válida y no aporta nada.
 * @param phase     Desfase de Greenwich κ en grados, normalizado a [0, 360).
 */
@Builder
@With
public record StationConstituent(
        String symbol,
        double amplitude,
        double phase
) {
    public StationConstituent {
        Objects.requireNonNull(symbol, "El símbolo del constituyente no puede ser nulo.");
        if (!(amplitude >= 0.0) || Double.isInfinite(amplitude)) {
            throw new IllegalArgumentException("Amplitud inválida para " + symbol + ": " + amplitude);
        }
        if (!Double.isFinite(phase)) {
            throw new IllegalArgumentException("Fase no finita para " + symbol + ": " + phase);
        }
        phase = AngleMath.normalize(phase);
    }
}
