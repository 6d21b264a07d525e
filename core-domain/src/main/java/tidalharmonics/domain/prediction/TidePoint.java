package tidalharmonics.domain.prediction;

import java.time.Instant;
import java.util.Objects;

/**
 * Altura de marea predicha en un instante.
 *
 * @param time   Instante (UTC).
 * @param height Altura en metros respecto al datum de la estación.
 */
public record TidePoint(Instant time, double height) {
    public TidePoint {
        Objects.requireNonNull(time, "El instante no puede ser nulo.");
    }
}
