package tidalharmonics.domain.prediction;

import java.time.Instant;
import java.util.Objects;

/**
 * Pleamar o bajamar detectada en una serie.
 *
 * @param time   Instante refinado del extremo.
 * @param height Altura en el instante refinado (m).
 * @param type   HIGH (pleamar) o LOW (bajamar).
 */
public record Extreme(Instant time, double height, ExtremeType type) {
    public Extreme {
        Objects.requireNonNull(time, "El instante del extremo no puede ser nulo.");
        Objects.requireNonNull(type, "El tipo del extremo no puede ser nulo.");
    }

    public boolean isHigh() {
        return type == ExtremeType.HIGH;
    }
}
