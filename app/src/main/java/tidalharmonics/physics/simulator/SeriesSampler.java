package tidalharmonics.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import tidalharmonics.domain.prediction.TidePoint;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.physics.astronomy.AstronomicalEphemeris;
import tidalharmonics.physics.astronomy.EphemerisConfidence;
import tidalharmonics.physics.i.ICancellationToken;
import tidalharmonics.physics.i.IHeightFunction;
import tidalharmonics.physics.i.IPredictionComponent;
import tidalharmonics.physics.solver.TideSynthesizer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Genera series de alturas a paso fijo evaluando el sintetizador.
 * <p>
 * Contrato:
 * - Intervalo ≤ 0 o no finito: error del llamador, {@link IllegalArgumentException} inmediata.
 * - end ≤ start: serie vacía.
 * - Los instantes son estrictamente crecientes y están en [start, end).
 */
@Slf4j
public class SeriesSampler implements IPredictionComponent {

    private final TideSynthesizer synthesizer;

    public SeriesSampler(TideSynthesizer synthesizer) {
        this.synthesizer = Objects.requireNonNull(synthesizer, "El sintetizador no puede ser nulo.");
    }

    @Override
    public String getName() {
        return "Fixed-step sampler";
    }

    /**
     * Serie perezosa para una estación.
     */
    public TideSeries predictSeries(TideStation station, Instant start, Instant end, double intervalMinutes) {
        Duration step = toStep(intervalMinutes);
        Objects.requireNonNull(start, "El inicio de la serie no puede ser nulo.");
        Objects.requireNonNull(end, "El fin de la serie no puede ser nulo.");
        warnIfReducedConfidence(start, end);
        return new TideSeries(synthesizer.heightFunctionFor(station), start, end, step);
    }

    /**
     * Serie perezosa para una función de altura arbitraria.
     */
    public static TideSeries series(IHeightFunction heightFunction, Instant start, Instant end, double intervalMinutes) {
        return new TideSeries(heightFunction, start, end, toStep(intervalMinutes));
    }

    /**
     * Serie materializada.
     */
    public List<TidePoint> sample(TideStation station, Instant start, Instant end, double intervalMinutes) {
        return predictSeries(station, start, end, intervalMinutes).toList();
    }

    /**
     * Serie materializada con cancelación cooperativa. El resultado parcial es válido.
     */
    public List<TidePoint> sample(TideStation station, Instant start, Instant end, double intervalMinutes,
                                  ICancellationToken cancellation) {
        List<TidePoint> points = predictSeries(station, start, end, intervalMinutes).toList(cancellation);
        if (cancellation.isCancellationRequested()) {
            log.debug("Muestreo cancelado tras {} muestras.", points.size());
        }
        return points;
    }

    /**
     * Convierte el intervalo en minutos a un paso en nanosegundos, validándolo.
     */
    static Duration toStep(double intervalMinutes) {
        if (!Double.isFinite(intervalMinutes) || intervalMinutes <= 0.0) {
            throw new IllegalArgumentException("El intervalo de muestreo debe ser positivo y finito: " + intervalMinutes);
        }
        long nanos = Math.round(intervalMinutes * 60e9);
        if (nanos <= 0) {
            throw new IllegalArgumentException("El intervalo de muestreo es demasiado pequeño: " + intervalMinutes);
        }
        return Duration.ofNanos(nanos);
    }

    private void warnIfReducedConfidence(Instant start, Instant end) {
        AstronomicalEphemeris ephemeris = synthesizer.getEphemeris();
        if (ephemeris.confidence(start) == EphemerisConfidence.REDUCED
                || ephemeris.confidence(end) == EphemerisConfidence.REDUCED) {
            log.warn("Serie [{}, {}) fuera de la ventana de validez de las efemérides. Precisión reducida.", start, end);
        }
    }
}
