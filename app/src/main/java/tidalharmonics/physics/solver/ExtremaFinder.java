package tidalharmonics.physics.solver;

import lombok.extern.slf4j.Slf4j;
import tidalharmonics.config.PredictionConfig;
import tidalharmonics.domain.prediction.Extreme;
import tidalharmonics.domain.prediction.ExtremeType;
import tidalharmonics.domain.prediction.TidePoint;
import tidalharmonics.physics.i.IHeightFunction;
import tidalharmonics.physics.i.IPredictionComponent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detecta y refina pleamares y bajamares en una serie muestreada.
 * <p>
 * 1. Recorre los intervalos entre muestras calculando la pendiente discreta.
 * 2. Un cambio de signo entre dos intervalos con pendiente no nula marca un candidato.
 * 3. Si hay función de altura, refina el instante por bisección sobre el signo de la
 * pendiente (diferencia central) hasta que el intervalo es menor que la tolerancia o se
 * alcanza el tope de iteraciones; en ese caso devuelve la mejor estimación.
 * 4. Positiva→negativa es pleamar; negativa→positiva es bajamar.
 * <p>
 * Los intervalos de pendiente nula se saltan conservando el último signo, de modo que
 * cada candidato invierte el signo del anterior y los tipos alternan siempre.
 * Solo se informan extremos acotados por datos a ambos lados: un giro en el primer o
 * último intervalo de la serie no se detecta.
 * <p>
 * Es el único buscador de raíces del motor; los instantes de repunte (slack water)
 * son estos mismos extremos. Thread-safe.
 */
@Slf4j
public class ExtremaFinder implements IPredictionComponent {

    private final long toleranceNanos;
    private final int maxIterations;
    private final long probeNanos;

    public ExtremaFinder(PredictionConfig config) {
        if (!(config.getExtremaToleranceSeconds() > 0.0)) {
            throw new IllegalArgumentException("La tolerancia de refinamiento debe ser positiva: " + config.getExtremaToleranceSeconds());
        }
        if (config.getExtremaMaxIterations() < 1) {
            throw new IllegalArgumentException("El tope de iteraciones debe ser al menos 1: " + config.getExtremaMaxIterations());
        }
        if (!(config.getSlopeProbeSeconds() > 0.0)) {
            throw new IllegalArgumentException("El paso de la sonda de pendiente debe ser positivo: " + config.getSlopeProbeSeconds());
        }
        this.toleranceNanos = Math.round(config.getExtremaToleranceSeconds() * 1e9);
        this.maxIterations = config.getExtremaMaxIterations();
        this.probeNanos = Math.round(config.getSlopeProbeSeconds() * 1e9);
    }

    @Override
    public String getName() {
        return "Slope bisection";
    }

    /**
     * Extremos sin refinar: para cada candidato devuelve la muestra más alta (o más baja)
     * del tramo de giro. Útil para series observadas sin función de altura.
     */
    public List<Extreme> findExtremes(List<TidePoint> series) {
        return findExtremes(series, null);
    }

    /**
     * Extremos refinados por bisección re-evaluando {@code heightFunction}.
     *
     * @param series         Serie ordenada por tiempo estrictamente creciente.
     * @param heightFunction Función de altura que generó la serie; null para no refinar.
     * @return Extremos en orden temporal, con tipos alternos.
     */
    public List<Extreme> findExtremes(List<TidePoint> series, IHeightFunction heightFunction) {
        Objects.requireNonNull(series, "La serie no puede ser nula.");
        List<Extreme> extremes = new ArrayList<>();
        if (series.size() < 2) {
            return extremes;
        }

        int previousSign = 0;
        int previousInterval = -1;

        for (int i = 0; i < series.size() - 1; i++) {
            TidePoint a = series.get(i);
            TidePoint b = series.get(i + 1);
            if (!b.time().isAfter(a.time())) {
                throw new IllegalArgumentException("La serie no es estrictamente creciente en el índice " + (i + 1));
            }

            // Solo importa el signo de Δh/Δt y Δt > 0
            int sign = (int) Math.signum(b.height() - a.height());
            if (sign == 0) {
                continue;
            }

            if (previousSign != 0 && sign != previousSign) {
                ExtremeType type = previousSign > 0 ? ExtremeType.HIGH : ExtremeType.LOW;
                Extreme extreme = heightFunction == null
                        ? bestSample(series, previousInterval + 1, i, type)
                        : refine(heightFunction, series.get(previousInterval).time(), b.time(), previousSign, type);
                extremes.add(extreme);
            }

            previousSign = sign;
            previousInterval = i;
        }
        return extremes;
    }

    /**
     * Bisección sobre el signo de la pendiente en [low, high], sabiendo que en {@code low}
     * la pendiente tiene signo {@code lowSign}.
     */
    Extreme refine(IHeightFunction heightFunction, Instant low, Instant high, int lowSign, ExtremeType type) {
        long lo = 0;
        long hi = Duration.between(low, high).toNanos();

        int iteration = 0;
        while (hi - lo > toleranceNanos && iteration < maxIterations) {
            long mid = lo + (hi - lo) / 2;
            int slopeSign = slopeSign(heightFunction, low.plusNanos(mid));
            if (slopeSign == 0) {
                // Pendiente exactamente nula: es el extremo
                lo = mid;
                hi = mid;
                break;
            }
            if (slopeSign == lowSign) {
                lo = mid;
            } else {
                hi = mid;
            }
            iteration++;
        }

        if (hi - lo > toleranceNanos) {
            log.warn("Refinamiento de {} cerca de {} sin converger tras {} iteraciones (intervalo {} s). Se usa la mejor estimación.",
                    type, low, iteration, (hi - lo) / 1e9);
        }

        Instant best = low.plusNanos(lo + (hi - lo) / 2);
        return new Extreme(best, heightFunction.heightAt(best), type);
    }

    private int slopeSign(IHeightFunction heightFunction, Instant t) {
        double before = heightFunction.heightAt(t.minusNanos(probeNanos));
        double after = heightFunction.heightAt(t.plusNanos(probeNanos));
        return (int) Math.signum(after - before);
    }

    // Muestra extrema en [from, to] (índices de la serie)
    private static Extreme bestSample(List<TidePoint> series, int from, int to, ExtremeType type) {
        TidePoint best = series.get(from);
        for (int k = from + 1; k <= to; k++) {
            TidePoint candidate = series.get(k);
            boolean better = type == ExtremeType.HIGH
                    ? candidate.height() > best.height()
                    : candidate.height() < best.height();
            if (better) {
                best = candidate;
            }
        }
        return new Extreme(best.time(), best.height(), type);
    }
}
