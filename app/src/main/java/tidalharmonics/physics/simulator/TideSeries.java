package tidalharmonics.physics.simulator;

import tidalharmonics.domain.prediction.TidePoint;
import tidalharmonics.physics.i.ICancellationToken;
import tidalharmonics.physics.i.IHeightFunction;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Serie temporal perezosa y reiniciable de alturas de marea en [start, end).
 * <p>
 * No guarda muestras: cada iterador evalúa la función de altura al vuelo, así que
 * rangos muy largos (un año a un minuto) no ocupan memoria hasta que se materializan.
 * El instante de la muestra i es start + i·step, sin acumulación de error.
 */
public final class TideSeries implements Iterable<TidePoint> {

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private final IHeightFunction heightFunction;
    private final Instant start;
    private final Instant end;
    private final Duration step;

    TideSeries(IHeightFunction heightFunction, Instant start, Instant end, Duration step) {
        this.heightFunction = heightFunction;
        this.start = start;
        this.end = end;
        this.step = step;
    }

    @Override
    public Iterator<TidePoint> iterator() {
        return new Iterator<>() {
            private long index = 0;

            @Override
            public boolean hasNext() {
                return timeAt(index).isBefore(end);
            }

            @Override
            public TidePoint next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Instant time = timeAt(index++);
                return new TidePoint(time, heightFunction.heightAt(time));
            }
        };
    }

    public Stream<TidePoint> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), size(),
                        Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE | Spliterator.SIZED),
                false);
    }

    /**
     * Materializa la serie completa.
     */
    public List<TidePoint> toList() {
        return toList(ICancellationToken.NONE);
    }

    /**
     * Materializa la serie consultando el token antes de cada muestra.
     * Si se cancela, devuelve las muestras calculadas hasta ese momento.
     */
    public List<TidePoint> toList(ICancellationToken cancellation) {
        List<TidePoint> points = new ArrayList<>((int) Math.min(size(), 1_000_000L));
        Iterator<TidePoint> it = iterator();
        while (it.hasNext()) {
            if (cancellation.isCancellationRequested()) {
                break;
            }
            points.add(it.next());
        }
        return points;
    }

    /**
     * Número de muestras de la serie, saturado a {@link Long#MAX_VALUE}.
     * <p>
     * El rango se mide en nanosegundos con {@link BigInteger}: un {@code long} desborda
     * a partir de unos 292 años.
     */
    public long size() {
        if (!start.isBefore(end)) {
            return 0;
        }
        Duration span = Duration.between(start, end);
        BigInteger spanNanos = BigInteger.valueOf(span.getSeconds())
                .multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(span.getNano()));
        BigInteger stepNanos = BigInteger.valueOf(step.toNanos());
        BigInteger count = spanNanos.add(stepNanos).subtract(BigInteger.ONE).divide(stepNanos);
        return count.bitLength() < Long.SIZE ? count.longValue() : Long.MAX_VALUE;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    Instant timeAt(long index) {
        return start.plus(step.multipliedBy(index));
    }

    double heightAt(Instant time) {
        return heightFunction.heightAt(time);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration getStep() {
        return step;
    }
}
