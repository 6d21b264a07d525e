package tidalharmonics.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import tidalharmonics.config.PredictionConfig;
import tidalharmonics.domain.prediction.TidePoint;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.physics.i.ICancellationToken;
import tidalharmonics.physics.i.IPredictionComponent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Muestreo de series largas repartido entre un pool fijo de hilos.
 * <p>
 * Las muestras son independientes entre sí, así que la serie se trocea en bloques
 * contiguos ({@link TideSampleTask}) que se evalúan sin sincronización y se concatenan
 * en orden. El resultado es idéntico al del {@link SeriesSampler} secuencial.
 */
@Slf4j
public class ParallelSeriesSampler implements IPredictionComponent, AutoCloseable {

    private static final long MIN_BLOCK_SIZE = 256;

    private final SeriesSampler sampler;
    private final ExecutorService threadPool;
    private final int workerCount;

    public ParallelSeriesSampler(SeriesSampler sampler, PredictionConfig config) {
        this.sampler = sampler;
        this.workerCount = Math.max(config.getWorkerThreads(), 1);
        this.threadPool = Executors.newFixedThreadPool(workerCount);
        log.info("ParallelSeriesSampler inicializado con {} hilos.", workerCount);
    }

    @Override
    public String getName() {
        return "Parallel fixed-step sampler";
    }

    public List<TidePoint> sample(TideStation station, Instant start, Instant end, double intervalMinutes) {
        return sample(station, start, end, intervalMinutes, ICancellationToken.NONE);
    }

    /**
     * Si se cancela, cada bloque se detiene en su siguiente muestra y se devuelve el
     * prefijo contiguo completo calculado hasta el primer bloque incompleto.
     */
    public List<TidePoint> sample(TideStation station, Instant start, Instant end, double intervalMinutes,
                                  ICancellationToken cancellation) {
        TideSeries series = sampler.predictSeries(station, start, end, intervalMinutes);
        long total = series.size();
        if (total == 0) {
            return List.of();
        }

        long blockSize = Math.max(MIN_BLOCK_SIZE, (total + workerCount - 1) / workerCount);
        List<TideSampleTask> tasks = new ArrayList<>();
        for (long from = 0; from < total; from += blockSize) {
            tasks.add(new TideSampleTask(series, from, Math.min(from + blockSize, total), cancellation));
        }
        log.debug("Muestreo paralelo: {} muestras en {} bloques.", total, tasks.size());

        List<Future<List<TidePoint>>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Muestreo paralelo interrumpido.", e);
        }

        List<TidePoint> points = new ArrayList<>((int) Math.min(total, Integer.MAX_VALUE - 8));
        for (int i = 0; i < futures.size(); i++) {
            TideSampleTask task = tasks.get(i);
            List<TidePoint> block;
            try {
                block = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Muestreo paralelo interrumpido.", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Error evaluando el bloque que empieza en la muestra " + task.getFromIndex(), e.getCause());
            }
            points.addAll(block);
            if (block.size() < task.getToIndex() - task.getFromIndex()) {
                break;
            }
        }
        return points;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("ParallelSeriesSampler cerrado.");
    }
}
