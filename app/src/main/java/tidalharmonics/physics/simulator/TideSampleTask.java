package tidalharmonics.physics.simulator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import tidalharmonics.domain.prediction.TidePoint;
import tidalharmonics.physics.i.ICancellationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Tarea que evalúa un bloque contiguo de muestras [fromIndex, toIndex) de una serie.
 * Está diseñada para ejecutarse en un pool de hilos: no comparte estado mutable.
 */
@Getter
@RequiredArgsConstructor
public class TideSampleTask implements Callable<List<TidePoint>> {

    private final TideSeries series;
    private final long fromIndex;
    private final long toIndex;
    private final ICancellationToken cancellation;

    @Override
    public List<TidePoint> call() {
        List<TidePoint> block = new ArrayList<>((int) (toIndex - fromIndex));
        for (long i = fromIndex; i < toIndex; i++) {
            if (cancellation.isCancellationRequested()) {
                break;
            }
            var time = series.timeAt(i);
            block.add(new TidePoint(time, series.heightAt(time)));
        }
        return block;
    }
}
