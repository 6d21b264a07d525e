package tidalharmonics.physics.model;

import lombok.extern.slf4j.Slf4j;
import tidalharmonics.physics.astronomy.AstronomicalEphemeris;
import tidalharmonics.physics.astronomy.NodalCorrectionModel;
import tidalharmonics.physics.astronomy.NodalFactors;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoización de factores nodales por cubo temporal.
 * <p>
 * El nodo lunar avanza unos 0,053° al día, así que los factores de todas las muestras
 * de un mismo cubo se evalúan con N en el inicio del cubo. El valor depende solo de
 * (símbolo, cubo), nunca del orden de las llamadas, por lo que el resultado es determinista.
 * Cada instancia tiene su propio mapa acotado; no hay estado global.
 */
@Slf4j
public class NodalFactorCache {

    private final NodalCorrectionModel model;
    private final AstronomicalEphemeris ephemeris;
    private final long bucketSeconds;
    private final int maxEntries;
    private final Map<BucketKey, NodalFactors> cache = new ConcurrentHashMap<>();

    public NodalFactorCache(NodalCorrectionModel model, AstronomicalEphemeris ephemeris, long bucketSeconds, int maxEntries) {
        if (bucketSeconds <= 0) {
            throw new IllegalArgumentException("El cubo temporal debe ser positivo: " + bucketSeconds);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("El tamaño máximo de la caché debe ser positivo: " + maxEntries);
        }
        this.model = model;
        this.ephemeris = ephemeris;
        this.bucketSeconds = bucketSeconds;
        this.maxEntries = maxEntries;
    }

    public NodalFactors factorsAt(String symbol, Instant instant) {
        long bucket = Math.floorDiv(instant.getEpochSecond(), bucketSeconds);
        if (cache.size() >= maxEntries) {
            log.debug("Caché nodal llena ({} entradas). Vaciando.", cache.size());
            cache.clear();
        }
        return cache.computeIfAbsent(new BucketKey(symbol, bucket), this::evaluate);
    }

    public int size() {
        return cache.size();
    }

    private NodalFactors evaluate(BucketKey key) {
        Instant bucketStart = Instant.ofEpochSecond(key.bucket() * bucketSeconds);
        return model.getFactors(key.symbol(), ephemeris.getParameters(bucketStart));
    }

    private record BucketKey(String symbol, long bucket) {}
}
