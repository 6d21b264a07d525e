package tidalharmonics.service;

import lombok.extern.slf4j.Slf4j;
import tidalharmonics.config.PredictionConfig;
import tidalharmonics.domain.constituent.ConstituentCatalog;
import tidalharmonics.domain.prediction.ConstituentContribution;
import tidalharmonics.domain.prediction.DataIntegrityReport;
import tidalharmonics.domain.prediction.Extreme;
import tidalharmonics.domain.prediction.TidalRange;
import tidalharmonics.domain.prediction.TidePoint;
import tidalharmonics.domain.station.TidalType;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.factory.ReferenceDataFactory;
import tidalharmonics.physics.i.ICancellationToken;
import tidalharmonics.physics.impl.ContributionDecomposer;
import tidalharmonics.physics.model.LunarCycleCalculator;
import tidalharmonics.physics.model.TidalTypeClassifier;
import tidalharmonics.physics.simulator.SeriesSampler;
import tidalharmonics.physics.simulator.TideSeries;
import tidalharmonics.physics.solver.ExtremaFinder;
import tidalharmonics.physics.solver.TideSynthesizer;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Superficie pública del motor de predicción armónica.
 * <p>
 * Funciones puras y síncronas sobre datos de referencia de solo lectura. La usan
 * directamente las capas de estado, los exportadores y las calculadoras de avisos.
 */
@Slf4j
public class TidePredictionService {

    private static final Duration RANGE_HALF_WINDOW = Duration.ofMinutes(750);
    private static final double RANGE_INTERVAL_MINUTES = 10.0;

    private final PredictionConfig config;
    private final TideSynthesizer synthesizer;
    private final SeriesSampler sampler;
    private final ExtremaFinder extremaFinder;
    private final ContributionDecomposer decomposer;
    private final LunarCycleCalculator lunarCycle;

    public TidePredictionService(ConstituentCatalog catalog, PredictionConfig config) {
        this(new TideSynthesizer(catalog, config), config);
    }

    public TidePredictionService(TideSynthesizer synthesizer, PredictionConfig config) {
        this.config = config;
        this.synthesizer = synthesizer;
        this.sampler = new SeriesSampler(synthesizer);
        this.extremaFinder = new ExtremaFinder(config);
        this.decomposer = new ContributionDecomposer(synthesizer);
        this.lunarCycle = new LunarCycleCalculator(synthesizer.getEphemeris(), synthesizer.getCatalog());
        log.debug("TidePredictionService creado: {}, {}, {}.", synthesizer.getName(), sampler.getName(), extremaFinder.getName());
    }

    /**
     * Servicio con el catálogo estándar y la configuración por defecto.
     */
    public static TidePredictionService withDefaultCatalog() throws IOException {
        return new TidePredictionService(ReferenceDataFactory.loadDefaultCatalog(), PredictionConfig.defaults());
    }

    public double predictTide(TideStation station, Instant instant) {
        return synthesizer.height(station, instant);
    }

    /**
     * Serie materializada en [start, end). Registra un aviso si la estación tiene
     * constituyentes desconocidos.
     */
    public List<TidePoint> predictTideSeries(TideStation station, Instant start, Instant end, double intervalMinutes) {
        synthesizer.inspect(station);
        return sampler.sample(station, start, end, intervalMinutes);
    }

    public List<TidePoint> predictTideSeries(TideStation station, Instant start, Instant end) {
        return predictTideSeries(station, start, end, config.getDefaultIntervalMinutes());
    }

    public List<TidePoint> predictTideSeries(TideStation station, Instant start, Instant end, double intervalMinutes,
                                             ICancellationToken cancellation) {
        synthesizer.inspect(station);
        return sampler.sample(station, start, end, intervalMinutes, cancellation);
    }

    /**
     * Serie perezosa y reiniciable, para rangos muy largos.
     */
    public TideSeries streamTideSeries(TideStation station, Instant start, Instant end, double intervalMinutes) {
        return sampler.predictSeries(station, start, end, intervalMinutes);
    }

    /**
     * Extremos refinados contra la predicción de la estación.
     */
    public List<Extreme> findExtremes(TideStation station, List<TidePoint> series) {
        return extremaFinder.findExtremes(series, synthesizer.heightFunctionFor(station));
    }

    /**
     * Extremos sin refinar (mejor muestra de cada giro), para series de origen desconocido.
     */
    public List<Extreme> findExtremes(List<TidePoint> series) {
        return extremaFinder.findExtremes(series);
    }

    /**
     * Pleamares y bajamares en [start, end).
     */
    public List<Extreme> predictExtremes(TideStation station, Instant start, Instant end, double intervalMinutes) {
        return findExtremes(station, predictTideSeries(station, start, end, intervalMinutes));
    }

    public List<ConstituentContribution> getConstituentContributions(TideStation station, Instant instant) {
        return decomposer.contributions(station, instant);
    }

    /**
     * Mínimo y máximo en ±12,5 h alrededor del instante, muestreando cada 10 minutos.
     */
    public TidalRange getTidalRange(TideStation station, Instant instant) {
        List<TidePoint> window = sampler.sample(station,
                instant.minus(RANGE_HALF_WINDOW), instant.plus(RANGE_HALF_WINDOW), RANGE_INTERVAL_MINUTES);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (TidePoint point : window) {
            min = Math.min(min, point.height());
            max = Math.max(max, point.height());
        }
        return new TidalRange(min, max);
    }

    public double getSpringNeapIndicator(Instant instant) {
        return lunarCycle.springNeapIndicator(instant);
    }

    public double getLunarPhase(Instant instant) {
        return lunarCycle.lunarPhase(instant);
    }

    public TidalType classify(TideStation station) {
        return TidalTypeClassifier.classify(station);
    }

    public DataIntegrityReport inspect(TideStation station) {
        return synthesizer.inspect(station);
    }

    public TideSynthesizer getSynthesizer() {
        return synthesizer;
    }

    public SeriesSampler getSampler() {
        return sampler;
    }
}
