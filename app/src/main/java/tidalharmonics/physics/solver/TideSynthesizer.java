package tidalharmonics.physics.solver;

import lombok.extern.slf4j.Slf4j;
import tidalharmonics.config.PredictionConfig;
import tidalharmonics.domain.constituent.ConstituentCatalog;
import tidalharmonics.domain.constituent.ConstituentDefinition;
import tidalharmonics.domain.prediction.ConstituentContribution;
import tidalharmonics.domain.prediction.DataIntegrityReport;
import tidalharmonics.domain.station.StationConstituent;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.physics.astronomy.AngleMath;
import tidalharmonics.physics.astronomy.AstronomicalAngles;
import tidalharmonics.physics.astronomy.AstronomicalEphemeris;
import tidalharmonics.physics.astronomy.EquilibriumArgumentCalculator;
import tidalharmonics.physics.astronomy.NodalCorrectionModel;
import tidalharmonics.physics.astronomy.NodalCorrectionTable;
import tidalharmonics.physics.astronomy.NodalFactors;
import tidalharmonics.physics.i.IHeightFunction;
import tidalharmonics.physics.i.IPredictionComponent;
import tidalharmonics.physics.model.NodalFactorCache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Síntesis armónica de la altura de marea.
 * <p>
 * h(t) = Z0 + Σ fᵢ · Aᵢ · cos(V0ᵢ + uᵢ − κᵢ)
 * <p>
 * Determinista: el mismo par (estación, instante) produce siempre la misma altura.
 * Sin estado mutable salvo la caché nodal opcional, que también es determinista, y el registro
 * de símbolos desconocidos ya avisados, que solo afecta a los logs. Thread-safe.
 */
@Slf4j
public class TideSynthesizer implements IPredictionComponent {

    private final ConstituentCatalog catalog;
    private final AstronomicalEphemeris ephemeris;
    private final NodalCorrectionModel nodalModel;
    private final NodalFactorCache nodalCache;
    // "estación/símbolo" ya avisados
    private final Set<String> reportedUnknown = ConcurrentHashMap.newKeySet();

    public TideSynthesizer(ConstituentCatalog catalog, PredictionConfig config) {
        this(catalog,
                new AstronomicalEphemeris(config.getEphemerisValidityYears()),
                config.isNodalCorrectionsEnabled() ? new NodalCorrectionTable() : NodalCorrectionModel.identity(),
                config);
    }

    public TideSynthesizer(ConstituentCatalog catalog,
                           AstronomicalEphemeris ephemeris,
                           NodalCorrectionModel nodalModel,
                           PredictionConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "El catálogo no puede ser nulo.");
        this.ephemeris = Objects.requireNonNull(ephemeris, "Las efemérides no pueden ser nulas.");
        this.nodalModel = Objects.requireNonNull(nodalModel, "El modelo nodal no puede ser nulo.");
        this.nodalCache = config.isNodalCacheEnabled()
                ? new NodalFactorCache(nodalModel, ephemeris, config.getNodalCacheBucketSeconds(), config.getNodalCacheMaxEntries())
                : null;
    }

    @Override
    public String getName() {
        return "Harmonic synthesis";
    }

    /**
     * Altura de marea (m) respecto al datum de la estación.
     * Los constituyentes sin definición en el catálogo se excluyen de la suma.
     */
    public double height(TideStation station, Instant instant) {
        Objects.requireNonNull(station, "La estación no puede ser nula.");
        Objects.requireNonNull(instant, "El instante no puede ser nulo.");

        final AstronomicalAngles angles = ephemeris.getParameters(instant);
        double sum = 0.0;
        for (StationConstituent constituent : station.constituents()) {
            Optional<ConstituentContribution> term = evaluateTerm(station, constituent, angles, instant);
            if (term.isPresent()) {
                sum += term.get().value();
            }
        }
        return station.meanLevelOffset() + sum;
    }

    /**
     * Calcula el término de un único constituyente de la estación.
     * Un símbolo desconocido se avisa una sola vez por estación.
     *
     * @return El aporte, o vacío si el símbolo no existe en el catálogo.
     */
    public Optional<ConstituentContribution> evaluateTerm(TideStation station, StationConstituent constituent,
                                                          AstronomicalAngles angles, Instant instant) {
        Optional<ConstituentDefinition> definition = catalog.find(constituent.symbol());
        if (definition.isEmpty()) {
            if (reportedUnknown.add(station.id() + "/" + constituent.symbol())) {
                log.warn("Estación {}: constituyente {} sin definición en el catálogo. Excluido de la suma.",
                        station.id(), constituent.symbol());
            }
            return Optional.empty();
        }

        final double v0 = EquilibriumArgumentCalculator.computeV0(definition.get().doodson(), angles);
        final NodalFactors nodal = nodalFactors(constituent.symbol(), angles, instant);
        final double phase = AngleMath.normalize(v0 + nodal.u() - constituent.phase());
        final double effectiveAmplitude = nodal.f() * constituent.amplitude();

        return Optional.of(new ConstituentContribution(
                constituent.symbol(),
                effectiveAmplitude * Math.cos(Math.toRadians(phase)),
                effectiveAmplitude,
                phase
        ));
    }

    /**
     * Cota superior de |h(t) − Z0|: Σ fᵢ·Aᵢ en el instante dado.
     */
    public double amplitudeBound(TideStation station, Instant instant) {
        final AstronomicalAngles angles = ephemeris.getParameters(instant);
        double bound = 0.0;
        for (StationConstituent constituent : station.constituents()) {
            if (catalog.contains(constituent.symbol())) {
                bound += nodalFactors(constituent.symbol(), angles, instant).f() * constituent.amplitude();
            }
        }
        return bound;
    }

    /**
     * Lista los símbolos de la estación que no existen en el catálogo y los registra como aviso.
     */
    public DataIntegrityReport inspect(TideStation station) {
        List<String> unknown = new ArrayList<>();
        for (StationConstituent constituent : station.constituents()) {
            if (!catalog.contains(constituent.symbol())) {
                unknown.add(constituent.symbol());
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Estación {}: constituyentes desconocidos {} excluidos de la predicción.", station.id(), unknown);
        }
        return new DataIntegrityReport(station.id(), unknown);
    }

    /**
     * Vista funcional h(t) de una estación, para el muestreador y el buscador de extremos.
     */
    public IHeightFunction heightFunctionFor(TideStation station) {
        Objects.requireNonNull(station, "La estación no puede ser nula.");
        return instant -> height(station, instant);
    }

    public AstronomicalEphemeris getEphemeris() {
        return ephemeris;
    }

    public ConstituentCatalog getCatalog() {
        return catalog;
    }

    private NodalFactors nodalFactors(String symbol, AstronomicalAngles angles, Instant instant) {
        if (nodalCache != null) {
            return nodalCache.factorsAt(symbol, instant);
        }
        return nodalModel.getFactors(symbol, angles);
    }
}
