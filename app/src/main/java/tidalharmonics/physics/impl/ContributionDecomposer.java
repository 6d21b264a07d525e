package tidalharmonics.physics.impl;

import lombok.RequiredArgsConstructor;
import tidalharmonics.domain.prediction.ConstituentContribution;
import tidalharmonics.domain.station.StationConstituent;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.physics.astronomy.AstronomicalAngles;
import tidalharmonics.physics.i.IPredictionComponent;
import tidalharmonics.physics.solver.TideSynthesizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Descompone la altura en el aporte de cada constituyente.
 * <p>
 * Cada término se recalcula sin caché. La suma de los valores devueltos es igual a
 * {@code height(station, instant) − Z0}.
 */
@RequiredArgsConstructor
public class ContributionDecomposer implements IPredictionComponent {

    private final TideSynthesizer synthesizer;

    @Override
    public String getName() {
        return "Constituent decomposition";
    }

    /**
     * Aportes en el orden de la estación. Los símbolos desconocidos no aparecen.
     */
    public List<ConstituentContribution> contributions(TideStation station, Instant instant) {
        final AstronomicalAngles angles = synthesizer.getEphemeris().getParameters(instant);
        List<ConstituentContribution> result = new ArrayList<>(station.constituents().size());
        for (StationConstituent constituent : station.constituents()) {
            synthesizer.evaluateTerm(station, constituent, angles, instant).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Suma de los aportes: comprobación directa contra el sintetizador.
     */
    public double total(TideStation station, Instant instant) {
        double sum = 0.0;
        for (ConstituentContribution contribution : contributions(station, instant)) {
            sum += contribution.value();
        }
        return sum;
    }
}
