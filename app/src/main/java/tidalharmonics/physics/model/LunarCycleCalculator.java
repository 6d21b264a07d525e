package tidalharmonics.physics.model;

import lombok.RequiredArgsConstructor;
import tidalharmonics.domain.constituent.ConstituentCatalog;
import tidalharmonics.domain.constituent.ConstituentDefinition;
import tidalharmonics.physics.astronomy.AngleMath;
import tidalharmonics.physics.astronomy.AstronomicalAngles;
import tidalharmonics.physics.astronomy.AstronomicalEphemeris;
import tidalharmonics.physics.astronomy.EquilibriumArgumentCalculator;

import java.time.Instant;
import java.util.Optional;

/**
 * Indicadores del ciclo lunar derivados de los ángulos astronómicos.
 */
@RequiredArgsConstructor
public class LunarCycleCalculator {

    private final AstronomicalEphemeris ephemeris;
    private final ConstituentCatalog catalog;

    /**
     * Indicador de mareas vivas/muertas en [-1, 1].
     * <p>
     * cos(V0(M2) − V0(S2)) = cos(2·(h − s)): +1 con M2 y S2 en fase (sicigias, vivas),
     * -1 en oposición (cuadraturas, muertas).
     * Devuelve 0 si el catálogo no define M2 o S2.
     */
    public double springNeapIndicator(Instant instant) {
        Optional<ConstituentDefinition> m2 = catalog.find("M2");
        Optional<ConstituentDefinition> s2 = catalog.find("S2");
        if (m2.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        AstronomicalAngles angles = ephemeris.getParameters(instant);
        double phaseDifference = AngleMath.normalize(
                EquilibriumArgumentCalculator.computeV0(m2.get().doodson(), angles)
                        - EquilibriumArgumentCalculator.computeV0(s2.get().doodson(), angles));
        return Math.cos(Math.toRadians(phaseDifference));
    }

    /**
     * Fase lunar en [0, 1): 0 luna nueva, 0,5 luna llena. Elongación media (s − h) / 360.
     */
    public double lunarPhase(Instant instant) {
        AstronomicalAngles angles = ephemeris.getParameters(instant);
        return AngleMath.normalize(angles.s() - angles.h()) / 360.0;
    }
}
