package tidalharmonics.physics.astronomy;

import tidalharmonics.domain.constituent.DoodsonNumbers;

import java.util.Objects;

/**
 * Argumento de equilibrio V0: producto escalar de los coeficientes de Doodson con los
 * seis ángulos astronómicos, normalizado a [0, 360).
 */
public final class EquilibriumArgumentCalculator {

    /**
     * Prohibido construir esta clase utilidad
     */
    private EquilibriumArgumentCalculator() {
    }

    /**
     * V0 a partir de los números de Doodson.
     *
     * @param doodson Coeficientes del constituyente (6 elementos, garantizado por {@link DoodsonNumbers}).
     * @param angles  Ángulos astronómicos del instante.
     * @return V0 en grados, [0, 360).
     */
    public static double computeV0(DoodsonNumbers doodson, AstronomicalAngles angles) {
        Objects.requireNonNull(doodson, "Los números de Doodson no pueden ser nulos.");
        Objects.requireNonNull(angles, "Los ángulos astronómicos no pueden ser nulos.");

        final double[] a = angles.asArray();
        double v0 = 0.0;
        for (int i = 0; i < DoodsonNumbers.SIZE; i++) {
            v0 += doodson.get(i) * a[i];
        }
        return AngleMath.normalize(v0);
    }
}
