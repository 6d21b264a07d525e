package tidalharmonics.physics.astronomy;

import tidalharmonics.domain.constituent.ConstituentFamily;

import java.util.function.DoubleFunction;

/**
 * Conjunto cerrado de fórmulas de corrección nodal en función de N.
 * <p>
 * Aproximaciones de primer orden en el ciclo nodal de 18,6 años. Los constituyentes
 * compuestos de aguas someras combinan las fórmulas de sus componentes: f se multiplica
 * y u se suma con el mismo signo que la combinación de frecuencias.
 */
public enum NodalFormula {

    IDENTITY(null, n -> NodalFactors.IDENTITY),

    LUNAR_SEMIDIURNAL(ConstituentFamily.SEMIDIURNAL,
            n -> new NodalFactors(m2F(n), m2U(n))),

    LUNI_SOLAR_SEMIDIURNAL(ConstituentFamily.SEMIDIURNAL,
            n -> new NodalFactors(1.024 + 0.286 * cos(n), -17.74 * sin(n))),

    LUNI_SOLAR_DIURNAL(ConstituentFamily.DIURNAL,
            n -> new NodalFactors(k1F(n), k1U(n))),

    LUNAR_DIURNAL(ConstituentFamily.DIURNAL,
            n -> new NodalFactors(1.009 + 0.187 * cos(n), 10.8 * sin(n))),

    LUNAR_DIURNAL_J1(ConstituentFamily.DIURNAL,
            n -> new NodalFactors(1.024 + 0.286 * cos(n), -17.74 * sin(n))),

    LUNAR_DIURNAL_M1(ConstituentFamily.DIURNAL, n -> {
        double a = 1.0 - 0.2505 * Math.cos(2.0 * rad(n)) - 0.1102 * cos(n);
        double b = 0.2505 * Math.sin(2.0 * rad(n)) + 0.1102 * sin(n);
        return new NodalFactors(Math.sqrt(a * a + b * b), 0.0);
    }),

    LUNAR_FORTNIGHTLY(ConstituentFamily.LONG_PERIOD,
            n -> new NodalFactors(1.043 + 0.414 * cos(n), -23.7 * sin(n))),

    LUNAR_MONTHLY(ConstituentFamily.LONG_PERIOD,
            n -> new NodalFactors(1.0 - 0.13 * cos(n), 0.0)),

    // M2 × M2
    SHALLOW_M4(ConstituentFamily.SHALLOW_WATER,
            n -> new NodalFactors(Math.pow(m2F(n), 2), 2.0 * m2U(n))),

    // M2 × S2
    SHALLOW_MS4(ConstituentFamily.SHALLOW_WATER,
            n -> new NodalFactors(m2F(n), m2U(n))),

    SHALLOW_M6(ConstituentFamily.SHALLOW_WATER,
            n -> new NodalFactors(Math.pow(m2F(n), 3), 3.0 * m2U(n))),

    SHALLOW_M8(ConstituentFamily.SHALLOW_WATER,
            n -> new NodalFactors(Math.pow(m2F(n), 4), 4.0 * m2U(n))),

    // M2 + K1
    SHALLOW_MK3(ConstituentFamily.SHALLOW_WATER,
            n -> new NodalFactors(m2F(n) * k1F(n), m2U(n) + k1U(n))),

    // 2·M2 − K1
    SHALLOW_2MK3(ConstituentFamily.SHALLOW_WATER,
            n -> new NodalFactors(Math.pow(m2F(n), 2) * k1F(n), 2.0 * m2U(n) - k1U(n)));

    private final ConstituentFamily family;
    private final DoubleFunction<NodalFactors> formula;

    NodalFormula(ConstituentFamily family, DoubleFunction<NodalFactors> formula) {
        this.family = family;
        this.formula = formula;
    }

    /**
     * Evalúa la fórmula para la longitud del nodo N (grados).
     */
    public NodalFactors apply(double nodeAngle) {
        return formula.apply(AngleMath.normalize(nodeAngle));
    }

    /**
     * Familia a la que se aplica la fórmula; null para la identidad.
     */
    public ConstituentFamily getFamily() {
        return family;
    }

    private static double m2F(double n) {
        return 1.0 - 0.037 * cos(n);
    }

    private static double m2U(double n) {
        return -2.1 * sin(n);
    }

    private static double k1F(double n) {
        return 1.006 + 0.115 * cos(n);
    }

    private static double k1U(double n) {
        return -8.86 * sin(n);
    }

    private static double rad(double degrees) {
        return Math.toRadians(degrees);
    }

    private static double sin(double degrees) {
        return Math.sin(rad(degrees));
    }

    private static double cos(double degrees) {
        return Math.cos(rad(degrees));
    }
}
