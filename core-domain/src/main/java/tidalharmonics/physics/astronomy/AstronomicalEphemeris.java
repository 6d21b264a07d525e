package tidalharmonics.physics.astronomy;

import java.time.Instant;

/**
 * Calcula los ángulos astronómicos fundamentales a partir del tiempo.
 * <p>
 * Cada longitud media es un polinomio cúbico en T, el número de siglos julianos
 * desde J2000.0 (2000-01-01T12:00 UTC). Coeficientes de Meeus (Astronomical Algorithms,
 * cap. 22, 25 y 47). El ángulo horario T avanza 15°/h desde 0° a las 0h UT.
 * <p>
 * Función pura y total: válida para cualquier instante, aunque la precisión se degrada
 * lejos de la época de referencia (ver {@link #confidence(Instant)}). Thread-safe.
 */
public class AstronomicalEphemeris {

    /** J2000.0 en segundos Unix. */
    public static final long J2000_EPOCH_SECOND = 946_728_000L;
    public static final double SECONDS_PER_CENTURY = 36_525.0 * 86_400.0;

    private static final double SECONDS_PER_DAY = 86_400.0;

    private static final double[] MOON_MEAN_LONGITUDE = {218.3164477, 481267.88123421, -0.0015786, 1.0 / 538841.0};
    private static final double[] SUN_MEAN_LONGITUDE = {280.46646, 36000.76983, 0.0003032, 0.0};
    private static final double[] LUNAR_PERIGEE = {83.3532465, 4069.0137287, -0.0103200, -1.0 / 80053.0};
    private static final double[] LUNAR_NODE = {125.0445479, -1934.1362891, 0.0020754, 1.0 / 467441.0};
    private static final double[] SOLAR_PERIGEE = {282.93735, 1.71946, 0.00046, 0.0};

    private final double validityCenturies;

    public AstronomicalEphemeris() {
        this(200.0);
    }

    /**
     * @param validityYears Distancia a J2000 (años) dentro de la cual la confianza es nominal.
     */
    public AstronomicalEphemeris(double validityYears) {
        if (!(validityYears > 0.0)) {
            throw new IllegalArgumentException("La ventana de validez debe ser positiva: " + validityYears);
        }
        this.validityCenturies = validityYears / 100.0;
    }

    /**
     * Ángulos astronómicos en el instante dado.
     */
    public AstronomicalAngles getParameters(Instant instant) {
        final double T = julianCenturies(instant);

        return new AstronomicalAngles(
                hourAngle(instant),
                AngleMath.polynomial(T, MOON_MEAN_LONGITUDE),
                AngleMath.polynomial(T, SUN_MEAN_LONGITUDE),
                AngleMath.polynomial(T, LUNAR_PERIGEE),
                AngleMath.polynomial(T, LUNAR_NODE),
                AngleMath.polynomial(T, SOLAR_PERIGEE)
        );
    }

    /**
     * Siglos julianos desde J2000.0. Se calcula desde los segundos Unix para no perder
     * precisión con el día juliano absoluto.
     */
    public static double julianCenturies(Instant instant) {
        double seconds = (instant.getEpochSecond() - J2000_EPOCH_SECOND) + instant.getNano() / 1e9;
        return seconds / SECONDS_PER_CENTURY;
    }

    /**
     * Día juliano del instante (JD 2440587.5 = época Unix).
     */
    public static double julianDay(Instant instant) {
        return 2_440_587.5 + (instant.getEpochSecond() + instant.getNano() / 1e9) / SECONDS_PER_DAY;
    }

    public EphemerisConfidence confidence(Instant instant) {
        return Math.abs(julianCenturies(instant)) <= validityCenturies
                ? EphemerisConfidence.NOMINAL
                : EphemerisConfidence.REDUCED;
    }

    // 15°/h desde medianoche UT
    private static double hourAngle(Instant instant) {
        long secondOfDay = Math.floorMod(instant.getEpochSecond(), 86_400L);
        double hours = (secondOfDay + instant.getNano() / 1e9) / 3600.0;
        return 15.0 * hours;
    }
}
