package tidalharmonics.physics.astronomy;

/**
 * Utilidades angulares compartidas. Todos los ángulos se normalizan antes de
 * cualquier evaluación trigonométrica para evitar la deriva numérica.
 */
public final class AngleMath {

    /**
     * Prohibido construir esta clase utilidad
     */
    private AngleMath() {
    }

    /**
     * Normaliza un ángulo en grados al intervalo [0, 360).
     */
    public static double normalize(double degrees) {
        double normalized = degrees % 360.0;
        if (normalized < 0.0) {
            normalized += 360.0;
        }
        // -1e-17 % 360 + 360 redondea a 360.0
        return normalized >= 360.0 ? 0.0 : normalized;
    }

    /**
     * Coseno de un ángulo en grados, normalizando primero.
     */
    public static double cosDegrees(double degrees) {
        return Math.cos(Math.toRadians(normalize(degrees)));
    }

    /**
     * Evalúa c0 + c1·x + c2·x² + ... por Horner.
     */
    public static double polynomial(double x, double... coefficients) {
        double result = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            result = result * x + coefficients[i];
        }
        return result;
    }
}
