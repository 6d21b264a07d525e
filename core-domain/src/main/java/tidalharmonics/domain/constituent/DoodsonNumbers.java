package tidalharmonics.domain.constituent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Objects;

/**
 * Los seis coeficientes enteros de Doodson de un constituyente, en el orden
 * {T, s, h, p, N, p'}.
 * <p>
 * La velocidad angular del constituyente es la combinación lineal de estos
 * coeficientes con las velocidades medias de los seis ángulos fundamentales.
 *
 * @param coefficients Copia inmutable de los seis coeficientes.
 */
public record DoodsonNumbers(int[] coefficients) {

    public static final int SIZE = 6;

    /**
     * Velocidades medias de los ángulos fundamentales en grados/hora, mismo orden que los coeficientes.
     */
    private static final double[] MEAN_RATES = {
            15.0,        // T: ángulo horario del Sol medio
            0.5490165,   // s: longitud media de la Luna
            0.0410686,   // h: longitud media del Sol
            0.0046418,   // p: perigeo lunar
            -0.0022064,  // N: nodo ascendente lunar (retrógrado)
            0.0000020    // p': perigeo solar
    };

    public DoodsonNumbers {
        Objects.requireNonNull(coefficients, "Los coeficientes de Doodson no pueden ser nulos.");
        if (coefficients.length != SIZE) {
            throw new IllegalArgumentException(
                    "Se esperaban " + SIZE + " coeficientes de Doodson, recibidos " + coefficients.length);
        }
        coefficients = coefficients.clone();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DoodsonNumbers of(int... coefficients) {
        return new DoodsonNumbers(coefficients);
    }

    @Override
    @JsonValue
    public int[] coefficients() {
        return coefficients.clone();
    }

    public int get(int index) {
        return coefficients[index];
    }

    /**
     * Velocidad angular (grados/hora) implicada por los coeficientes.
     * Sirve para validar la velocidad declarada en el catálogo.
     */
    public double angularSpeed() {
        double speed = 0.0;
        for (int i = 0; i < SIZE; i++) {
            speed += coefficients[i] * MEAN_RATES[i];
        }
        return speed;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DoodsonNumbers other && Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return "DoodsonNumbers" + Arrays.toString(coefficients);
    }
}
