package tidalharmonics.physics.astronomy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AngleMathTest {

    @Test
    @DisplayName("normalize: reduce cualquier ángulo a [0, 360)")
    void normalize_shouldWrapIntoRange() {
        assertEquals(0.0, AngleMath.normalize(0.0));
        assertEquals(0.0, AngleMath.normalize(360.0));
        assertEquals(270.0, AngleMath.normalize(-90.0), 1e-12);
        assertEquals(10.0, AngleMath.normalize(730.0), 1e-12);
        assertEquals(0.0, AngleMath.normalize(-1e-17), "El redondeo no debe producir 360.0");
    }

    @Test
    @DisplayName("cosDegrees: coseno en grados")
    void cosDegrees_shouldEvaluateInDegrees() {
        assertEquals(1.0, AngleMath.cosDegrees(720.0), 1e-12);
        assertEquals(-1.0, AngleMath.cosDegrees(180.0), 1e-12);
        assertEquals(0.0, AngleMath.cosDegrees(-90.0), 1e-12);
    }

    @Test
    @DisplayName("polynomial: evaluación de Horner")
    void polynomial_shouldUseAscendingCoefficients() {
        // 1 + 2x + 3x² en x = 2 → 17
        assertEquals(17.0, AngleMath.polynomial(2.0, 1.0, 2.0, 3.0), 1e-12);
        assertEquals(5.0, AngleMath.polynomial(100.0, 5.0), 1e-12);
    }
}
