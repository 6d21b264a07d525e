package tidalharmonics.physics.model;

import tidalharmonics.domain.station.TidalType;
import tidalharmonics.domain.station.TideStation;

/**
 * Clasifica el régimen de marea de una estación por el factor de forma
 * F = (K1 + O1) / (M2 + S2).
 * <p>
 * - F &lt; 0,25: semidiurna
 * - 0,25 ≤ F &lt; 1,5: mixta, principalmente semidiurna
 * - 1,5 ≤ F &lt; 3,0: mixta, principalmente diurna
 * - F ≥ 3,0: diurna
 */
public final class TidalTypeClassifier {

    /**
     * Prohibido construir esta clase utilidad
     */
    private TidalTypeClassifier() {
    }

    public static double formFactor(TideStation station) {
        double diurnal = station.amplitudeOf("K1") + station.amplitudeOf("O1");
        double semidiurnal = station.amplitudeOf("M2") + station.amplitudeOf("S2");
        // Sin constituyentes semidiurnos el denominador vale 1
        return diurnal / (semidiurnal == 0.0 ? 1.0 : semidiurnal);
    }

    public static TidalType classify(TideStation station) {
        double ratio = formFactor(station);
        if (ratio < 0.25) return TidalType.SEMIDIURNAL;
        if (ratio < 1.5) return TidalType.MIXED_SEMIDIURNAL;
        if (ratio < 3.0) return TidalType.MIXED_DIURNAL;
        return TidalType.DIURNAL;
    }
}
