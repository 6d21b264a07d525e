package tidalharmonics.domain.station;

/**
 * Clasificación del régimen de marea según el factor de forma (K1+O1)/(M2+S2).
 */
public enum TidalType {
    SEMIDIURNAL("Semidiurna (dos pleamares iguales al día)"),
    MIXED_SEMIDIURNAL("Mixta, principalmente semidiurna"),
    MIXED_DIURNAL("Mixta, principalmente diurna"),
    DIURNAL("Diurna (una pleamar al día)");

    private final String label;

    TidalType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
