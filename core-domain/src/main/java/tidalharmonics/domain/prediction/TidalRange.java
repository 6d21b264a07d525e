package tidalharmonics.domain.prediction;

/**
 * Alturas mínima y máxima predichas en una ventana alrededor de un instante.
 */
public record TidalRange(double minHeight, double maxHeight) {

    public double range() {
        return maxHeight - minHeight;
    }
}
