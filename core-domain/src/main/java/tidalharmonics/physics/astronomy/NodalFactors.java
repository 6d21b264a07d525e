package tidalharmonics.physics.astronomy;

/**
 * Corrección nodal de un constituyente.
 *
 * @param f Factor de amplitud (adimensional).
 * @param u Corrección de fase en grados.
 */
public record NodalFactors(double f, double u) {

    public static final NodalFactors IDENTITY = new NodalFactors(1.0, 0.0);

    public boolean isIdentity() {
        return f == 1.0 && u == 0.0;
    }
}
