package tidalharmonics.physics.astronomy;

/**
 * Los seis ángulos astronómicos fundamentales en un instante, en grados y normalizados a [0, 360).
 * Se calcula de nuevo para cada instante; nunca se muta.
 *
 * @param T  Ángulo horario del Sol medio en Greenwich.
 * @param s  Longitud media de la Luna.
 * @param h  Longitud media del Sol.
 * @param p  Longitud del perigeo lunar.
 * @param N  Longitud del nodo ascendente lunar.
 * @param pp Longitud del perigeo solar (p').
 */
public record AstronomicalAngles(double T, double s, double h, double p, double N, double pp) {

    public AstronomicalAngles {
        T = AngleMath.normalize(T);
        s = AngleMath.normalize(s);
        h = AngleMath.normalize(h);
        p = AngleMath.normalize(p);
        N = AngleMath.normalize(N);
        pp = AngleMath.normalize(pp);
    }

    /**
     * Ángulos en el mismo orden que los coeficientes de Doodson.
     */
    public double[] asArray() {
        return new double[]{T, s, h, p, N, pp};
    }
}
