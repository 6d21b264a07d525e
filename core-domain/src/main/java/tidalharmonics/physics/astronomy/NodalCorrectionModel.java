package tidalharmonics.physics.astronomy;

/**
 * Contrato para obtener la corrección nodal (f, u) de un constituyente.
 */
@FunctionalInterface
public interface NodalCorrectionModel {

    /**
     * @param symbol    Símbolo del constituyente.
     * @param nodeAngle Longitud del nodo ascendente lunar N, en grados.
     */
    NodalFactors getFactors(String symbol, double nodeAngle);

    /**
     * Variante que recibe todos los ángulos del instante.
     */
    default NodalFactors getFactors(String symbol, AstronomicalAngles angles) {
        return getFactors(symbol, angles.N());
    }

    /**
     * Modelo sin corrección: f = 1, u = 0 para todos los constituyentes.
     */
    static NodalCorrectionModel identity() {
        return (symbol, nodeAngle) -> NodalFactors.IDENTITY;
    }
}
