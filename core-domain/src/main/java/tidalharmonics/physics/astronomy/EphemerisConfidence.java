package tidalharmonics.physics.astronomy;

/**
 * Fiabilidad de los polinomios de las efemérides para un instante dado.
 * Fuera de la ventana de validez el resultado sigue siendo calculable, pero menos preciso.
 */
public enum EphemerisConfidence {
    NOMINAL,
    REDUCED
}
