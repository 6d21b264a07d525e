package tidalharmonics.physics.i;

/**
 * Contrato base para los componentes numéricos del motor de predicción.
 * Permite identificarlos en logs sin importar su algoritmo.
 */
public interface IPredictionComponent {
    /**
     * Nombre corto del algoritmo (ej: "Harmonic synthesis", "Slope bisection").
     */
    String getName();

    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
