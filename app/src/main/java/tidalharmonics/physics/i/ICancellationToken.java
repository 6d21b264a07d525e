package tidalharmonics.physics.i;

/**
 * Token de cancelación cooperativa. Los bucles largos lo consultan en cada iteración
 * y terminan devolviendo el resultado parcial.
 */
@FunctionalInterface
public interface ICancellationToken {

    ICancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
