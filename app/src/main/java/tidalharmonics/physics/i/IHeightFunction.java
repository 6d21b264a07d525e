package tidalharmonics.physics.i;

import java.time.Instant;

/**
 * Altura de marea como función del tiempo. Debe ser determinista:
 * el mismo instante produce siempre la misma altura.
 */
@FunctionalInterface
public interface IHeightFunction {
    double heightAt(Instant instant);
}
