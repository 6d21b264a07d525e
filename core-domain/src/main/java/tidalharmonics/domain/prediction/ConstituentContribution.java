package tidalharmonics.domain.prediction;

/**
 * Aporte individual de un constituyente a la altura en un instante.
 *
 * @param symbol             Símbolo del constituyente.
 * @param value              Término f·A·cos(fase) en metros.
 * @param effectiveAmplitude f·A en metros (longitud del fasor).
 * @param phase              Fase V0 + u − κ normalizada, en grados.
 */
public record ConstituentContribution(
        String symbol,
        double value,
        double effectiveAmplitude,
        double phase
) {}
