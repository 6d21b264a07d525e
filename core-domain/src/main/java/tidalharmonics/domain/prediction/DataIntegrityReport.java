package tidalharmonics.domain.prediction;

import java.util.List;

/**
 * Resultado de inspeccionar una estación contra el catálogo de constituyentes.
 * Los símbolos desconocidos se excluyen de la suma; la predicción sigue siendo válida pero parcial.
 *
 * @param stationId      Estación inspeccionada.
 * @param unknownSymbols Símbolos sin definición en el catálogo, en orden de aparición.
 */
public record DataIntegrityReport(String stationId, List<String> unknownSymbols) {

    public DataIntegrityReport {
        unknownSymbols = List.copyOf(unknownSymbols);
    }

    public boolean isClean() {
        return unknownSymbols.isEmpty();
    }
}
