package tidalharmonics.io;

import tidalharmonics.domain.constituent.ConstituentDefinition;

import java.util.List;

/**
 * Estructura del fichero JSON del catálogo de constituyentes.
 */
public record CatalogDocument(String source, List<ConstituentDefinition> constituents) {
    public CatalogDocument {
        constituents = constituents == null ? List.of() : List.copyOf(constituents);
    }
}
