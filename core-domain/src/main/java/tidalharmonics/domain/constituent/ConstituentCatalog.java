package tidalharmonics.domain.constituent;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Catálogo global de constituyentes indexado por símbolo. Inmutable una vez construido.
 */
public final class ConstituentCatalog {

    private final Map<String, ConstituentDefinition> bySymbol;

    private ConstituentCatalog(Map<String, ConstituentDefinition> bySymbol) {
        this.bySymbol = Collections.unmodifiableMap(bySymbol);
    }

    /**
     * Construye el catálogo. Los símbolos duplicados son un error de datos.
     */
    public static ConstituentCatalog of(Collection<ConstituentDefinition> definitions) {
        Map<String, ConstituentDefinition> map = new LinkedHashMap<>();
        for (ConstituentDefinition definition : definitions) {
            if (map.putIfAbsent(definition.symbol(), definition) != null) {
                throw new IllegalStateException("Símbolo duplicado en el catálogo: " + definition.symbol());
            }
        }
        return new ConstituentCatalog(map);
    }

    public Optional<ConstituentDefinition> find(String symbol) {
        return Optional.ofNullable(bySymbol.get(symbol));
    }

    public boolean contains(String symbol) {
        return bySymbol.containsKey(symbol);
    }

    public Collection<ConstituentDefinition> definitions() {
        return bySymbol.values();
    }

    public int size() {
        return bySymbol.size();
    }
}
