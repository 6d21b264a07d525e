package tidalharmonics.domain.constituent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Familias de constituyentes según la especie (número de ciclos por día lunar).
 */
public enum ConstituentFamily {
    @JsonProperty("semidiurnal")
    SEMIDIURNAL,

    @JsonProperty("diurnal")
    DIURNAL,

    @JsonProperty("long-period")
    LONG_PERIOD,

    /**
     * Componentes compuestos o sobretonos generados por la fricción en aguas someras.
     */
    @JsonProperty("shallow-water")
    SHALLOW_WATER
}
