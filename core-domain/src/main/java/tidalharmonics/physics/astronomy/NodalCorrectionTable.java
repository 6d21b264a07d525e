package tidalharmonics.physics.astronomy;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Tabla de correcciones nodales: asignación cerrada símbolo → {@link NodalFormula}.
 * <p>
 * Los constituyentes solares (S2, P1, Sa...) y los no modelados reciben la corrección
 * identidad {f = 1, u = 0}. Para constituyentes menores sin fórmula propia esto es una
 * aproximación conocida, no un error.
 * <p>
 * Solo datos y funciones puras; sin estado mutable.
 */
public class NodalCorrectionTable implements NodalCorrectionModel {

    private static final Map<String, NodalFormula> FORMULAS = Map.ofEntries(
            entry("M2", NodalFormula.LUNAR_SEMIDIURNAL),
            entry("N2", NodalFormula.LUNAR_SEMIDIURNAL),
            entry("2N2", NodalFormula.LUNAR_SEMIDIURNAL),
            entry("MU2", NodalFormula.LUNAR_SEMIDIURNAL),
            entry("NU2", NodalFormula.LUNAR_SEMIDIURNAL),
            entry("L2", NodalFormula.LUNAR_SEMIDIURNAL),
            entry("LAM2", NodalFormula.LUNAR_SEMIDIURNAL),

            entry("S2", NodalFormula.IDENTITY),
            entry("T2", NodalFormula.IDENTITY),
            entry("R2", NodalFormula.IDENTITY),

            entry("K2", NodalFormula.LUNI_SOLAR_SEMIDIURNAL),
            entry("K1", NodalFormula.LUNI_SOLAR_DIURNAL),

            entry("O1", NodalFormula.LUNAR_DIURNAL),
            entry("Q1", NodalFormula.LUNAR_DIURNAL),
            entry("2Q1", NodalFormula.LUNAR_DIURNAL),
            entry("RHO1", NodalFormula.LUNAR_DIURNAL),

            entry("P1", NodalFormula.IDENTITY),
            entry("S1", NodalFormula.IDENTITY),

            entry("J1", NodalFormula.LUNAR_DIURNAL_J1),
            entry("OO1", NodalFormula.LUNAR_DIURNAL_J1),
            entry("M1", NodalFormula.LUNAR_DIURNAL_M1),

            entry("Mf", NodalFormula.LUNAR_FORTNIGHTLY),
            entry("Mm", NodalFormula.LUNAR_MONTHLY),
            entry("Ssa", NodalFormula.IDENTITY),
            entry("Sa", NodalFormula.IDENTITY),
            entry("MSf", NodalFormula.IDENTITY),

            entry("M4", NodalFormula.SHALLOW_M4),
            entry("MN4", NodalFormula.SHALLOW_M4),
            entry("MS4", NodalFormula.SHALLOW_MS4),
            entry("M6", NodalFormula.SHALLOW_M6),
            entry("M8", NodalFormula.SHALLOW_M8),
            entry("S4", NodalFormula.IDENTITY),
            entry("S6", NodalFormula.IDENTITY),
            entry("MK3", NodalFormula.SHALLOW_MK3),
            entry("2MK3", NodalFormula.SHALLOW_2MK3)
    );

    @Override
    public NodalFactors getFactors(String symbol, double nodeAngle) {
        return formulaFor(symbol).apply(nodeAngle);
    }

    /**
     * Fórmula asignada al símbolo; {@link NodalFormula#IDENTITY} si no está modelado.
     */
    public NodalFormula formulaFor(String symbol) {
        return FORMULAS.getOrDefault(symbol, NodalFormula.IDENTITY);
    }

    /**
     * Indica si el símbolo tiene una entrada explícita en la tabla.
     */
    public boolean isModeled(String symbol) {
        return FORMULAS.containsKey(symbol);
    }
}
