package tidalharmonics.domain.constituent;

import lombok.Builder;

import java.util.Objects;

/**
 * Definición global (catálogo) de un constituyente de marea. Solo lectura.
 *
 * @param symbol      Símbolo convencional (ej: "M2").
 * @param name        Nombre descriptivo.
 * @param family      Familia del constituyente.
 * @param doodson     Coeficientes de Doodson.
 * @param speed       Velocidad angular constante en grados/hora. Debe ser positiva.
 * @param period      Periodo en horas. Si no se informa se deriva de la velocidad.
 * @param description Texto libre, opcional.
 */
@Builder
public record ConstituentDefinition(
        String symbol,
        String name,
        ConstituentFamily family,
        DoodsonNumbers doodson,
        double speed,
        double period,
        String description
) {
    public ConstituentDefinition {
        Objects.requireNonNull(symbol, "El símbolo del constituyente no puede ser nulo.");
        Objects.requireNonNull(family, "La familia del constituyente " + symbol + " no puede ser nula.");
        Objects.requireNonNull(doodson, "Los números de Doodson de " + symbol + " no pueden ser nulos.");
        if (!(speed > 0.0) || Double.isInfinite(speed)) {
            throw new IllegalArgumentException("La velocidad angular de " + symbol + " debe ser positiva y finita: " + speed);
        }
        if (period <= 0.0) {
            period = 360.0 / speed;
        }
        if (name == null) {
            name = symbol;
        }
    }
}
