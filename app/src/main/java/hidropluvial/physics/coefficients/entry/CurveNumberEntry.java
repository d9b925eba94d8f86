package hidropluvial.physics.coefficients.entry;

import hidropluvial.domain.basin.SoilGroup;

/**
 * Fila de la tabla de Curva Número (TR-55) con un CN por grupo hidrológico de suelo.
 *
 * @param condition Condición hidrológica ("Buena", "Regular", "Mala" o "N/A").
 */
public record CurveNumberEntry(
        String category,
        String description,
        String condition,
        int cnA,
        int cnB,
        int cnC,
        int cnD
) {

    public int cn(SoilGroup group) {
        return switch (group) {
            case A -> cnA;
            case B -> cnB;
            case C -> cnC;
            case D -> cnD;
        };
    }
}
