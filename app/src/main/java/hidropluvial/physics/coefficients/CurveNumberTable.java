package hidropluvial.physics.coefficients;

import hidropluvial.domain.basin.SoilGroup;
import hidropluvial.physics.coefficients.entry.CurveNumberEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabla unificada de Curva Número (TR-55) en condición AMC II.
 * Las primeras filas son coberturas urbanas y el resto agrícolas.
 */
public final class CurveNumberTable {

    public static final List<CurveNumberEntry> URBAN = List.of(
            new CurveNumberEntry("Residencial", "Lotes 500 m² (65% impermeable)", "N/A", 77, 85, 90, 92),
            new CurveNumberEntry("Residencial", "Lotes 1000 m² (38% impermeable)", "N/A", 61, 75, 83, 87),
            new CurveNumberEntry("Residencial", "Lotes 1500 m² (30% impermeable)", "N/A", 57, 72, 81, 86),
            new CurveNumberEntry("Residencial", "Lotes 2000 m² (25% impermeable)", "N/A", 54, 70, 80, 85),
            new CurveNumberEntry("Residencial", "Lotes 4000 m² (20% impermeable)", "N/A", 51, 68, 79, 84),
            new CurveNumberEntry("Comercial", "Distritos comerciales (85% imp)", "N/A", 89, 92, 94, 95),
            new CurveNumberEntry("Industrial", "Distritos industriales (72% imp)", "N/A", 81, 88, 91, 93),
            new CurveNumberEntry("Superficies", "Pavimento impermeable", "N/A", 98, 98, 98, 98),
            new CurveNumberEntry("Superficies", "Grava", "N/A", 76, 85, 89, 91),
            new CurveNumberEntry("Superficies", "Tierra", "N/A", 72, 82, 87, 89),
            new CurveNumberEntry("Espacios abiertos", "Césped >75% cubierto", "Buena", 39, 61, 74, 80),
            new CurveNumberEntry("Espacios abiertos", "Césped 50-75% cubierto", "Regular", 49, 69, 79, 84),
            new CurveNumberEntry("Espacios abiertos", "Césped <50% cubierto", "Mala", 68, 79, 86, 89)
    );

    public static final List<CurveNumberEntry> AGRICULTURAL = List.of(
            new CurveNumberEntry("Barbecho", "Suelo desnudo", "N/A", 77, 86, 91, 94),
            new CurveNumberEntry("Cultivos", "Hileras rectas", "Mala", 72, 81, 88, 91),
            new CurveNumberEntry("Cultivos", "Hileras rectas", "Buena", 67, 78, 85, 89),
            new CurveNumberEntry("Cultivos", "Hileras en contorno", "Mala", 70, 79, 84, 88),
            new CurveNumberEntry("Cultivos", "Hileras en contorno", "Buena", 65, 75, 82, 86),
            new CurveNumberEntry("Cultivos", "Terrazas", "Mala", 66, 74, 80, 82),
            new CurveNumberEntry("Cultivos", "Terrazas", "Buena", 62, 71, 78, 81),
            new CurveNumberEntry("Pasturas", "Continua", "Mala", 68, 79, 86, 89),
            new CurveNumberEntry("Pasturas", "Continua", "Regular", 49, 69, 79, 84),
            new CurveNumberEntry("Pasturas", "Continua", "Buena", 39, 61, 74, 80),
            new CurveNumberEntry("Pradera", "Natural", "Buena", 30, 58, 71, 78),
            new CurveNumberEntry("Bosque", "Con mantillo", "Mala", 45, 66, 77, 83),
            new CurveNumberEntry("Bosque", "Con mantillo", "Regular", 36, 60, 73, 79),
            new CurveNumberEntry("Bosque", "Con mantillo", "Buena", 30, 55, 70, 77)
    );

    public static final List<CurveNumberEntry> UNIFIED = concat(URBAN, AGRICULTURAL);

    private CurveNumberTable() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * CN de la fila {@code index} de la tabla unificada para el grupo de suelo dado.
     */
    public static int cn(int index, SoilGroup group) {
        if (index < 0 || index >= UNIFIED.size()) {
            throw new IllegalArgumentException("Índice " + index + " fuera de rango para tabla de CN");
        }
        return UNIFIED.get(index).cn(group);
    }

    private static List<CurveNumberEntry> concat(List<CurveNumberEntry> first, List<CurveNumberEntry> second) {
        List<CurveNumberEntry> all = new ArrayList<>(first);
        all.addAll(second);
        return List.copyOf(all);
    }
}
