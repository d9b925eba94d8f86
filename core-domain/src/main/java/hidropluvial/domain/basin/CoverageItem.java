package hidropluvial.domain.basin;

/**
 * Una cobertura del suelo dentro de la cuenca.
 *
 * @param areaHa      Área de la cobertura en hectáreas.
 * @param value       Coeficiente asociado (C o CN) tal como se eligió.
 * @param tableIndex  Posición en la tabla de origen, o {@code null} si el valor se introdujo a mano.
 * @param description Texto libre para trazabilidad.
 */
public record CoverageItem(double areaHa, double value, Integer tableIndex, String description) {

    public CoverageItem {
        if (areaHa <= 0) {
            throw new IllegalArgumentException("El área de la cobertura debe ser > 0 (recibido " + areaHa + ")");
        }
        if (value < 0) {
            throw new IllegalArgumentException("El coeficiente de la cobertura no puede ser negativo");
        }
        if (tableIndex != null && tableIndex < 0) {
            throw new IllegalArgumentException("El índice de tabla no puede ser negativo");
        }
    }

    public static CoverageItem manual(double areaHa, double value) {
        return new CoverageItem(areaHa, value, null, null);
    }

    public static CoverageItem fromTable(double areaHa, double value, int tableIndex) {
        return new CoverageItem(areaHa, value, tableIndex, null);
    }

    public boolean hasTableIndex() {
        return tableIndex != null;
    }
}
