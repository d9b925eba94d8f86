package hidropluvial.physics.coefficients.entry;

/**
 * Fila de la tabla regional de Uruguay: rango mínimo/máximo y valor típico.
 * No depende del período de retorno.
 *
 * @param typical Valor típico, o {@code null} si la fuente sólo da el rango.
 */
public record RegionalEntry(String category, String description, double cMin, double cMax, Double typical)
        implements CoefficientEntry {

    public RegionalEntry {
        if (cMin > cMax) {
            throw new IllegalArgumentException("Rango de C inválido: " + cMin + " > " + cMax);
        }
    }

    /**
     * El valor típico si existe; si no, el punto medio del rango.
     */
    public double recommended() {
        return typical != null ? typical : (cMin + cMax) / 2.0;
    }

    @Override
    public double cForReturnPeriod(double returnPeriodYr) {
        return recommended();
    }
}
