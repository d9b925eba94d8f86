package hidropluvial.physics.i;

/**
 * Relación intensidad-duración-frecuencia.
 * <p>
 * Las dos operaciones son consistentes por construcción: {@code depth = intensity · duration / 60}.
 */
public interface IIdfCurve {

    /**
     * @param durationMin    Duración de la lluvia (min), > 0.
     * @param returnPeriodYr Período de retorno (años), > 0.
     * @return Intensidad media (mm/h).
     */
    double intensity(double durationMin, double returnPeriodYr);

    /**
     * @return Lámina acumulada (mm) para la duración dada.
     */
    default double depth(double durationMin, double returnPeriodYr) {
        return intensity(durationMin, returnPeriodYr) * durationMin / 60.0;
    }

    /**
     * Etiqueta del método, usada en los hietogramas y en los registros.
     */
    String name();

    static void validateArguments(double durationMin, double returnPeriodYr) {
        if (durationMin <= 0) {
            throw new IllegalArgumentException("Duración debe ser > 0 (recibido " + durationMin + ")");
        }
        if (returnPeriodYr <= 0) {
            throw new IllegalArgumentException("Período de retorno debe ser > 0 (recibido " + returnPeriodYr + ")");
        }
    }
}
