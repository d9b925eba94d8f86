package hidropluvial.physics.coefficients.entry;

/**
 * Fila de una tabla de coeficientes de escorrentía C.
 */
public interface CoefficientEntry {

    String category();

    String description();

    /**
     * Coeficiente C aplicable al período de retorno dado. Las tablas que no dependen
     * del Tr devuelven siempre el mismo valor.
     */
    double cForReturnPeriod(double returnPeriodYr);
}
