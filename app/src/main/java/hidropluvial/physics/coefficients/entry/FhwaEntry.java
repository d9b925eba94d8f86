package hidropluvial.physics.coefficients.entry;

/**
 * Fila de la tabla FHWA HEC-22. El C base vale para Tr de 2 a 10 años y se mayora
 * con un factor por frecuencia (1.1 a 25 años, 1.2 a 50, 1.25 a 100), sin superar 1.0.
 */
public record FhwaEntry(String category, String description, double cBase) implements CoefficientEntry {

    @Override
    public double cForReturnPeriod(double returnPeriodYr) {
        return Math.min(cBase * frequencyFactor(returnPeriodYr), 1.0);
    }

    public static double frequencyFactor(double tr) {
        if (tr <= 10) {
            return 1.0;
        } else if (tr <= 25) {
            return 1.0 + 0.1 * (tr - 10) / 15;
        } else if (tr <= 50) {
            return 1.1 + 0.1 * (tr - 25) / 25;
        } else if (tr <= 100) {
            return 1.2 + 0.05 * (tr - 50) / 50;
        }
        return 1.25;
    }
}
