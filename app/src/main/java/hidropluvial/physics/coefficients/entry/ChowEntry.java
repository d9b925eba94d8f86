package hidropluvial.physics.coefficients.entry;

/**
 * Fila de la tabla de Ven Te Chow (Applied Hydrology, tabla 15.1.1) con C por período
 * de retorno. Entre los Tr publicados se interpola linealmente; fuera de ellos se usa
 * el extremo más cercano.
 */
public record ChowEntry(
        String category,
        String description,
        double c2,
        double c5,
        double c10,
        double c25,
        double c50,
        double c100
) implements CoefficientEntry {

    private static final double[] RETURN_PERIODS = {2, 5, 10, 25, 50, 100};

    @Override
    public double cForReturnPeriod(double returnPeriodYr) {
        double[] values = {c2, c5, c10, c25, c50, c100};
        if (returnPeriodYr <= RETURN_PERIODS[0]) {
            return c2;
        }
        if (returnPeriodYr >= RETURN_PERIODS[RETURN_PERIODS.length - 1]) {
            return c100;
        }
        for (int i = 0; i < RETURN_PERIODS.length - 1; i++) {
            double t1 = RETURN_PERIODS[i];
            double t2 = RETURN_PERIODS[i + 1];
            if (returnPeriodYr <= t2) {
                return values[i] + (values[i + 1] - values[i]) * (returnPeriodYr - t1) / (t2 - t1);
            }
        }
        return c100;
    }
}
