package hidropluvial.physics.idf;

import hidropluvial.physics.i.IIdfCurve;

/**
 * Curva IDF de Bernard: {@code i = a·Tr^m / t^n}.
 * Duraciones por debajo de 0.1 min se evalúan en 0.1 min para evitar la singularidad en t = 0.
 */
public class BernardIdf implements IIdfCurve {

    private static final double MIN_DURATION_MIN = 0.1;

    private final double a;
    private final double m;
    private final double n;

    public BernardIdf(double a, double m, double n) {
        if (a <= 0) {
            throw new IllegalArgumentException("Coeficiente a debe ser > 0");
        }
        if (m <= 0 || m >= 1) {
            throw new IllegalArgumentException("Exponente m debe estar en (0, 1)");
        }
        if (n <= 0 || n >= 2) {
            throw new IllegalArgumentException("Exponente n debe estar en (0, 2)");
        }
        this.a = a;
        this.m = m;
        this.n = n;
    }

    @Override
    public double intensity(double durationMin, double returnPeriodYr) {
        IIdfCurve.validateArguments(durationMin, returnPeriodYr);
        double t = Math.max(durationMin, MIN_DURATION_MIN);
        return a * Math.pow(returnPeriodYr, m) / Math.pow(t, n);
    }

    @Override
    public String name() {
        return "bernard";
    }
}
