package hidropluvial.physics.idf;

import hidropluvial.physics.i.IIdfCurve;

/**
 * Curva IDF de Koutsoyiannis et al. (1998) con distribución de Gumbel:
 * <pre>
 *     a(T) = μ + σ·y_T,   y_T = -ln(-ln(1 - 1/T))
 *     i    = a(T) / (d + θ)^η
 * </pre>
 * La duración {@code d} se expresa en minutos.
 */
public class KoutsoyiannisIdf implements IIdfCurve {

    private final double mu;
    private final double sigma;
    private final double theta;
    private final double eta;

    public KoutsoyiannisIdf(double mu, double sigma, double theta, double eta) {
        if (sigma <= 0) {
            throw new IllegalArgumentException("Parámetro sigma debe ser > 0");
        }
        if (theta < 0) {
            throw new IllegalArgumentException("Parámetro theta debe ser >= 0");
        }
        if (eta <= 0) {
            throw new IllegalArgumentException("Parámetro eta debe ser > 0");
        }
        this.mu = mu;
        this.sigma = sigma;
        this.theta = theta;
        this.eta = eta;
    }

    @Override
    public double intensity(double durationMin, double returnPeriodYr) {
        IIdfCurve.validateArguments(durationMin, returnPeriodYr);
        if (returnPeriodYr <= 1) {
            throw new IllegalArgumentException("Período de retorno debe ser > 1 para Koutsoyiannis");
        }
        double gumbel = -Math.log(-Math.log(1.0 - 1.0 / returnPeriodYr));
        double a = mu + sigma * gumbel;
        return a / Math.pow(durationMin + theta, eta);
    }

    @Override
    public String name() {
        return "koutsoyiannis";
    }
}
