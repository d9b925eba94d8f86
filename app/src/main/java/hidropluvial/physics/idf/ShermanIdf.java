package hidropluvial.physics.idf;

import hidropluvial.domain.idf.ShermanCoefficients;
import hidropluvial.physics.i.IIdfCurve;

import java.util.Objects;

/**
 * Curva IDF de tres parámetros tipo Sherman: {@code i = k·Tr^m / (t + c)^n}.
 */
public class ShermanIdf implements IIdfCurve {

    private final ShermanCoefficients coefficients;

    public ShermanIdf(ShermanCoefficients coefficients) {
        this.coefficients = Objects.requireNonNull(coefficients, "Los coeficientes Sherman no pueden ser nulos.");
    }

    @Override
    public double intensity(double durationMin, double returnPeriodYr) {
        IIdfCurve.validateArguments(durationMin, returnPeriodYr);
        double numerator = coefficients.k() * Math.pow(returnPeriodYr, coefficients.m());
        return numerator / Math.pow(durationMin + coefficients.c(), coefficients.n());
    }

    @Override
    public String name() {
        return "sherman";
    }

    public ShermanCoefficients coefficients() {
        return coefficients;
    }
}
