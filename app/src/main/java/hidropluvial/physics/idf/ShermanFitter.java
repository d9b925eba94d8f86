package hidropluvial.physics.idf;

import hidropluvial.domain.idf.ShermanCoefficients;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.fitting.AbstractCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoint;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ajuste de coeficientes Sherman a intensidades observadas para un período de retorno fijo.
 * <p>
 * Se ajusta {@code i = K / (t + c)^n} por mínimos cuadrados (Levenberg-Marquardt) con
 * {@code c} en [0, 60] y {@code n} en [0.1, 2). El exponente del período de retorno no
 * puede identificarse con un solo Tr: se asume {@code m = 0.2} y {@code k = K / Tr^m}.
 */
@Slf4j
public final class ShermanFitter {

    public static final double ASSUMED_M = 0.2;
    public static final double[] DEFAULT_INITIAL_GUESS = {1000.0, 10.0, 0.7};

    private static final int MAX_EVALUATIONS = 5000;

    private ShermanFitter() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    public static ShermanCoefficients fit(double[] durationsMin, double[] intensitiesMmHr, double returnPeriodYr) {
        return fit(durationsMin, intensitiesMmHr, returnPeriodYr, DEFAULT_INITIAL_GUESS);
    }

    /**
     * @param initialGuess Valores iniciales {@code (K, c, n)}.
     * @throws IllegalArgumentException si hay menos de 3 puntos, longitudes distintas o valores no positivos.
     */
    public static ShermanCoefficients fit(double[] durationsMin, double[] intensitiesMmHr, double returnPeriodYr,
                                          double[] initialGuess) {
        Objects.requireNonNull(durationsMin, "Las duraciones no pueden ser nulas.");
        Objects.requireNonNull(intensitiesMmHr, "Las intensidades no pueden ser nulas.");
        Objects.requireNonNull(initialGuess, "Los valores iniciales no pueden ser nulos.");
        if (durationsMin.length != intensitiesMmHr.length) {
            throw new IllegalArgumentException("Duraciones e intensidades deben tener la misma longitud.");
        }
        if (durationsMin.length < 3) {
            throw new IllegalArgumentException("Se necesitan al menos 3 puntos para ajustar 3 coeficientes");
        }
        if (initialGuess.length != 3) {
            throw new IllegalArgumentException("Los valores iniciales deben ser (K, c, n)");
        }
        if (returnPeriodYr <= 0) {
            throw new IllegalArgumentException("Período de retorno debe ser > 0");
        }

        List<WeightedObservedPoint> points = new ArrayList<>(durationsMin.length);
        for (int i = 0; i < durationsMin.length; i++) {
            if (durationsMin[i] <= 0 || intensitiesMmHr[i] <= 0) {
                throw new IllegalArgumentException("Duraciones e intensidades deben ser > 0");
            }
            points.add(new WeightedObservedPoint(1.0, durationsMin[i], intensitiesMmHr[i]));
        }

        double[] fitted = new BoundedShermanFitter(initialGuess).fit(points);
        double k = fitted[0] / Math.pow(returnPeriodYr, ASSUMED_M);
        log.debug("Sherman ajustado para Tr={}: K={} c={} n={}", returnPeriodYr, fitted[0], fitted[1], fitted[2]);
        return new ShermanCoefficients(k, ASSUMED_M, fitted[1], fitted[2]);
    }

    /**
     * {@code i(t) = K / (t + c)^n} con sus derivadas parciales.
     */
    static final class ShermanFunction implements ParametricUnivariateFunction {

        @Override
        public double value(double t, double... p) {
            return p[0] / Math.pow(t + p[1], p[2]);
        }

        @Override
        public double[] gradient(double t, double... p) {
            double base = t + p[1];
            double value = p[0] / Math.pow(base, p[2]);
            return new double[]{
                    value / p[0],
                    -p[2] * value / base,
                    -value * Math.log(base)
            };
        }
    }

    private static final class BoundedShermanFitter extends AbstractCurveFitter {

        private final double[] initialGuess;

        private BoundedShermanFitter(double[] initialGuess) {
            this.initialGuess = initialGuess.clone();
        }

        @Override
        protected LeastSquaresProblem getProblem(Collection<WeightedObservedPoint> points) {
            int size = points.size();
            double[] target = new double[size];
            double[] weights = new double[size];
            int i = 0;
            for (WeightedObservedPoint point : points) {
                target[i] = point.getY();
                weights[i] = point.getWeight();
                i++;
            }

            AbstractCurveFitter.TheoreticalValuesFunction model =
                    new AbstractCurveFitter.TheoreticalValuesFunction(new ShermanFunction(), points);

            return new LeastSquaresBuilder()
                    .maxEvaluations(MAX_EVALUATIONS)
                    .maxIterations(MAX_EVALUATIONS)
                    .start(initialGuess)
                    .target(target)
                    .weight(new DiagonalMatrix(weights))
                    .model(model.getModelFunction(), model.getModelFunctionJacobian())
                    .parameterValidator(new ShermanBounds())
                    .build();
        }
    }

    private static final class ShermanBounds implements ParameterValidator {

        @Override
        public RealVector validate(RealVector params) {
            double k = Math.max(params.getEntry(0), 1e-9);
            double c = Math.min(Math.max(params.getEntry(1), 0.0), 60.0);
            double n = Math.min(Math.max(params.getEntry(2), 0.1), 1.999);
            return new ArrayRealVector(new double[]{k, c, n});
        }
    }
}
