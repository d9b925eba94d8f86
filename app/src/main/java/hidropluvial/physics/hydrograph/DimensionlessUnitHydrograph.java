package hidropluvial.physics.hydrograph;

import java.util.Objects;

/**
 * Hidrograma unitario adimensional: caudal relativo {@code q/qp} en función de {@code t/Tp}.
 *
 * @param timeRatio Abscisas {@code t/Tp}, estrictamente crecientes y empezando en 0.
 * @param flowRatio Ordenadas {@code q/qp}, en [0, 1].
 */
public record DimensionlessUnitHydrograph(double[] timeRatio, double[] flowRatio) {

    public DimensionlessUnitHydrograph {
        Objects.requireNonNull(timeRatio, "Las abscisas t/Tp no pueden ser nulas.");
        Objects.requireNonNull(flowRatio, "Las ordenadas q/qp no pueden ser nulas.");
        if (timeRatio.length != flowRatio.length || timeRatio.length < 2) {
            throw new IllegalArgumentException("El hidrograma adimensional necesita al menos 2 puntos con igual número de abscisas y ordenadas");
        }
        if (timeRatio[0] != 0.0) {
            throw new IllegalArgumentException("El hidrograma adimensional debe empezar en t/Tp = 0");
        }
        for (int i = 0; i < timeRatio.length; i++) {
            if (i > 0 && timeRatio[i] <= timeRatio[i - 1]) {
                throw new IllegalArgumentException("Las abscisas t/Tp deben ser crecientes");
            }
            if (flowRatio[i] < 0 || flowRatio[i] > 1) {
                throw new IllegalArgumentException("Las ordenadas q/qp deben estar en [0, 1]");
            }
        }
        timeRatio = timeRatio.clone();
        flowRatio = flowRatio.clone();
    }

    /**
     * Interpolación lineal; después de la última abscisa el caudal es nulo.
     */
    public double flowRatioAt(double tOverTp) {
        int last = timeRatio.length - 1;
        if (tOverTp <= 0) {
            return flowRatio[0];
        }
        if (tOverTp > timeRatio[last]) {
            return 0.0;
        }
        int hi = 1;
        while (timeRatio[hi] < tOverTp) {
            hi++;
        }
        int lo = hi - 1;
        return flowRatio[lo] + (flowRatio[hi] - flowRatio[lo]) * (tOverTp - timeRatio[lo]) / (timeRatio[hi] - timeRatio[lo]);
    }

    /**
     * Tiempo base relativo {@code Tb/Tp}.
     */
    public double baseRatio() {
        return timeRatio[timeRatio.length - 1];
    }
}
