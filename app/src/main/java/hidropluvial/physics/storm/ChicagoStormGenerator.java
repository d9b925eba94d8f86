package hidropluvial.physics.storm;

import hidropluvial.domain.idf.ShermanCoefficients;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.factory.HyetographResultFactory;

import java.util.Objects;

/**
 * Tormenta de diseño Chicago (Keifer y Chu, 1957) sobre una IDF tipo Sherman
 * {@code i = a / (t + b)^c}, con {@code a = k·Tr^m}.
 * <pre>
 *     antes del pico:   i = a·[(1−c)·t_b/r + b] / (t_b/r + b)^(c+1)
 *     después del pico: i = a·[(1−c)·t_a/(1−r) + b] / (t_a/(1−r) + b)^(c+1)
 * </pre>
 * Las láminas se reescalan para sumar exactamente el total pedido.
 */
public final class ChicagoStormGenerator {

    public static final double DEFAULT_ADVANCEMENT = 0.375;

    private ChicagoStormGenerator() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param advancement Coeficiente de avance r en (0, 1): fracción de la duración antes del pico.
     */
    public static HyetographResult generate(double totalDepthMm, double durationHr, double dtMin,
                                            ShermanCoefficients coefficients, double returnPeriodYr,
                                            double advancement) {
        Objects.requireNonNull(coefficients, "Se requieren coeficientes Sherman para la tormenta Chicago.");
        if (totalDepthMm <= 0) {
            throw new IllegalArgumentException("Lámina total debe ser > 0");
        }
        if (advancement <= 0 || advancement >= 1) {
            throw new IllegalArgumentException("El coeficiente de avance r debe estar en (0, 1) (recibido " + advancement + ")");
        }

        int n = HyetographResultFactory.intervalCount(durationHr, dtMin);
        double durationMin = n * dtMin;
        double a = coefficients.k() * Math.pow(returnPeriodYr, coefficients.m());
        double b = coefficients.c();
        double c = coefficients.n();
        double tPeak = advancement * durationMin;

        double[] times = HyetographResultFactory.centeredTimes(n, dtMin);
        double[] depths = new double[n];
        double sum = 0.0;

        for (int i = 0; i < n; i++) {
            double t = times[i];
            double scaled = t <= tPeak
                    ? (tPeak - t) / advancement
                    : (t - tPeak) / (1.0 - advancement);
            if (scaled + b < 1e-9) {
                // Centro de intervalo justo en el pico con b = 0: singularidad de la fórmula.
                scaled = dtMin / 2.0;
            }
            double intensity = a * ((1.0 - c) * scaled + b) / Math.pow(scaled + b, c + 1.0);
            // Con exponente c > 1 la rama lejana se vuelve negativa; no hay lluvia negativa.
            depths[i] = Math.max(intensity, 0.0) * dtMin / 60.0;
            sum += depths[i];
        }

        if (sum <= 0) {
            throw new IllegalArgumentException("Los coeficientes Sherman no producen lluvia en la duración pedida");
        }
        double scale = totalDepthMm / sum;
        for (int i = 0; i < n; i++) {
            depths[i] *= scale;
        }
        return HyetographResultFactory.createFromDepths(times, depths, dtMin, "chicago");
    }
}
