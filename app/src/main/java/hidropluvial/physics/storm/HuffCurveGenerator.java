package hidropluvial.physics.storm;

import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.io.ReferenceCurveRegistry;

import java.util.Objects;

/**
 * Curvas de Huff (1967): distribución según el cuartil de la tormenta en que cae la
 * mayor parte de la lluvia, para probabilidades del 10, 50 y 90 %.
 */
public final class HuffCurveGenerator {

    public static final int DEFAULT_PROBABILITY = 50;

    private HuffCurveGenerator() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param quartile    Cuartil 1-4.
     * @param probability 10, 50 o 90.
     */
    public static HyetographResult generate(ReferenceCurveRegistry registry, double totalDepthMm,
                                            double durationHr, double dtMin, int quartile, int probability) {
        Objects.requireNonNull(registry, "El registro de curvas no puede ser nulo.");
        if (totalDepthMm < 0) {
            throw new IllegalArgumentException("Lámina total debe ser >= 0");
        }
        // Abscisa en % de la duración: se pasa a horas para muestrear igual que SCS.
        CumulativeCurve curve = registry.huffCurve(quartile, probability).scaleX(durationHr / 100.0);
        double[] depths = MassCurveSampler.sample(curve, durationHr, dtMin, totalDepthMm / curve.lastY());
        return MassCurveSampler.toResult(depths, durationHr, "huff_q" + quartile + "_p" + probability);
    }
}
