package hidropluvial.physics.storm;

import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.io.ReferenceCurveRegistry;

import java.util.Objects;

/**
 * Distribuciones adimensionales SCS de 24 h (Tipos I, IA, II y III).
 * <p>
 * Para duraciones distintas de 24 h el eje de tiempo de la curva se escala por D/24.
 */
public final class ScsDistributionGenerator {

    private static final double REFERENCE_DURATION_HR = 24.0;

    private ScsDistributionGenerator() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param registry     Curvas de referencia.
     * @param type         Uno de {@code SCS_I}, {@code SCS_IA}, {@code SCS_II}, {@code SCS_III}.
     * @param totalDepthMm Lámina total (mm).
     */
    public static HyetographResult generate(ReferenceCurveRegistry registry, StormType type,
                                            double totalDepthMm, double durationHr, double dtMin) {
        Objects.requireNonNull(registry, "El registro de curvas no puede ser nulo.");
        if (totalDepthMm < 0) {
            throw new IllegalArgumentException("Lámina total debe ser >= 0");
        }
        CumulativeCurve curve = registry.scsCurve(type).scaleX(durationHr / REFERENCE_DURATION_HR);
        double[] depths = MassCurveSampler.sample(curve, durationHr, dtMin, totalDepthMm / curve.lastY());
        return MassCurveSampler.toResult(depths, durationHr, methodLabel(type));
    }

    static String methodLabel(StormType type) {
        return switch (type) {
            case SCS_I -> "scs_type_i";
            case SCS_IA -> "scs_type_ia";
            case SCS_II -> "scs_type_ii";
            case SCS_III -> "scs_type_iii";
            default -> throw new IllegalArgumentException("Tipo de tormenta inválido: " + type.getCode());
        };
    }
}
