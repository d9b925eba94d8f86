package hidropluvial.physics.coefficients;

import hidropluvial.domain.basin.AntecedentMoisture;

import java.util.Objects;

/**
 * Ajuste de la Curva Número por condición de humedad antecedente (Chow, 1988):
 * <pre>
 *     CN_I   = CN_II / (2.281 − 0.01281 · CN_II)
 *     CN_III = CN_II / (0.427 + 0.00573 · CN_II)
 * </pre>
 */
public final class CurveNumberAdjuster {

    private static final double CN_MIN = 30.0;
    private static final double CN_MAX = 100.0;

    private CurveNumberAdjuster() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param cnII CN en condición media (AMC II), en [30, 100].
     * @return CN ajustado, acotado a [30, 100].
     */
    public static double adjustCnForAmc(double cnII, AntecedentMoisture amc) {
        Objects.requireNonNull(amc, "La condición AMC no puede ser nula.");
        if (cnII < CN_MIN || cnII > CN_MAX) {
            throw new IllegalArgumentException("CN debe estar entre 30 y 100 (recibido " + cnII + ")");
        }
        double adjusted = switch (amc) {
            case AVERAGE -> cnII;
            case DRY -> cnII / (2.281 - 0.01281 * cnII);
            case WET -> cnII / (0.427 + 0.00573 * cnII);
        };
        return Math.max(CN_MIN, Math.min(CN_MAX, adjusted));
    }
}
