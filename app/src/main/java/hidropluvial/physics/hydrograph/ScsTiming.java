package hidropluvial.physics.hydrograph;

import hidropluvial.domain.storm.StormType;

/**
 * Parámetros temporales del hidrograma unitario SCS.
 */
public final class ScsTiming {

    public static final double LAG_RATIO = 0.6;
    public static final double BASE_RATIO = 2.67;

    private static final double DT_TO_TC_RATIO = 0.133;
    private static final double DEFAULT_MIN_DT_MIN = 5.0;
    private static final double SCS_MIN_DT_MIN = 15.0;

    private ScsTiming() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * {@code tlag = 0.6·Tc}.
     */
    public static double lagTime(double tcHr) {
        return LAG_RATIO * tcHr;
    }

    /**
     * {@code Tp = Δt/2 + 0.6·Tc}.
     */
    public static double timeToPeak(double tcHr, double dtHr) {
        return dtHr / 2.0 + lagTime(tcHr);
    }

    /**
     * {@code Tb = 2.67·Tp}.
     */
    public static double timeBase(double tpHr) {
        return BASE_RATIO * tpHr;
    }

    /**
     * Paso recomendado {@code Δt = 0.133·Tc}, nunca menor que 5 min (15 min para las
     * tormentas SCS de 24 h).
     *
     * @param stormType Tormenta prevista; {@code null} aplica el mínimo general.
     * @return Paso en horas.
     */
    public static double recommendedDtHr(double tcHr, StormType stormType) {
        if (tcHr <= 0) {
            throw new IllegalArgumentException("Tc debe ser > 0 (recibido " + tcHr + ")");
        }
        double minimumMin = stormType != null && stormType.isScs() ? SCS_MIN_DT_MIN : DEFAULT_MIN_DT_MIN;
        return Math.max(DT_TO_TC_RATIO * tcHr, minimumMin / 60.0);
    }
}
