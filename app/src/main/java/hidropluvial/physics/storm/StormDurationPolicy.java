package hidropluvial.physics.storm;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.storm.StormType;

import java.util.Objects;

/**
 * Duración y paso de tiempo con que se genera cada tipo de tormenta de diseño.
 */
public final class StormDurationPolicy {

    public static final double GZ_DURATION_HR = 6.0;
    public static final double DAILY_DURATION_HR = 24.0;
    public static final double DAILY_MIN_DT_MIN = 10.0;

    private StormDurationPolicy() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * <ul>
     *     <li>gz: 6 h.</li>
     *     <li>bimodal y custom: la duración configurada.</li>
     *     <li>blocks24 y SCS: 24 h.</li>
     *     <li>Huff: max(2·Tc, 2 h).</li>
     *     <li>Resto: max(Tc, 1 h).</li>
     * </ul>
     */
    public static double durationHr(StormType type, double tcHr, AnalysisConfig config) {
        Objects.requireNonNull(type, "El tipo de tormenta no puede ser nulo.");
        if (type == StormType.GZ) {
            return GZ_DURATION_HR;
        }
        if (type == StormType.BIMODAL) {
            return config.getBimodalDurationHr();
        }
        if (type == StormType.CUSTOM) {
            return config.getCustomDurationHr();
        }
        if (type == StormType.BLOCKS_24 || type.isScs()) {
            return DAILY_DURATION_HR;
        }
        if (type.isHuff()) {
            return Math.max(2.0 * tcHr, 2.0);
        }
        return Math.max(tcHr, 1.0);
    }

    /**
     * Las tormentas de 24 h no bajan de 10 min de paso.
     */
    public static double effectiveDtMin(StormType type, double dtMin) {
        if (type == StormType.BLOCKS_24 || type.isScs()) {
            return Math.max(dtMin, DAILY_MIN_DT_MIN);
        }
        return dtMin;
    }
}
