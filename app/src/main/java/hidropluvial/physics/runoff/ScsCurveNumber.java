package hidropluvial.physics.runoff;

/**
 * Relaciones del método de la Curva Número (SCS-CN) en su forma métrica:
 * <pre>
 *     S  = 25400/CN − 254          [mm]
 *     Ia = λ·S
 *     Q  = (P − Ia)² / (P − Ia + S)   si P > Ia, si no 0
 * </pre>
 * <p>
 * Stateless y Thread-Safe.
 */
public final class ScsCurveNumber {

    public static final double DEFAULT_LAMBDA = 0.2;

    private ScsCurveNumber() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Retención potencial máxima S (mm).
     */
    public static double retention(double cn) {
        if (cn <= 0 || cn > 100) {
            throw new IllegalArgumentException("CN debe estar en (0, 100] (recibido " + cn + ")");
        }
        return 25400.0 / cn - 254.0;
    }

    public static double initialAbstraction(double retentionMm, double lambda) {
        if (lambda < 0) {
            throw new IllegalArgumentException("λ debe ser >= 0 (recibido " + lambda + ")");
        }
        return lambda * retentionMm;
    }

    /**
     * Escorrentía acumulada Q (mm) para una lluvia acumulada P.
     */
    public static double runoff(double precipitationMm, double retentionMm, double initialAbstractionMm) {
        if (precipitationMm <= initialAbstractionMm) {
            return 0.0;
        }
        double effective = precipitationMm - initialAbstractionMm;
        return effective * effective / (effective + retentionMm);
    }

    /**
     * Atajo que deriva S e Ia a partir del CN.
     */
    public static double runoffForCn(double precipitationMm, double cn, double lambda) {
        double s = retention(cn);
        return runoff(precipitationMm, s, initialAbstraction(s, lambda));
    }
}
