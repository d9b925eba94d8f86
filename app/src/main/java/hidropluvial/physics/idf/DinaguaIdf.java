package hidropluvial.physics.idf;

import hidropluvial.physics.i.IIdfCurve;
import lombok.extern.slf4j.Slf4j;

/**
 * Curva IDF regional DINAGUA (Uruguay), según Rodríguez Fontal (1980):
 * <pre>
 *     P(d, Tr, A) = P3,10 · Cd(d) · Ct(Tr) · CA(A, d)
 * </pre>
 * donde P3,10 es la lámina máxima de 3 horas y 10 años de período de retorno tomada del
 * mapa de isoyetas. La intensidad se deriva como {@code I = P / d}.
 * <p>
 * Los métodos estáticos trabajan con duraciones en horas, como la formulación original;
 * la vista {@link IIdfCurve} trabaja en minutos como el resto de curvas.
 */
@Slf4j
public class DinaguaIdf implements IIdfCurve {

    private static final double MIN_AREA_DURATION_HR = 0.083; // 5 minutos
    private static final double AREA_REDUCTION_THRESHOLD_KM2 = 1.0;
    private static final double MAX_VALIDATED_AREA_KM2 = 300.0;

    private final double p310Mm;
    private final Double areaKm2;

    /**
     * @param p310Mm  Precipitación P3,10 (mm).
     * @param areaKm2 Área de la cuenca para la reducción por área, o {@code null} para no reducir.
     */
    public DinaguaIdf(double p310Mm, Double areaKm2) {
        if (p310Mm <= 0) {
            throw new IllegalArgumentException("P3,10 debe ser > 0");
        }
        if (areaKm2 != null && areaKm2 <= 0) {
            throw new IllegalArgumentException("Área debe ser > 0");
        }
        if (p310Mm < 50 || p310Mm > 120) {
            log.warn("P3,10={} mm fuera del rango típico de Uruguay (50-120 mm)", p310Mm);
        }
        if (areaKm2 != null && areaKm2 > MAX_VALIDATED_AREA_KM2) {
            log.warn("Área {} km² > 300 km²: verificar con estudios regionales", areaKm2);
        }
        this.p310Mm = p310Mm;
        this.areaKm2 = areaKm2;
    }

    public DinaguaIdf(double p310Mm) {
        this(p310Mm, null);
    }

    @Override
    public double intensity(double durationMin, double returnPeriodYr) {
        IIdfCurve.validateArguments(durationMin, returnPeriodYr);
        double durationHr = durationMin / 60.0;
        return depthMm(p310Mm, returnPeriodYr, durationHr, areaKm2) / durationHr;
    }

    @Override
    public double depth(double durationMin, double returnPeriodYr) {
        IIdfCurve.validateArguments(durationMin, returnPeriodYr);
        return depthMm(p310Mm, returnPeriodYr, durationMin / 60.0, areaKm2);
    }

    @Override
    public String name() {
        return "dinagua";
    }

    public double p310Mm() {
        return p310Mm;
    }

    // --------------------------------------------------------------------------
    // Factores de corrección
    // --------------------------------------------------------------------------

    /**
     * Factor de duración Cd(d) = d·I(d)/P3,10, normalizado para que Cd(3 h) ≈ 1.
     *
     * @param durationHr Duración en horas (> 0).
     */
    public static double durationFactor(double durationHr) {
        if (durationHr <= 0) {
            throw new IllegalArgumentException("Duración debe ser > 0");
        }
        if (durationHr < 3.0) {
            return 0.6208 * durationHr / Math.pow(durationHr + 0.0137, 0.5639);
        }
        return 1.0287 * durationHr / Math.pow(durationHr + 1.0293, 0.8083);
    }

    /**
     * Factor de período de retorno Ct(Tr), normalizado para que Ct(10) ≈ 1.
     *
     * @param returnPeriodYr Período de retorno (>= 2 años).
     */
    public static double returnPeriodFactor(double returnPeriodYr) {
        if (returnPeriodYr < 2) {
            throw new IllegalArgumentException("Período de retorno debe ser >= 2 años (recibido " + returnPeriodYr + ")");
        }
        return 0.5786 - 0.4312 * Math.log10(Math.log(returnPeriodYr / (returnPeriodYr - 1.0)));
    }

    /**
     * Factor de reducción por área CA(A, d). Vale 1 para cuencas de hasta 1 km² y
     * decrece con el área, por lo que la lámina nunca crece al aumentar la cuenca.
     * Las áreas mayores de 300 km² quedan fuera del rango calibrado.
     */
    public static double areaFactor(double areaKm2, double durationHr) {
        if (areaKm2 <= AREA_REDUCTION_THRESHOLD_KM2) {
            return 1.0;
        }
        double d = Math.max(durationHr, MIN_AREA_DURATION_HR);
        double ca = 1.0 - (0.3549 * Math.pow(d, -0.4272)) * (1.0 - Math.exp(-0.005792 * areaKm2));
        return Math.min(ca, 1.0);
    }

    // --------------------------------------------------------------------------
    // Lámina e intensidad
    // --------------------------------------------------------------------------

    /**
     * Lámina acumulada P(d, Tr, A) en mm.
     *
     * @param areaKm2 Área de la cuenca, o {@code null} para omitir la reducción por área.
     */
    public static double depthMm(double p310Mm, double returnPeriodYr, double durationHr, Double areaKm2) {
        return calculate(p310Mm, returnPeriodYr, durationHr, areaKm2).depthMm();
    }

    /**
     * Calcula lámina, intensidad y los tres factores de corrección.
     */
    public static DinaguaIdfResult calculate(double p310Mm, double returnPeriodYr, double durationHr, Double areaKm2) {
        if (p310Mm <= 0) {
            throw new IllegalArgumentException("P3,10 debe ser > 0");
        }
        if (durationHr <= 0) {
            throw new IllegalArgumentException("Duración debe ser > 0");
        }

        double cd = durationFactor(durationHr);
        double ct = returnPeriodFactor(returnPeriodYr);
        double ca = (areaKm2 != null && areaKm2 > 0) ? areaFactor(areaKm2, durationHr) : 1.0;

        double depth = p310Mm * cd * ct * ca;
        return new DinaguaIdfResult(depth, depth / durationHr, cd, ct, ca,
                p310Mm, returnPeriodYr, durationHr, areaKm2);
    }
}
