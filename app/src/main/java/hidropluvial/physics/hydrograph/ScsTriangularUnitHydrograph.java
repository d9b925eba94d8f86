package hidropluvial.physics.hydrograph;

import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.physics.i.IUnitHydrograph;

/**
 * Hidrograma unitario triangular SCS: {@code Tb = 2.67·Tp} y
 * {@code qp = 0.208·A[km²]/Tp} por mm de escorrentía.
 */
public class ScsTriangularUnitHydrograph implements IUnitHydrograph {

    public static final double PEAK_RATE_COEFFICIENT = 0.208;
    public static final double EQUIVALENT_X_FACTOR = 1.67;

    @Override
    public UnitHydrograph build(double areaHa, double tcHr, double dtHr) {
        TriangularUnitHydrograph.validate(areaHa, tcHr, dtHr);
        double tp = ScsTiming.timeToPeak(tcHr, dtHr);
        double tb = ScsTiming.timeBase(tp);
        double qp = peakFlow(areaHa / 100.0, 1.0, tp);
        return TriangularUnitHydrograph.sampleTriangle(qp, tp, tb, EQUIVALENT_X_FACTOR, dtHr);
    }

    @Override
    public String name() {
        return "scs_triangular";
    }

    /**
     * Caudal pico (m³/s) para una lámina de escorrentía dada.
     */
    public static double peakFlow(double areaKm2, double runoffMm, double tpHr) {
        if (tpHr <= 0) {
            throw new IllegalArgumentException("Tp debe ser > 0");
        }
        return PEAK_RATE_COEFFICIENT * areaKm2 * runoffMm / tpHr;
    }
}
