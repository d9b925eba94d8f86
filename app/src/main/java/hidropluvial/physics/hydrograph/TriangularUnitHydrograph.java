package hidropluvial.physics.hydrograph;

import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.physics.i.IUnitHydrograph;

/**
 * Hidrograma unitario triangular con factor morfológico X (Porto):
 * <pre>
 *     Tp = Δt/2 + 0.6·Tc
 *     qp = 0.278 · A[km²] / Tp · 2/(1 + X)
 *     Tb = (1 + X)·Tp
 * </pre>
 * X = 1 corresponde a cuencas urbanas internas y valores mayores alargan la recesión
 * (1.67 reproduce la forma SCS, 5.5 una cuenca rural de baja pendiente).
 */
public class TriangularUnitHydrograph implements IUnitHydrograph {

    public static final double MIN_X_FACTOR = 1.0;

    private final double xFactor;

    public TriangularUnitHydrograph(double xFactor) {
        if (xFactor < MIN_X_FACTOR) {
            throw new IllegalArgumentException("Factor X debe ser >= 1.0 (recibido " + xFactor + ")");
        }
        this.xFactor = xFactor;
    }

    @Override
    public UnitHydrograph build(double areaHa, double tcHr, double dtHr) {
        validate(areaHa, tcHr, dtHr);
        double tp = ScsTiming.timeToPeak(tcHr, dtHr);
        double tb = (1.0 + xFactor) * tp;
        double qp = 0.278 * (areaHa / 100.0) / tp * 2.0 / (1.0 + xFactor);
        return sampleTriangle(qp, tp, tb, xFactor, dtHr);
    }

    @Override
    public String name() {
        return "triangular_x";
    }

    public double xFactor() {
        return xFactor;
    }

    static void validate(double areaHa, double tcHr, double dtHr) {
        if (areaHa <= 0) {
            throw new IllegalArgumentException("Área debe ser > 0");
        }
        if (tcHr <= 0) {
            throw new IllegalArgumentException("Tc debe ser > 0");
        }
        if (dtHr <= 0) {
            throw new IllegalArgumentException("dt debe ser > 0");
        }
    }

    /**
     * Muestrea el triángulo (0,0)-(Tp,qp)-(Tb,0) en {@code k·Δt}, {@code k = 0..ceil(Tb/Δt)}.
     * La última ordenada cae en o después de Tb y vale 0.
     */
    static UnitHydrograph sampleTriangle(double qp, double tp, double tb, double xFactor, double dtHr) {
        int points = (int) Math.ceil(tb / dtHr - 1e-9) + 1;
        double recession = tb - tp;
        double[] time = new double[points];
        double[] flow = new double[points];
        for (int k = 0; k < points; k++) {
            double t = k * dtHr;
            time[k] = t;
            double q = t <= tp ? qp * t / tp : qp * (tb - t) / recession;
            flow[k] = Math.max(q, 0.0);
        }
        return new UnitHydrograph(time, flow, tp, tb, qp, xFactor, dtHr);
    }
}
