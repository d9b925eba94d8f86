package hidropluvial.physics.hydrograph;

import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.physics.i.IUnitHydrograph;

/**
 * Hidrograma unitario Gamma:
 * <pre>
 *     q/qp = (t/Tp)^m · e^(m·(1 − t/Tp))
 * </pre>
 * El pico se escala con el PRF equivalente {@code 130·m + 3} (m = 3.7 equivale a PRF 484).
 * Se trunca en {@code Tb = 5·Tp}.
 */
public class GammaUnitHydrograph implements IUnitHydrograph {

    public static final double DEFAULT_SHAPE = 3.7;
    private static final double BASE_RATIO = 5.0;

    private final double shape;

    public GammaUnitHydrograph() {
        this(DEFAULT_SHAPE);
    }

    public GammaUnitHydrograph(double shape) {
        if (shape <= 0) {
            throw new IllegalArgumentException("Parámetro de forma m debe ser > 0 (recibido " + shape + ")");
        }
        this.shape = shape;
    }

    @Override
    public UnitHydrograph build(double areaHa, double tcHr, double dtHr) {
        TriangularUnitHydrograph.validate(areaHa, tcHr, dtHr);
        double tp = ScsTiming.timeToPeak(tcHr, dtHr);
        double prf = 130.0 * shape + 3.0;
        double qp = prf / ScsCurvilinearUnitHydrograph.STANDARD_PEAK_RATE_FACTOR
                * ScsTriangularUnitHydrograph.peakFlow(areaHa / 100.0, 1.0, tp);
        double tb = BASE_RATIO * tp;

        int points = (int) Math.ceil(tb / dtHr - 1e-9) + 1;
        double[] time = new double[points];
        double[] flow = new double[points];
        for (int k = 0; k < points; k++) {
            time[k] = k * dtHr;
            double ratio = time[k] / tp;
            flow[k] = ratio <= 0 ? 0.0 : qp * Math.pow(ratio, shape) * Math.exp(shape * (1.0 - ratio));
        }
        return new UnitHydrograph(time, flow, tp, tb, qp, BASE_RATIO - 1.0, dtHr);
    }

    @Override
    public String name() {
        return "gamma";
    }
}
