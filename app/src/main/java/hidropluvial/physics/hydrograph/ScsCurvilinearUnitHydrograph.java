package hidropluvial.physics.hydrograph;

import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.physics.i.IUnitHydrograph;

import java.util.Objects;

/**
 * Hidrograma unitario curvilíneo (adimensional) SCS.
 * <p>
 * El pico es el del triangular SCS escalado por {@code PRF/484}; la forma se interpola
 * de la tabla adimensional {@code q/qp = f(t/Tp)}, que termina en {@code t/Tp = 5}.
 */
public class ScsCurvilinearUnitHydrograph implements IUnitHydrograph {

    public static final double STANDARD_PEAK_RATE_FACTOR = 484.0;

    private final DimensionlessUnitHydrograph shape;
    private final double peakRateFactor;

    public ScsCurvilinearUnitHydrograph(DimensionlessUnitHydrograph shape) {
        this(shape, STANDARD_PEAK_RATE_FACTOR);
    }

    public ScsCurvilinearUnitHydrograph(DimensionlessUnitHydrograph shape, double peakRateFactor) {
        this.shape = Objects.requireNonNull(shape, "El hidrograma adimensional no puede ser nulo.");
        if (peakRateFactor <= 0) {
            throw new IllegalArgumentException("PRF debe ser > 0 (recibido " + peakRateFactor + ")");
        }
        this.peakRateFactor = peakRateFactor;
    }

    @Override
    public UnitHydrograph build(double areaHa, double tcHr, double dtHr) {
        TriangularUnitHydrograph.validate(areaHa, tcHr, dtHr);
        double tp = ScsTiming.timeToPeak(tcHr, dtHr);
        double qp = peakRateFactor / STANDARD_PEAK_RATE_FACTOR
                * ScsTriangularUnitHydrograph.peakFlow(areaHa / 100.0, 1.0, tp);
        double tb = shape.baseRatio() * tp;

        int points = (int) Math.ceil(tb / dtHr - 1e-9) + 1;
        double[] time = new double[points];
        double[] flow = new double[points];
        for (int k = 0; k < points; k++) {
            time[k] = k * dtHr;
            flow[k] = qp * shape.flowRatioAt(time[k] / tp);
        }
        return new UnitHydrograph(time, flow, tp, tb, qp, tb / tp - 1.0, dtHr);
    }

    @Override
    public String name() {
        return "scs_curvilinear";
    }
}
