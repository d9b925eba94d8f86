package hidropluvial.physics.hydrograph;

import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.physics.i.IUnitHydrograph;

/**
 * Hidrograma unitario de Clark: curva tiempo-área en forma de rombo transitada por un
 * embalse lineal de constante R.
 * <pre>
 *     A(t)/A = 1.414·(t/Tc)^1.5            t/Tc ≤ 0.5
 *     A(t)/A = 1 − 1.414·(1 − t/Tc)^1.5    t/Tc > 0.5
 *     O[i] = c1·I[i] + c1·I[i−1] + c0·O[i−1],  c1 = Δt/(2R + Δt), c0 = (2R − Δt)/(2R + Δt)
 * </pre>
 * Sin R explícito se usa {@code R = 2·Tc}. Se corta en {@code Tb = Tc + 5·R}.
 */
public class ClarkUnitHydrograph implements IUnitHydrograph {

    public static final double DEFAULT_STORAGE_TO_TC_RATIO = 2.0;
    private static final double STORAGE_TAIL = 5.0;

    private final Double storageHr;

    public ClarkUnitHydrograph() {
        this(null);
    }

    /**
     * @param storageHr Constante de almacenamiento R (h), o {@code null} para {@code 2·Tc}.
     */
    public ClarkUnitHydrograph(Double storageHr) {
        if (storageHr != null && storageHr <= 0) {
            throw new IllegalArgumentException("Coeficiente de almacenamiento R debe ser > 0 (recibido " + storageHr + ")");
        }
        this.storageHr = storageHr;
    }

    @Override
    public UnitHydrograph build(double areaHa, double tcHr, double dtHr) {
        TriangularUnitHydrograph.validate(areaHa, tcHr, dtHr);
        double r = storageHr != null ? storageHr : DEFAULT_STORAGE_TO_TC_RATIO * tcHr;
        double c1 = dtHr / (2.0 * r + dtHr);
        double c0 = (2.0 * r - dtHr) / (2.0 * r + dtHr);
        double tb = tcHr + STORAGE_TAIL * r;

        int points = (int) Math.ceil(tb / dtHr - 1e-9) + 1;
        double[] time = new double[points];
        double[] inflow = new double[points];
        double areaKm2 = areaHa / 100.0;
        double previousArea = 0.0;
        for (int k = 0; k < points; k++) {
            time[k] = k * dtHr;
            double area = timeArea(Math.min(time[k] / tcHr, 1.0));
            // 1 mm sobre el área incremental, repartido en el intervalo.
            inflow[k] = (area - previousArea) * areaKm2 * 1000.0 / (dtHr * 3600.0);
            previousArea = area;
        }

        double[] outflow = new double[points];
        int peak = 0;
        for (int k = 1; k < points; k++) {
            outflow[k] = c1 * inflow[k] + c1 * inflow[k - 1] + c0 * outflow[k - 1];
            if (outflow[k] > outflow[peak]) {
                peak = k;
            }
        }
        double tp = time[peak];
        double xFactor = tp > 0 ? tb / tp - 1.0 : 0.0;
        return new UnitHydrograph(time, outflow, tp, tb, outflow[peak], xFactor, dtHr);
    }

    @Override
    public String name() {
        return "clark";
    }

    /**
     * Fracción de área acumulada para un tiempo relativo {@code t/Tc} en [0, 1].
     */
    static double timeArea(double tOverTc) {
        double fraction = tOverTc <= 0.5
                ? 1.414 * Math.pow(tOverTc, 1.5)
                : 1.0 - 1.414 * Math.pow(1.0 - tOverTc, 1.5);
        return Math.max(0.0, Math.min(1.0, fraction));
    }
}
