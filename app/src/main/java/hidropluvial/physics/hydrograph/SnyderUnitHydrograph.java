package hidropluvial.physics.hydrograph;

import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.physics.i.IUnitHydrograph;

/**
 * Hidrograma unitario sintético de Snyder (1938), en unidades inglesas internamente:
 * <pre>
 *     tp  = Ct·(L·Lc)^0.3            [h, mi]
 *     Qp  = 640·Cp·A/tp              [cfs por pulgada, mi²]
 *     W50 = 770·(Qp/A)^−1.08, W75 = 440·(Qp/A)^−1.08   [h]
 * </pre>
 * Los anchos se reparten 1/3 antes y 2/3 después del pico y la base es {@code tp + 3·W50}.
 * Las ordenadas se devuelven por mm de escorrentía (la forma clásica es por pulgada).
 * El Tc no interviene: el retardo sale de la geometría del cauce.
 */
public class SnyderUnitHydrograph implements IUnitHydrograph {

    public static final double DEFAULT_CT = 2.0;
    public static final double DEFAULT_CP = 0.6;

    private static final double KM_TO_MI = 0.621371;
    private static final double KM2_TO_MI2 = 0.386102;
    private static final double CFS_TO_M3S = 0.0283168;
    private static final double MM_PER_INCH = 25.4;

    private final double lengthKm;
    private final double centroidLengthKm;
    private final double ct;
    private final double cp;

    public SnyderUnitHydrograph(double lengthKm, double centroidLengthKm) {
        this(lengthKm, centroidLengthKm, DEFAULT_CT, DEFAULT_CP);
    }

    /**
     * @param lengthKm         Longitud del cauce principal L (km).
     * @param centroidLengthKm Distancia desde la salida al punto del cauce más cercano al centroide Lc (km).
     * @param ct               Coeficiente de retardo Ct.
     * @param cp               Coeficiente de pico Cp, en (0, 1].
     */
    public SnyderUnitHydrograph(double lengthKm, double centroidLengthKm, double ct, double cp) {
        if (lengthKm <= 0 || centroidLengthKm <= 0) {
            throw new IllegalArgumentException("Las longitudes L y Lc deben ser > 0");
        }
        if (centroidLengthKm > lengthKm) {
            throw new IllegalArgumentException("Lc no puede superar la longitud del cauce");
        }
        if (ct <= 0) {
            throw new IllegalArgumentException("Coeficiente Ct debe ser > 0");
        }
        if (cp <= 0 || cp > 1) {
            throw new IllegalArgumentException("Coeficiente Cp debe estar en (0, 1]");
        }
        this.lengthKm = lengthKm;
        this.centroidLengthKm = centroidLengthKm;
        this.ct = ct;
        this.cp = cp;
    }

    /**
     * Retardo de Snyder (h).
     */
    public double lagTimeHr() {
        return ct * Math.pow(lengthKm * KM_TO_MI * centroidLengthKm * KM_TO_MI, 0.3);
    }

    /**
     * Caudal pico (m³/s) para 1 pulgada de escorrentía.
     */
    public double peakFlowPerInch(double areaKm2) {
        return 640.0 * cp * areaKm2 * KM2_TO_MI2 / lagTimeHr() * CFS_TO_M3S;
    }

    @Override
    public UnitHydrograph build(double areaHa, double tcHr, double dtHr) {
        if (areaHa <= 0) {
            throw new IllegalArgumentException("Área debe ser > 0");
        }
        if (dtHr <= 0) {
            throw new IllegalArgumentException("dt debe ser > 0");
        }
        double areaKm2 = areaHa / 100.0;
        double tp = lagTimeHr();
        double qpInch = peakFlowPerInch(areaKm2);

        double unitPeak = (qpInch / CFS_TO_M3S) / (areaKm2 * KM2_TO_MI2);
        double w50 = 770.0 * Math.pow(unitPeak, -1.08);
        double w75 = 440.0 * Math.pow(unitPeak, -1.08);
        if (w50 / 3.0 >= tp) {
            throw new IllegalArgumentException("Ancho W50 incompatible con el retardo de Snyder (Cp demasiado bajo)");
        }
        double tb = tp + 3.0 * w50;

        double qp = qpInch / MM_PER_INCH;
        double[] keyTime = {0.0, tp - w50 / 3.0, tp - w75 / 3.0, tp, tp + 2.0 * w75 / 3.0, tp + 2.0 * w50 / 3.0, tb};
        double[] keyFlow = {0.0, 0.5 * qp, 0.75 * qp, qp, 0.75 * qp, 0.5 * qp, 0.0};

        int points = (int) Math.ceil(tb / dtHr - 1e-9) + 1;
        double[] time = new double[points];
        double[] flow = new double[points];
        for (int k = 0; k < points; k++) {
            time[k] = k * dtHr;
            flow[k] = interpolate(keyTime, keyFlow, time[k]);
        }
        return new UnitHydrograph(time, flow, tp, tb, qp, tb / tp - 1.0, dtHr);
    }

    @Override
    public String name() {
        return "snyder";
    }

    private static double interpolate(double[] x, double[] y, double at) {
        if (at >= x[x.length - 1]) {
            return 0.0;
        }
        int hi = 1;
        while (x[hi] < at) {
            hi++;
        }
        int lo = hi - 1;
        return Math.max(0.0, y[lo] + (y[hi] - y[lo]) * (at - x[lo]) / (x[hi] - x[lo]));
    }
}
