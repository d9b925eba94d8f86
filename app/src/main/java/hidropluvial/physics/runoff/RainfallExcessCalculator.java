package hidropluvial.physics.runoff;

import hidropluvial.domain.basin.AntecedentMoisture;
import hidropluvial.domain.hydrograph.ExcessOutcome;
import hidropluvial.domain.hydrograph.ExcessSeries;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.physics.coefficients.CurveNumberAdjuster;

import java.util.Objects;

/**
 * Transforma un hietograma en lluvia efectiva por intervalo.
 * <p>
 * Si falta el dato que el método necesita (C o CN) el resultado es
 * {@link ExcessOutcome#unavailable}, nunca una serie de ceros.
 */
public final class RainfallExcessCalculator {

    private RainfallExcessCalculator() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    public static ExcessOutcome compute(RunoffMethod method, HyetographResult storm, Double c, Double cnII,
                                        AntecedentMoisture amc, double lambda) {
        Objects.requireNonNull(method, "El método de escorrentía no puede ser nulo.");
        return switch (method) {
            case RATIONAL -> rational(storm, c);
            case SCS_CN -> scs(storm, cnII, amc, lambda);
        };
    }

    /**
     * {@code exceso[i] = C · lámina[i]}.
     */
    public static ExcessOutcome rational(HyetographResult storm, Double c) {
        Objects.requireNonNull(storm, "El hietograma no puede ser nulo.");
        if (c == null) {
            return ExcessOutcome.unavailable(RunoffMethod.RATIONAL, "la cuenca no tiene coeficiente C");
        }
        if (c <= 0 || c > 1) {
            throw new IllegalArgumentException("Coeficiente C debe estar entre 0 y 1 (recibido " + c + ")");
        }
        double[] depths = storm.depthMm();
        double[] excess = new double[depths.length];
        double total = 0.0;
        for (int i = 0; i < depths.length; i++) {
            excess[i] = c * depths[i];
            total += excess[i];
        }
        return ExcessOutcome.computed(ExcessSeries.rational(excess, total, c));
    }

    /**
     * Exceso SCS-CN: se ajusta el CN por AMC, se aplica la ecuación a la lámina acumulada
     * y se toman diferencias sucesivas.
     */
    public static ExcessOutcome scs(HyetographResult storm, Double cnII, AntecedentMoisture amc, double lambda) {
        Objects.requireNonNull(storm, "El hietograma no puede ser nulo.");
        if (cnII == null) {
            return ExcessOutcome.unavailable(RunoffMethod.SCS_CN, "la cuenca no tiene Curva Número");
        }
        double cn = CurveNumberAdjuster.adjustCnForAmc(cnII, amc == null ? AntecedentMoisture.AVERAGE : amc);
        double s = ScsCurveNumber.retention(cn);
        double ia = ScsCurveNumber.initialAbstraction(s, lambda);

        double[] cumulative = storm.cumulativeMm();
        double[] excess = new double[cumulative.length];
        double previous = 0.0;
        for (int i = 0; i < cumulative.length; i++) {
            double q = ScsCurveNumber.runoff(cumulative[i], s, ia);
            excess[i] = Math.max(q - previous, 0.0);
            previous = q;
        }
        return ExcessOutcome.computed(ExcessSeries.scs(excess, previous, cn, s, ia));
    }
}
