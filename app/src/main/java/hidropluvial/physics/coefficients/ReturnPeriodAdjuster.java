package hidropluvial.physics.coefficients;

import hidropluvial.domain.basin.CoverageItem;
import hidropluvial.domain.basin.RationalTable;
import hidropluvial.domain.basin.TableCoefficient;
import hidropluvial.domain.basin.WeightedCoefficient;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Ajuste del coeficiente C al período de retorno del análisis.
 * <p>
 * Dos caminos:
 * <ul>
 *     <li>Exacto: se vuelve a leer cada cobertura en su tabla para el Tr pedido.</li>
 *     <li>Genérico: se escala el C por la razón entre factores promedio derivados de
 *     la tabla de Ven Te Chow. Es menos preciso y sólo se usa cuando no hay coberturas.</li>
 * </ul>
 */
@Slf4j
public final class ReturnPeriodAdjuster {

    public static final int DEFAULT_BASE_TR = 2;

    private static final double[] FACTOR_TR = {2, 5, 10, 25, 50, 100};
    private static final double[] FACTOR_VALUES = {1.00, 1.17, 1.33, 1.50, 1.66, 1.84};

    private ReturnPeriodAdjuster() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Elige el camino exacto siempre que el coeficiente lo admita.
     *
     * @param coefficient C ponderado de la cuenca.
     * @param tr          Período de retorno objetivo (años).
     * @param baseTr      Período de retorno al que corresponde un C opaco.
     */
    public static double cForTr(WeightedCoefficient coefficient, double tr, double baseTr) {
        Objects.requireNonNull(coefficient, "El coeficiente C no puede ser nulo.");
        if (coefficient.supportsExactReturnPeriod() && coefficient instanceof TableCoefficient table) {
            return recalculateWeightedCForTr(table.items(), tr, table.table());
        }
        return adjustCForTr(coefficient.value(), tr, baseTr);
    }

    public static double cForTr(WeightedCoefficient coefficient, double tr) {
        return cForTr(coefficient, tr, DEFAULT_BASE_TR);
    }

    /**
     * {@code C_tr = C_base · f(tr) / f(base)}, con f interpolado linealmente y C ≤ 1.
     */
    public static double adjustCForTr(double cBase, double tr, double baseTr) {
        if (tr == baseTr) {
            return cBase;
        }
        double adjusted = cBase * (averageFactor(tr) / averageFactor(baseTr));
        return Math.min(adjusted, 1.0);
    }

    public static double adjustCForTr(double cBase, double tr) {
        return adjustCForTr(cBase, tr, DEFAULT_BASE_TR);
    }

    /**
     * Pondera las coberturas leyendo cada una en la tabla para el Tr pedido. Las que no
     * tienen índice conservan su valor guardado.
     */
    public static double recalculateWeightedCForTr(List<CoverageItem> items, double tr, RationalTable table) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("La lista de coberturas no puede estar vacía");
        }
        double[] areas = new double[items.size()];
        double[] values = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            CoverageItem item = items.get(i);
            areas[i] = item.areaHa();
            values[i] = item.hasTableIndex()
                    ? RationalCoefficientTables.cForReturnPeriod(table, item.tableIndex(), tr)
                    : item.value();
        }
        double c = CoefficientWeighting.weighted(areas, values);
        log.debug("C recalculado desde tabla {} para Tr={}: {}", table.getCode(), tr, c);
        return c;
    }

    static double averageFactor(double tr) {
        if (tr <= FACTOR_TR[0]) {
            return FACTOR_VALUES[0];
        }
        int last = FACTOR_TR.length - 1;
        if (tr >= FACTOR_TR[last]) {
            return FACTOR_VALUES[last];
        }
        for (int i = 0; i < last; i++) {
            if (tr <= FACTOR_TR[i + 1]) {
                double t1 = FACTOR_TR[i];
                double t2 = FACTOR_TR[i + 1];
                return FACTOR_VALUES[i] + (FACTOR_VALUES[i + 1] - FACTOR_VALUES[i]) * (tr - t1) / (t2 - t1);
            }
        }
        return 1.0;
    }
}
