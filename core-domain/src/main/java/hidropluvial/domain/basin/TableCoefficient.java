package hidropluvial.domain.basin;

import java.util.List;
import java.util.Objects;

/**
 * Coeficiente C ponderado a partir de coberturas elegidas en una tabla publicada.
 *
 * @param table Tabla de la que provienen los índices.
 * @param items Coberturas de la cuenca (al menos una).
 * @param value Resultado Σ(área·C)/Σárea para el Tr base.
 */
public record TableCoefficient(RationalTable table, List<CoverageItem> items, double value)
        implements WeightedCoefficient {

    /**
     * Holgura admitida al comparar la suma de coberturas con el área de la cuenca (ha).
     */
    public static final double AREA_TOLERANCE_HA = 0.01;

    public TableCoefficient {
        Objects.requireNonNull(table, "La tabla de coeficientes no puede ser nula.");
        Objects.requireNonNull(items, "La lista de coberturas no puede ser nula.");
        if (items.isEmpty()) {
            throw new IllegalArgumentException("La lista de coberturas no puede estar vacía");
        }
        if (value <= 0 || value > 1) {
            throw new IllegalArgumentException("Coeficiente C debe estar entre 0 y 1 (recibido " + value + ")");
        }
        items = List.copyOf(items);
    }

    public double totalAreaHa() {
        return items.stream().mapToDouble(CoverageItem::areaHa).sum();
    }

    @Override
    public boolean supportsExactReturnPeriod() {
        return table.isReturnPeriodDependent() && items.stream().anyMatch(CoverageItem::hasTableIndex);
    }

    @Override
    public void validateAgainstBasin(double basinAreaHa) {
        double total = totalAreaHa();
        if (total > basinAreaHa + AREA_TOLERANCE_HA) {
            throw new IllegalArgumentException(String.format(
                    "Las coberturas suman %.2f ha y exceden el área de la cuenca (%.2f ha)", total, basinAreaHa));
        }
    }
}
