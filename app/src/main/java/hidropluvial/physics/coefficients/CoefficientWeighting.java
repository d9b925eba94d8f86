package hidropluvial.physics.coefficients;

import hidropluvial.domain.basin.CoverageItem;
import hidropluvial.domain.basin.RationalTable;
import hidropluvial.domain.basin.TableCoefficient;

import java.util.List;
import java.util.Objects;

/**
 * Ponderación por área de coeficientes C y CN:
 * <pre>
 *     X = Σ(Aᵢ · Xᵢ) / Σ Aᵢ
 * </pre>
 */
public final class CoefficientWeighting {

    private CoefficientWeighting() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param areas        Áreas en cualquier unidad coherente.
     * @param coefficients Coeficientes C de cada área.
     * @throws IllegalArgumentException si las longitudes difieren o el área total es cero.
     */
    public static double weighted(double[] areas, double[] coefficients) {
        Objects.requireNonNull(areas, "Las áreas no pueden ser nulas.");
        Objects.requireNonNull(coefficients, "Los coeficientes no pueden ser nulos.");
        if (areas.length != coefficients.length) {
            throw new IllegalArgumentException("Las listas de areas y coeficientes deben tener igual longitud");
        }
        return weightedSum(areas, coefficients);
    }

    public static double weightedCn(double[] areas, double[] curveNumbers) {
        Objects.requireNonNull(areas, "Las áreas no pueden ser nulas.");
        Objects.requireNonNull(curveNumbers, "Los CN no pueden ser nulos.");
        if (areas.length != curveNumbers.length) {
            throw new IllegalArgumentException("Las listas de areas y CN deben tener igual longitud");
        }
        return weightedSum(areas, curveNumbers);
    }

    /**
     * Pondera los valores guardados en las coberturas.
     */
    public static double weighted(List<CoverageItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("La lista de coberturas no puede estar vacía");
        }
        double[] areas = new double[items.size()];
        double[] values = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            areas[i] = items.get(i).areaHa();
            values[i] = items.get(i).value();
        }
        return weightedSum(areas, values);
    }

    /**
     * Construye el coeficiente ponderado conservando la tabla y las coberturas, de modo
     * que pueda re-derivarse para otro período de retorno.
     */
    public static TableCoefficient fromTable(RationalTable table, List<CoverageItem> items) {
        return new TableCoefficient(table, items, weighted(items));
    }

    private static double weightedSum(double[] areas, double[] values) {
        double totalArea = 0.0;
        double sum = 0.0;
        for (int i = 0; i < areas.length; i++) {
            totalArea += areas[i];
            sum += areas[i] * values[i];
        }
        if (totalArea == 0) {
            throw new IllegalArgumentException("El area total no puede ser cero");
        }
        return sum / totalArea;
    }
}
