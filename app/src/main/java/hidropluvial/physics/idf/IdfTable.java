package hidropluvial.physics.idf;

import hidropluvial.physics.i.IIdfCurve;

import java.util.Objects;

/**
 * Tabla completa de intensidades y láminas de una curva IDF.
 * Filas: duraciones; columnas: períodos de retorno.
 *
 * @param method          Curva de origen.
 * @param durationsMin    Duraciones evaluadas (min).
 * @param returnPeriods   Períodos de retorno evaluados (años).
 * @param intensityMmHr   {@code intensity[duración][Tr]} (mm/h).
 * @param depthMm         {@code depth[duración][Tr]} (mm).
 */
public record IdfTable(
        String method,
        double[] durationsMin,
        int[] returnPeriods,
        double[][] intensityMmHr,
        double[][] depthMm
) {

    public static final double[] STANDARD_DURATIONS_MIN = {5, 10, 15, 20, 30, 45, 60, 90, 120, 180, 240, 360, 720, 1440};
    public static final int[] STANDARD_RETURN_PERIODS = {2, 5, 10, 25, 50, 100};

    /**
     * Evalúa la curva en las duraciones y períodos de retorno estándar.
     */
    public static IdfTable of(IIdfCurve curve) {
        return of(curve, STANDARD_DURATIONS_MIN, STANDARD_RETURN_PERIODS);
    }

    public static IdfTable of(IIdfCurve curve, double[] durationsMin, int[] returnPeriods) {
        Objects.requireNonNull(curve, "La curva IDF no puede ser nula.");
        double[][] intensity = new double[durationsMin.length][returnPeriods.length];
        double[][] depth = new double[durationsMin.length][returnPeriods.length];
        for (int i = 0; i < durationsMin.length; i++) {
            for (int j = 0; j < returnPeriods.length; j++) {
                intensity[i][j] = curve.intensity(durationsMin[i], returnPeriods[j]);
                depth[i][j] = curve.depth(durationsMin[i], returnPeriods[j]);
            }
        }
        return new IdfTable(curve.name(), durationsMin.clone(), returnPeriods.clone(), intensity, depth);
    }
}
