package hidropluvial.physics.tc;

import hidropluvial.physics.i.IIdfCurve;
import lombok.extern.slf4j.Slf4j;

/**
 * Tiempo de concentración por onda cinemática:
 * <pre>
 *     tc = 6.99 · (n·L)^0.6 / (i^0.4 · S^0.3)   [min, m, mm/h]
 * </pre>
 * Como la intensidad depende del propio Tc, se resuelve como punto fijo. Sin curva IDF
 * la intensidad queda fija y el bucle converge en la segunda iteración; con curva,
 * en cada paso se relee la intensidad a la duración igual al Tc vigente.
 * <p>
 * Si no converge se devuelve la última estimación.
 */
@Slf4j
public final class KinematicWaveSolver {

    public static final int MAX_ITERATIONS = 20;
    public static final double TOLERANCE_HR = 0.01;

    private KinematicWaveSolver() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Versión con intensidad constante.
     *
     * @param lengthM       Longitud del flujo (m).
     * @param manningN      Coeficiente de Manning.
     * @param slope         Pendiente (m/m).
     * @param intensityMmHr Intensidad de lluvia (mm/h).
     * @return Tc en horas.
     */
    public static double solve(double lengthM, double manningN, double slope, double intensityMmHr) {
        return solve(lengthM, manningN, slope, intensityMmHr, null, 0, MAX_ITERATIONS, TOLERANCE_HR);
    }

    /**
     * Versión acoplada a una curva IDF: la intensidad inicial es la semilla y se actualiza
     * en cada iteración con {@code idf.intensity(tc, Tr)}.
     */
    public static double solve(double lengthM, double manningN, double slope, double initialIntensityMmHr,
                               IIdfCurve idf, double returnPeriodYr) {
        return solve(lengthM, manningN, slope, initialIntensityMmHr, idf, returnPeriodYr, MAX_ITERATIONS, TOLERANCE_HR);
    }

    /**
     * Versión primitiva con todos los parámetros de ajuste.
     *
     * @param idf           Curva para actualizar la intensidad; {@code null} la mantiene fija.
     * @param maxIterations Máximo de iteraciones (>= 1).
     * @param toleranceHr   Diferencia entre iteraciones que se considera convergida (h).
     */
    public static double solve(double lengthM, double manningN, double slope, double initialIntensityMmHr,
                               IIdfCurve idf, double returnPeriodYr, int maxIterations, double toleranceHr) {
        EmpiricalTcSolver.requirePositive(lengthM, "Longitud");
        EmpiricalTcSolver.requirePositive(manningN, "Coeficiente n");
        EmpiricalTcSolver.requirePositive(slope, "Pendiente");
        EmpiricalTcSolver.requirePositive(initialIntensityMmHr, "Intensidad");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("El número de iteraciones debe ser >= 1");
        }

        final double geometricTerm = 6.99 * Math.pow(manningN * lengthM, 0.6) / Math.pow(slope, 0.3);

        double intensity = initialIntensityMmHr;
        double tcPrev = 0.0;
        double tcHr = 0.0;

        for (int k = 0; k < maxIterations; k++) {
            tcHr = geometricTerm / Math.pow(intensity, 0.4) / 60.0;

            if (Math.abs(tcHr - tcPrev) < toleranceHr) {
                return tcHr;
            }
            tcPrev = tcHr;

            if (idf != null) {
                intensity = idf.intensity(tcHr * 60.0, returnPeriodYr);
            }
        }

        log.warn("Onda cinemática sin converger tras {} iteraciones; se usa Tc={} h", maxIterations, tcHr);
        return tcHr;
    }
}
