package hidropluvial.physics.tc;

import hidropluvial.domain.tc.KirpichSurface;

/**
 * Biblioteca estática de fórmulas empíricas de tiempo de concentración.
 * <p>
 * Todas devuelven el Tc en horas, aunque la formulación publicada trabaje en minutos.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class EmpiricalTcSolver {

    private static final double FT_PER_M = 3.28084;
    private static final double MI_PER_KM = 0.621371;

    public static final double DEFAULT_T0_MIN = 5.0;

    private EmpiricalTcSolver() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Kirpich (1940): {@code tc = 0.0195 · L^0.77 · S^-0.385} [min, m, m/m],
     * multiplicado por el factor de la superficie.
     *
     * @param lengthM Longitud del cauce principal (m).
     * @param slope   Pendiente media del cauce (m/m).
     * @param surface Tipo de superficie; nulo equivale a cauce natural.
     * @return Tc en horas.
     */
    public static double kirpich(double lengthM, double slope, KirpichSurface surface) {
        requirePositive(lengthM, "Longitud");
        requirePositive(slope, "Pendiente");
        double factor = surface == null ? 1.0 : surface.getFactor();

        double tcMin = 0.0195 * Math.pow(lengthM, 0.77) * Math.pow(slope, -0.385);
        return tcMin * factor / 60.0;
    }

    public static double kirpich(double lengthM, double slope) {
        return kirpich(lengthM, slope, KirpichSurface.NATURAL);
    }

    /**
     * Témez: {@code tc = 0.3 · (L / S^0.25)^0.76} [h, km, m/m].
     */
    public static double temez(double lengthKm, double slope) {
        requirePositive(lengthKm, "Longitud");
        requirePositive(slope, "Pendiente");
        return 0.3 * Math.pow(lengthKm / Math.pow(slope, 0.25), 0.76);
    }

    /**
     * California Culverts Practice: {@code tc = 60 · (11.9 · L³ / H)^0.385} [min, mi, ft].
     *
     * @param lengthKm       Longitud del cauce (km).
     * @param elevationDropM Desnivel entre extremos (m).
     * @return Tc en horas.
     */
    public static double california(double lengthKm, double elevationDropM) {
        requirePositive(lengthKm, "Longitud");
        requirePositive(elevationDropM, "Diferencia de elevación");
        double lengthMi = lengthKm * MI_PER_KM;
        double dropFt = elevationDropM * FT_PER_M;

        return Math.pow(11.9 * Math.pow(lengthMi, 3) / dropFt, 0.385);
    }

    /**
     * FAA: {@code tc = 1.8 · (1.1 − C) · L^0.5 / S^0.333} [min, ft, %].
     */
    public static double faa(double lengthM, double slopePct, double c) {
        requirePositive(lengthM, "Longitud");
        requirePositive(slopePct, "Pendiente");
        requireRunoffCoefficient(c);
        double lengthFt = lengthM * FT_PER_M;

        double tcMin = 1.8 * (1.1 - c) * Math.sqrt(lengthFt) / Math.pow(slopePct, 0.333);
        return tcMin / 60.0;
    }

    /**
     * Método de los Desbordes (DINAGUA), recomendado para cuencas urbanas de Uruguay:
     * <pre>
     *     Tc = T0 + 6.625 · A^0.3 · P^-0.39 · C^-0.45   [min, ha, %]
     * </pre>
     *
     * @param areaHa   Área de la cuenca (ha).
     * @param slopePct Pendiente media (%).
     * @param c        Coeficiente de escorrentía en (0, 1].
     * @param t0Min    Tiempo de entrada (min), >= 0.
     * @return Tc en horas.
     */
    public static double desbordes(double areaHa, double slopePct, double c, double t0Min) {
        requirePositive(areaHa, "Área");
        requirePositive(slopePct, "Pendiente");
        requireRunoffCoefficient(c);
        if (t0Min < 0) {
            throw new IllegalArgumentException("Tiempo de entrada T0 debe ser >= 0");
        }

        double tcMin = t0Min + 6.625 * Math.pow(areaHa, 0.3) * Math.pow(slopePct, -0.39) * Math.pow(c, -0.45);
        return tcMin / 60.0;
    }

    public static double desbordes(double areaHa, double slopePct, double c) {
        return desbordes(areaHa, slopePct, c, DEFAULT_T0_MIN);
    }

    // --- Validaciones ---

    static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " debe ser > 0 (recibido " + value + ")");
        }
    }

    private static void requireRunoffCoefficient(double c) {
        if (!(c > 0 && c <= 1)) {
            throw new IllegalArgumentException("Coeficiente C debe estar entre 0 y 1 (recibido " + c + ")");
        }
    }
}
