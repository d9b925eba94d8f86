package hidropluvial.physics.runoff;

import hidropluvial.domain.basin.SoilGroup;

import java.util.Objects;

/**
 * Fórmula racional de caudal pico y tasas mínimas de infiltración por grupo de suelo.
 */
public final class RationalMethod {

    /**
     * Constante de unidades para C·i[mm/h]·A[ha] → m³/s.
     */
    public static final double UNIT_FACTOR = 0.00278;

    private RationalMethod() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * {@code Q = 0.00278 · C · i · A}.
     *
     * @param c             Coeficiente de escorrentía en (0, 1].
     * @param intensityMmHr Intensidad de diseño (mm/h).
     * @param areaHa        Área (ha).
     * @return Caudal pico (m³/s).
     */
    public static double peakFlow(double c, double intensityMmHr, double areaHa) {
        if (c <= 0 || c > 1) {
            throw new IllegalArgumentException("Coeficiente C debe estar entre 0 y 1 (recibido " + c + ")");
        }
        if (intensityMmHr < 0) {
            throw new IllegalArgumentException("Intensidad debe ser >= 0 (recibido " + intensityMmHr + ")");
        }
        if (areaHa <= 0) {
            throw new IllegalArgumentException("Área debe ser > 0 (recibido " + areaHa + ")");
        }
        return UNIT_FACTOR * c * intensityMmHr * areaHa;
    }

    /**
     * Tasa mínima de infiltración (mm/h): A 2.4, B/C/D 1.2.
     */
    public static double minimumInfiltrationRate(SoilGroup group) {
        Objects.requireNonNull(group, "El grupo de suelo no puede ser nulo.");
        return group == SoilGroup.A ? 2.4 : 1.2;
    }
}
