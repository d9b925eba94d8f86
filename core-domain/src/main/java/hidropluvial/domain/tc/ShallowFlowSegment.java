package hidropluvial.domain.tc;

/**
 * Flujo concentrado superficial (shallow concentrated flow).
 *
 * @param lengthM Longitud en metros.
 * @param slope   Pendiente (m/m).
 * @param surface Tipo de superficie que fija el coeficiente de velocidad k.
 */
public record ShallowFlowSegment(double lengthM, double slope, ShallowSurface surface) implements FlowSegment {

    public ShallowFlowSegment {
        if (lengthM <= 0) {
            throw new IllegalArgumentException("Longitud debe ser > 0");
        }
        if (slope <= 0) {
            throw new IllegalArgumentException("Pendiente debe ser > 0");
        }
        if (surface == null) {
            surface = ShallowSurface.UNPAVED;
        }
    }

    @Override
    public SegmentType type() {
        return SegmentType.SHALLOW;
    }
}
