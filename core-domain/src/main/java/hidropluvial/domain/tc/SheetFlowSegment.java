package hidropluvial.domain.tc;

/**
 * Flujo laminar (sheet flow). TR-55 limita su longitud a 100 m.
 *
 * @param lengthM  Longitud en metros, en (0, 100].
 * @param manningN Coeficiente de Manning para flujo laminar.
 * @param slope    Pendiente (m/m).
 * @param p2Mm     Lluvia de 2 años y 24 h en mm; {@code null} usa el valor por defecto del método.
 */
public record SheetFlowSegment(double lengthM, double manningN, double slope, Double p2Mm) implements FlowSegment {

    public static final double MAX_LENGTH_M = 100.0;

    public SheetFlowSegment {
        if (lengthM <= 0 || lengthM > MAX_LENGTH_M) {
            throw new IllegalArgumentException("Longitud de flujo laminar debe ser 0-100 m (recibido " + lengthM + ")");
        }
        if (manningN <= 0) {
            throw new IllegalArgumentException("Coeficiente n debe ser > 0");
        }
        if (slope <= 0) {
            throw new IllegalArgumentException("Pendiente debe ser > 0");
        }
        if (p2Mm != null && p2Mm <= 0) {
            throw new IllegalArgumentException("P2 debe ser > 0");
        }
    }

    public SheetFlowSegment(double lengthM, double manningN, double slope) {
        this(lengthM, manningN, slope, null);
    }

    @Override
    public SegmentType type() {
        return SegmentType.SHEET;
    }
}
