package hidropluvial.domain.tc;

/**
 * Flujo en canal, velocidad por Manning.
 *
 * @param lengthM          Longitud en metros.
 * @param manningN         Coeficiente de Manning del canal.
 * @param slope            Pendiente (m/m).
 * @param hydraulicRadiusM Radio hidráulico en metros.
 */
public record ChannelFlowSegment(double lengthM, double manningN, double slope, double hydraulicRadiusM)
        implements FlowSegment {

    public ChannelFlowSegment {
        if (lengthM <= 0) {
            throw new IllegalArgumentException("Longitud debe ser > 0");
        }
        if (manningN <= 0) {
            throw new IllegalArgumentException("Coeficiente n debe ser > 0");
        }
        if (slope <= 0) {
            throw new IllegalArgumentException("Pendiente debe ser > 0");
        }
        if (hydraulicRadiusM <= 0) {
            throw new IllegalArgumentException("Radio hidráulico debe ser > 0");
        }
    }

    @Override
    public SegmentType type() {
        return SegmentType.CHANNEL;
    }
}
