package hidropluvial.domain.tc;

/**
 * Tramo del recorrido del flujo en el método de velocidades NRCS.
 * <p>
 * Cada implementación declara su {@link SegmentType}; el calculador despacha
 * sobre esa etiqueta.
 */
public interface FlowSegment {

    SegmentType type();

    /**
     * @return Longitud del tramo en metros.
     */
    double lengthM();
}
