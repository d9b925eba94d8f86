package hidropluvial.domain.tc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Etiqueta de los tres tipos de tramo del método de velocidades NRCS (TR-55).
 */
@Getter
@RequiredArgsConstructor
public enum SegmentType {
    SHEET("sheet"),
    SHALLOW("shallow"),
    CHANNEL("channel");

    private final String code;
}
