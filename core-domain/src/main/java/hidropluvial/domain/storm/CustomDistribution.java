package hidropluvial.domain.storm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Estrategias para repartir en el tiempo una lámina total conocida.
 */
@Getter
@RequiredArgsConstructor
public enum CustomDistribution {

    UNIFORM("uniform"),
    TRIANGULAR("triangular"),
    ALTERNATING_BLOCKS("alternating_blocks"),
    /**
     * Bloques alternantes con el pico en 1/6 de la duración.
     */
    ALTERNATING_BLOCKS_GZ("alternating_blocks_gz"),
    SCS_TYPE_II("scs_type_ii"),
    HUFF_Q1("huff_q1"),
    HUFF_Q2("huff_q2"),
    HUFF_Q3("huff_q3"),
    HUFF_Q4("huff_q4");

    private final String code;

    public static CustomDistribution fromCode(String code) {
        for (CustomDistribution distribution : values()) {
            if (distribution.code.equalsIgnoreCase(code == null ? "" : code.trim())) {
                return distribution;
            }
        }
        throw new IllegalArgumentException("Distribución desconocida: " + code);
    }
}
