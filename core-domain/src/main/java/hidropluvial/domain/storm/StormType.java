package hidropluvial.domain.storm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Códigos de tormenta de diseño que el orquestador puede seleccionar.
 */
@Getter
@RequiredArgsConstructor
public enum StormType {

    GZ("gz", "Bloques alternantes DINAGUA (pico 1/6)"),
    BLOCKS("blocks", "Bloques alternantes DINAGUA"),
    BLOCKS_24("blocks24", "Bloques alternantes DINAGUA 24 h"),
    BIMODAL("bimodal", "Bimodal DINAGUA"),
    CHICAGO("chicago", "Tormenta Chicago"),
    SCS_I("scs_i", "SCS 24 h Tipo I"),
    SCS_IA("scs_ia", "SCS 24 h Tipo IA"),
    SCS_II("scs_ii", "SCS 24 h Tipo II"),
    SCS_III("scs_iii", "SCS 24 h Tipo III"),
    HUFF_Q1("huff_q1", "Huff cuartil 1"),
    HUFF_Q2("huff_q2", "Huff cuartil 2"),
    HUFF_Q3("huff_q3", "Huff cuartil 3"),
    HUFF_Q4("huff_q4", "Huff cuartil 4"),
    CUSTOM("custom", "Personalizada");

    private final String code;
    private final String label;

    private static final Map<String, StormType> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(type -> type.code, type -> type))
    );

    /**
     * @throws IllegalArgumentException si el código de tormenta no existe.
     */
    public static StormType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Código de tormenta desconocido: null");
        }
        StormType type = BY_CODE.get(code.trim().toLowerCase());
        if (type == null) {
            throw new IllegalArgumentException("Código de tormenta desconocido: " + code);
        }
        return type;
    }

    public boolean isScs() {
        return this == SCS_I || this == SCS_IA || this == SCS_II || this == SCS_III;
    }

    public boolean isHuff() {
        return this == HUFF_Q1 || this == HUFF_Q2 || this == HUFF_Q3 || this == HUFF_Q4;
    }

    /**
     * @return Cuartil Huff (1-4).
     * @throws IllegalStateException si el tipo no es una curva Huff.
     */
    public int huffQuartile() {
        if (!isHuff()) {
            throw new IllegalStateException(code + " no es una curva Huff");
        }
        return Character.getNumericValue(code.charAt(code.length() - 1));
    }
}
