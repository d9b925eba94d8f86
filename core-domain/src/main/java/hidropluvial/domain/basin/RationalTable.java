package hidropluvial.domain.basin;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tablas de coeficiente de escorrentía C disponibles. Los índices guardados en
 * {@link CoverageItem} son posiciones dentro de una de estas tablas.
 */
@Getter
@RequiredArgsConstructor
public enum RationalTable {

    CHOW("chow", "Ven Te Chow - Applied Hydrology", true),
    FHWA("fhwa", "FHWA HEC-22 (Federal Highway Administration)", true),
    URUGUAY("uruguay", "Tabla regional Uruguay", false);

    private final String code;
    private final String source;
    /**
     * Indica si la tabla publica valores de C distintos por período de retorno.
     */
    private final boolean returnPeriodDependent;

    public static RationalTable fromCode(String code) {
        for (RationalTable table : values()) {
            if (table.code.equalsIgnoreCase(code == null ? "" : code.trim())) {
                return table;
            }
        }
        throw new IllegalArgumentException("Tabla '" + code + "' no disponible");
    }
}
