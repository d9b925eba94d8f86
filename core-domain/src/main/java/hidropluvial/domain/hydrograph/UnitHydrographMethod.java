package hidropluvial.domain.hydrograph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Hidrogramas unitarios sintéticos disponibles.
 */
@Getter
@RequiredArgsConstructor
public enum UnitHydrographMethod {

    TRIANGULAR_X("triangular_x"),
    SCS_TRIANGULAR("scs_triangular"),
    SCS_CURVILINEAR("scs_curvilinear"),
    GAMMA("gamma"),
    CLARK("clark"),
    SNYDER("snyder");

    private final String code;

    public static UnitHydrographMethod fromCode(String code) {
        for (UnitHydrographMethod method : values()) {
            if (method.code.equalsIgnoreCase(code == null ? "" : code.trim())) {
                return method;
            }
        }
        throw new IllegalArgumentException("Hidrograma unitario desconocido: " + code);
    }
}
