package hidropluvial.domain.hydrograph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Transformaciones lluvia-escorrentía disponibles. Son mutuamente excluyentes dentro de un análisis.
 */
@Getter
@RequiredArgsConstructor
public enum RunoffMethod {

    RATIONAL("racional"),
    SCS_CN("scs-cn");

    private final String code;

    public static RunoffMethod fromCode(String code) {
        for (RunoffMethod method : values()) {
            if (method.code.equalsIgnoreCase(code == null ? "" : code.trim())) {
                return method;
            }
        }
        throw new IllegalArgumentException("Método de escorrentía desconocido: " + code);
    }
}
