package hidropluvial.domain.basin;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Grupo hidrológico de suelo del NRCS (A: alta infiltración ... D: muy baja).
 */
@Getter
@RequiredArgsConstructor
public enum SoilGroup {

    A("Arenas profundas, loess, limos agregados"),
    B("Suelos poco profundos de loess, franco arenosos"),
    C("Francos arcillosos, suelos con bajo contenido orgánico"),
    D("Arcillas expansivas, suelos con nivel freático alto");

    private final String description;

    /**
     * Busca el grupo por su letra. Un valor nulo o desconocido devuelve {@link #B},
     * el grupo por defecto de las tablas TR-55.
     */
    public static SoilGroup fromString(String text) {
        if (text == null || text.isBlank()) {
            return B;
        }
        try {
            return valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return B;
        }
    }
}
