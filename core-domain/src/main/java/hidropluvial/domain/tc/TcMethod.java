package hidropluvial.domain.tc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Métodos de tiempo de concentración soportados por el motor.
 */
@Getter
@RequiredArgsConstructor
public enum TcMethod {

    KIRPICH("kirpich", "Kirpich"),
    TEMEZ("temez", "Témez"),
    CALIFORNIA("california", "California Culverts"),
    FAA("faa", "FAA"),
    DESBORDES("desbordes", "Desbordes"),
    KINEMATIC("kinematic", "Onda cinemática"),
    NRCS("nrcs", "NRCS (velocidades)");

    private final String code;
    private final String label;

    private static final Map<String, TcMethod> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(method -> method.code, method -> method))
    );

    /**
     * Busca el método por su etiqueta textual (sin distinguir mayúsculas).
     *
     * @throws IllegalArgumentException si la etiqueta no corresponde a ningún método.
     */
    public static TcMethod fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Método desconocido: null");
        }
        TcMethod method = BY_CODE.get(code.trim().toLowerCase());
        if (method == null) {
            throw new IllegalArgumentException("Método desconocido: " + code);
        }
        return method;
    }
}
