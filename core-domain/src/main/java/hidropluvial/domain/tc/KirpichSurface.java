package hidropluvial.domain.tc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Multiplicador de Kirpich según el tipo de superficie del recorrido.
 */
@Getter
@RequiredArgsConstructor
public enum KirpichSurface {

    NATURAL("natural", 1.0),
    GRASSY("grassy", 2.0),
    CONCRETE("concrete", 0.4),
    CONCRETE_CHANNEL("concrete_channel", 0.2);

    private final String code;
    private final double factor;

    private static final Map<String, KirpichSurface> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(surface -> surface.code, surface -> surface))
    );

    /**
     * Un tipo desconocido equivale a cauce natural (factor 1.0).
     */
    public static KirpichSurface fromCode(String code) {
        if (code == null) return NATURAL;
        return BY_CODE.getOrDefault(code.trim().toLowerCase(), NATURAL);
    }
}
