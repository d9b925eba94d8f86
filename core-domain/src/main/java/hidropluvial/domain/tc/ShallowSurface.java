package hidropluvial.domain.tc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Superficies del flujo concentrado superficial y su coeficiente k (m/s) en V = k·√S.
 */
@Getter
@RequiredArgsConstructor
public enum ShallowSurface {

    PAVED("paved", 6.196),
    UNPAVED("unpaved", 4.918),
    GRASSED("grassed", 4.572),
    SHORT_GRASS("short_grass", 2.134);

    private final String code;
    private final double velocityCoefficient;

    private static final Map<String, ShallowSurface> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(surface -> surface.code, surface -> surface))
    );

    /**
     * Superficie desconocida o nula: se asume {@link #UNPAVED}.
     */
    public static ShallowSurface fromCode(String code) {
        if (code == null) return UNPAVED;
        return BY_CODE.getOrDefault(code.trim().toLowerCase(), UNPAVED);
    }
}
