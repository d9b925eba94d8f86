package hidropluvial.domain.tc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Coeficientes de Manning para flujo laminar (TR-55, tabla 3-1).
 */
@Getter
@RequiredArgsConstructor
public enum SheetFlowRoughness {

    SMOOTH("Superficie lisa (concreto, asfalto, grava, suelo desnudo)", 0.011),
    FALLOW("Barbecho sin residuos", 0.05),
    SHORT_GRASS("Pasto corto de pradera", 0.15),
    DENSE_GRASS("Pasto denso", 0.24),
    LIGHT_WOODS("Bosque ralo", 0.40),
    DENSE_WOODS("Bosque denso", 0.80);

    private final String description;
    private final double manningN;
}
