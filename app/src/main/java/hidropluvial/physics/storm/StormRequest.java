package hidropluvial.physics.storm;

import hidropluvial.config.AnalysisConfig;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Datos de una tormenta concreta dentro de un análisis: la lluvia de referencia de la
 * cuenca, el período de retorno y el Tc que fija la duración.
 */
@Value
@Builder
@With
public class StormRequest {

    double p310Mm;
    double returnPeriodYr;
    double tcHr;

    /**
     * Área para la reducción areal DINAGUA, o {@code null} para no reducir.
     */
    Double areaKm2;

    @Builder.Default
    AnalysisConfig config = AnalysisConfig.defaults();
}
