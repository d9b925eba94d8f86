package hidropluvial.physics.storm;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.MissingParameterException;
import hidropluvial.domain.storm.CustomDistribution;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.io.ReferenceCurveRegistry;
import hidropluvial.physics.i.IHyetographGenerator;
import hidropluvial.physics.idf.DinaguaIdf;
import hidropluvial.physics.idf.ShermanIdf;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Despachador de tormentas de diseño: decide duración y paso con
 * {@link StormDurationPolicy} y delega en el generador de cada código.
 * <p>
 * Las láminas totales de SCS, Huff y bimodal salen de la IDF DINAGUA para la
 * duración de la tormenta.
 */
@Slf4j
public class HyetographFactory implements IHyetographGenerator {

    private static final double GZ_PEAK_POSITION = 1.0 / 6.0;
    private static final double CENTERED_PEAK_POSITION = 0.5;

    private final ReferenceCurveRegistry registry;

    public HyetographFactory(ReferenceCurveRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "El registro de curvas no puede ser nulo.");
    }

    @Override
    public HyetographResult generate(StormType type, StormRequest request) {
        Objects.requireNonNull(type, "El tipo de tormenta no puede ser nulo.");
        Objects.requireNonNull(request, "La solicitud de tormenta no puede ser nula.");

        AnalysisConfig config = request.getConfig();
        double durationHr = StormDurationPolicy.durationHr(type, request.getTcHr(), config);
        double dtMin = StormDurationPolicy.effectiveDtMin(type, config.getDtMin());
        double p310 = request.getP310Mm();
        double tr = request.getReturnPeriodYr();
        Double area = request.getAreaKm2();

        log.debug("Tormenta {} Tr={} D={} h dt={} min", type.getCode(), tr, durationHr, dtMin);

        switch (type) {
            case GZ -> {
                return AlternatingBlocksGenerator.dinagua(p310, tr, durationHr, dtMin, area, GZ_PEAK_POSITION);
            }
            case BLOCKS, BLOCKS_24 -> {
                return AlternatingBlocksGenerator.dinagua(p310, tr, durationHr, dtMin, area, CENTERED_PEAK_POSITION);
            }
            case BIMODAL -> {
                return BimodalStormGenerator.dinagua(p310, tr, durationHr, dtMin, area, BimodalShape.fromConfig(config));
            }
            case CHICAGO -> {
                if (config.getShermanCoefficients() == null) {
                    throw new MissingParameterException("Chicago", List.of("sherman_coefficients"));
                }
                double total = new ShermanIdf(config.getShermanCoefficients()).depth(durationHr * 60.0, tr);
                return ChicagoStormGenerator.generate(total, durationHr, dtMin,
                        config.getShermanCoefficients(), tr, config.getChicagoAdvancement());
            }
            case SCS_I, SCS_IA, SCS_II, SCS_III -> {
                double total = DinaguaIdf.depthMm(p310, tr, durationHr, area);
                return ScsDistributionGenerator.generate(registry, type, total, durationHr, dtMin);
            }
            case HUFF_Q1, HUFF_Q2, HUFF_Q3, HUFF_Q4 -> {
                double total = DinaguaIdf.depthMm(p310, tr, durationHr, area);
                return HuffCurveGenerator.generate(registry, total, durationHr, dtMin,
                        type.huffQuartile(), config.getHuffProbability());
            }
            case CUSTOM -> {
                return custom(config, p310, tr, durationHr, dtMin, area);
            }
            default -> throw new IllegalArgumentException("Código de tormenta desconocido: " + type.getCode());
        }
    }

    /**
     * Prioridad: evento observado, luego lámina conocida con su distribución, y si no hay
     * ninguna de las dos, bloques alternantes DINAGUA centrados.
     */
    private HyetographResult custom(AnalysisConfig config, double p310, double tr, double durationHr,
                                    double dtMin, Double area) {
        if (config.hasCustomEvent()) {
            return CustomHyetographGenerator.fromEvent(config.getCustomEventTimeMin(), config.getCustomEventDepthMm());
        }
        if (config.getCustomDepthMm() != null && config.getCustomDepthMm() > 0) {
            CustomDistribution distribution = config.getCustomDistribution() != null
                    ? config.getCustomDistribution()
                    : CustomDistribution.ALTERNATING_BLOCKS;
            return CustomHyetographGenerator.distribute(registry, config.getCustomDepthMm(), durationHr, dtMin, distribution);
        }
        return AlternatingBlocksGenerator.dinagua(p310, tr, durationHr, dtMin, area, CENTERED_PEAK_POSITION);
    }
}
