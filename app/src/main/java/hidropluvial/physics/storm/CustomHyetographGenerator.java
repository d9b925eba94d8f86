package hidropluvial.physics.storm;

import hidropluvial.domain.storm.CustomDistribution;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.factory.HyetographResultFactory;
import hidropluvial.io.ReferenceCurveRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Tormentas personalizadas: una lámina total conocida repartida con una distribución
 * elegida, o un evento observado tal cual.
 */
public final class CustomHyetographGenerator {

    /**
     * Exponente de la relación lámina-duración sintética P(d) = P·(d/D)^0.6.
     */
    private static final double SYNTHETIC_DEPTH_EXPONENT = 0.6;

    private static final double GZ_PEAK_POSITION = 1.0 / 6.0;

    private CustomHyetographGenerator() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Reparte {@code totalDepthMm} en la duración. El método resultante se etiqueta
     * {@code custom_<distribución>}.
     */
    public static HyetographResult distribute(ReferenceCurveRegistry registry, double totalDepthMm, double durationHr,
                                              double dtMin, CustomDistribution distribution) {
        Objects.requireNonNull(distribution, "La distribución no puede ser nula.");
        if (totalDepthMm <= 0) {
            throw new IllegalArgumentException("Lámina total debe ser > 0");
        }
        int n = HyetographResultFactory.intervalCount(durationHr, dtMin);
        double[] depths;

        switch (distribution) {
            case UNIFORM -> {
                depths = new double[n];
                Arrays.fill(depths, totalDepthMm / n);
            }
            case TRIANGULAR -> depths = triangular(totalDepthMm, n);
            case ALTERNATING_BLOCKS -> depths = syntheticBlocks(totalDepthMm, n, 0.5);
            case ALTERNATING_BLOCKS_GZ -> depths = syntheticBlocks(totalDepthMm, n, GZ_PEAK_POSITION);
            case SCS_TYPE_II -> {
                return ScsDistributionGenerator.generate(registry, StormType.SCS_II, totalDepthMm, durationHr, dtMin)
                        .relabel("custom_scs_type_ii");
            }
            case HUFF_Q1, HUFF_Q2, HUFF_Q3, HUFF_Q4 -> {
                int quartile = distribution.ordinal() - CustomDistribution.HUFF_Q1.ordinal() + 1;
                return HuffCurveGenerator.generate(registry, totalDepthMm, durationHr, dtMin,
                                quartile, HuffCurveGenerator.DEFAULT_PROBABILITY)
                        .relabel("custom_huff_q" + quartile);
            }
            default -> throw new IllegalArgumentException("Distribución desconocida: " + distribution.getCode());
        }

        String label = distribution == CustomDistribution.ALTERNATING_BLOCKS_GZ
                ? CustomDistribution.ALTERNATING_BLOCKS.getCode()
                : distribution.getCode();
        return HyetographResultFactory.createFromDepths(
                HyetographResultFactory.centeredTimes(n, dtMin), depths, dtMin, "custom_" + label);
    }

    /**
     * Evento observado. El paso se toma de los dos primeros tiempos y se supone regular.
     *
     * @param timeMin Tiempo central de cada intervalo (min).
     * @param depthMm Lámina de cada intervalo (mm), >= 0.
     */
    public static HyetographResult fromEvent(List<Double> timeMin, List<Double> depthMm) {
        Objects.requireNonNull(timeMin, "Los tiempos del evento no pueden ser nulos.");
        Objects.requireNonNull(depthMm, "Las láminas del evento no pueden ser nulas.");
        if (timeMin.size() != depthMm.size()) {
            throw new IllegalArgumentException("time_min y depth_mm deben tener la misma longitud");
        }
        if (timeMin.size() < 2) {
            throw new IllegalArgumentException("Se necesitan al menos 2 intervalos");
        }
        double dt = timeMin.get(1) - timeMin.get(0);
        if (dt <= 0) {
            throw new IllegalArgumentException("Los tiempos del evento deben ser crecientes");
        }

        double[] times = timeMin.stream().mapToDouble(Double::doubleValue).toArray();
        double[] depths = depthMm.stream().mapToDouble(Double::doubleValue).toArray();
        for (double depth : depths) {
            if (depth < 0) {
                throw new IllegalArgumentException("Las láminas del evento deben ser >= 0");
            }
        }
        return HyetographResultFactory.createFromDepths(times, depths, dt, "custom_event");
    }

    private static double[] triangular(double totalDepthMm, int n) {
        int peak = n / 2;
        double[] weights = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            if (i <= peak) {
                weights[i] = peak > 0 ? (double) i / peak : 1.0;
            } else {
                weights[i] = (double) (n - 1 - i) / (n - 1 - peak);
            }
            sum += weights[i];
        }
        for (int i = 0; i < n; i++) {
            weights[i] *= totalDepthMm / sum;
        }
        return weights;
    }

    private static double[] syntheticBlocks(double totalDepthMm, int n, double peakPosition) {
        double[] cumulative = new double[n];
        for (int i = 0; i < n; i++) {
            cumulative[i] = totalDepthMm * Math.pow((i + 1.0) / n, SYNTHETIC_DEPTH_EXPONENT);
        }
        double[] increments = AlternatingBlocksGenerator.increments(cumulative);
        return AlternatingBlocksGenerator.distribute(AlternatingBlocksGenerator.sortDescending(increments), n, peakPosition);
    }
}
