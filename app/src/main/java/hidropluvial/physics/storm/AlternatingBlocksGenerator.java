package hidropluvial.physics.storm;

import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.factory.HyetographResultFactory;
import hidropluvial.physics.i.IIdfCurve;
import hidropluvial.physics.idf.DinaguaIdf;

import java.util.Arrays;
import java.util.Objects;

/**
 * Método de los bloques alternantes.
 * <ol>
 *     <li>Láminas acumuladas de la IDF en {@code dt, 2·dt, ..., n·dt}.</li>
 *     <li>Incrementos entre duraciones consecutivas.</li>
 *     <li>Incrementos ordenados de mayor a menor.</li>
 *     <li>El mayor va en la posición del pico; el resto alterna a izquierda y derecha.</li>
 * </ol>
 */
public final class AlternatingBlocksGenerator {

    /**
     * Diferencia (mm) entre el total pedido y el de la IDF a partir de la cual se reescala.
     */
    private static final double RESCALE_TOLERANCE_MM = 0.01;

    private AlternatingBlocksGenerator() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Versión genérica sobre cualquier curva IDF.
     *
     * @param totalDepthMm Lámina total deseada; si difiere de la de la IDF en más de 0.01 mm se reescala.
     *                     {@code null} conserva la lámina de la IDF.
     * @param peakPosition Posición relativa del pico en [0, 1].
     */
    public static HyetographResult generate(IIdfCurve idf, Double totalDepthMm, double durationHr, double dtMin,
                                            double returnPeriodYr, double peakPosition) {
        Objects.requireNonNull(idf, "La curva IDF no puede ser nula.");
        int n = HyetographResultFactory.intervalCount(durationHr, dtMin);

        double[] cumulative = new double[n];
        for (int i = 0; i < n; i++) {
            cumulative[i] = idf.depth((i + 1) * dtMin, returnPeriodYr);
        }
        double[] increments = increments(cumulative);

        double idfTotal = cumulative[n - 1];
        if (totalDepthMm != null && Math.abs(idfTotal - totalDepthMm) > RESCALE_TOLERANCE_MM) {
            double scale = totalDepthMm / idfTotal;
            for (int i = 0; i < n; i++) {
                increments[i] *= scale;
            }
        }

        double[] depths = distribute(sortDescending(increments), n, peakPosition);
        return HyetographResultFactory.createFromDepths(
                HyetographResultFactory.centeredTimes(n, dtMin), depths, dtMin, "alternating_blocks");
    }

    /**
     * Versión DINAGUA: las láminas acumuladas salen de {@link DinaguaIdf#depthMm}.
     *
     * @param areaKm2 Área para la reducción areal, o {@code null}.
     */
    public static HyetographResult dinagua(double p310Mm, double returnPeriodYr, double durationHr, double dtMin,
                                           Double areaKm2, double peakPosition) {
        int n = HyetographResultFactory.intervalCount(durationHr, dtMin);
        double dtHr = dtMin / 60.0;

        double[] cumulative = new double[n];
        for (int i = 0; i < n; i++) {
            cumulative[i] = DinaguaIdf.depthMm(p310Mm, returnPeriodYr, (i + 1) * dtHr, areaKm2);
        }

        double[] depths = distribute(sortDescending(increments(cumulative)), n, peakPosition);
        return HyetographResultFactory.createFromDepths(
                HyetographResultFactory.centeredTimes(n, dtMin), depths, dtMin, "alternating_blocks_dinagua");
    }

    /**
     * Coloca los incrementos (ordenados de mayor a menor) alrededor del índice
     * {@code floor(peakPosition·n)}, alternando izquierda/derecha. Cuando un lado se
     * agota, se sigue por el otro.
     */
    public static double[] distribute(double[] sortedDescending, int n, double peakPosition) {
        if (peakPosition < 0 || peakPosition > 1) {
            throw new IllegalArgumentException("La posición del pico debe estar entre 0 y 1 (recibido " + peakPosition + ")");
        }
        double[] result = new double[n];
        int peakIndex = Math.min((int) (peakPosition * n), n - 1);

        int left = peakIndex;
        int right = peakIndex + 1;
        boolean toggleLeft = true;

        for (double increment : sortedDescending) {
            if (toggleLeft && left >= 0) {
                result[left--] = increment;
            } else if (!toggleLeft && right < n) {
                result[right++] = increment;
            } else if (left >= 0) {
                result[left--] = increment;
            } else if (right < n) {
                result[right++] = increment;
            }
            toggleLeft = !toggleLeft;
        }
        return result;
    }

    static double[] increments(double[] cumulative) {
        double[] increments = new double[cumulative.length];
        increments[0] = cumulative[0];
        for (int i = 1; i < cumulative.length; i++) {
            increments[i] = cumulative[i] - cumulative[i - 1];
        }
        return increments;
    }

    static double[] sortDescending(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        for (int i = 0, j = sorted.length - 1; i < j; i++, j--) {
            double tmp = sorted[i];
            sorted[i] = sorted[j];
            sorted[j] = tmp;
        }
        return sorted;
    }
}
