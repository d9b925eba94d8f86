package hidropluvial.physics.storm;

import hidropluvial.domain.idf.ShermanCoefficients;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.factory.HyetographResultFactory;
import hidropluvial.physics.idf.DinaguaIdf;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tormentas bimodales (doble pico), útiles en cuencas urbanas de impermeabilidad mixta
 * y en tormentas frontales largas.
 */
public final class BimodalStormGenerator {

    private BimodalStormGenerator() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Dos picos triangulares sobre el tiempo normalizado. Cada pico se normaliza por su
     * área (regla del trapecio) y se escala a su parte de la lámina; al final la serie se
     * reescala para sumar exactamente {@code totalDepthMm}.
     */
    public static HyetographResult triangular(double totalDepthMm, double durationHr, double dtMin, BimodalShape shape) {
        Objects.requireNonNull(shape, "La forma bimodal no puede ser nula.");
        if (totalDepthMm < 0) {
            throw new IllegalArgumentException("Lámina total debe ser >= 0");
        }
        int n = HyetographResultFactory.intervalCount(durationHr, dtMin);
        double[] times = HyetographResultFactory.centeredTimes(n, dtMin);
        double[] normalized = new double[n];
        for (int i = 0; i < n; i++) {
            normalized[i] = times[i] / (durationHr * 60.0);
        }

        double[] first = triangularPeak(normalized, shape.peak1Position(), shape.peakWidth(),
                totalDepthMm * shape.volumeSplit());
        double[] second = triangularPeak(normalized, shape.peak2Position(), shape.peakWidth(),
                totalDepthMm * (1.0 - shape.volumeSplit()));

        double[] depths = new double[n];
        for (int i = 0; i < n; i++) {
            depths[i] = first[i] + second[i];
        }
        rescale(depths, totalDepthMm);
        return HyetographResultFactory.createFromDepths(times, depths, dtMin, "bimodal");
    }

    /**
     * Bimodal con la lámina total tomada de la IDF DINAGUA para la duración de la tormenta.
     */
    public static HyetographResult dinagua(double p310Mm, double returnPeriodYr, double durationHr, double dtMin,
                                           Double areaKm2, BimodalShape shape) {
        double total = DinaguaIdf.depthMm(p310Mm, returnPeriodYr, durationHr, areaKm2);
        return triangular(total, durationHr, dtMin, shape).relabel("bimodal_dinagua");
    }

    /**
     * Superposición de dos tormentas Chicago con avance igual a la posición de cada pico.
     * El ancho de pico de {@code shape} no interviene.
     */
    public static HyetographResult chicago(double totalDepthMm, double durationHr, double dtMin,
                                           ShermanCoefficients coefficients, double returnPeriodYr, BimodalShape shape) {
        Objects.requireNonNull(shape, "La forma bimodal no puede ser nula.");
        double volume1 = totalDepthMm * shape.volumeSplit();
        double volume2 = totalDepthMm - volume1;

        int n = HyetographResultFactory.intervalCount(durationHr, dtMin);
        double[] depths = new double[n];
        if (volume1 > 0) {
            add(depths, ChicagoStormGenerator.generate(volume1, durationHr, dtMin, coefficients,
                    returnPeriodYr, shape.peak1Position()).depthMm());
        }
        if (volume2 > 0) {
            add(depths, ChicagoStormGenerator.generate(volume2, durationHr, dtMin, coefficients,
                    returnPeriodYr, shape.peak2Position()).depthMm());
        }
        rescale(depths, totalDepthMm);
        return HyetographResultFactory.createFromDepths(
                HyetographResultFactory.centeredTimes(n, dtMin), depths, dtMin, "bimodal_chicago");
    }

    private static double[] triangularPeak(double[] t, double center, double width, double volume) {
        double[] result = new double[t.length];
        double left = center - width;
        double right = center + width;

        for (int i = 0; i < t.length; i++) {
            if (t[i] >= left && t[i] <= center) {
                result[i] = (t[i] - left) / (center - left);
            } else if (t[i] > center && t[i] <= right) {
                result[i] = (right - t[i]) / (right - center);
            }
        }

        double area = 0.0;
        for (int i = 1; i < t.length; i++) {
            area += 0.5 * (result[i] + result[i - 1]) * (t[i] - t[i - 1]);
        }
        if (area > 0) {
            for (int i = 0; i < result.length; i++) {
                result[i] *= volume / area;
            }
            return result;
        }

        // Pico más angosto que el paso (o un solo intervalo): todo el volumen al intervalo más cercano.
        Arrays.fill(result, 0.0);
        int nearest = 0;
        for (int i = 1; i < t.length; i++) {
            if (Math.abs(t[i] - center) < Math.abs(t[nearest] - center)) {
                nearest = i;
            }
        }
        result[nearest] = volume;
        return result;
    }

    private static void add(double[] target, double[] values) {
        for (int i = 0; i < target.length; i++) {
            target[i] += values[i];
        }
    }

    private static void rescale(double[] depths, double totalDepthMm) {
        double sum = 0.0;
        for (double depth : depths) {
            sum += depth;
        }
        if (sum > 0) {
            double scale = totalDepthMm / sum;
            for (int i = 0; i < depths.length; i++) {
                depths[i] *= scale;
            }
        }
    }
}
